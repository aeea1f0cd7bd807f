/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.sockbridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Provides version information for the SockBridge client.
 *
 * <p>Version information is read from a properties file filtered at build time.
 */
public final class SockBridgeVersion {

    private static final Logger log = LoggerFactory.getLogger(SockBridgeVersion.class);
    private static final String PROPERTIES_FILE = "/sockbridge-version.properties";
    private static final String UNKNOWN = "unknown";

    private static final SockBridgeVersion INSTANCE = load(PROPERTIES_FILE);

    private final String version;
    private final String buildTime;

    SockBridgeVersion(String version, String buildTime) {
        this.version = version;
        this.buildTime = buildTime;
    }

    static SockBridgeVersion load(String resource) {
        String version = UNKNOWN;
        String buildTime = UNKNOWN;

        try (InputStream is = SockBridgeVersion.class.getResourceAsStream(resource)) {
            if (is != null) {
                Properties props = new Properties();
                props.load(is);
                version = props.getProperty("version", UNKNOWN);
                buildTime = props.getProperty("buildTime", UNKNOWN);
            }
        } catch (IOException e) {
            log.warn("Failed to read version information from {}", resource, e);
        }

        return new SockBridgeVersion(version, buildTime);
    }

    /**
     * Gets the singleton SockBridgeVersion instance.
     *
     * @return the version information instance
     */
    public static SockBridgeVersion getInstance() {
        return INSTANCE;
    }

    /**
     * Gets the library version string.
     *
     * @return the version string (e.g., "0.3.0")
     */
    public String getVersion() {
        return version;
    }

    /**
     * Gets the build timestamp.
     *
     * @return the build time as ISO-8601 string, or "unknown" if not available
     */
    public String getBuildTime() {
        return buildTime;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SockBridge ").append(version);
        if (!UNKNOWN.equals(buildTime)) {
            sb.append(" (built: ").append(buildTime).append(")");
        }
        return sb.toString();
    }
}
