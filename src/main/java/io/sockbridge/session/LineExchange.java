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

package io.sockbridge.session;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link LineSession#exchange(String)}: the lines that were sent and, position by position, the
 * reply received after each of them.
 *
 * @param sentLines the lines written, without terminator
 * @param replies one entry per sent line, empty where no data came back
 */
public record LineExchange(List<String> sentLines, List<Optional<String>> replies) {

    public LineExchange {
        sentLines = List.copyOf(sentLines);
        replies = List.copyOf(replies);
    }

    /**
     * Concatenates the replies that carried data, in order.
     *
     * @return the joined reply text, possibly empty
     */
    public String joinedReplies() {
        StringBuilder joined = new StringBuilder();
        replies.forEach(reply -> reply.ifPresent(joined::append));
        return joined.toString();
    }

    /**
     * Returns how many sent lines got no reply.
     *
     * @return the number of empty replies
     */
    public long missingReplies() {
        return replies.stream().filter(Optional::isEmpty).count();
    }
}
