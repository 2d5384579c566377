/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.pipe.remoting.config;

public class RemotingServerConfig extends RemotingConfig {
    /**
     * Prefix of the ids this side generates for outbound requests. Inbound envelopes whose request id carries it
     * are responses; the two peers of a stream must use different prefixes.
     */
    private String requestIdPrefix = "java-";

    /**
     * Whether public methods of a {@code DispatchServer} subclass become commands on construction.
     */
    private boolean exposeMethods = true;

    private ReadMode readMode = ReadMode.PER_POLL;

    public String getRequestIdPrefix() {
        return requestIdPrefix;
    }

    public void setRequestIdPrefix(final String requestIdPrefix) {
        this.requestIdPrefix = requestIdPrefix;
    }

    public boolean isExposeMethods() {
        return exposeMethods;
    }

    public void setExposeMethods(final boolean exposeMethods) {
        this.exposeMethods = exposeMethods;
    }

    public ReadMode getReadMode() {
        return readMode;
    }

    public void setReadMode(final ReadMode readMode) {
        this.readMode = readMode;
    }
}
