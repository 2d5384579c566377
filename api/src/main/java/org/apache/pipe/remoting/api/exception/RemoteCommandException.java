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

package org.apache.pipe.remoting.api.exception;

/**
 * The peer processed a command and answered with an error envelope.
 */
public class RemoteCommandException extends RemotingRuntimeException {
    private static final long serialVersionUID = 694381247795530183L;

    private final String command;
    private final String remoteMessage;
    private final String remoteTraceback;

    public RemoteCommandException(String command, String remoteMessage, String remoteTraceback) {
        super(String.format("Remote error for command '%s': %s", command, remoteMessage));
        this.command = command;
        this.remoteMessage = remoteMessage;
        this.remoteTraceback = remoteTraceback;
    }

    public String getCommand() {
        return command;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }

    /**
     * @return the diagnostic detail sent by the peer, or {@code null} if it sent none
     */
    public String getRemoteTraceback() {
        return remoteTraceback;
    }
}
