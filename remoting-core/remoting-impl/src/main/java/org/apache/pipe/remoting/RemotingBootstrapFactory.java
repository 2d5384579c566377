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

package org.apache.pipe.remoting;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Properties;
import org.apache.pipe.remoting.api.codec.Codec;
import org.apache.pipe.remoting.config.RemotingServerConfig;
import org.apache.pipe.remoting.impl.dispatch.DispatchServer;
import org.apache.pipe.remoting.impl.queue.MessageQueue;
import org.apache.pipe.remoting.impl.transport.FramedTransport;
import org.apache.pipe.remoting.internal.BeanUtils;
import org.apache.pipe.remoting.internal.PropertyUtils;
import org.jetbrains.annotations.NotNull;

/**
 * Remoting Bootstrap entrance.
 */
public final class RemotingBootstrapFactory {
    private RemotingBootstrapFactory() {
    }

    /**
     * Creates a server over the process's standard streams.
     */
    public static DispatchServer createStdioServer(@NotNull final RemotingServerConfig config) {
        return new DispatchServer(System.in, System.out, config);
    }

    public static DispatchServer createServer(@NotNull final InputStream in, @NotNull final OutputStream out,
        @NotNull final RemotingServerConfig config) {
        return new DispatchServer(in, out, config);
    }

    public static DispatchServer createServer(@NotNull final InputStream in, @NotNull final OutputStream out,
        @NotNull final String fileName) {
        Properties prop = PropertyUtils.loadProps(fileName);
        RemotingServerConfig config = BeanUtils.populate(prop, RemotingServerConfig.class);
        return new DispatchServer(in, out, config);
    }

    public static DispatchServer createServer(@NotNull final InputStream in, @NotNull final OutputStream out,
        @NotNull final Properties properties) {
        RemotingServerConfig config = BeanUtils.populate(properties, RemotingServerConfig.class);
        return new DispatchServer(in, out, config);
    }

    public static DispatchServer createServer(@NotNull final InputStream in, @NotNull final OutputStream out,
        @NotNull final Codec codec, @NotNull final RemotingServerConfig config) {
        return new DispatchServer(new MessageQueue(new FramedTransport(in, out, config), codec), config);
    }
}
