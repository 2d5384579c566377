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

package org.apache.pipe.remoting.api.interceptor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans every event out to the registered interceptors. A failing interceptor is logged and skipped, it never
 * aborts the command or the response it observes.
 */
public class InterceptorGroup {
    private static final Logger LOG = LoggerFactory.getLogger(InterceptorGroup.class);

    private final List<Interceptor> interceptors = new CopyOnWriteArrayList<>();

    public void registerInterceptor(Interceptor interceptor) {
        if (interceptor != null) {
            this.interceptors.add(interceptor);
        }
    }

    public void beforeRequest(RequestContext context) {
        for (Interceptor interceptor : interceptors) {
            try {
                interceptor.beforeRequest(context);
            } catch (Throwable e) {
                LOG.warn("Interceptor {} failed before request {}", interceptor, context, e);
            }
        }
    }

    public void afterResponseReceived(ResponseContext context) {
        for (Interceptor interceptor : interceptors) {
            try {
                interceptor.afterResponseReceived(context);
            } catch (Throwable e) {
                LOG.warn("Interceptor {} failed after response {}", interceptor, context, e);
            }
        }
    }

    public int size() {
        return interceptors.size();
    }
}
