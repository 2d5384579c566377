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

import java.util.Map;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.apache.pipe.remoting.api.RemotingEndPoint;

public class RequestContext {
    protected RemotingEndPoint remotingEndPoint;
    protected Map<String, Object> request;

    public RequestContext(final RemotingEndPoint remotingEndPoint, final Map<String, Object> request) {
        this.remotingEndPoint = remotingEndPoint;
        this.request = request;
    }

    public RemotingEndPoint getRemotingEndPoint() {
        return remotingEndPoint;
    }

    public Map<String, Object> getRequest() {
        return request;
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this, ToStringStyle.SHORT_PREFIX_STYLE);
    }
}
