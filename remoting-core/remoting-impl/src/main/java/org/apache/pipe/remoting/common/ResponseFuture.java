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

package org.apache.pipe.remoting.common;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.apache.pipe.remoting.api.AsyncHandler;
import org.jetbrains.annotations.Nullable;

/**
 * Completion handle of one outbound request, keyed by its request id in the server's response table.
 */
public class ResponseFuture {
    private final long beginTimestamp = System.currentTimeMillis();
    private final CountDownLatch countDownLatch = new CountDownLatch(1);
    private final AtomicBoolean asyncHandlerExecuted = new AtomicBoolean(false);

    private final String requestId;
    private final long timeoutMillis;
    private final AsyncHandler asyncHandler;
    private final SemaphoreReleaseOnlyOnce once;

    private volatile Map<String, Object> responseEnvelope;
    private volatile Throwable cause;

    private Map<String, Object> requestEnvelope;

    public ResponseFuture(String requestId, long timeoutMillis, @Nullable AsyncHandler asyncHandler,
        @Nullable SemaphoreReleaseOnlyOnce once) {
        this.requestId = requestId;
        this.timeoutMillis = timeoutMillis;
        this.asyncHandler = asyncHandler;
        this.once = once;
    }

    public ResponseFuture(String requestId, long timeoutMillis) {
        this(requestId, timeoutMillis, null, null);
    }

    public void executeAsyncHandler() {
        if (asyncHandler != null) {
            if (this.asyncHandlerExecuted.compareAndSet(false, true)) {
                if (cause != null) {
                    asyncHandler.onFailure(requestEnvelope, cause);
                } else {
                    asyncHandler.onSuccess(responseEnvelope);
                }
            }
        }
    }

    public void release() {
        if (this.once != null) {
            this.once.release();
        }
    }

    /**
     * @param timeoutMillis how long to wait, {@code 0} or less waits until the response or a failure is put
     * @return the response envelope, or {@code null} on timeout or failure
     */
    public Map<String, Object> waitResponse(final long timeoutMillis) {
        try {
            if (timeoutMillis > 0) {
                this.countDownLatch.await(timeoutMillis, TimeUnit.MILLISECONDS);
            } else {
                this.countDownLatch.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return this.responseEnvelope;
    }

    public void putResponse(final Map<String, Object> responseEnvelope) {
        this.responseEnvelope = responseEnvelope;
        this.countDownLatch.countDown();
    }

    /**
     * Fails the request and wakes up a blocked waiter.
     */
    public void fail(final Throwable cause) {
        this.cause = cause;
        this.countDownLatch.countDown();
    }

    public boolean isTimeout() {
        return timeoutMillis > 0 && beginTimestamp + timeoutMillis <= System.currentTimeMillis();
    }

    public long getBeginTimestamp() {
        return beginTimestamp;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public AsyncHandler getAsyncHandler() {
        return asyncHandler;
    }

    public Throwable getCause() {
        return cause;
    }

    public Map<String, Object> getResponseEnvelope() {
        return responseEnvelope;
    }

    public String getRequestId() {
        return requestId;
    }

    public Map<String, Object> getRequestEnvelope() {
        return requestEnvelope;
    }

    public void setRequestEnvelope(Map<String, Object> requestEnvelope) {
        this.requestEnvelope = requestEnvelope;
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this, ToStringStyle.MULTI_LINE_STYLE);
    }
}
