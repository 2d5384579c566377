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

public class RemotingConfig extends PipeTransportConfig {
    /**
     * Timeout handed to each blocking receive of the poll loop.
     */
    private int pollTimeoutMillis = 100;
    private int idlePauseMillis = 10;
    private int errorBackoffMillis = 100;

    private int sendTimeoutMillis = 5000;
    private int defaultRequestTimeoutMillis = 5000;

    /**
     * Period of the scan that expires pending requests.
     */
    private int responseScanIntervalMillis = 10;

    /**
     * Handler threads kept alive while idle. Each in-flight command beyond them gets a thread of its own, up to
     * {@code handlerExecutorMaxThreads}; commands arriving past that bound are rejected, never queued.
     */
    private int handlerExecutorThreads = 8;
    private int handlerExecutorMaxThreads = 1000;

    private int asyncHandlerExecutorThreads = Runtime.getRuntime().availableProcessors();

    private int asyncInvokeSemaphore = 64;

    private int shutdownTimeoutMillis = 3000;

    public int getPollTimeoutMillis() {
        return pollTimeoutMillis;
    }

    public void setPollTimeoutMillis(final int pollTimeoutMillis) {
        this.pollTimeoutMillis = pollTimeoutMillis;
    }

    public int getIdlePauseMillis() {
        return idlePauseMillis;
    }

    public void setIdlePauseMillis(final int idlePauseMillis) {
        this.idlePauseMillis = idlePauseMillis;
    }

    public int getErrorBackoffMillis() {
        return errorBackoffMillis;
    }

    public void setErrorBackoffMillis(final int errorBackoffMillis) {
        this.errorBackoffMillis = errorBackoffMillis;
    }

    public int getSendTimeoutMillis() {
        return sendTimeoutMillis;
    }

    public void setSendTimeoutMillis(final int sendTimeoutMillis) {
        this.sendTimeoutMillis = sendTimeoutMillis;
    }

    public int getDefaultRequestTimeoutMillis() {
        return defaultRequestTimeoutMillis;
    }

    public void setDefaultRequestTimeoutMillis(final int defaultRequestTimeoutMillis) {
        this.defaultRequestTimeoutMillis = defaultRequestTimeoutMillis;
    }

    public int getResponseScanIntervalMillis() {
        return responseScanIntervalMillis;
    }

    public void setResponseScanIntervalMillis(final int responseScanIntervalMillis) {
        this.responseScanIntervalMillis = responseScanIntervalMillis;
    }

    public int getHandlerExecutorThreads() {
        return handlerExecutorThreads;
    }

    public void setHandlerExecutorThreads(final int handlerExecutorThreads) {
        this.handlerExecutorThreads = handlerExecutorThreads;
    }

    public int getHandlerExecutorMaxThreads() {
        return handlerExecutorMaxThreads;
    }

    public void setHandlerExecutorMaxThreads(final int handlerExecutorMaxThreads) {
        this.handlerExecutorMaxThreads = handlerExecutorMaxThreads;
    }

    public int getAsyncHandlerExecutorThreads() {
        return asyncHandlerExecutorThreads;
    }

    public void setAsyncHandlerExecutorThreads(final int asyncHandlerExecutorThreads) {
        this.asyncHandlerExecutorThreads = asyncHandlerExecutorThreads;
    }

    public int getAsyncInvokeSemaphore() {
        return asyncInvokeSemaphore;
    }

    public void setAsyncInvokeSemaphore(final int asyncInvokeSemaphore) {
        this.asyncInvokeSemaphore = asyncInvokeSemaphore;
    }

    public int getShutdownTimeoutMillis() {
        return shutdownTimeoutMillis;
    }

    public void setShutdownTimeoutMillis(final int shutdownTimeoutMillis) {
        this.shutdownTimeoutMillis = shutdownTimeoutMillis;
    }
}
