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
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.pipe.remoting.BaseTest;
import org.apache.pipe.remoting.api.AsyncHandler;
import org.apache.pipe.remoting.api.command.Envelope;
import org.apache.pipe.remoting.api.exception.RemotingAccessException;
import org.apache.pipe.remoting.api.exception.RemotingRuntimeException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class ResponseFutureTest extends BaseTest {
    private ResponseFuture future;

    @Test
    public void executeAsyncHandler_Success() {
        final Map<String, Object> request = Envelope.command("echo", "hi", "java-1");
        final Map<String, Object> response = Envelope.reply("hi", "java-1");
        final AtomicInteger calls = new AtomicInteger();
        future = new ResponseFuture("java-1", 3000, new AsyncHandler() {
            @Override
            public void onFailure(final Map<String, Object> request, final Throwable cause) {
                shouldNotReachHere();
            }

            @Override
            public void onSuccess(final Map<String, Object> res) {
                calls.incrementAndGet();
                assertEquals(response, res);
            }
        }, null);

        future.setRequestEnvelope(request);
        future.putResponse(response);
        future.executeAsyncHandler();
        future.executeAsyncHandler();

        assertEquals(1, calls.get());
    }

    @Test
    public void executeAsyncHandler_Failure() {
        final Map<String, Object> request = Envelope.command("echo", "hi", "java-1");
        final RemotingRuntimeException exception = new RemotingAccessException("Test Exception");
        future = new ResponseFuture("java-1", 3000, new AsyncHandler() {
            @Override
            public void onFailure(final Map<String, Object> req, final Throwable cause) {
                assertEquals(request, req);
                assertNull(future.getResponseEnvelope());
                assertEquals(exception, cause);
            }

            @Override
            public void onSuccess(final Map<String, Object> response) {
                shouldNotReachHere();
            }
        }, null);

        future.setRequestEnvelope(request);
        future.fail(exception);
        future.executeAsyncHandler();
    }

    @Test
    public void waitResponse_Success() {
        future = new ResponseFuture("java-1", 1000, null, null);
        final Map<String, Object> response = Envelope.reply(1, "java-1");

        runInThreads(new Runnable() {
            @Override
            public void run() {
                try {
                    TimeUnit.MILLISECONDS.sleep(100);
                } catch (InterruptedException ignore) {
                }
                future.putResponse(response);
            }
        }, 1);
        Map<String, Object> res = future.waitResponse(1000);
        assertEquals(res, response);
    }

    @Test
    public void waitResponse_Timeout() {
        future = new ResponseFuture("java-1", 1000, null, null);
        Map<String, Object> response = future.waitResponse(10);
        assertNull(response);
    }

    @Test
    public void waitResponse_FailWakesWaiter() {
        future = new ResponseFuture("java-1", 0, null, null);
        future.fail(new RemotingAccessException("closed"));

        assertNull(future.waitResponse(0));
        assertEquals("closed", future.getCause().getMessage());
    }

    @Test
    public void release_OnlyOnce() {
        Semaphore semaphore = new Semaphore(0);
        future = new ResponseFuture("java-1", 1000, null, new SemaphoreReleaseOnlyOnce(semaphore));

        future.release();
        future.release();

        assertEquals(1, semaphore.availablePermits());
    }

    @Test
    public void isTimeout_NonPositiveNeverExpires() throws InterruptedException {
        ResponseFuture unbounded = new ResponseFuture("java-1", 0);
        ResponseFuture bounded = new ResponseFuture("java-2", 1);

        TimeUnit.MILLISECONDS.sleep(5);

        assertEquals(false, unbounded.isTimeout());
        assertEquals(true, bounded.isTimeout());
    }
}
