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

package org.apache.pipe.remoting.external;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ThreadUtils {
    private static final Logger LOG = LoggerFactory.getLogger(ThreadUtils.class);

    private ThreadUtils() {
    }

    public static ThreadFactory newThreadFactory(final String processName, final boolean isDaemon) {
        return new BasicThreadFactory.Builder()
            .namingPattern(processName + "-%d")
            .daemon(isDaemon)
            .uncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                @Override
                public void uncaughtException(Thread t, Throwable e) {
                    LOG.error("Uncaught exception in thread {}", t.getName(), e);
                }
            })
            .build();
    }

    public static ExecutorService newFixedThreadPool(int nThreads, int queueCapacity, String processName,
        boolean isDaemon) {
        return new ThreadPoolExecutor(nThreads, nThreads, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<Runnable>(queueCapacity), newThreadFactory(processName, isDaemon));
    }

    /**
     * Pool that hands every task to a thread right away, growing up to {@code maxThreads}. Idle threads above
     * {@code coreThreads} die after a minute. Tasks submitted while all threads are busy are rejected.
     */
    public static ExecutorService newElasticThreadPool(int coreThreads, int maxThreads, String processName,
        boolean isDaemon) {
        return new ThreadPoolExecutor(coreThreads, Math.max(coreThreads, maxThreads), 60L, TimeUnit.SECONDS,
            new SynchronousQueue<Runnable>(), newThreadFactory(processName, isDaemon));
    }

    public static ExecutorService newSingleThreadExecutor(String processName, boolean isDaemon) {
        return newFixedThreadPool(1, Integer.MAX_VALUE, processName, isDaemon);
    }

    public static Thread newThread(String name, Runnable runnable, boolean daemon) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(daemon);
        return thread;
    }
}
