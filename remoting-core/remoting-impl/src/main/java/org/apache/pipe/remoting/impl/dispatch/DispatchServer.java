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

package org.apache.pipe.remoting.impl.dispatch;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import org.apache.commons.lang3.Validate;
import org.apache.pipe.remoting.api.AsyncCommandHandler;
import org.apache.pipe.remoting.api.AsyncHandler;
import org.apache.pipe.remoting.api.CommandHandler;
import org.apache.pipe.remoting.api.DefaultCommandHandler;
import org.apache.pipe.remoting.api.RemotingEndPoint;
import org.apache.pipe.remoting.api.RemotingService;
import org.apache.pipe.remoting.api.command.Envelope;
import org.apache.pipe.remoting.api.command.MethodInfo;
import org.apache.pipe.remoting.api.command.ParameterInfo;
import org.apache.pipe.remoting.api.exception.RemoteCommandException;
import org.apache.pipe.remoting.api.exception.RemotingAccessException;
import org.apache.pipe.remoting.api.exception.RemotingConnectionClosedException;
import org.apache.pipe.remoting.api.exception.RemotingRuntimeException;
import org.apache.pipe.remoting.api.exception.RemotingTimeoutException;
import org.apache.pipe.remoting.api.exception.SemaphoreExhaustedException;
import org.apache.pipe.remoting.api.interceptor.Interceptor;
import org.apache.pipe.remoting.api.interceptor.InterceptorGroup;
import org.apache.pipe.remoting.api.interceptor.RequestContext;
import org.apache.pipe.remoting.api.interceptor.ResponseContext;
import org.apache.pipe.remoting.common.ResponseFuture;
import org.apache.pipe.remoting.common.SemaphoreReleaseOnlyOnce;
import org.apache.pipe.remoting.config.ReadMode;
import org.apache.pipe.remoting.config.RemotingServerConfig;
import org.apache.pipe.remoting.external.ThreadUtils;
import org.apache.pipe.remoting.impl.codec.JacksonCodec;
import org.apache.pipe.remoting.impl.queue.MessageQueue;
import org.apache.pipe.remoting.impl.transport.FramedTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bidirectional command server over a {@link MessageQueue}.
 *
 * <p>A single dispatcher thread runs the poll loop, correlates responses with on-going outbound requests and
 * governs the response table. Blocking stream reads happen on a reader thread and are handed back to the
 * dispatcher, command handlers run on the handler executor, so neither a slow read nor a slow handler holds up
 * the loop. The handler executor gives each in-flight command a thread of its own; {@code exit} and
 * {@code shutdown} run on a separate control thread and are served even when every handler is blocked.</p>
 *
 * <p>Public methods declared by subclasses are exposed as commands on construction, see
 * {@link #exposeMethods(Object)} for the binding rules.</p>
 */
public class DispatchServer implements RemotingService, Closeable {
    /**
     * Remoting logger instance.
     */
    protected static final Logger LOG = LoggerFactory.getLogger(DispatchServer.class);

    public static final String EXIT_COMMAND = "exit";
    public static final String SHUTDOWN_COMMAND = "shutdown";
    public static final String GET_METHODS_COMMAND = "__get_methods__";

    /**
     * Returned by a handler that already replied, or whose command must not be answered.
     */
    public static final Object NO_REPLY = new Object();

    private final RemotingServerConfig config;
    private final MessageQueue queue;

    /**
     * Guards the handler table, the response table and the server state.
     */
    private final Lock lock = new ReentrantLock();

    private final Map<String, AsyncCommandHandler> handlerTable = new HashMap<>();

    /**
     * Auto-exposed commands, reported by {@code __get_methods__}.
     */
    private final Map<String, MethodDescriptor> exposedMethods = new LinkedHashMap<>();

    /**
     * This map caches all on-going outbound requests.
     */
    private final Map<String, ResponseFuture> responseTable = new HashMap<>(256);

    private DefaultCommandHandler defaultHandler;

    private ServerState state = ServerState.NOT_STARTED;

    private final CountDownLatch stoppedLatch = new CountDownLatch(1);

    private final AtomicLong requestIdGenerator = new AtomicLong();

    /**
     * Semaphore to limit maximum number of on-going asynchronous requests.
     */
    private final Semaphore semaphoreAsync;

    private final InterceptorGroup interceptorGroup = new InterceptorGroup();

    /**
     * Methods the peer reported through {@code __get_methods__}.
     */
    private final Map<String, MethodInfo> remoteMethods = new ConcurrentHashMap<>();

    /**
     * Runs the poll loop and the response table scan.
     */
    private final EventExecutor dispatcher;

    /**
     * Performs the blocking read of each poll iteration.
     */
    private final ExecutorService readerExecutor;

    private final ExecutorService handlerExecutor;

    /**
     * Runs {@code exit} and {@code shutdown}, which must not wait behind busy command handlers.
     */
    private final ExecutorService controlExecutor;

    /**
     * Invoke the async handler in this executor when process response.
     */
    private final ExecutorService asyncHandlerExecutor;

    /**
     * Frames read by the continuous reader, drained by the dispatcher.
     */
    private final BlockingQueue<ReadResult> handoff = new LinkedBlockingQueue<>();

    private final Runnable pollTask = new Runnable() {
        @Override
        public void run() {
            poll();
        }
    };

    public DispatchServer(InputStream in, OutputStream out) {
        this(in, out, new RemotingServerConfig());
    }

    public DispatchServer(InputStream in, OutputStream out, RemotingServerConfig config) {
        this(new MessageQueue(new FramedTransport(in, out, config), JacksonCodec.messagePack()), config);
    }

    public DispatchServer(MessageQueue queue, RemotingServerConfig config) {
        this.queue = Validate.notNull(queue, "queue");
        this.config = Validate.notNull(config, "config");
        Validate.notEmpty(config.getRequestIdPrefix(), "requestIdPrefix");

        this.semaphoreAsync = new Semaphore(config.getAsyncInvokeSemaphore(), true);
        this.dispatcher = new DefaultEventExecutor(ThreadUtils.newThreadFactory("PipeRemoting-Dispatcher", true));
        this.readerExecutor = ThreadUtils.newSingleThreadExecutor("PipeRemoting-Reader", true);
        this.handlerExecutor = ThreadUtils.newElasticThreadPool(config.getHandlerExecutorThreads(),
            config.getHandlerExecutorMaxThreads(), "PipeRemoting-HandlerExecutor", true);
        this.controlExecutor = ThreadUtils.newSingleThreadExecutor("PipeRemoting-Control", true);
        this.asyncHandlerExecutor = ThreadUtils.newFixedThreadPool(config.getAsyncHandlerExecutorThreads(),
            10000, "PipeRemoting-AsyncExecutor", true);

        registerBuiltinHandlers();

        if (config.isExposeMethods()) {
            for (MethodDescriptor descriptor : MethodDescriptor.describe(this, DispatchServer.class)) {
                registerMethod(descriptor);
            }
        }
    }

    private void registerBuiltinHandlers() {
        registerHandler(EXIT_COMMAND, new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                return handleExit(requestId);
            }
        });
        registerHandler(SHUTDOWN_COMMAND, new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                return handleShutdown(requestId);
            }
        });
        registerHandler(GET_METHODS_COMMAND, new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                return handleGetMethods();
            }
        });
    }

    @Override
    public void start() {
        lock.lock();
        try {
            if (state == ServerState.RUNNING) {
                return;
            }
            if (state == ServerState.STOPPED) {
                throw new IllegalStateException("Dispatch server is stopped and can not be restarted");
            }
            state = ServerState.RUNNING;
        } finally {
            lock.unlock();
        }

        long scanInterval = Math.max(1, config.getResponseScanIntervalMillis());
        this.dispatcher.scheduleAtFixedRate(new Runnable() {
            @Override
            public void run() {
                try {
                    scanResponseTable();
                } catch (Throwable e) {
                    LOG.error("Scan response table error", e);
                }
            }
        }, scanInterval, scanInterval, TimeUnit.MILLISECONDS);

        if (config.getReadMode() == ReadMode.CONTINUOUS) {
            ThreadUtils.newThread("PipeRemoting-ContinuousReader", new Runnable() {
                @Override
                public void run() {
                    readContinuously();
                }
            }, true).start();
        }

        this.dispatcher.execute(pollTask);

        LOG.info("Dispatch server started, read mode {}, request id prefix {}", config.getReadMode(),
            config.getRequestIdPrefix());
    }

    /**
     * Stops the server and waits a bounded time for the dispatcher to terminate. Already dispatched handlers are
     * not cancelled and may still reply.
     */
    @Override
    public void stop() {
        requestStop(new RemotingAccessException("Dispatch server stopped before the response arrived"));

        if (!this.dispatcher.inEventLoop()) {
            this.dispatcher.terminationFuture().awaitUninterruptibly(config.getShutdownTimeoutMillis());
        }
    }

    /**
     * Stops the server and closes the underlying streams.
     */
    @Override
    public void close() {
        stop();
        queue.close();
    }

    /**
     * @return {@code true} if the server reached the stopped state within the timeout
     */
    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return stoppedLatch.await(timeout, unit);
    }

    /**
     * Moves the server to the stopped state without waiting for anything.
     *
     * @return {@code false} if the server was already stopped
     */
    protected boolean requestStop(RemotingRuntimeException pendingCause) {
        lock.lock();
        try {
            if (state == ServerState.STOPPED) {
                return false;
            }
            state = ServerState.STOPPED;
        } finally {
            lock.unlock();
        }

        failPendingRequests(pendingCause);

        this.readerExecutor.shutdown();
        this.handlerExecutor.shutdown();
        this.controlExecutor.shutdown();
        this.asyncHandlerExecutor.shutdown();
        this.dispatcher.shutdownGracefully(0, config.getShutdownTimeoutMillis(), TimeUnit.MILLISECONDS);

        stoppedLatch.countDown();
        LOG.info("Dispatch server stopped");
        return true;
    }

    public ServerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return getState() == ServerState.RUNNING;
    }

    /**
     * Registers a synchronous handler, replacing any handler of the same command. The handler runs on the handler
     * executor.
     */
    @Override
    public void registerHandler(String command, final CommandHandler handler) {
        Validate.notNull(handler, "handler");
        registerAsyncHandler(command, new AsyncCommandHandler() {
            @Override
            public CompletableFuture<Object> handle(Object data, String requestId) {
                try {
                    return CompletableFuture.completedFuture(handler.handle(data, requestId));
                } catch (Throwable e) {
                    return failedFuture(e);
                }
            }
        });
    }

    @Override
    public void registerAsyncHandler(String command, AsyncCommandHandler handler) {
        Validate.notEmpty(command, "command");
        Validate.notNull(handler, "handler");
        lock.lock();
        try {
            this.handlerTable.put(command, handler);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setDefaultHandler(DefaultCommandHandler handler) {
        lock.lock();
        try {
            this.defaultHandler = handler;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void registerInterceptor(Interceptor interceptor) {
        this.interceptorGroup.registerInterceptor(interceptor);
    }

    /**
     * Exposes {@code method} of {@code target} as command {@code name}.
     */
    public void registerMethod(String name, Object target, Method method) {
        registerMethod(MethodDescriptor.of(name, target, method));
    }

    /**
     * Exposes the public methods of {@code service}, its superclasses' included. Commands already registered keep
     * their handler.
     *
     * <p>When the command data is a mapping each parameter is looked up by name: by its {@code @Param} name, or
     * the compiled name. A missing required parameter fails the command, a missing optional one is passed as
     * {@code null} or the primitive default. Any other data is passed as the first parameter. Methods returning
     * a {@link CompletionStage} reply when the stage completes.</p>
     */
    public void exposeMethods(Object service) {
        Validate.notNull(service, "service");
        for (MethodDescriptor descriptor : MethodDescriptor.describe(service, Object.class)) {
            registerMethod(descriptor);
        }
    }

    private void registerMethod(final MethodDescriptor descriptor) {
        AsyncCommandHandler handler = new AsyncCommandHandler() {
            @Override
            public CompletableFuture<Object> handle(Object data, String requestId) {
                try {
                    Object result = descriptor.invoke(data);
                    if (result instanceof CompletionStage) {
                        final CompletableFuture<Object> future = new CompletableFuture<>();
                        ((CompletionStage<?>) result).whenComplete(new BiConsumer<Object, Throwable>() {
                            @Override
                            public void accept(Object value, Throwable cause) {
                                if (cause != null) {
                                    future.completeExceptionally(cause);
                                } else {
                                    future.complete(value);
                                }
                            }
                        });
                        return future;
                    }
                    return CompletableFuture.completedFuture(result);
                } catch (Throwable e) {
                    return failedFuture(e);
                }
            }
        };

        lock.lock();
        try {
            if (this.handlerTable.containsKey(descriptor.getName())) {
                LOG.debug("Command {} is already registered, method {} is not exposed", descriptor.getName(),
                    descriptor.getMethod());
                return;
            }
            this.handlerTable.put(descriptor.getName(), handler);
            this.exposedMethods.put(descriptor.getName(), descriptor);
        } finally {
            lock.unlock();
        }
        LOG.debug("Exposed method {} as command {}", descriptor.getMethod(), descriptor.getName());
    }

    public boolean hasHandler(String command) {
        lock.lock();
        try {
            return this.handlerTable.containsKey(command);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the names of the auto-exposed commands, in exposure order
     */
    public List<String> exposedCommands() {
        lock.lock();
        try {
            return new ArrayList<>(this.exposedMethods.keySet());
        } finally {
            lock.unlock();
        }
    }

    private void poll() {
        if (!isRunning()) {
            return;
        }

        if (config.getReadMode() == ReadMode.CONTINUOUS) {
            ReadResult result = handoff.poll();
            if (result == null) {
                schedulePoll(config.getIdlePauseMillis());
            } else {
                onRead(result);
            }
            return;
        }

        try {
            this.readerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    final ReadResult result = readOnce();
                    try {
                        dispatcher.execute(new Runnable() {
                            @Override
                            public void run() {
                                onRead(result);
                            }
                        });
                    } catch (RejectedExecutionException e) {
                        LOG.debug("Dispatcher is shut down, drop read result {}", result);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Reader executor is shut down, poll loop ends");
        }
    }

    private void readContinuously() {
        while (isRunning()) {
            ReadResult result = readOnce();
            handoff.offer(result);
            if (result.cause instanceof RemotingConnectionClosedException) {
                break;
            }
        }
        LOG.debug("Continuous reader ends");
    }

    private ReadResult readOnce() {
        try {
            return new ReadResult(queue.get(true, config.getPollTimeoutMillis()), null);
        } catch (Throwable e) {
            return new ReadResult(null, e);
        }
    }

    private void onRead(ReadResult result) {
        if (!isRunning()) {
            LOG.debug("Dispatch server is not running, drop read result {}", result);
            return;
        }

        Throwable cause = result.cause;
        if (cause instanceof RemotingConnectionClosedException) {
            LOG.info("Peer closed the pipe, dispatch server stops");
            requestStop(new RemotingConnectionClosedException("Pipe closed before the response arrived", cause));
            return;
        }
        if (cause instanceof RemotingTimeoutException) {
            schedulePoll(config.getIdlePauseMillis());
            return;
        }
        if (cause != null) {
            LOG.error("Error getting message", cause);
            schedulePoll(config.getErrorBackoffMillis());
            return;
        }

        try {
            processMessageReceived(result.message);
        } catch (Throwable e) {
            LOG.error("Process message {} error", result.message, e);
        }
        schedulePoll(0);
    }

    private void schedulePoll(long delayMillis) {
        try {
            if (delayMillis <= 0) {
                this.dispatcher.execute(pollTask);
            } else {
                this.dispatcher.schedule(pollTask, delayMillis, TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            LOG.debug("Dispatcher is shut down, poll loop ends");
        }
    }

    protected void processMessageReceived(Object message) {
        if (!(message instanceof Map)) {
            LOG.warn("Drop message {}, it is not an envelope", message);
            return;
        }

        Map<String, Object> envelope = Envelope.copyOf((Map<?, ?>) message);
        String requestId = Envelope.requestId(envelope);
        if (requestId != null && isOwnRequestId(requestId)) {
            processResponseEnvelope(requestId, envelope);
        } else {
            processRequestEnvelope(requestId, envelope);
        }
    }

    private boolean isOwnRequestId(String requestId) {
        return requestId.startsWith(config.getRequestIdPrefix());
    }

    private void processRequestEnvelope(final String requestId, final Map<String, Object> request) {
        Object commandValue = request.get(Envelope.COMMAND);
        final String command = commandValue == null ? null : commandValue.toString();
        final Object data = request.get(Envelope.DATA);

        LOG.debug("Received command {}, request id {}", command, requestId);

        ExecutorService executor = isControlCommand(command) ? this.controlExecutor : this.handlerExecutor;
        try {
            executor.execute(new Runnable() {
                @Override
                public void run() {
                    processCommand(command, data, requestId, request);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Command {} with request id {} is rejected by handler executor", command, requestId);
            if (requestId != null) {
                sendResponse(HandlerResult.failure(HandlerResult.FailureKind.REJECTED,
                    "System busy, command rejected", null).toEnvelope(requestId));
            }
        }
    }

    private static boolean isControlCommand(String command) {
        return EXIT_COMMAND.equals(command) || SHUTDOWN_COMMAND.equals(command);
    }

    void processCommand(final String command, final Object data, final String requestId,
        final Map<String, Object> request) {
        this.interceptorGroup.beforeRequest(new RequestContext(RemotingEndPoint.RESPONSE, request));

        invokeHandler(command, data, requestId).whenComplete(new BiConsumer<HandlerResult, Throwable>() {
            @Override
            public void accept(HandlerResult result, Throwable cause) {
                HandlerResult outcome = cause != null ? HandlerResult.failure(cause) : result;
                handleResult(command, requestId, request, outcome);
            }
        });
    }

    private CompletableFuture<HandlerResult> invokeHandler(String command, Object data, String requestId) {
        AsyncCommandHandler handler;
        DefaultCommandHandler fallback;
        lock.lock();
        try {
            handler = this.handlerTable.get(command);
            fallback = this.defaultHandler;
        } finally {
            lock.unlock();
        }

        CompletableFuture<Object> future;
        try {
            if (handler != null) {
                future = handler.handle(data, requestId);
            } else if (fallback != null) {
                future = CompletableFuture.completedFuture(fallback.handle(command, data, requestId));
            } else {
                LOG.warn("The command {} is NOT supported", command);
                return CompletableFuture.completedFuture(HandlerResult.unknownCommand(command));
            }
        } catch (Throwable e) {
            return CompletableFuture.completedFuture(HandlerResult.failure(e));
        }

        if (future == null) {
            return CompletableFuture.completedFuture(HandlerResult.success(null));
        }

        return future.handle(new BiFunction<Object, Throwable, HandlerResult>() {
            @Override
            public HandlerResult apply(Object value, Throwable cause) {
                if (cause != null) {
                    return HandlerResult.failure(cause);
                }
                if (value == NO_REPLY) {
                    return HandlerResult.noReply();
                }
                return HandlerResult.success(value);
            }
        });
    }

    private void handleResult(String command, String requestId, Map<String, Object> request, HandlerResult result) {
        if (result.isFailure()) {
            if (result.getFailureKind() == HandlerResult.FailureKind.HANDLER_ERROR) {
                LOG.error("Process command {} error: {}\n{}", command, result.getMessage(), result.getDetail());
            } else {
                LOG.warn("Process command {} failed: {}", command, result.getMessage());
            }
        }

        if (requestId == null) {
            return;
        }

        Map<String, Object> response = result.toEnvelope(requestId);
        if (response == null) {
            return;
        }

        this.interceptorGroup.afterResponseReceived(new ResponseContext(RemotingEndPoint.RESPONSE, request, response));

        sendResponse(response);
    }

    private void sendResponse(Map<String, Object> response) {
        try {
            this.queue.put(response, true, config.getSendTimeoutMillis());
        } catch (Throwable e) {
            LOG.error("Send response {} failed", response.get(Envelope.REQUEST_ID), e);
        }
    }

    private void processResponseEnvelope(String requestId, Map<String, Object> response) {
        final ResponseFuture responseFuture;
        lock.lock();
        try {
            responseFuture = this.responseTable.remove(requestId);
        } finally {
            lock.unlock();
        }

        if (responseFuture == null) {
            LOG.warn("Response {} doesn't have a matched request, dropped", requestId);
            return;
        }

        this.interceptorGroup.afterResponseReceived(new ResponseContext(RemotingEndPoint.REQUEST,
            responseFuture.getRequestEnvelope(), response));

        responseFuture.putResponse(response);
        if (responseFuture.getAsyncHandler() != null) {
            executeAsyncHandler(responseFuture);
        } else {
            responseFuture.release();
        }
    }

    void scanResponseTable() {
        final List<ResponseFuture> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<String, ResponseFuture>> it = this.responseTable.entrySet().iterator();
            while (it.hasNext()) {
                ResponseFuture responseFuture = it.next().getValue();
                if (responseFuture.isTimeout()) {
                    it.remove();
                    expired.add(responseFuture);
                }
            }
        } finally {
            lock.unlock();
        }

        for (ResponseFuture rf : expired) {
            LOG.warn("Removes timeout request {}", rf.getRequestId());
            rf.fail(timeoutException(rf.getRequestEnvelope(), rf.getTimeoutMillis()));
            executeAsyncHandler(rf);
        }
    }

    private void failPendingRequests(RemotingRuntimeException cause) {
        final List<ResponseFuture> pending;
        lock.lock();
        try {
            pending = new ArrayList<>(this.responseTable.values());
            this.responseTable.clear();
        } finally {
            lock.unlock();
        }

        for (ResponseFuture rf : pending) {
            rf.fail(cause);
            executeAsyncHandler(rf);
        }
    }

    private void executeAsyncHandler(final ResponseFuture responseFuture) {
        if (responseFuture.getAsyncHandler() == null) {
            responseFuture.release();
            return;
        }

        boolean runInThisThread = false;
        try {
            this.asyncHandlerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    try {
                        responseFuture.executeAsyncHandler();
                    } catch (Throwable e) {
                        LOG.warn("Execute async handler in specific executor exception, ", e);
                    } finally {
                        responseFuture.release();
                    }
                }
            });
        } catch (Throwable e) {
            runInThisThread = true;
            LOG.warn("Execute async handler in executor exception, maybe the executor is busy now", e);
        }

        if (runInThisThread) {
            try {
                responseFuture.executeAsyncHandler();
            } catch (Throwable e) {
                LOG.warn("Execute async handler in current thread exception", e);
            } finally {
                responseFuture.release();
            }
        }
    }

    private void requestFail(String requestId, Throwable cause) {
        final ResponseFuture responseFuture;
        lock.lock();
        try {
            responseFuture = this.responseTable.remove(requestId);
        } finally {
            lock.unlock();
        }
        if (responseFuture != null) {
            responseFuture.fail(cause);
            executeAsyncHandler(responseFuture);
        }
    }

    private void registerResponseFuture(ResponseFuture responseFuture) {
        lock.lock();
        try {
            if (state != ServerState.RUNNING) {
                throw new IllegalStateException("Dispatch server is not running, state " + state);
            }
            this.responseTable.put(responseFuture.getRequestId(), responseFuture);
        } finally {
            lock.unlock();
        }
    }

    private void removeResponseFuture(String requestId) {
        lock.lock();
        try {
            this.responseTable.remove(requestId);
        } finally {
            lock.unlock();
        }
    }

    protected String nextRequestId() {
        return config.getRequestIdPrefix() + requestIdGenerator.getAndIncrement();
    }

    public Object request(String command, Object data) {
        return request(command, data, config.getDefaultRequestTimeoutMillis());
    }

    @Override
    public Object request(String command, Object data, long timeoutMillis) {
        return invoke(command, data, timeoutMillis).get(Envelope.RESULT);
    }

    /**
     * Sends a command and blocks until its response arrives.
     *
     * @param timeoutMillis how long to wait, {@code 0} or less waits indefinitely
     * @throws RemotingTimeoutException if no response arrived in time; a later reply is dropped
     * @throws IllegalStateException if the server is not running or the caller is the dispatcher thread
     */
    @Override
    public Map<String, Object> invoke(String command, Object data, long timeoutMillis) {
        if (this.dispatcher.inEventLoop()) {
            throw new IllegalStateException("Blocking request from the dispatcher thread can never complete");
        }

        final String requestId = nextRequestId();
        final Map<String, Object> request = Envelope.command(command, data, requestId);
        final ResponseFuture responseFuture = new ResponseFuture(requestId, timeoutMillis);
        responseFuture.setRequestEnvelope(request);

        registerResponseFuture(responseFuture);
        try {
            this.interceptorGroup.beforeRequest(new RequestContext(RemotingEndPoint.REQUEST, request));

            this.queue.put(request, true, config.getSendTimeoutMillis());

            Map<String, Object> response = responseFuture.waitResponse(timeoutMillis);
            if (response == null) {
                Throwable cause = responseFuture.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause != null) {
                    throw new RemotingAccessException("Request " + requestId + " failed", cause);
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new RemotingAccessException(
                        String.format("Interrupted waiting for response to command '%s'", command));
                }
                throw timeoutException(request, timeoutMillis);
            }
            return response;
        } finally {
            removeResponseFuture(requestId);
        }
    }

    @Override
    public void invokeAsync(final String command, final Object data, final AsyncHandler asyncHandler,
        final long timeoutMillis) {
        Validate.notNull(asyncHandler, "asyncHandler");

        final String requestId = nextRequestId();
        final Map<String, Object> request = Envelope.command(command, data, requestId);

        boolean acquired = this.semaphoreAsync.tryAcquire();
        if (!acquired) {
            String info = String.format("No available async semaphore to issue the request %s", request);
            ResponseFuture rejected = new ResponseFuture(requestId, timeoutMillis, asyncHandler, null);
            rejected.setRequestEnvelope(request);
            rejected.fail(new SemaphoreExhaustedException(info));
            LOG.error(info);
            executeAsyncHandler(rejected);
            return;
        }

        SemaphoreReleaseOnlyOnce once = new SemaphoreReleaseOnlyOnce(this.semaphoreAsync);
        final ResponseFuture responseFuture = new ResponseFuture(requestId, timeoutMillis, asyncHandler, once);
        responseFuture.setRequestEnvelope(request);

        try {
            registerResponseFuture(responseFuture);
        } catch (IllegalStateException e) {
            once.release();
            throw e;
        }

        try {
            this.interceptorGroup.beforeRequest(new RequestContext(RemotingEndPoint.REQUEST, request));
            this.queue.put(request, true, config.getSendTimeoutMillis());
        } catch (Exception e) {
            LOG.error("Send request {} error", requestId, e);
            requestFail(requestId, e);
        }
    }

    public CompletableFuture<Object> asyncRequest(String command, Object data) {
        return asyncRequest(command, data, config.getDefaultRequestTimeoutMillis());
    }

    @Override
    public CompletableFuture<Object> asyncRequest(String command, Object data, long timeoutMillis) {
        final CompletableFuture<Object> future = new CompletableFuture<>();
        invokeAsync(command, data, new AsyncHandler() {
            @Override
            public void onFailure(Map<String, Object> request, Throwable cause) {
                future.completeExceptionally(cause);
            }

            @Override
            public void onSuccess(Map<String, Object> response) {
                future.complete(response.get(Envelope.RESULT));
            }
        }, timeoutMillis);
        return future;
    }

    @Override
    public void sendOneway(String command, Object data) {
        Map<String, Object> request = Envelope.command(command, data, null);
        this.interceptorGroup.beforeRequest(new RequestContext(RemotingEndPoint.REQUEST, request));
        this.queue.put(request, true, config.getSendTimeoutMillis());
    }

    public Object call(String command, Object data) {
        return call(command, data, config.getDefaultRequestTimeoutMillis());
    }

    /**
     * Invokes a command and extracts its outcome: the {@code result} field, or the sole field of a bare mapping
     * reply, or the whole reply without its request id.
     *
     * @throws RemoteCommandException if the peer replied with an error
     */
    public Object call(String command, Object data, long timeoutMillis) {
        Map<String, Object> response = invoke(command, data, timeoutMillis);

        if (response.containsKey(Envelope.ERROR)) {
            Object traceback = response.get(Envelope.TRACEBACK);
            throw new RemoteCommandException(command, String.valueOf(response.get(Envelope.ERROR)),
                traceback == null ? null : traceback.toString());
        }
        if (response.containsKey(Envelope.RESULT)) {
            return response.get(Envelope.RESULT);
        }

        Map<String, Object> rest = new LinkedHashMap<>(response);
        rest.remove(Envelope.REQUEST_ID);
        if (rest.size() == 1) {
            return rest.values().iterator().next();
        }
        return rest;
    }

    public MethodCall on(String command) {
        return new MethodCall(this, command, config.getDefaultRequestTimeoutMillis());
    }

    /**
     * Asks the peer for its exposed methods and caches them.
     */
    public Map<String, MethodInfo> discoverMethods(long timeoutMillis) {
        Map<String, Object> response = invoke(GET_METHODS_COMMAND, null, timeoutMillis);
        Object methods = response.get("methods");
        if (!(methods instanceof Map)) {
            throw new RemotingRuntimeException("Invalid method information returned: " + response);
        }

        Map<String, MethodInfo> discovered = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) methods).entrySet()) {
            String name = String.valueOf(entry.getKey());
            discovered.put(name, parseMethodInfo(name, entry.getValue()));
        }

        this.remoteMethods.clear();
        this.remoteMethods.putAll(discovered);
        return Collections.unmodifiableMap(discovered);
    }

    private static MethodInfo parseMethodInfo(String name, Object value) {
        List<ParameterInfo> parameters = new ArrayList<>();
        String returnType = null;
        String doc = null;
        if (value instanceof Map) {
            Map<?, ?> info = (Map<?, ?>) value;
            Object params = info.get("parameters");
            if (params instanceof List) {
                for (Object param : (List<?>) params) {
                    if (param instanceof Map) {
                        Map<?, ?> p = (Map<?, ?>) param;
                        parameters.add(new ParameterInfo(String.valueOf(p.get("name")),
                            !Boolean.FALSE.equals(p.get("required")), stringOrNull(p.get("type"))));
                    }
                }
            }
            Object returns = info.get("return");
            if (returns instanceof Map) {
                returnType = stringOrNull(((Map<?, ?>) returns).get("type"));
            }
            doc = stringOrNull(info.get("doc"));
        }
        return new MethodInfo(name, parameters, returnType, doc);
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }

    /**
     * @return the methods cached by the last {@link #discoverMethods(long)}
     */
    public Map<String, MethodInfo> remoteMethods() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(this.remoteMethods));
    }

    /**
     * @return the methods this server exposes, in exposure order, as the peer sees them after discovery
     */
    public Map<String, MethodInfo> localMethods() {
        Map<String, MethodInfo> methods = new LinkedHashMap<>();
        lock.lock();
        try {
            for (Map.Entry<String, MethodDescriptor> entry : this.exposedMethods.entrySet()) {
                methods.put(entry.getKey(), entry.getValue().toMethodInfo());
            }
        } finally {
            lock.unlock();
        }
        return Collections.unmodifiableMap(methods);
    }

    public MethodInfo remoteMethod(String name) {
        return this.remoteMethods.get(name);
    }

    /**
     * Sends {@code shutdown} to the peer and waits for its acknowledgement.
     *
     * @return the status the peer acknowledged with
     */
    public Object requestPeerShutdown(long timeoutMillis) {
        return invoke(SHUTDOWN_COMMAND, null, timeoutMillis).get(Envelope.STATUS);
    }

    /**
     * Sends {@code exit} to the peer without waiting, the peer process terminates.
     */
    public void requestPeerExit() {
        sendOneway(EXIT_COMMAND, null);
    }

    protected Object handleExit(final String requestId) {
        LOG.info("Received exit command, process halts");
        if (requestId != null) {
            // The pipe may be held by a stuck writer, so the acknowledgement gets a bounded wait.
            Thread ack = ThreadUtils.newThread("PipeRemoting-ExitAck", new Runnable() {
                @Override
                public void run() {
                    sendResponse(Envelope.reply(Envelope.status("exiting"), requestId));
                }
            }, true);
            ack.start();
            try {
                ack.join(Math.max(1, config.getSendTimeoutMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while sending the exit acknowledgement");
            }
        }
        System.out.flush();
        System.err.flush();
        halt(0);
        return NO_REPLY;
    }

    protected Object handleShutdown(String requestId) {
        LOG.info("Received shutdown command, dispatch server stops");
        if (requestId != null) {
            sendResponse(Envelope.reply(Envelope.status("shutting_down"), requestId));
        }
        requestStop(new RemotingAccessException("Dispatch server shut down before the response arrived"));
        return NO_REPLY;
    }

    protected Map<String, Object> handleGetMethods() {
        Map<String, Object> methods = new LinkedHashMap<>();
        lock.lock();
        try {
            for (Map.Entry<String, MethodDescriptor> entry : this.exposedMethods.entrySet()) {
                methods.put(entry.getKey(), entry.getValue().toMetadata());
            }
        } finally {
            lock.unlock();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("methods", methods);
        return result;
    }

    /**
     * Terminates the process immediately, skipping shutdown hooks.
     */
    protected void halt(int status) {
        Runtime.getRuntime().halt(status);
    }

    public MessageQueue getQueue() {
        return queue;
    }

    public RemotingServerConfig getConfig() {
        return config;
    }

    private static RemotingTimeoutException timeoutException(Map<String, Object> request, long timeoutMillis) {
        Object command = request == null ? null : request.get(Envelope.COMMAND);
        return new RemotingTimeoutException(
            String.format("Timeout waiting for response to command '%s'", command), timeoutMillis);
    }

    private static CompletableFuture<Object> failedFuture(Throwable cause) {
        CompletableFuture<Object> future = new CompletableFuture<>();
        future.completeExceptionally(cause);
        return future;
    }

    private static final class ReadResult {
        private final Object message;
        private final Throwable cause;

        ReadResult(Object message, Throwable cause) {
            this.message = message;
            this.cause = cause;
        }

        @Override
        public String toString() {
            return "ReadResult{message=" + message + ", cause=" + cause + '}';
        }
    }
}
