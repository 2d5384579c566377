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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.apache.pipe.remoting.BaseTest;
import org.apache.pipe.remoting.api.AsyncHandler;
import org.apache.pipe.remoting.api.CommandHandler;
import org.apache.pipe.remoting.api.DefaultCommandHandler;
import org.apache.pipe.remoting.api.RemotingEndPoint;
import org.apache.pipe.remoting.api.annotation.Exposed;
import org.apache.pipe.remoting.api.annotation.NotExposed;
import org.apache.pipe.remoting.api.annotation.Param;
import org.apache.pipe.remoting.api.command.Envelope;
import org.apache.pipe.remoting.api.command.MethodInfo;
import org.apache.pipe.remoting.api.exception.RemoteCommandException;
import org.apache.pipe.remoting.api.exception.RemotingConnectionClosedException;
import org.apache.pipe.remoting.api.exception.RemotingTimeoutException;
import org.apache.pipe.remoting.api.interceptor.Interceptor;
import org.apache.pipe.remoting.api.interceptor.RequestContext;
import org.apache.pipe.remoting.api.interceptor.ResponseContext;
import org.apache.pipe.remoting.config.ReadMode;
import org.apache.pipe.remoting.config.RemotingServerConfig;
import org.apache.pipe.remoting.impl.queue.MessageQueue;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DispatchServerTest extends BaseTest {
    private CalculatorServer server;
    private MessageQueue peer;
    private CountDownLatch busyHandlers;

    @Before
    public void setUp() throws IOException {
        server = newServer(serverConfig("java-"));
        server.start();
    }

    private CalculatorServer newServer(RemotingServerConfig config) throws IOException {
        MessageQueue[] pair = newQueuePair();
        peer = pair[1];
        return autoClose(new CalculatorServer(pair[0], config));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> ask(String command, Object data, String requestId) {
        peer.put(Envelope.command(command, data, requestId));
        return (Map<String, Object>) peer.get();
    }

    private static Map<String, Object> args(Object... namesAndValues) {
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            args.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return args;
    }

    /**
     * Registers {@code block}, which holds its handler thread until the returned latch is released.
     */
    private CountDownLatch registerBlockingHandler(DispatchServer target, int expectedCalls) {
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch entered = new CountDownLatch(expectedCalls);
        busyHandlers = entered;
        target.registerHandler("block", new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) throws Exception {
                entered.countDown();
                release.await();
                return "released";
            }
        });
        return release;
    }

    /**
     * Lets the peer answer the next request it receives with {@code result}.
     */
    private void answerNextRequest(final Object result) {
        runInThreads(new Runnable() {
            @Override
            @SuppressWarnings("unchecked")
            public void run() {
                Map<String, Object> request = (Map<String, Object>) peer.get();
                peer.put(Envelope.reply(result, Envelope.requestId(request)));
            }
        }, 1);
    }

    @Test(timeout = 5000)
    public void processCommand_UnknownCommand() {
        Map<String, Object> response = ask("foo", null, "py-1");

        assertThat(response).hasSize(2)
            .containsEntry("error", "Unknown command: foo")
            .containsEntry("request_id", "py-1");
    }

    @Test(timeout = 5000)
    public void processCommand_ExposedMethodWithNamedArguments() {
        Map<String, Object> response = ask("add", args("a", 1, "b", 2), "py-1");

        assertThat(response.get("result")).isEqualTo(3);
        assertThat(response.get("request_id")).isEqualTo("py-1");
    }

    @Test(timeout = 5000)
    public void processCommand_PositionalArgument() {
        Map<String, Object> response = ask("echo", Arrays.asList(1, "two"), "py-1");

        assertThat(response.get("result")).isEqualTo(Arrays.asList(1, "two"));
    }

    @Test(timeout = 5000)
    public void processCommand_MissingRequiredArgument() {
        Map<String, Object> response = ask("add", args("a", 1), "py-1");

        assertThat((String) response.get("error")).contains("missing required argument 'b'");
    }

    @Test(timeout = 5000)
    public void processCommand_OptionalArgumentAndRenamedCommand() {
        assertThat(ask("greet", args("name", "Ann"), "py-1").get("result")).isEqualTo("Hello, Ann");
        assertThat(ask("greet", args("name", "Ann", "greeting", "Hi"), "py-2").get("result")).isEqualTo("Hi, Ann");
        assertThat(ask("hello", args("name", "Ann"), "py-3").get("error")).isEqualTo("Unknown command: hello");
    }

    @Test(timeout = 5000)
    public void processCommand_AsyncMethod() {
        assertThat(ask("later", "value", "py-1").get("result")).isEqualTo("later:value");
    }

    @Test(timeout = 5000)
    public void processCommand_HandlerFailure() {
        Map<String, Object> response = ask("explode", args("message", "boom"), "py-1");

        assertThat(response.get("error")).isEqualTo("boom");
        assertThat((String) response.get("traceback")).contains("IllegalStateException");
        assertThat(response.get("request_id")).isEqualTo("py-1");

        assertThat(ask("add", args("a", 2, "b", 2), "py-2").get("result")).isEqualTo(4);
    }

    @Test(timeout = 5000)
    public void processCommand_MappingResultIsMerged() {
        server.registerHandler("stats", new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                return Collections.singletonMap("count", 2);
            }
        });

        Map<String, Object> response = ask("stats", null, "py-1");

        assertThat(response).hasSize(2).containsEntry("count", 2).containsEntry("request_id", "py-1");
    }

    @Test(timeout = 5000)
    public void processCommand_NullResult() {
        server.registerHandler("nothing", new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                return null;
            }
        });

        Map<String, Object> response = ask("nothing", null, "py-1");

        assertThat(response).containsKey("result");
        assertThat(response.get("result")).isNull();
    }

    @Test(timeout = 5000)
    public void processCommand_DefaultHandler() {
        server.setDefaultHandler(new DefaultCommandHandler() {
            @Override
            public Object handle(String command, Object data, String requestId) {
                return "default:" + command + ":" + data;
            }
        });

        assertThat(ask("whatever", 7, "py-1").get("result")).isEqualTo("default:whatever:7");
        assertThat(ask("add", args("a", 1, "b", 1), "py-2").get("result")).isEqualTo(2);
    }

    @Test(timeout = 5000)
    public void processCommand_FastReplyOvertakesSlow() {
        server.registerHandler("slow", new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) throws Exception {
                TimeUnit.MILLISECONDS.sleep(500);
                return "slow";
            }
        });
        server.registerHandler("fast", new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                return "fast";
            }
        });

        peer.put(Envelope.command("slow", null, "py-1"));
        peer.put(Envelope.command("fast", null, "py-2"));

        Map<?, ?> first = (Map<?, ?>) peer.get();
        Map<?, ?> second = (Map<?, ?>) peer.get();
        assertThat(first.get("result")).isEqualTo("fast");
        assertThat(second.get("result")).isEqualTo("slow");
    }

    @Test(timeout = 5000)
    public void processCommand_OnewayIsNotAnswered() {
        final ObjectFuture<Object> received = newObjectFuture(1, 3000);
        server.registerHandler("note", new CommandHandler() {
            @Override
            public Object handle(Object data, String requestId) {
                received.putObject(data);
                received.release();
                return "ignored";
            }
        });

        peer.put(Envelope.command("note", "memo", null));
        assertThat(received.getObject()).isEqualTo("memo");

        assertThat(ask("add", args("a", 1, "b", 2), "py-1").get("request_id")).isEqualTo("py-1");
    }

    @Test(timeout = 5000)
    public void processMessage_NonEnvelopeIsDropped() {
        peer.put("garbage");
        peer.put(Arrays.asList(1, 2));

        assertThat(ask("add", args("a", 1, "b", 2), "py-1").get("result")).isEqualTo(3);
        assertThat(server.isRunning()).isTrue();
    }

    @Test(timeout = 5000)
    @SuppressWarnings("unchecked")
    public void getMethods_DescribesExposedCommands() {
        Map<String, Object> response = ask(DispatchServer.GET_METHODS_COMMAND, null, "py-1");
        Map<String, Object> methods = (Map<String, Object>) response.get("methods");

        assertThat(methods).containsKeys("add", "echo", "greet", "later", "explode");
        assertThat(methods).doesNotContainKeys("hello", "hidden", "utility", "start", "stop", "request",
            "exit", "shutdown", "__get_methods__");

        Map<String, Object> greet = (Map<String, Object>) methods.get("greet");
        assertThat(greet.get("doc")).isEqualTo("Greets someone");
        List<Map<String, Object>> parameters = (List<Map<String, Object>>) greet.get("parameters");
        assertThat(parameters).hasSize(2);
        assertThat(parameters.get(0)).containsEntry("name", "name").containsEntry("required", true)
            .containsEntry("type", "java.lang.String");
        assertThat(parameters.get(1)).containsEntry("name", "greeting").containsEntry("required", false);

        Map<String, Object> add = (Map<String, Object>) methods.get("add");
        assertThat((Map<String, Object>) add.get("return")).containsEntry("type", "int");
    }

    @Test(timeout = 5000)
    public void exit_AcknowledgesThenHalts() throws InterruptedException {
        Map<String, Object> response = ask(DispatchServer.EXIT_COMMAND, null, "py-9");

        assertThat(response).containsEntry("status", "exiting").containsEntry("request_id", "py-9");
        assertThat(server.halted.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(server.haltStatus).isEqualTo(0);
    }

    @Test
    public void localMethods_MatchExposedCommands() {
        Map<String, MethodInfo> methods = server.localMethods();

        assertThat(methods.keySet()).containsExactlyElementsOf(server.exposedCommands());
        MethodInfo greet = methods.get("greet");
        assertThat(greet.getDoc()).isEqualTo("Greets someone");
        assertThat(greet.getParameters()).hasSize(2);
        assertThat(greet.getParameters().get(1).getName()).isEqualTo("greeting");
        assertThat(greet.getParameters().get(1).isRequired()).isFalse();
        assertThat(methods.get("add").getReturnType()).isEqualTo("int");
    }

    @Test(timeout = 10000)
    public void exit_HaltsWhileEveryHandlerThreadIsBlocked() throws Exception {
        RemotingServerConfig config = serverConfig("java-");
        config.setHandlerExecutorMaxThreads(config.getHandlerExecutorThreads());
        CalculatorServer busy = newServer(config);
        int threads = config.getHandlerExecutorThreads();
        CountDownLatch release = registerBlockingHandler(busy, threads);
        busy.start();

        try {
            for (int i = 0; i < threads; i++) {
                peer.put(Envelope.command("block", null, null));
            }
            assertThat(busyHandlers.await(3, TimeUnit.SECONDS)).isTrue();

            Map<String, Object> response = ask(DispatchServer.EXIT_COMMAND, null, "py-exit");

            assertThat(response).containsEntry("status", "exiting").containsEntry("request_id", "py-exit");
            assertThat(busy.halted.await(3, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
        }
    }

    @Test(timeout = 10000)
    public void processCommand_FastCommandNotQueuedBehindBlockedHandlers() throws Exception {
        int blocked = serverConfig("java-").getHandlerExecutorThreads() + 2;
        CountDownLatch release = registerBlockingHandler(server, blocked);

        try {
            for (int i = 0; i < blocked; i++) {
                peer.put(Envelope.command("block", null, null));
            }
            assertThat(busyHandlers.await(3, TimeUnit.SECONDS)).isTrue();

            assertThat(ask("add", args("a", 1, "b", 2), "py-1").get("result")).isEqualTo(3);
        } finally {
            release.countDown();
        }
    }

    @Test(timeout = 5000)
    public void shutdown_AcknowledgesThenStops() throws InterruptedException {
        Map<String, Object> response = ask(DispatchServer.SHUTDOWN_COMMAND, null, "py-1");

        assertThat(response).containsEntry("status", "shutting_down").containsEntry("request_id", "py-1");
        assertThat(server.awaitStopped(3, TimeUnit.SECONDS)).isTrue();
        assertThat(server.getState()).isEqualTo(ServerState.STOPPED);
    }

    @Test(timeout = 5000)
    public void request_ResolvesWithResult() {
        answerNextRequest(Collections.singletonMap(Envelope.RESULT, args("x", 1)));

        Object result = server.request("echo", args("x", 1), 3000);

        assertThat(result).isEqualTo(args("x", 1));
    }

    @Test(timeout = 10000)
    public void request_TimeoutPurgesAndDropsLateReply() {
        assertThatThrownBy(new ThrowingCallable() {
            @Override
            public void call() {
                server.request("echo", "late", 100);
            }
        }).isInstanceOf(RemotingTimeoutException.class)
            .hasMessageContaining("Timeout waiting for response to command 'echo'");

        @SuppressWarnings("unchecked")
        Map<String, Object> request = (Map<String, Object>) peer.get();
        String requestId = Envelope.requestId(request);
        assertThat(requestId).startsWith("java-");

        ObjectFuture<String> dropped = retrieveStringFromLog("doesn't have a matched request");
        peer.put(Envelope.reply("late", requestId));
        assertThat(dropped.getObject()).contains(requestId);

        answerNextRequest("fresh");
        assertThat(server.request("echo", "fresh", 3000)).isEqualTo("fresh");
    }

    @Test(timeout = 10000)
    @SuppressWarnings("unchecked")
    public void asyncRequest_CorrelatesOutOfOrderReplies() throws Exception {
        List<CompletableFuture<Object>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(server.asyncRequest("echo", i, 3000));
        }

        List<Map<String, Object>> requests = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            requests.add((Map<String, Object>) peer.get());
        }
        Collections.reverse(requests);
        for (Map<String, Object> request : requests) {
            peer.put(Envelope.reply(request.get(Envelope.DATA), Envelope.requestId(request)));
        }

        for (int i = 0; i < 5; i++) {
            assertThat(futures.get(i).get(3, TimeUnit.SECONDS)).isEqualTo(i);
        }
    }

    @Test(timeout = 5000)
    public void invokeAsync_TimeoutReportedToHandler() {
        final ObjectFuture<Throwable> failure = newObjectFuture(1, 3000);

        server.invokeAsync("echo", "never", new AsyncHandler() {
            @Override
            public void onFailure(Map<String, Object> request, Throwable cause) {
                failure.putObject(cause);
                failure.release();
            }

            @Override
            public void onSuccess(Map<String, Object> response) {
                shouldNotReachHere();
            }
        }, 50);

        assertThat(failure.getObject()).isInstanceOf(RemotingTimeoutException.class);
    }

    @Test(timeout = 5000)
    public void call_RemoteErrorRaised() {
        runInThreads(new Runnable() {
            @Override
            @SuppressWarnings("unchecked")
            public void run() {
                Map<String, Object> request = (Map<String, Object>) peer.get();
                peer.put(Envelope.reply(Envelope.error("division by zero", "Traceback..."),
                    Envelope.requestId(request)));
            }
        }, 1);

        assertThatThrownBy(new ThrowingCallable() {
            @Override
            public void call() {
                server.call("divide", args("a", 1, "b", 0), 3000);
            }
        }).isInstanceOf(RemoteCommandException.class).hasMessageContaining("division by zero");
    }

    @Test(timeout = 5000)
    public void call_BareMappingReply() {
        answerNextRequest(args("status", "ok"));

        assertThat(server.call("ping", null, 3000)).isEqualTo("ok");
    }

    @Test(timeout = 5000)
    public void peerClosed_StopsServerAndFailsPending() throws Exception {
        CompletableFuture<Object> pending = server.asyncRequest("echo", "x", 0);
        peer.get();

        peer.close();

        assertThat(server.awaitStopped(3, TimeUnit.SECONDS)).isTrue();
        try {
            pending.get(3, TimeUnit.SECONDS);
            shouldNotReachHere();
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(RemotingConnectionClosedException.class);
        }
    }

    @Test
    public void request_RequiresRunningServer() throws IOException {
        final CalculatorServer idle = newServer(serverConfig("java-"));

        assertThatThrownBy(new ThrowingCallable() {
            @Override
            public void call() {
                idle.request("echo", 1, 100);
            }
        }).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void start_AfterStopIsRejected() {
        server.stop();

        assertThat(server.getState()).isEqualTo(ServerState.STOPPED);
        assertThatThrownBy(new ThrowingCallable() {
            @Override
            public void call() {
                server.start();
            }
        }).isInstanceOf(IllegalStateException.class);
    }

    @Test(timeout = 5000)
    public void interceptors_SeeInboundCommandAndResponse() throws InterruptedException {
        final AtomicReference<RequestContext> before = new AtomicReference<>();
        final AtomicReference<ResponseContext> after = new AtomicReference<>();
        final CountDownLatch seen = new CountDownLatch(1);
        server.registerInterceptor(new Interceptor() {
            @Override
            public void beforeRequest(RequestContext context) {
                before.set(context);
            }

            @Override
            public void afterResponseReceived(ResponseContext context) {
                after.set(context);
                seen.countDown();
            }
        });

        ask("add", args("a", 1, "b", 2), "py-1");

        assertThat(seen.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(before.get().getRemotingEndPoint()).isEqualTo(RemotingEndPoint.RESPONSE);
        assertThat(before.get().getRequest()).containsEntry("command", "add");
        assertThat(after.get().getResponse()).containsEntry("result", 3);
    }

    @Test(timeout = 5000)
    public void exposeMethods_ServiceObject() {
        server.exposeMethods(new GreetingService());

        assertThat(ask("shout", "hey", "py-1").get("result")).isEqualTo("HEY");
        assertThat(ask("add", args("a", 1, "b", 2), "py-2").get("result")).isEqualTo(3);
        assertThat(server.exposedCommands()).contains("shout");
    }

    @Test(timeout = 5000)
    public void exposeMethods_Disabled() throws IOException {
        RemotingServerConfig config = serverConfig("java-");
        config.setExposeMethods(false);
        CalculatorServer plain = newServer(config);
        plain.start();

        assertThat(ask("add", args("a", 1, "b", 2), "py-1").get("error")).isEqualTo("Unknown command: add");
        assertThat(plain.hasHandler(DispatchServer.SHUTDOWN_COMMAND)).isTrue();
    }

    @Test(timeout = 5000)
    public void continuousReadMode() throws IOException {
        RemotingServerConfig config = serverConfig("java-");
        config.setReadMode(ReadMode.CONTINUOUS);
        newServer(config).start();

        assertThat(ask("add", args("a", 20, "b", 22), "py-1").get("result")).isEqualTo(42);
        assertThat(ask("add", args("a", 1, "b", 1), "py-2").get("result")).isEqualTo(2);
    }

    public static class CalculatorServer extends DispatchServer {
        final CountDownLatch halted = new CountDownLatch(1);
        volatile int haltStatus = -1;

        public CalculatorServer(MessageQueue queue, RemotingServerConfig config) {
            super(queue, config);
        }

        public int add(int a, int b) {
            return a + b;
        }

        public Object echo(Object data) {
            return data;
        }

        @Exposed(value = "greet", doc = "Greets someone")
        public String hello(@Param("name") String name, @Param(value = "greeting", required = false) String greeting) {
            return (greeting == null ? "Hello" : greeting) + ", " + name;
        }

        public CompletableFuture<String> later(final String value) {
            return CompletableFuture.supplyAsync(new Supplier<String>() {
                @Override
                public String get() {
                    return "later:" + value;
                }
            });
        }

        public void explode(String message) {
            throw new IllegalStateException(message);
        }

        @NotExposed
        public void hidden() {
        }

        public static void utility() {
        }

        @Override
        protected void halt(int status) {
            haltStatus = status;
            halted.countDown();
        }
    }

    public static class GreetingService {
        public String shout(String text) {
            return text.toUpperCase();
        }
    }
}
