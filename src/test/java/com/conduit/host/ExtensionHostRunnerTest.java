package com.conduit.host;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.EchoExtension;
import com.conduit.extension.Extension;
import com.conduit.extension.HealthStatus;
import com.conduit.extension.TestExtension;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.UnknownMethodException;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionHostRunnerTest {

    private final List<String> output = new CopyOnWriteArrayList<>();
    private ExecutorService workers;
    private ExtensionHostRunner runner;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.stop();
        }
        workers.shutdownNow();
    }

    private ExtensionHostRunner startRunner(Extension extension) throws Exception {
        runner = new ExtensionHostRunner(extension, new JsonObject(), output::add, workers);
        runner.start();
        return runner;
    }

    private JsonObject awaitMessage(String type, String id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            for (String line : output) {
                JsonObject message = HostMessages.parse(line);
                if (message != null && type.equals(HostMessages.getString(message, "type"))
                    && (id == null || id.equals(HostMessages.getString(message, "id")))) {
                    return message;
                }
            }
            Thread.sleep(10);
        }
        fail("No " + type + " message" + (id != null ? " with id " + id : ""));
        return null;
    }

    private static String request(String id, String method, JsonObject params) {
        return HostMessages.serialize(HostMessages.request(id, method, params, "conn-1", null, null));
    }

    private static JsonObject text(String value) {
        JsonObject params = new JsonObject();
        params.addProperty("text", value);
        return params;
    }

    @Test
    @DisplayName("Starting announces the registration")
    void testRegisterOnStart() throws Exception {
        startRunner(new EchoExtension(new JsonObject()));

        JsonObject register = awaitMessage("register", null);

        assertEquals("echo", register.getAsJsonObject("extension").get("id").getAsString());
        assertEquals(2, register.getAsJsonObject("extension").getAsJsonArray("methods").size());
    }

    @Test
    void testRequestResponse() throws Exception {
        startRunner(new EchoExtension(new JsonObject()));

        runner.handleLine(request("r1", "echo.say", text("hello")));

        JsonObject response = awaitMessage("res", "r1");
        assertTrue(HostMessages.isOk(response));
        assertEquals("hello", response.getAsJsonObject("payload").get("text").getAsString());
    }

    @Test
    @DisplayName("Params are validated inside the host")
    void testValidationError() throws Exception {
        startRunner(new EchoExtension(new JsonObject()));

        runner.handleLine(request("r1", "echo.say", new JsonObject()));

        JsonObject response = awaitMessage("res", "r1");
        assertFalse(HostMessages.isOk(response));
        assertEquals("VALIDATION_ERROR", HostMessages.getString(response, "code"));
        assertTrue(HostMessages.getString(response, "error").contains("'text'"));
    }

    @Test
    void testHandlerFailure() throws Exception {
        startRunner(new EchoExtension(new JsonObject()));

        runner.handleLine(request("r1", "echo.fail", new JsonObject()));
        runner.handleLine(request("r2", "echo.unknown", new JsonObject()));

        JsonObject failed = awaitMessage("res", "r1");
        assertEquals("EXTENSION_ERROR", HostMessages.getString(failed, "code"));
        assertEquals("echo failed", HostMessages.getString(failed, "error"));
        assertEquals("UNKNOWN_METHOD", HostMessages.getString(awaitMessage("res", "r2"), "code"));
    }

    @Test
    void testHealth() throws Exception {
        TestExtension extension = new TestExtension("voice");
        extension.healthStatus = new HealthStatus(false, Map.of("status", "muted"));
        startRunner(extension);

        runner.handleLine(request("h1", HostMessages.METHOD_HEALTH, new JsonObject()));

        JsonObject payload = awaitMessage("res", "h1").getAsJsonObject("payload");
        assertFalse(payload.get("ok").getAsBoolean());
        assertEquals("muted", payload.getAsJsonObject("details").get("status").getAsString());
    }

    @Test
    @DisplayName("Source responses are handed to the extension")
    void testSourceResponse() throws Exception {
        TestExtension extension = new TestExtension("imessage").withRoutes("imessage");
        startRunner(extension);
        JsonObject params = new JsonObject();
        params.addProperty("source", "imessage/+1555");
        params.add("event", HostMessages.event(GatewayEvent.builder("session.reply").source("imessage/+1555").build()));

        runner.handleLine(request("s1", HostMessages.METHOD_SOURCE_RESPONSE, params));

        JsonObject response = awaitMessage("res", "s1");
        assertEquals("ok", response.getAsJsonObject("payload").get("status").getAsString());
        assertEquals(1, extension.sourceResponses.size());
        assertEquals("session.reply", extension.sourceResponses.get(0).getType());
    }

    @Test
    @DisplayName("Gateway events reach matching subscriptions")
    void testEventDispatch() throws Exception {
        List<GatewayEvent> seen = new CopyOnWriteArrayList<>();
        TestExtension extension = new TestExtension("listener");
        startRunner(extension);
        extension.ctx().on("session.*", seen::add);

        runner.handleLine(HostMessages.serialize(HostMessages.event(GatewayEvent.of("session.abc.delta", null))));
        runner.handleLine(HostMessages.serialize(HostMessages.event(GatewayEvent.of("voice.transcript", null))));

        workers.shutdown();
        assertTrue(workers.awaitTermination(2, TimeUnit.SECONDS));
        assertEquals(1, seen.size());
        assertEquals("session.abc.delta", seen.get(0).getType());
    }

    @Test
    void testEmit() throws Exception {
        TestExtension extension = new TestExtension("voice");
        startRunner(extension);

        extension.ctx().emit("voice.transcript", Map.of("text", "hi"));

        JsonObject event = awaitMessage("event", null);
        assertEquals("voice.transcript", HostMessages.getString(event, "event"));
        assertEquals("hi", event.getAsJsonObject("payload").get("text").getAsString());
    }

    @Test
    @DisplayName("A nested call inherits the request's trace one level deeper")
    void testNestedCall() throws Exception {
        TestExtension extension = new TestExtension("relay");
        extension.withMethod("relay.call", params -> extension.ctx().call("voice.speak", params)
            .get(2, TimeUnit.SECONDS));
        startRunner(extension);
        JsonObject request = HostMessages.request("r1", "relay.call", text("hi"), "conn-1",
            new CallContext("trace-9", 0, System.currentTimeMillis() + 10_000), null);

        runner.handleLine(HostMessages.serialize(request));

        JsonObject call = awaitMessage("call", null);
        assertEquals("voice.speak", HostMessages.getString(call, "method"));
        assertEquals("trace-9", HostMessages.getString(call, "traceId"));
        assertEquals(1, call.get("depth").getAsInt());
        assertEquals("conn-1", HostMessages.getString(call, "connectionId"));

        runner.handleLine(HostMessages.serialize(HostMessages.success(HostMessages.TYPE_CALL_RESPONSE,
            HostMessages.getString(call, "id"), new JsonPrimitive("spoken"))));

        JsonObject response = awaitMessage("res", "r1");
        assertTrue(HostMessages.isOk(response));
        assertEquals("spoken", response.get("payload").getAsString());
    }

    @Test
    void testNestedCallFailure() throws Exception {
        TestExtension extension = new TestExtension("relay");
        extension.withMethod("relay.call", params -> extension.ctx().call("voice.speak", params)
            .get(2, TimeUnit.SECONDS));
        startRunner(extension);

        runner.handleLine(request("r1", "relay.call", new JsonObject()));
        JsonObject call = awaitMessage("call", null);
        runner.handleLine(HostMessages.serialize(HostMessages.failure(HostMessages.TYPE_CALL_RESPONSE,
            HostMessages.getString(call, "id"), new UnknownMethodException("voice.speak"))));

        JsonObject response = awaitMessage("res", "r1");
        assertFalse(HostMessages.isOk(response));
        assertEquals("UNKNOWN_METHOD", HostMessages.getString(response, "code"));
    }

    @Test
    @DisplayName("Reaching end of input stops the extension")
    void testRunUntilEndOfInput() throws Exception {
        TestExtension extension = new TestExtension("voice");
        startRunner(extension);

        runner.run(new BufferedReader(new StringReader("not json\n\n")));

        assertEquals(1, extension.stopCount);
    }

    @Test
    @DisplayName("A line without a type is skipped and reading continues")
    void testMessageWithoutType() throws Exception {
        TestExtension extension = new TestExtension("voice");
        startRunner(extension);

        runner.run(new BufferedReader(new StringReader("{\"id\":\"r1\",\"method\":\"voice.speak\"}\n")));

        assertEquals(1, extension.stopCount);
        assertTrue(output.stream().noneMatch(line -> line.contains("\"r1\"")));
    }
}
