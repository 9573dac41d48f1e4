package com.conduit.server;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.ExtensionManager;
import com.conduit.extension.TestExtension;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the server on an ephemeral port and talks to it over HTTP and WebSocket.
 */
class GatewayServerTest {

    private ExtensionManager manager;
    private ConnectionRegistry connections;
    private GatewayServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        manager = new ExtensionManager(Runnable::run);
        manager.register(new TestExtension("voice").withMethod("voice.speak", params -> "spoken"));
        connections = new ConnectionRegistry();
        manager.addClientSink(connections);
        server = new GatewayServer("127.0.0.1", 0, manager, connections);
        server.start();
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        manager.shutdown();
    }

    private URI uri(String scheme, String path) {
        return URI.create(scheme + "://127.0.0.1:" + server.getPort() + path);
    }

    @Test
    void testHealthEndpoint() throws Exception {
        HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri("http", "/health")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        JsonObject body = JsonParser.parseString(response.body()).getAsJsonObject();
        assertEquals("ok", body.get("status").getAsString());
        assertTrue(body.getAsJsonObject("extensions").has("voice"));
    }

    @Test
    void testUnknownPath() throws Exception {
        HttpResponse<String> response = client.send(HttpRequest.newBuilder(uri("http", "/nope")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(404, response.statusCode());
    }

    @Test
    @DisplayName("Requests and events flow over the WebSocket")
    void testWebSocketSession() throws Exception {
        BlockingQueue<String> received = new LinkedBlockingQueue<>();
        WebSocket socket = client.newWebSocketBuilder()
            .buildAsync(uri("ws", GatewayServer.WEBSOCKET_PATH), new WebSocket.Listener() {
                private final StringBuilder buffer = new StringBuilder();

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buffer.append(data);
                    if (last) {
                        received.add(buffer.toString());
                        buffer.setLength(0);
                    }
                    webSocket.request(1);
                    return null;
                }
            })
            .get(5, TimeUnit.SECONDS);

        socket.sendText("{\"type\":\"req\",\"id\":\"1\",\"method\":\"voice.speak\"}", true).get(5, TimeUnit.SECONDS);
        JsonObject response = JsonParser.parseString(received.poll(5, TimeUnit.SECONDS)).getAsJsonObject();
        assertEquals("1", response.get("id").getAsString());
        assertTrue(response.get("ok").getAsBoolean());
        assertEquals("spoken", response.get("payload").getAsString());

        socket.sendText("{\"type\":\"req\",\"id\":\"2\",\"method\":\"gateway.subscribe\",\"params\":{\"events\":[\"voice.*\"]}}",
            true).get(5, TimeUnit.SECONDS);
        assertNotNull(received.poll(5, TimeUnit.SECONDS));
        assertEquals(1, connections.size());

        manager.publish(GatewayEvent.of("voice.transcript", new JsonObject()));
        JsonObject event = JsonParser.parseString(received.poll(5, TimeUnit.SECONDS)).getAsJsonObject();
        assertEquals("event", event.get("type").getAsString());
        assertEquals("voice.transcript", event.get("event").getAsString());

        socket.sendClose(WebSocket.NORMAL_CLOSURE, "done").get(5, TimeUnit.SECONDS);
    }
}
