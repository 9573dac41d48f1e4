package com.conduit.host;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.extension.MethodDefinition;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.ExtensionCallException;
import com.conduit.rpc.GatewayException;
import com.conduit.schema.MethodSchema;
import com.conduit.schema.MethodSchema.FieldType;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HostMessagesTest {

    @Test
    @DisplayName("Only JSON objects with a type are protocol messages")
    void testParse() {
        assertNotNull(HostMessages.parse("{\"type\":\"res\",\"id\":\"1\"}"));
        assertNull(HostMessages.parse("{\"id\":\"1\"}"));
        assertNull(HostMessages.parse("[1,2]"));
        assertNull(HostMessages.parse("{broken"));
    }

    @Test
    @DisplayName("Serialized messages fit on one line")
    void testSingleLine() {
        JsonObject params = new JsonObject();
        params.addProperty("text", "line one\nline two");

        String line = HostMessages.serialize(HostMessages.request("1", "voice.speak", params, null, null, null));

        assertFalse(line.contains("\n"));
        assertEquals("line one\nline two",
            HostMessages.parse(line).getAsJsonObject("params").get("text").getAsString());
    }

    @Test
    void testRequestCarriesCallContext() {
        CallContext context = new CallContext("trace-1", 2, 12345L);

        JsonObject request = HostMessages.request("1", "voice.speak", null, "conn-1", context, List.of("x"));

        assertEquals("trace-1", request.get("traceId").getAsString());
        assertEquals(2, request.get("depth").getAsInt());
        assertEquals(12345L, request.get("deadlineMs").getAsLong());
        assertEquals("conn-1", request.get("connectionId").getAsString());
        assertEquals(1, request.getAsJsonArray("tags").size());

        CallContext read = HostMessages.readCallContext(request, 1000);
        assertEquals(context, read);
    }

    @Test
    @DisplayName("Missing trace metadata is filled in")
    void testReadCallContextDefaults() {
        long before = System.currentTimeMillis();

        CallContext context = HostMessages.readCallContext(new JsonObject(), 5000);

        assertNotNull(context.traceId());
        assertEquals(0, context.depth());
        assertTrue(context.deadlineMs() >= before + 5000);
    }

    @Test
    void testRegistration() {
        MethodSchema schema = MethodSchema.builder().required("text", FieldType.STRING).build();
        ExtensionRegistration registration = new ExtensionRegistration("voice", "Voice",
            List.of(new MethodDefinition("voice.speak", "Speak", schema)), List.of("voice.*"), List.of("tts"));

        ExtensionRegistration read = HostMessages.readRegistration(
            HostMessages.parse(HostMessages.serialize(HostMessages.register(registration))));

        assertEquals("voice", read.id());
        assertEquals("Voice", read.name());
        assertEquals(List.of("voice.*"), read.events());
        assertEquals(List.of("tts"), read.sourceRoutes());
        MethodDefinition method = read.methods().get(0);
        assertEquals("Speak", method.description());
        assertEquals(1, method.inputSchema().validate(new JsonObject()).size());
    }

    @Test
    void testRegistrationWithoutExtension() {
        JsonObject message = new JsonObject();
        message.addProperty("type", "register");

        assertThrows(IllegalArgumentException.class, () -> HostMessages.readRegistration(message));
    }

    @Test
    void testEvent() {
        JsonObject payload = new JsonObject();
        payload.addProperty("text", "hi");
        GatewayEvent event = GatewayEvent.builder("voice.transcript")
            .payload(payload)
            .origin("voice")
            .source("tts/1")
            .connectionId("conn-1")
            .tags(List.of("a"))
            .timestamp(99L)
            .build();

        GatewayEvent read = HostMessages.readEvent(HostMessages.event(event), null);

        assertEquals("voice.transcript", read.getType());
        assertEquals(payload, read.getPayload());
        assertEquals("voice", read.getOrigin());
        assertEquals("tts/1", read.getSource());
        assertEquals("conn-1", read.getConnectionId());
        assertEquals(List.of("a"), read.getTags());
        assertEquals(99L, read.getTimestamp());
        assertEquals("gateway", HostMessages.readEvent(HostMessages.event(event), "gateway").getOrigin());
    }

    @Test
    @DisplayName("Error codes survive the wire")
    void testReadError() {
        GatewayException coded = HostMessages.readError(
            HostMessages.failure("res", "1", new GatewayException("TIMEOUT", "too slow")));
        GatewayException plain = HostMessages.readError(new JsonObject());

        assertEquals("TIMEOUT", coded.getCode());
        assertEquals("too slow", coded.getMessage());
        assertInstanceOf(ExtensionCallException.class, plain);
        assertEquals("Unknown error", plain.getMessage());
    }

    @Test
    void testIsOk() {
        assertTrue(HostMessages.isOk(HostMessages.success("res", "1", null)));
        assertFalse(HostMessages.isOk(HostMessages.failure("res", "1", new ExtensionCallException("x"))));
        assertFalse(HostMessages.isOk(new JsonObject()));
    }
}
