package com.conduit.server;

import com.conduit.extension.ExtensionManager;
import com.conduit.extension.HealthStatus;
import com.conduit.extension.TestExtension;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthReportTest {

    @Test
    void testReport() {
        ExtensionManager manager = new ExtensionManager(Runnable::run);
        TestExtension voice = new TestExtension("voice").withRoutes("tts");
        voice.healthStatus = new HealthStatus(false, Map.of("status", "no_microphone"));
        manager.register(voice);
        ConnectionRegistry connections = new ConnectionRegistry();
        connections.add(new ClientConnection("c1", text -> {}, Runnable::run));
        connections.add(new ClientConnection("c2", text -> {}, Runnable::run));

        JsonObject report = new HealthReport(manager, connections).build();

        assertEquals("ok", report.get("status").getAsString());
        assertEquals(2, report.get("clients").getAsInt());
        JsonObject status = report.getAsJsonObject("extensions").getAsJsonObject("voice");
        assertFalse(status.get("ok").getAsBoolean());
        assertEquals("no_microphone", status.getAsJsonObject("details").get("status").getAsString());
        assertEquals("voice", report.getAsJsonObject("sourceRoutes").get("tts").getAsString());
    }
}
