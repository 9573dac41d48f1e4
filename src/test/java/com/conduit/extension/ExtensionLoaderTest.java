package com.conduit.extension;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionLoaderTest {

    @Test
    @DisplayName("The config constructor receives the extension config")
    void testLoadWithConfig() throws Exception {
        JsonObject config = new JsonObject();
        config.addProperty("prefix", ">> ");

        Extension extension = ExtensionLoader.load(EchoExtension.class.getName(), config);
        JsonObject params = new JsonObject();
        params.addProperty("text", "hi");

        assertEquals("echo", extension.id());
        JsonObject result = (JsonObject) extension.handleMethod("echo.say", params);
        assertEquals(">> hi", result.get("text").getAsString());
    }

    @Test
    void testUnknownClass() {
        assertThrows(ExtensionRegistrationException.class,
            () -> ExtensionLoader.load("com.conduit.missing.Nope", new JsonObject()));
    }

    @Test
    void testNotAnExtension() {
        assertThrows(ExtensionRegistrationException.class,
            () -> ExtensionLoader.load(String.class.getName(), new JsonObject()));
    }

    @Test
    @DisplayName("A class without a usable constructor is rejected")
    void testNoUsableConstructor() {
        assertThrows(ExtensionRegistrationException.class,
            () -> ExtensionLoader.load(TestExtension.class.getName(), new JsonObject()));
    }
}
