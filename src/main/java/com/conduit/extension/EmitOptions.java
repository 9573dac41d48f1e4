package com.conduit.extension;

import java.util.List;

/**
 * Optional routing metadata for an emitted event.
 *
 * @param source external channel address the event belongs to, e.g. {@code "imessage/+1555..."}
 * @param connectionId restricts client delivery to one connection
 * @param sessionId the session the event concerns
 * @param tags free-form tags carried on the event
 */
public record EmitOptions(String source, String connectionId, String sessionId, List<String> tags) {

    public static final EmitOptions NONE = new EmitOptions(null, null, null, List.of());

    public EmitOptions {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static EmitOptions source(String source) {
        return new EmitOptions(source, null, null, List.of());
    }

    public static EmitOptions toConnection(String connectionId) {
        return new EmitOptions(null, connectionId, null, List.of());
    }
}
