package com.conduit.events;

/**
 * Matches dot-delimited event types against subscription patterns.
 *
 * Supported pattern forms:
 * <ul>
 *   <li>{@code "*"} matches every event type</li>
 *   <li>{@code "session.prompt"} exact match</li>
 *   <li>{@code "session.*"} two-segment trailing wildcard, matches any event under
 *       {@code session.} at any depth</li>
 *   <li>{@code "session.*.delta"} each {@code *} matches exactly one segment</li>
 * </ul>
 * Any other shape only matches when segment counts are equal.
 */
public final class EventPatterns {

    public static final String MATCH_ALL = "*";

    private static final String WILDCARD_SEGMENT = "*";

    private EventPatterns() {
    }

    /**
     * Checks whether an event type matches a subscription pattern.
     *
     * @param eventType the concrete event type, e.g. {@code "session.abc.delta"}
     * @param pattern the subscription pattern
     * @return true if the pattern accepts the event type
     */
    public static boolean matches(String eventType, String pattern) {
        if (eventType == null || pattern == null) {
            return false;
        }
        if (MATCH_ALL.equals(pattern) || pattern.equals(eventType)) {
            return true;
        }

        String[] patternParts = split(pattern);
        String[] eventParts = split(eventType);

        if (patternParts.length == 2 && WILDCARD_SEGMENT.equals(patternParts[1])) {
            return eventParts[0].equals(patternParts[0]);
        }

        if (patternParts.length != eventParts.length) {
            return false;
        }
        for (int i = 0; i < patternParts.length; i++) {
            if (!WILDCARD_SEGMENT.equals(patternParts[i]) && !patternParts[i].equals(eventParts[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether any of the given patterns matches the event type.
     */
    public static boolean matchesAny(String eventType, Iterable<String> patterns) {
        for (String pattern : patterns) {
            if (matches(eventType, pattern)) {
                return true;
            }
        }
        return false;
    }

    // String.split would drop trailing empty segments; keep them so "a." never equals "a"
    private static String[] split(String value) {
        int count = 1;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '.') {
                count++;
            }
        }
        String[] parts = new String[count];
        int start = 0;
        int index = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '.') {
                parts[index++] = value.substring(start, i);
                start = i + 1;
            }
        }
        parts[index] = value.substring(start);
        return parts;
    }
}
