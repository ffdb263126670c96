package com.lodestar.core.persistence;

import java.util.regex.Pattern;

/**
 * Identifies one session of one agent in a {@link StateStore}.
 * <p>
 * Both parts are restricted to {@code [A-Za-z0-9._-]+} so they can be used
 * verbatim as file names and table keys.
 */
public record SessionKey(String agentId, String sessionId) {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    public SessionKey {
        requireValid("agentId", agentId);
        requireValid("sessionId", sessionId);
    }

    public static SessionKey of(String agentId, String sessionId) {
        return new SessionKey(agentId, sessionId);
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches() && !id.equals(".") && !id.equals("..");
    }

    private static void requireValid(String label, String id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException(
                    "Invalid " + label + " '" + id + "': must match [A-Za-z0-9._-]+");
        }
    }

    @Override
    public String toString() {
        return agentId + "/" + sessionId;
    }
}
