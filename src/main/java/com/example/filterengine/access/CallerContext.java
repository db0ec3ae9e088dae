package com.example.filterengine.access;

import java.util.Objects;

/**
 * Who is asking. Resolved by the HTTP or tool layer; authentication itself happens upstream.
 */
public final class CallerContext {
    private final String userId;
    private final String teamId;

    private CallerContext(String userId, String teamId) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.teamId = teamId;
    }

    public static CallerContext of(String userId, String teamId) {
        return new CallerContext(userId, teamId == null || teamId.isBlank() ? null : teamId);
    }

    public static CallerContext user(String userId) {
        return new CallerContext(userId, null);
    }

    public String getUserId() { return userId; }
    public String getTeamId() { return teamId; }

    @Override
    public String toString() {
        return teamId == null ? userId : userId + "@" + teamId;
    }
}
