package com.filesentinel.core.model;

/**
 * Who triggered the scan. Captured by the upload layer; we only record it.
 */
public record ActorContext(String userId, String ipAddress, String userAgent) {

    public static ActorContext system() {
        return new ActorContext("system", null, null);
    }

    public static ActorContext user(String userId) {
        return new ActorContext(userId, null, null);
    }

    public String actorId() {
        return userId != null ? userId : "anonymous";
    }
}
