package com.loanorigination.model;

/**
 * Whoever performs a lifecycle operation. Passed explicitly into every call;
 * the core never looks up a "current user".
 */
public record Actor(
    String id,          // Null only for the system actor
    ActorType type
) {
    public static final Actor SYSTEM = new Actor(null, ActorType.SYSTEM);

    public Actor {
        if (type == null) {
            throw new IllegalArgumentException("Actor type cannot be null");
        }
        if (type != ActorType.SYSTEM && (id == null || id.isBlank())) {
            throw new IllegalArgumentException("Actor ID cannot be null or empty for " + type);
        }
    }

    public static Actor staff(String id) {
        return new Actor(id, ActorType.STAFF);
    }

    public static Actor applicant(String id) {
        return new Actor(id, ActorType.APPLICANT);
    }
}
