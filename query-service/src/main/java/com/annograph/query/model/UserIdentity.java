package com.annograph.query.model;

/**
 * Requesting user. {@code id} is null for anonymous callers.
 */
public record UserIdentity(Long id, boolean superuser) {

    private static final UserIdentity ANONYMOUS = new UserIdentity(null, false);

    public static UserIdentity anonymous() {
        return ANONYMOUS;
    }

    public static UserIdentity of(long id) {
        return new UserIdentity(id, false);
    }

    public static UserIdentity superuser(long id) {
        return new UserIdentity(id, true);
    }

    public boolean isAnonymous() {
        return id == null;
    }

    /**
     * Identity component of result cache keys.
     */
    public String cacheKey() {
        if (id == null) {
            return "anon";
        }
        return (superuser ? "su" : "u") + id;
    }
}
