package com.annograph.query.permission;

import com.annograph.query.model.UserIdentity;
import org.springframework.stereotype.Component;

/**
 * Maps the {@code X-User-Id} header to a user. A missing header or an unknown or inactive user
 * is treated as anonymous.
 */
@Component
public class UserResolver {

    public static final String USER_HEADER = "X-User-Id";

    private final PermissionStore permissionStore;

    public UserResolver(PermissionStore permissionStore) {
        this.permissionStore = permissionStore;
    }

    public UserIdentity resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return UserIdentity.anonymous();
        }
        long userId;
        try {
            userId = Long.parseLong(headerValue.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(USER_HEADER + " must be a numeric user id", ex);
        }
        return permissionStore.findUser(userId).orElse(UserIdentity.anonymous());
    }
}
