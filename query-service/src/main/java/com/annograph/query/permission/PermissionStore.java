package com.annograph.query.permission;

import com.annograph.query.model.ObjectAccess;
import com.annograph.query.model.UserIdentity;

import java.util.Optional;

/**
 * Object-level ACL facts. There are no per-annotation or per-relationship entries.
 */
public interface PermissionStore {

    Optional<UserIdentity> findUser(long userId);

    Optional<ObjectAccess> findAccess(PermissionedType type, long objectId);
}
