package com.annograph.query.model;

import java.util.Set;

/**
 * Visibility facts of a permissioned object: document, corpus, analysis or extract.
 * {@code scopeCorpusId} is the corpus an analysis or extract belongs to, null for documents,
 * corpuses and unscoped objects.
 */
public record ObjectAccess(long objectId, Long creatorId, boolean publiclyVisible, Set<Long> readerIds, Long scopeCorpusId) {

    public ObjectAccess {
        readerIds = readerIds == null ? Set.of() : Set.copyOf(readerIds);
    }

    public ObjectAccess(long objectId, Long creatorId, boolean publiclyVisible, Set<Long> readerIds) {
        this(objectId, creatorId, publiclyVisible, readerIds, null);
    }

    public boolean visibleTo(UserIdentity user) {
        if (user.superuser() || publiclyVisible) {
            return true;
        }
        if (user.isAnonymous()) {
            return false;
        }
        return user.id().equals(creatorId) || readerIds.contains(user.id());
    }
}
