package com.taskvault.backend.global.security;

import java.util.UUID;

import com.taskvault.backend.global.error.ProblemException;

/**
 * Resource-level rule: only the owner may read, change or delete a resource.
 *
 * <p>A non-owner gets the same not-found answer as for a resource that does not exist,
 * so status codes never confirm that someone else's resource is there.
 */
public final class OwnershipAuthorization {

    private OwnershipAuthorization() {
    }

    public static boolean isOwner(UUID principalId, UUID resourceOwnerId) {
        return principalId != null && principalId.equals(resourceOwnerId);
    }

    public static void requireOwner(UUID principalId, UUID resourceOwnerId, String notFoundCode) {
        if (!isOwner(principalId, resourceOwnerId)) {
            throw ProblemException.notFound(notFoundCode);
        }
    }
}
