package com.propertyguess.fmvengine.domain.service;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the authenticated caller. Authentication itself happens upstream.
 */
public interface CurrentUserResolver {

    Optional<UUID> currentUserId();
}
