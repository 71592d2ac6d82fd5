package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.model.AuthorProfile;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of the user directory. Karma bookkeeping lives elsewhere.
 */
public interface UserKarmaLookup {

    /**
     * Returns null when the user is unknown.
     */
    Integer getKarma(UUID userId);

    /**
     * Unknown users are absent from the returned map.
     */
    Map<UUID, AuthorProfile> getProfiles(Collection<UUID> userIds);

    default Map<UUID, Integer> getKarmaByUser(Collection<UUID> userIds) {
        Map<UUID, Integer> result = new HashMap<>();
        getProfiles(userIds).forEach((id, profile) -> result.put(id, profile.karma()));
        return result;
    }
}
