package com.propertyguess.fmvengine.infra.user;

import com.propertyguess.fmvengine.domain.model.AuthorProfile;
import com.propertyguess.fmvengine.domain.model.UserAccount;
import com.propertyguess.fmvengine.domain.repository.UserAccountRepository;
import com.propertyguess.fmvengine.domain.service.UserKarmaLookup;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaUserKarmaLookup implements UserKarmaLookup {

    private final UserAccountRepository userAccountRepository;

    @Override
    public Integer getKarma(UUID userId) {
        if (userId == null) return null;
        return userAccountRepository.findById(userId)
                .map(UserAccount::getKarma)
                .orElse(null);
    }

    @Override
    public Map<UUID, AuthorProfile> getProfiles(Collection<UUID> userIds) {
        Map<UUID, AuthorProfile> profiles = new HashMap<>();
        if (userIds == null || userIds.isEmpty()) return profiles;

        for (UserAccount account : userAccountRepository.findAllById(userIds)) {
            profiles.put(account.getId(), new AuthorProfile(
                    account.getId(), account.getUsername(), account.getDisplayName(), account.getKarma()));
        }
        return profiles;
    }
}
