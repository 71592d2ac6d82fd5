package com.propertyguess.fmvengine.domain.model;

import java.util.UUID;

public record AuthorProfile(UUID id, String username, String displayName, int karma) {
}
