package com.propertyguess.fmvengine.infra.web;

import com.propertyguess.fmvengine.domain.service.CurrentUserResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;
import java.util.UUID;

/**
 * Reads the identity forwarded by the authenticating gateway in {@value #USER_ID_HEADER}.
 */
@Slf4j
@Component
public class HeaderCurrentUserResolver implements CurrentUserResolver {

    public static final String USER_ID_HEADER = "X-User-Id";

    @Override
    public Optional<UUID> currentUserId() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return Optional.empty();
        }
        HttpServletRequest request = servletAttributes.getRequest();
        String raw = request.getHeader(USER_ID_HEADER);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw.trim()));
        } catch (IllegalArgumentException e) {
            log.debug("[Identity] 잘못된 사용자 헤더: {}", raw);
            return Optional.empty();
        }
    }
}
