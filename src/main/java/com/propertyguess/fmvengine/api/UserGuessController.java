package com.propertyguess.fmvengine.api;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.GuessHistory;
import com.propertyguess.fmvengine.domain.model.GuessHistoryItem;
import com.propertyguess.fmvengine.domain.service.CurrentUserResolver;
import com.propertyguess.fmvengine.domain.service.GuessHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/users/me")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class UserGuessController {

    private final GuessHistoryService guessHistoryService;
    private final CurrentUserResolver currentUserResolver;

    @GetMapping("/guesses")
    public ResponseEntity<Map<String, Object>> history(@RequestParam(defaultValue = "1") int page,
                                                       @RequestParam(defaultValue = "20") int limit) {
        UUID userId = currentUserResolver.currentUserId().orElse(null);
        try {
            GuessHistory history = guessHistoryService.history(userId, page, limit);

            List<Map<String, Object>> items = history.items().stream()
                    .map(this::itemBody)
                    .toList();

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("items", items);
            body.put("page", history.page());
            body.put("limit", history.pageSize());
            body.put("total", history.total());
            body.put("hasMore", history.hasMore());
            return ResponseEntity.ok(body);
        } catch (FmvEngineException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", e.getKind().name());
            body.put("message", e.getMessage());
            HttpStatus status = e.getKind() == FmvEngineException.FailureKind.UNAUTHORIZED
                    ? HttpStatus.UNAUTHORIZED
                    : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(body);
        }
    }

    private Map<String, Object> itemBody(GuessHistoryItem item) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("propertyId", item.propertyId());
        body.put("propertyAddress", item.propertyAddress());
        body.put("guessedPrice", item.guessedPrice());
        body.put("guessedAt", Instant.ofEpochMilli(item.guessedAtEpochMs()).toString());
        body.put("outcome", item.outcome());
        body.put("actualPrice", item.actualPrice());
        return body;
    }
}
