package com.propertyguess.fmvengine.api;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.FmvResult;
import com.propertyguess.fmvengine.domain.model.GuessPage;
import com.propertyguess.fmvengine.domain.model.GuessView;
import com.propertyguess.fmvengine.domain.model.PriceGuess;
import com.propertyguess.fmvengine.domain.model.SubmissionResult;
import com.propertyguess.fmvengine.domain.service.CurrentUserResolver;
import com.propertyguess.fmvengine.domain.service.FmvAggregator;
import com.propertyguess.fmvengine.domain.service.GuessQueryService;
import com.propertyguess.fmvengine.domain.service.GuessSubmissionGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/properties/{propertyId}")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class PropertyGuessController {

    private final GuessSubmissionGate submissionGate;
    private final GuessQueryService guessQueryService;
    private final FmvAggregator fmvAggregator;
    private final CurrentUserResolver currentUserResolver;

    @PostMapping("/guesses")
    public ResponseEntity<Map<String, Object>> submit(@PathVariable UUID propertyId,
                                                      @RequestBody(required = false) GuessRequest req) {
        UUID userId = currentUserResolver.currentUserId().orElse(null);
        BigDecimal price = req == null ? null : req.guessedPrice();

        try {
            SubmissionResult result = submissionGate.submit(propertyId, userId, price);

            Map<String, Object> body = guessBody(result.guess());
            body.put("editableAt", iso(result.editableAtEpochMs()));
            body.put("message", result.created()
                    ? "Price guess submitted successfully"
                    : "Price guess updated successfully");
            body.put("consensus", result.consensus());

            return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(body);
        } catch (FmvEngineException e) {
            return failure(e);
        }
    }

    @GetMapping("/guesses")
    public ResponseEntity<Map<String, Object>> list(@PathVariable UUID propertyId,
                                                    @RequestParam(defaultValue = "1") int page,
                                                    @RequestParam(defaultValue = "20") int limit) {
        try {
            GuessPage result = guessQueryService.list(propertyId, page, limit);

            List<Map<String, Object>> data = result.guesses().stream()
                    .map(this::viewBody)
                    .toList();

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("page", result.page());
            meta.put("limit", result.pageSize());
            meta.put("total", result.total());
            meta.put("totalPages", result.totalPages());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("data", data);
            body.put("meta", meta);
            body.put("fmv", result.fmv());
            return ResponseEntity.ok(body);
        } catch (FmvEngineException e) {
            return failure(e);
        }
    }

    @GetMapping("/fmv")
    public ResponseEntity<Object> fmv(@PathVariable UUID propertyId) {
        try {
            FmvResult result = fmvAggregator.compute(propertyId);
            return ResponseEntity.ok(result);
        } catch (FmvEngineException e) {
            return ResponseEntity.status(statusOf(e.getKind())).body(errorBody(e));
        }
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> malformed(Exception e) {
        log.debug("[GuessAPI] 잘못된 요청: {}", e.getMessage());
        return failure(FmvEngineException.invalidInput("guessedPrice must be a number and propertyId a UUID"));
    }

    private Map<String, Object> guessBody(PriceGuess guess) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", guess.getId());
        body.put("propertyId", guess.getPropertyId());
        body.put("userId", guess.getUserId());
        body.put("guessedPrice", guess.getGuessedPrice());
        body.put("isOutlier", guess.isOutlier());
        body.put("createdAt", iso(guess.getCreatedAtEpochMs()));
        body.put("updatedAt", iso(guess.getUpdatedAtEpochMs()));
        return body;
    }

    private Map<String, Object> viewBody(GuessView view) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", view.getId());
        body.put("propertyId", view.getPropertyId());
        body.put("userId", view.getUserId());
        body.put("guessedPrice", view.getGuessedPrice());
        body.put("isOutlier", view.isOutlier());
        body.put("createdAt", iso(view.getCreatedAtEpochMs()));
        body.put("updatedAt", iso(view.getUpdatedAtEpochMs()));
        body.put("editableAt", iso(view.getEditableAtEpochMs()));

        GuessView.Author author = view.getAuthor();
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("id", author.getId());
        user.put("username", author.getUsername());
        user.put("displayName", author.getDisplayName());
        user.put("karma", author.getKarma());
        user.put("karmaRank", Map.of(
                "title", author.getRank().title(),
                "level", author.getRank().level()));
        body.put("user", user);
        return body;
    }

    private ResponseEntity<Map<String, Object>> failure(FmvEngineException e) {
        return ResponseEntity.status(statusOf(e.getKind())).body(errorBody(e));
    }

    private Map<String, Object> errorBody(FmvEngineException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", e.getKind().name());
        body.put("message", e.getMessage());
        if (e.getCooldownEndsAt() != null) {
            body.put("cooldownEndsAt", e.getCooldownEndsAt().toString());
        }
        return body;
    }

    private HttpStatus statusOf(FmvEngineException.FailureKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case INVALID_INPUT, COOLDOWN_ACTIVE -> HttpStatus.BAD_REQUEST;
        };
    }

    private static String iso(long epochMs) {
        return Instant.ofEpochMilli(epochMs).toString();
    }

    public record GuessRequest(BigDecimal guessedPrice) {
    }
}
