package com.propertyguess.fmvengine.domain.service;

import com.propertyguess.fmvengine.domain.exception.FmvEngineException;
import com.propertyguess.fmvengine.domain.model.PropertyRecord;
import com.propertyguess.fmvengine.domain.repository.PriceGuessRepository;
import com.propertyguess.fmvengine.domain.repository.PropertyRepository;
import com.propertyguess.fmvengine.support.MutableClock;
import com.propertyguess.fmvengine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
@DisplayName("GuessSubmissionGate under concurrent submissions")
class GuessSubmissionGateConcurrencyTest {

    private static final int THREADS = 8;

    @Autowired
    private GuessSubmissionGate gate;

    @Autowired
    private PriceGuessRepository priceGuessRepository;

    @Autowired
    private PropertyRepository propertyRepository;

    @Autowired
    private MutableClock clock;

    private UUID propertyId;
    private UUID userId;

    @BeforeEach
    void seed() {
        clock.set(TestClockConfig.START);
        propertyId = UUID.randomUUID();
        userId = UUID.randomUUID();
        propertyRepository.save(PropertyRecord.builder()
                .id(propertyId)
                .address("7 Canal Street")
                .city("Incheon")
                .assessedValue(new BigDecimal("400000"))
                .build());
    }

    @Test
    @DisplayName("parallel first submissions create one row, parallel edits after the cooldown update it once")
    void onlyOneWriterWinsEachRound() throws Exception {
        List<String> firstRound = submitInParallel(new BigDecimal("410000"));

        assertThat(firstRound).filteredOn("CREATED"::equals).hasSize(1);
        assertThat(firstRound).filteredOn("COOLDOWN_ACTIVE"::equals).hasSize(THREADS - 1);
        assertThat(priceGuessRepository.countByPropertyId(propertyId)).isEqualTo(1);

        clock.advance(Duration.ofDays(5));
        List<String> editRound = submitInParallel(new BigDecimal("430000"));

        assertThat(editRound).filteredOn("UPDATED"::equals).hasSize(1);
        assertThat(editRound).filteredOn("COOLDOWN_ACTIVE"::equals).hasSize(THREADS - 1);
        assertThat(priceGuessRepository.countByPropertyId(propertyId)).isEqualTo(1);
        assertThat(priceGuessRepository.findByPropertyIdAndUserId(propertyId, userId))
                .hasValueSatisfying(g -> {
                    assertThat(g.getGuessedPrice()).isEqualByComparingTo("430000");
                    assertThat(g.getUpdatedAtEpochMs()).isEqualTo(clock.millis());
                });
    }

    private List<String> submitInParallel(BigDecimal price) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch ready = new CountDownLatch(THREADS);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    try {
                        return gate.submit(propertyId, userId, price).outcome().name();
                    } catch (FmvEngineException e) {
                        return e.getKind().name();
                    }
                }));
            }
            assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
            go.countDown();

            List<String> outcomes = new ArrayList<>();
            for (Future<String> future : futures) {
                outcomes.add(future.get(30, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }
}
