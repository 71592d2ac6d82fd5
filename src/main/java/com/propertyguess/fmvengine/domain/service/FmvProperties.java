package com.propertyguess.fmvengine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "fmv")
public class FmvProperties {

    private Submission submission = new Submission();
    private Outlier outlier = new Outlier();
    private Weighting weighting = new Weighting();
    private Anchoring anchoring = new Anchoring();
    private Alignment alignment = new Alignment();
    private Cache cache = new Cache();
    private History history = new History();

    @Getter
    @Setter
    public static class Submission {
        private Duration cooldown = Duration.ofDays(5);
        private BigDecimal maxPrice = new BigDecimal("100000000");
    }

    /**
     * Ratio band (guess / assessed value) outside of which a guess is tagged as a meme guess.
     */
    @Getter
    @Setter
    public static class Outlier {
        private double minRatio = 0.2;
        private double maxRatio = 5.0;
    }

    @Getter
    @Setter
    public static class Weighting {
        private double tierStep = 0.1;
        private double outlierWeight = 1.0;
    }

    /**
     * Share of the assessed value blended into the crowd estimate, per confidence tier.
     */
    @Getter
    @Setter
    public static class Anchoring {
        private double lowBlend = 0.5;
        private double mediumBlend = 0.0;
        private double highBlend = 0.0;
    }

    @Getter
    @Setter
    public static class Alignment {
        private double alignedPct = 5.0;
        private double closePct = 15.0;
        private double agreementBandPct = 10.0;
    }

    /**
     * Deviation from the sold price, in percent, up to which a past guess counts as accurate or close.
     */
    @Getter
    @Setter
    public static class History {
        private double accuratePct = 5.0;
        private double closePct = 20.0;
    }

    @Getter
    @Setter
    public static class Cache {
        private String backend = "memory";
        private Duration ttl = Duration.ofMinutes(5);
        private int maxEntries = 10_000;
    }
}
