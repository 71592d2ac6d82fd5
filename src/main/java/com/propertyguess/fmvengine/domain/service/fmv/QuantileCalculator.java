package com.propertyguess.fmvengine.domain.service.fmv;

import com.propertyguess.fmvengine.domain.model.FmvDistribution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Continuous-rank quantiles: {@code rank = p / 100 * (n - 1)}, linearly interpolated between
 * the neighbouring order statistics. Results are money values at scale 2.
 */
public final class QuantileCalculator {

    static final int SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private QuantileCalculator() {
    }

    public static FmvDistribution distribution(Collection<BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            return null;
        }
        List<BigDecimal> sorted = sortedCopy(prices);
        return new FmvDistribution(
                money(sorted.get(0)),
                percentileOfSorted(sorted, 10),
                percentileOfSorted(sorted, 25),
                percentileOfSorted(sorted, 50),
                percentileOfSorted(sorted, 75),
                percentileOfSorted(sorted, 90),
                money(sorted.get(sorted.size() - 1)));
    }

    public static BigDecimal percentile(Collection<BigDecimal> prices, int p) {
        if (prices == null || prices.isEmpty()) {
            throw new IllegalArgumentException("prices must not be empty");
        }
        return percentileOfSorted(sortedCopy(prices), p);
    }

    static BigDecimal percentileOfSorted(List<BigDecimal> sorted, int p) {
        if (p < 0 || p > 100) {
            throw new IllegalArgumentException("percentile must be within [0, 100]: " + p);
        }
        int n = sorted.size();
        if (n == 1) {
            return money(sorted.get(0));
        }

        // exact: p * (n - 1) / 100 has at most two decimal places
        BigDecimal rank = BigDecimal.valueOf((long) p * (n - 1)).divide(HUNDRED);
        int lower = rank.intValue();
        BigDecimal frac = rank.subtract(BigDecimal.valueOf(lower));
        if (frac.signum() == 0) {
            return money(sorted.get(lower));
        }

        BigDecimal lo = sorted.get(lower);
        BigDecimal hi = sorted.get(lower + 1);
        return money(lo.add(hi.subtract(lo).multiply(frac)));
    }

    private static List<BigDecimal> sortedCopy(Collection<BigDecimal> prices) {
        List<BigDecimal> sorted = new ArrayList<>(prices);
        sorted.sort(BigDecimal::compareTo);
        return sorted;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
