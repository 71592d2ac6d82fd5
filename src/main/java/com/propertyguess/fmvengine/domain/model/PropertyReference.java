package com.propertyguess.fmvengine.domain.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Authoritative reference values for a property. Either side may be null.
 */
public record PropertyReference(BigDecimal assessedValue, BigDecimal askingPrice) implements Serializable {

    public static final PropertyReference EMPTY = new PropertyReference(null, null);

    public boolean hasAssessedValue() {
        return assessedValue != null && assessedValue.signum() > 0;
    }

    public boolean hasAskingPrice() {
        return askingPrice != null && askingPrice.signum() > 0;
    }
}
