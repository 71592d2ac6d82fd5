package com.propertyguess.fmvengine.domain.service.fmv;

import com.propertyguess.fmvengine.domain.model.ConsensusAlignment;
import com.propertyguess.fmvengine.domain.service.FmvProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsensusAlignmentCalculatorTest {

    private final ConsensusAlignmentCalculator calculator = new ConsensusAlignmentCalculator(new FmvProperties());

    @Test
    @DisplayName("within 5% of the estimate is aligned")
    void aligned() {
        ConsensusAlignment result = calculator.evaluate(bd("410000"), bd("400000"),
                List.of(bd("400000"), bd("420000"), bd("600000"), bd("300000")));

        assertThat(result.getCategory()).isEqualTo(ConsensusAlignment.Category.ALIGNED);
        assertThat(result.getPercentDifference()).isEqualByComparingTo("2.50");
        // 400000 and 420000 fall within ±10% of 410000
        assertThat(result.getAlignmentPercentage()).isEqualByComparingTo("50.00");
    }

    @Test
    @DisplayName("within 15% is close")
    void close() {
        ConsensusAlignment result = calculator.evaluate(bd("440000"), bd("400000"), List.of());

        assertThat(result.getCategory()).isEqualTo(ConsensusAlignment.Category.CLOSE);
        assertThat(result.getAlignmentPercentage()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("further out is different, with a signed difference")
    void different() {
        ConsensusAlignment above = calculator.evaluate(bd("500000"), bd("400000"), List.of());
        ConsensusAlignment below = calculator.evaluate(bd("300000"), bd("400000"), List.of());

        assertThat(above.getCategory()).isEqualTo(ConsensusAlignment.Category.DIFFERENT);
        assertThat(above.getPercentDifference()).isEqualByComparingTo("25.00");
        assertThat(above.getMessage()).isEqualTo("Your guess is 25% above the crowd estimate");
        assertThat(below.getMessage()).isEqualTo("Your guess is 25% below the crowd estimate");
        assertThat(below.getPercentDifference()).isEqualByComparingTo("-25.00");
    }

    @Test
    @DisplayName("no crowd estimate → no feedback")
    void noEstimate() {
        assertThat(calculator.evaluate(bd("500000"), null, List.of())).isNull();
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
