package com.eainde.manuscript.governance.precision;

import com.eainde.manuscript.model.ConsistencyRule;
import com.eainde.manuscript.model.PrecisionContract;
import com.eainde.manuscript.model.PrecisionFlag;
import com.eainde.manuscript.model.PrecisionIssue;
import com.eainde.manuscript.model.RoundingRule;
import com.eainde.manuscript.model.TableData;
import com.eainde.manuscript.state.RigorLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class PrecisionGovernorTest {

    private final PrecisionGovernor governor = new PrecisionGovernor();

    private static TableData column(String name, Object... values) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object value : values) {
            rows.add(Map.of(name, value));
        }
        return TableData.of("t1", rows);
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("should round 1.23456 to 1.23 under a 5 sig fig / 2 decimal contract and flag it")
        void roundsExcessivePrecision() {
            PrecisionResult result = governor.govern(column("v", "1.23456"), PrecisionContract.of(5, 2),
                    RigorLevel.CONSERVATIVE);

            assertThat(result.table().rows().get(0)).containsEntry("v", "1.23");
            assertThat(result.flags()).singleElement().satisfies(flag -> {
                assertThat(flag.issue()).isEqualTo(PrecisionIssue.EXCESSIVE_PRECISION);
                assertThat(flag.tableId()).isEqualTo("t1");
                assertThat(flag.column()).isEqualTo("v");
                assertThat(flag.details()).isEqualTo("Normalized to 2 decimals / 5 sig figs");
            });
            assertThat(result.warnings()).containsExactly(PrecisionGovernor.WARNING_CONTRACT_FLAGS);
        }

        @Test
        @DisplayName("should clamp significant figures before decimals")
        void sigFigsFirst() {
            PrecisionResult result = governor.govern(column("v", 3.14159, "12345.678"), PrecisionContract.of(4, 2),
                    RigorLevel.EXPLORATORY);

            assertThat(result.table().rows().get(0)).containsEntry("v", "3.14");
            assertThat(result.table().rows().get(1)).containsEntry("v", "12350.00");
        }

        @Test
        @DisplayName("should honour the rounding rule")
        void roundingRule() {
            TableData table = column("v", "0.25");

            PrecisionResult halfUp = governor.govern(table,
                    new PrecisionContract(4, 1, RoundingRule.HALF_UP, ConsistencyRule.NONE), RigorLevel.EXPLORATORY);
            PrecisionResult bankers = governor.govern(table,
                    new PrecisionContract(4, 1, RoundingRule.BANKERS, ConsistencyRule.NONE), RigorLevel.EXPLORATORY);

            assertThat(halfUp.table().rows().get(0)).containsEntry("v", "0.3");
            assertThat(bankers.table().rows().get(0)).containsEntry("v", "0.2");
        }

        @Test
        @DisplayName("should be idempotent")
        void idempotent() {
            PrecisionContract contract = PrecisionContract.of(4, 2);
            PrecisionResult first = governor.govern(column("v", "1.23456", 2, new BigDecimal("7.5"), "1,234.5"),
                    contract, RigorLevel.CONSERVATIVE);

            PrecisionResult second = governor.govern(first.table(), contract, RigorLevel.CONSERVATIVE);

            assertThat(second.table()).isEqualTo(first.table());
            assertThat(second.flags()).isEmpty();
            assertThat(second.clean()).isTrue();
        }

        @Test
        @DisplayName("should leave a compliant value untouched")
        void compliantValue() {
            PrecisionResult result = governor.govern(column("v", "4.50"), PrecisionContract.of(4, 2),
                    RigorLevel.CONSERVATIVE);

            assertThat(result.table().rows().get(0)).containsEntry("v", "4.50");
            assertThat(result.clean()).isTrue();
        }
    }

    @Nested
    @DisplayName("Consistency")
    class Consistency {

        @Test
        @DisplayName("should flag a column whose decimal places disagree with the first value")
        void inconsistentDecimals() {
            PrecisionResult result = governor.govern(column("v", "1.5", "2.25"), PrecisionContract.of(4, 2),
                    RigorLevel.EXPLORATORY);

            assertThat(result.flags())
                    .filteredOn(f -> f.issue() == PrecisionIssue.INCONSISTENT_DECIMALS)
                    .extracting(PrecisionFlag::details)
                    .containsExactly("Expected 1 decimals, found 2");
        }

        @Test
        @DisplayName("should not check consistency when the rule is none")
        void ruleNone() {
            PrecisionResult result = governor.govern(column("v", "1.50", "2.2"),
                    new PrecisionContract(4, 2, RoundingRule.HALF_UP, ConsistencyRule.NONE), RigorLevel.EXPLORATORY);

            assertThat(result.flags()).extracting(PrecisionFlag::issue)
                    .doesNotContain(PrecisionIssue.INCONSISTENT_DECIMALS);
        }
    }

    @Nested
    @DisplayName("Bad data")
    class BadData {

        @Test
        @DisplayName("should pass non-numeric values through and warn in conservative mode")
        void nonNumeric() {
            PrecisionResult conservative = governor.govern(column("v", "n/a", "12%"), PrecisionContract.of(4, 2),
                    RigorLevel.CONSERVATIVE);
            PrecisionResult exploratory = governor.govern(column("v", "n/a"), PrecisionContract.of(4, 2),
                    RigorLevel.EXPLORATORY);

            assertThat(conservative.table().rows().get(0)).containsEntry("v", "n/a");
            assertThat(conservative.table().rows().get(1)).containsEntry("v", "12%");
            assertThat(conservative.flags()).isEmpty();
            assertThat(conservative.warnings()).containsExactly("non_numeric_value:v",
                    PrecisionGovernor.WARNING_CONTRACT_FLAGS);
            assertThat(exploratory.warnings()).isEmpty();
        }

        @Test
        @DisplayName("should treat values with an out-of-range exponent as non-numeric")
        void hugeExponent() {
            PrecisionResult result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> governor.govern(
                    column("v", "1e99999999", "1e-99999999"), PrecisionContract.of(4, 2), RigorLevel.CONSERVATIVE));

            assertThat(result.table().rows().get(0)).containsEntry("v", "1e99999999");
            assertThat(result.table().rows().get(1)).containsEntry("v", "1e-99999999");
            assertThat(result.flags()).isEmpty();
            assertThat(result.warnings()).contains("non_numeric_value:v");
        }

        @Test
        @DisplayName("should keep null rows and warn about them")
        void nullRows() {
            TableData table = TableData.of("t1", Arrays.asList(Map.of("v", "1.00"), null));

            PrecisionResult result = governor.govern(table, PrecisionContract.of(4, 2), RigorLevel.EXPLORATORY);

            assertThat(result.table().rows()).hasSize(2);
            assertThat(result.table().rows().get(1)).isNull();
            assertThat(result.warnings()).containsExactly(PrecisionGovernor.WARNING_INVALID_ROWS);
        }
    }

    @Test
    @DisplayName("should count significant digits without trailing zeros")
    void significantDigits() {
        assertThat(NumericValues.significantDigits(new BigDecimal("12350.00"))).isEqualTo(4);
        assertThat(NumericValues.significantDigits(BigDecimal.ZERO)).isEqualTo(1);
        assertThat(NumericValues.decimalPlaces("1.25e3")).isEqualTo(2);
        assertThat(NumericValues.normalize("3 kg")).isNull();
    }
}
