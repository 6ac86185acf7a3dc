package com.eainde.manuscript.governance.precision;

import com.eainde.manuscript.model.ConsistencyRule;
import com.eainde.manuscript.model.PrecisionContract;
import com.eainde.manuscript.model.PrecisionFlag;
import com.eainde.manuscript.model.PrecisionIssue;
import com.eainde.manuscript.model.TableData;
import com.eainde.manuscript.state.RigorLevel;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Enforces a {@link PrecisionContract} on a table.
 *
 * <h3>Per numeric cell</h3>
 * <ol>
 * <li>A string that already has exactly {@code max_decimals} places and would not change when re-rounded
 *     is left as it is. This is what makes the governor idempotent.</li>
 * <li>Otherwise the value is rounded to {@code max_sig_figs} significant digits, then to
 *     {@code max_decimals} places, and written as plain text with exactly that many places.</li>
 * </ol>
 * Changed values, and values that still carry more than {@code max_sig_figs} significant digits, raise
 * {@link PrecisionIssue#EXCESSIVE_PRECISION}. With {@link ConsistencyRule#PER_COLUMN} a raw decimal count that
 * differs from the first one seen in the column raises {@link PrecisionIssue#INCONSISTENT_DECIMALS}.
 * <p>
 * Non-numeric cells pass through untouched. Nothing here throws for bad data: flags and warnings are
 * advisory and the caller decides what is fatal.
 * </p>
 */
public class PrecisionGovernor {

    public static final String WARNING_CONTRACT_FLAGS = "precision_contract_flags";
    public static final String WARNING_INVALID_ROWS = "invalid_rows";
    public static final String WARNING_NON_NUMERIC_PREFIX = "non_numeric_value:";

    public PrecisionResult govern(TableData table, PrecisionContract contract, RigorLevel rigor) {
        String tableId = table.tableId();
        RoundingMode mode = contract.roundingRule().mode();
        boolean conservative = rigor == RigorLevel.CONSERVATIVE;

        List<PrecisionFlag> flags = new ArrayList<>();
        Set<String> warnings = new LinkedHashSet<>();
        Map<String, Integer> firstSeenDecimals = new HashMap<>();
        List<Map<String, Object>> rows = new ArrayList<>();

        for (Map<String, Object> row : table.rows()) {
            if (row == null) {
                warnings.add(WARNING_INVALID_ROWS);
                rows.add(null);
                continue;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                String column = cell.getKey();
                Object value = cell.getValue();
                String normalized = NumericValues.normalize(value);
                BigDecimal number = NumericValues.parse(normalized);
                if (number == null) {
                    if (conservative && value != null) {
                        warnings.add(WARNING_NON_NUMERIC_PREFIX + column);
                    }
                    out.put(column, value);
                    continue;
                }

                int decimals = NumericValues.decimalPlaces(normalized);
                if (contract.consistencyRule() == ConsistencyRule.PER_COLUMN) {
                    Integer first = firstSeenDecimals.putIfAbsent(column, decimals);
                    if (first != null && first != decimals) {
                        flags.add(new PrecisionFlag(tableId, column, PrecisionIssue.INCONSISTENT_DECIMALS,
                                "Expected " + first + " decimals, found " + decimals));
                    }
                }

                String original = String.valueOf(value);
                String formatted = format(value, normalized, number, contract, mode);
                boolean changed = !formatted.equals(original);
                BigDecimal governed = Objects.requireNonNull(NumericValues.parse(NumericValues.normalize(formatted)));
                boolean stillExceeds = NumericValues.significantDigits(governed) > contract.maxSigFigs();
                if (changed || stillExceeds) {
                    flags.add(new PrecisionFlag(tableId, column, PrecisionIssue.EXCESSIVE_PRECISION,
                            "Normalized to " + contract.maxDecimals() + " decimals / "
                                    + contract.maxSigFigs() + " sig figs"));
                }
                out.put(column, changed ? formatted : value);
            }
            rows.add(out);
        }

        if (conservative && (!flags.isEmpty() || !warnings.isEmpty())) {
            warnings.add(WARNING_CONTRACT_FLAGS);
        }
        return new PrecisionResult(table.withRows(rows), flags, new ArrayList<>(warnings));
    }

    /**
     * Governs one numeric value and returns its text form. Returns {@code String.valueOf(value)} for values
     * that are already compliant.
     */
    String format(Object value, String normalized, BigDecimal number, PrecisionContract contract, RoundingMode mode) {
        int maxDecimals = contract.maxDecimals();
        if (value instanceof String text && text.contains(".")
                && NumericValues.decimalPlaces(normalized) == maxDecimals
                && number.setScale(maxDecimals, mode).compareTo(number) == 0) {
            return text;
        }
        BigDecimal rounded = number;
        if (NumericValues.significantDigits(number) > contract.maxSigFigs()) {
            rounded = number.round(new MathContext(contract.maxSigFigs(), mode));
        }
        return rounded.setScale(maxDecimals, mode).toPlainString();
    }
}
