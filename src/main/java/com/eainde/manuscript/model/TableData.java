package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A table attached to the manuscript. Rows keep their column order.
 *
 * @param tableId        table identifier, {@code unknown_table} when absent
 * @param title          optional caption
 * @param rows           rows of column to cell value
 * @param sourceClaimIds claims the table is derived from
 * @param contract       table-specific precision contract, {@code null} to use the rigor default
 */
public record TableData(
        @JsonProperty("table_id") String tableId,
        @JsonProperty("title") String title,
        @JsonProperty("rows") List<Map<String, Object>> rows,
        @JsonProperty("source_claim_ids") List<String> sourceClaimIds,
        @JsonProperty("precision_contract") PrecisionContract contract
) {

    public static final String UNKNOWN_TABLE = "unknown_table";

    public TableData {
        tableId = tableId == null || tableId.isBlank() ? UNKNOWN_TABLE : tableId;
        List<Map<String, Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                copy.add(row == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
        sourceClaimIds = sourceClaimIds == null ? List.of() : List.copyOf(sourceClaimIds);
    }

    public static TableData of(String tableId, List<Map<String, Object>> rows) {
        return new TableData(tableId, null, rows, List.of(), null);
    }

    public TableData withRows(List<Map<String, Object>> newRows) {
        return new TableData(tableId, title, newRows, sourceClaimIds, contract);
    }
}
