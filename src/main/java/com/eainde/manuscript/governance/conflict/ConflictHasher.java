package com.eainde.manuscript.governance.conflict;

import com.eainde.manuscript.model.BoundingBox;
import com.eainde.manuscript.model.ConflictItem;
import com.eainde.manuscript.model.Hashing;
import com.eainde.manuscript.model.SourceAnchor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Order-independent digest of a list of conflict items.
 *
 * <h3>Canonical form</h3>
 * <ul>
 * <li>each item keeps type, severity, contradicted claim ids, evidence anchors and assumptions;
 *     ids and free-text summaries are left out so re-detection yields the same digest</li>
 * <li>strings are trimmed and lower-cased</li>
 * <li>claim ids and assumptions are sorted, anchors are sorted by (doc_id, page, bbox)</li>
 * <li>items are sorted by their own canonical JSON, then the whole list is encoded with sorted keys</li>
 * </ul>
 * The result is the SHA-256 hex digest of that encoding.
 */
public final class ConflictHasher {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private ConflictHasher() {
    }

    public static String hash(List<ConflictItem> items) {
        List<String> encodedItems = new ArrayList<>();
        for (ConflictItem item : items) {
            encodedItems.add(encode(canonicalItem(item)));
        }
        encodedItems.sort(Comparator.naturalOrder());
        String payload = "[" + String.join(",", encodedItems) + "]";
        return Hashing.sha256Hex(payload);
    }

    private static Map<String, Object> canonicalItem(ConflictItem item) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("type", norm(item.conflictType().name()));
        canonical.put("severity", norm(item.severity().name()));
        canonical.put("contradicts", sortedNormalized(item.contradicts()));
        canonical.put("assumptions", sortedNormalized(item.assumptions()));
        List<Map<String, Object>> anchors = new ArrayList<>();
        item.evidenceAnchors().stream()
                .sorted(Comparator.comparing((SourceAnchor a) -> norm(a.docId()))
                        .thenComparingInt(SourceAnchor::pageNumber)
                        .thenComparing(a -> bboxKey(a.bbox())))
                .forEach(a -> anchors.add(canonicalAnchor(a)));
        canonical.put("anchors", anchors);
        return canonical;
    }

    private static Map<String, Object> canonicalAnchor(SourceAnchor anchor) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("doc_id", norm(anchor.docId()));
        canonical.put("page", anchor.pageNumber());
        canonical.put("bbox", bboxKey(anchor.bbox()));
        return canonical;
    }

    private static String bboxKey(BoundingBox bbox) {
        if (bbox == null) {
            return "";
        }
        return bbox.x() + "," + bbox.y() + "," + bbox.w() + "," + bbox.h();
    }

    private static List<String> sortedNormalized(List<String> values) {
        return values.stream().map(ConflictHasher::norm).sorted().toList();
    }

    private static String norm(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String encode(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode conflict item for hashing", e);
        }
    }
}
