package com.eainde.manuscript.governance.conflict;

import com.eainde.manuscript.model.ConflictItem;
import com.eainde.manuscript.model.ConflictSeverity;
import com.eainde.manuscript.model.ConflictType;
import com.eainde.manuscript.model.SourceAnchor;
import com.eainde.manuscript.model.SuggestedAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictHasherTest {

    private static ConflictItem item(String id, List<String> contradicts, SourceAnchor... anchors) {
        return new ConflictItem(id, ConflictType.CONTRADICTION, ConflictSeverity.HIGH, "summary " + id,
                "details " + id, List.of(anchors), contradicts, List.of(),
                List.of(SuggestedAction.RETRY_EXTRACTION), 0.9);
    }

    private final ConflictItem first = item("c1", List.of("a", "b"),
            SourceAnchor.ofSnippet("doc", 1, "one"), SourceAnchor.ofSnippet("doc", 2, "two"));
    private final ConflictItem second = item("c2", List.of("c", "d"), SourceAnchor.ofSnippet("doc", 4, "four"));
    private final ConflictItem third = item("c3", List.of("e", "f"), SourceAnchor.ofSnippet("other", 1, "x"));

    @Test
    @DisplayName("should not depend on the order of the items")
    void orderIndependent() {
        List<ConflictItem> items = new ArrayList<>(List.of(first, second, third));
        String expected = ConflictHasher.hash(items);

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(items, random);
            assertThat(ConflictHasher.hash(items)).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("should not depend on the order of claim ids or anchors inside an item")
    void innerOrderIndependent() {
        ConflictItem reordered = item("c1", List.of("b", "a"),
                SourceAnchor.ofSnippet("doc", 2, "two"), SourceAnchor.ofSnippet("doc", 1, "one"));

        assertThat(ConflictHasher.hash(List.of(reordered))).isEqualTo(ConflictHasher.hash(List.of(first)));
    }

    @Test
    @DisplayName("should ignore ids, summaries and details")
    void ignoresFreeText() {
        ConflictItem renamed = item("other-id", List.of("a", "b"),
                SourceAnchor.ofSnippet("doc", 1, "one"), SourceAnchor.ofSnippet("doc", 2, "two"));

        assertThat(ConflictHasher.hash(List.of(renamed))).isEqualTo(ConflictHasher.hash(List.of(first)));
    }

    @Test
    @DisplayName("should change when the contradicted claims change")
    void sensitiveToContent() {
        ConflictItem changed = item("c1", List.of("a", "z"),
                SourceAnchor.ofSnippet("doc", 1, "one"), SourceAnchor.ofSnippet("doc", 2, "two"));

        assertThat(ConflictHasher.hash(List.of(changed))).isNotEqualTo(ConflictHasher.hash(List.of(first)));
    }

    @Test
    @DisplayName("should hash an empty list to a stable digest")
    void emptyList() {
        assertThat(ConflictHasher.hash(List.of())).isEqualTo(ConflictHasher.hash(new ArrayList<>())).hasSize(64);
    }
}
