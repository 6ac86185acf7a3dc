package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.state.ProjectContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DelimitedTripleExtractorTest {

    private final DelimitedTripleExtractor extractor = new DelimitedTripleExtractor();

    @Test
    @DisplayName("should read one triple per delimited line with optional page and confidence")
    void parsesLines() {
        ExtractionResult result = extractor.extract("""
                Intro text without delimiters.
                X | IMPACTS | Y | 1 | 0.8
                X | IMPACTS | Z
                """, ProjectContext.empty());

        assertThat(result.triples()).hasSize(2);
        ExtractedTriple first = result.triples().get(0);
        assertThat(first.page()).isEqualTo(1);
        assertThat(first.confidence()).isEqualTo(0.8);
        assertThat(first.sourcePointer().snippet()).isEqualTo("X | IMPACTS | Y | 1 | 0.8");
        assertThat(result.triples().get(1).page()).isNull();
        assertThat(result.entities()).containsExactly("X", "Y", "Z");
    }

    @Test
    @DisplayName("should skip incomplete lines and tolerate bad numbers")
    void lenient() {
        ExtractionResult result = extractor.extract(" | IMPACTS | Y\nX | IMPACTS | Y | page one | high", ProjectContext.empty());

        assertThat(result.triples()).singleElement()
                .satisfies(t -> {
                    assertThat(t.page()).isNull();
                    assertThat(t.confidence()).isNull();
                });
    }

    @Test
    @DisplayName("should return an empty result for blank text")
    void blank() {
        assertThat(extractor.extract("  ", ProjectContext.empty()).hasTriples()).isFalse();
        assertThat(extractor.extract(null, ProjectContext.empty()).hasTriples()).isFalse();
    }
}
