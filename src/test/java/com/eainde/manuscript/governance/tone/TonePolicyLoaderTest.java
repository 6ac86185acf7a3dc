package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.model.ToneSeverity;
import com.eainde.manuscript.model.ToneTerm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TonePolicyLoaderTest {

    private final TonePolicyLoader loader = new TonePolicyLoader();

    @Test
    @DisplayName("should read terms and the legacy hard/soft ban lists")
    void parsesPolicy() throws Exception {
        String yaml = """
                terms:
                  - word: revolutionary
                    severity: hard
                    replacement: significant
                    category: hype
                  - word: Revolutionary
                    severity: warn
                hard_ban: [groundbreaking]
                soft_ban: [novel]
                suggestions:
                  groundbreaking: new
                """;

        TonePolicy policy = loader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(policy.terms()).hasSize(3);
        assertThat(policy.find("REVOLUTIONARY")).get()
                .extracting(ToneTerm::severity, ToneTerm::replacement)
                .containsExactly(ToneSeverity.FAIL, "significant");
        assertThat(policy.find("groundbreaking")).get()
                .extracting(ToneTerm::severity, ToneTerm::replacement)
                .containsExactly(ToneSeverity.FAIL, "new");
        assertThat(policy.count(ToneSeverity.WARN)).isEqualTo(1);
    }

    @Test
    @DisplayName("should load the bundled neutral tone policy")
    void bundledPolicy() {
        TonePolicy policy = loader.load(new ClassPathResource("neutral-tone.yml"));

        assertThat(policy.find("revolutionary")).get()
                .extracting(ToneTerm::replacement)
                .isEqualTo("significant");
        assertThat(policy.count(ToneSeverity.FAIL)).isPositive();
    }
}
