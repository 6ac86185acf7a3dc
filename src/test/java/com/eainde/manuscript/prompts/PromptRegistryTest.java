package com.eainde.manuscript.prompts;

import com.eainde.manuscript.model.Hashing;
import com.eainde.manuscript.state.PromptUse;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptRegistryTest {

    private final AtomicLong nanos = new AtomicLong();
    private final AtomicInteger loads = new AtomicInteger();
    private PromptRegistry registry;

    @BeforeEach
    void setUp() {
        Cache<String, PromptTemplate> cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(5))
                .ticker(nanos::get)
                .executor(Runnable::run)
                .build();
        PromptSource source = role -> new PromptTemplate(role, String.valueOf(loads.incrementAndGet()), "prompt for " + role);
        registry = new PromptRegistry(source, cache);
    }

    @Test
    @DisplayName("should serve repeated lookups from the cache")
    void cached() {
        registry.get("extractor");
        registry.get("extractor");

        assertThat(loads).hasValue(1);
    }

    @Test
    @DisplayName("should reload once the entry expired")
    void expiry() {
        assertThat(registry.get("extractor").version()).isEqualTo("1");

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(6));

        assertThat(registry.get("extractor").version()).isEqualTo("2");
    }

    @Test
    @DisplayName("should reload after an explicit invalidation")
    void invalidate() {
        registry.get("drafter");
        registry.invalidate("drafter");
        registry.get("drafter");

        assertThat(loads).hasValue(2);
    }

    @Test
    @DisplayName("should describe a prompt use by role, version and text hash")
    void use() {
        PromptUse use = registry.use("drafter");

        assertThat(use.name()).isEqualTo("drafter");
        assertThat(use.version()).isEqualTo("1");
        assertThat(use.sha256()).isEqualTo(Hashing.sha256Hex("prompt for drafter"));
    }

    @Test
    @DisplayName("should name governance passes after their gate")
    void governancePass() {
        PromptUse use = PromptRegistry.governancePass("tone", "1");

        assertThat(use.name()).isEqualTo("governance:tone");
        assertThat(use.sha256()).hasSize(64).isEqualTo(PromptRegistry.governancePass("tone", "1").sha256());
    }

    @Test
    @DisplayName("should read bundled prompts with their version header")
    void classpathSource() {
        ClasspathPromptSource source = new ClasspathPromptSource("prompts");

        PromptTemplate template = source.load(PromptRegistry.EXTRACTOR);

        assertThat(template.version()).isEqualTo("1");
        assertThat(template.text()).doesNotStartWith("# version").contains("relation triples");
    }

    @Test
    @DisplayName("should reject a role without a prompt")
    void unknownRole() {
        assertThatThrownBy(() -> new ClasspathPromptSource("prompts/").load("nobody"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nobody");
    }
}
