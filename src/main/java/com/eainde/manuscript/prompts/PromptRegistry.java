package com.eainde.manuscript.prompts;

import com.eainde.manuscript.model.Hashing;
import com.eainde.manuscript.state.PromptUse;
import com.github.benmanes.caffeine.cache.Cache;

/**
 * Role prompt lookup through an injected TTL cache.
 * <p>
 * The cache is owned by whoever builds the registry (see {@code PipelineConfig}); tests pass their own
 * cache with a controllable ticker.
 * </p>
 */
public class PromptRegistry {

    public static final String EXTRACTOR = "extractor";
    public static final String DRAFTER = "drafter";
    public static final String TONE_REWRITER = "tone_rewriter";

    private final PromptSource source;
    private final Cache<String, PromptTemplate> cache;

    public PromptRegistry(PromptSource source, Cache<String, PromptTemplate> cache) {
        this.source = source;
        this.cache = cache;
    }

    public PromptTemplate get(String role) {
        return cache.get(role, source::load);
    }

    public PromptUse use(String role) {
        return get(role).toUse();
    }

    public void invalidate(String role) {
        cache.invalidate(role);
    }

    /** Manifest entry for a governance pass, keyed {@code governance:<gate>}. */
    public static PromptUse governancePass(String gate, String version) {
        return new PromptUse("governance:" + gate, version, Hashing.sha256Hex(gate + "@" + version));
    }
}
