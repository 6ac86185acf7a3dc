package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.model.ToneSeverity;
import com.eainde.manuscript.model.ToneTerm;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a tone policy from YAML.
 *
 * <pre>
 * terms:
 *   - word: revolutionary
 *     severity: fail        # or hard / warn / soft
 *     replacement: significant
 *     category: hype
 * hard_ban: [groundbreaking]   # legacy lists, mapped to fail / warn
 * soft_ban: [novel]
 * suggestions:
 *   groundbreaking: new
 * </pre>
 */
@Slf4j
public class TonePolicyLoader {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    static class PolicyDocument {
        @JsonProperty("terms")
        public List<ToneTerm> terms = new ArrayList<>();
        @JsonProperty("hard_ban")
        public List<String> hardBan = new ArrayList<>();
        @JsonProperty("soft_ban")
        public List<String> softBan = new ArrayList<>();
        @JsonProperty("suggestions")
        public Map<String, String> suggestions = Map.of();
    }

    public TonePolicy load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            TonePolicy policy = parse(in);
            log.info("Loaded tone policy from {}: {} fail / {} warn terms", resource.getDescription(),
                    policy.count(ToneSeverity.FAIL), policy.count(ToneSeverity.WARN));
            return policy;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read tone policy " + resource.getDescription(), e);
        }
    }

    TonePolicy parse(InputStream in) throws IOException {
        PolicyDocument doc = yaml.readValue(in, PolicyDocument.class);
        if (doc == null) {
            return new TonePolicy(List.of());
        }
        List<ToneTerm> terms = new ArrayList<>();
        if (doc.terms != null) {
            terms.addAll(doc.terms);
        }
        Map<String, String> suggestions = doc.suggestions == null ? Map.of() : doc.suggestions;
        if (doc.hardBan != null) {
            doc.hardBan.forEach(w -> terms.add(new ToneTerm(w, ToneSeverity.FAIL, suggestions.get(w), null)));
        }
        if (doc.softBan != null) {
            doc.softBan.forEach(w -> terms.add(new ToneTerm(w, ToneSeverity.WARN, suggestions.get(w), null)));
        }
        return new TonePolicy(terms);
    }
}
