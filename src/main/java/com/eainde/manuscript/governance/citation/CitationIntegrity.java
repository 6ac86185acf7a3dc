package com.eainde.manuscript.governance.citation;

import com.eainde.manuscript.model.ManuscriptBlock;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline claim bindings ({@code [[claim_id]]}) and their validation against known claims.
 */
public final class CitationIntegrity {

    private static final Pattern CLAIM_MARKER = Pattern.compile("\\[\\[([^\\[\\]]+)]]");

    private CitationIntegrity() {
    }

    public static List<String> extractClaimIds(String text) {
        if (text == null) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        Matcher m = CLAIM_MARKER.matcher(text);
        while (m.find()) {
            ids.add(m.group(1).trim());
        }
        return new ArrayList<>(ids);
    }

    /**
     * @param requireBinding when true, a block without any claim id is a problem
     * @return problems as {@code citation:<block>:<issue>} strings, empty when every binding is sound
     */
    public static List<String> validate(List<ManuscriptBlock> blocks, Set<String> knownClaimIds,
                                        boolean requireBinding) {
        List<String> problems = new ArrayList<>();
        for (ManuscriptBlock block : blocks) {
            if (block.claimIds().isEmpty()) {
                if (requireBinding) {
                    problems.add("citation:" + block.blockId() + ":no_claim_binding");
                }
                continue;
            }
            for (String id : block.claimIds()) {
                if (!knownClaimIds.contains(id)) {
                    problems.add("citation:" + block.blockId() + ":unknown_claim:" + id);
                }
            }
        }
        return problems;
    }
}
