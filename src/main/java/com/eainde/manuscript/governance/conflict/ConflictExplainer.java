package com.eainde.manuscript.governance.conflict;

import com.eainde.manuscript.model.ConflictType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Renders conflict explanations from fixed templates. Pure string work, no model involved.
 */
public class ConflictExplainer {

    static final String UNKNOWN_PAGE = "unknown";

    private static final Map<ConflictType, String> TEMPLATES = new EnumMap<>(ConflictType.class);

    static {
        TEMPLATES.put(ConflictType.CONTRADICTION,
                "Source A (page %2$s) asserts '%1$s', while Source B (page %4$s) asserts '%3$s'. "
                        + "These statements contradict each other.");
        TEMPLATES.put(ConflictType.MISSING_EVIDENCE,
                "Claim '%1$s' lacks sufficient evidence. Source A (page %2$s) provides partial support, "
                        + "but Source B (page %4$s) does not confirm this claim.");
        TEMPLATES.put(ConflictType.AMBIGUOUS,
                "Claim '%1$s' is ambiguous. Source A (page %2$s) and Source B (page %4$s) "
                        + "provide conflicting interpretations.");
        TEMPLATES.put(ConflictType.OUTDATED,
                "Claim '%1$s' may be outdated. Source A (page %2$s) provides an earlier assertion, "
                        + "while Source B (page %4$s) provides a more recent one.");
    }

    private final int excerptLength;

    public ConflictExplainer(int excerptLength) {
        if (excerptLength < 1) {
            throw new IllegalArgumentException("excerptLength must be positive");
        }
        this.excerptLength = excerptLength;
    }

    /**
     * @param type   template family
     * @param claimA text of the first claim
     * @param pageA  page of the first claim, {@code null} renders as {@value #UNKNOWN_PAGE}
     * @param claimB text of the second claim, unused by single-claim templates
     * @param pageB  page of the second claim
     */
    public String explain(ConflictType type, String claimA, Integer pageA, String claimB, Integer pageB) {
        String template = TEMPLATES.getOrDefault(type, TEMPLATES.get(ConflictType.CONTRADICTION));
        return String.format(template, excerpt(claimA), page(pageA), excerpt(claimB), page(pageB));
    }

    String excerpt(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (trimmed.length() <= excerptLength) {
            return trimmed;
        }
        return trimmed.substring(0, excerptLength) + "...";
    }

    private static String page(Integer page) {
        return page == null ? UNKNOWN_PAGE : page.toString();
    }
}
