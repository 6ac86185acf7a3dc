package com.eainde.manuscript.governance;

import java.util.function.Supplier;

/**
 * Marks code that must stay free of language-model calls.
 * <p>
 * Governance logic (conflict explanations, tone lint) runs inside {@link #call(String, Supplier)}.
 * Every model-backed adapter calls {@link #assertModelCallAllowed(String)} before it talks to a model,
 * so an accidental call from a deterministic section fails immediately instead of silently making
 * the output non-reproducible.
 * </p>
 */
public final class DeterministicScope {

    private static final ThreadLocal<String> ACTIVE = new ThreadLocal<>();

    private DeterministicScope() {
    }

    public static <T> T call(String section, Supplier<T> body) {
        String previous = ACTIVE.get();
        ACTIVE.set(section);
        try {
            return body.get();
        } finally {
            if (previous == null) {
                ACTIVE.remove();
            } else {
                ACTIVE.set(previous);
            }
        }
    }

    public static boolean isActive() {
        return ACTIVE.get() != null;
    }

    /**
     * @param caller name of the adapter about to call a model
     * @throws IllegalStateException when invoked inside a deterministic section
     */
    public static void assertModelCallAllowed(String caller) {
        String section = ACTIVE.get();
        if (section != null) {
            throw new IllegalStateException(
                    "Language model call from " + caller + " attempted inside deterministic section '" + section + "'");
        }
    }
}
