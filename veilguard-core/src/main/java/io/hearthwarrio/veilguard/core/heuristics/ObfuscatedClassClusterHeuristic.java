package io.hearthwarrio.veilguard.core.heuristics;

import io.hearthwarrio.veilguard.core.ElementHeuristic;
import io.hearthwarrio.veilguard.core.HeuristicContext;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * Matches positioned containers whose class attribute is a cluster of long generated tokens.
 * <p>
 * A token counts as obfuscated when it has at least {@value #MIN_TOKEN_LENGTH} characters and contains both an
 * uppercase letter and a digit or underscore.
 */
public final class ObfuscatedClassClusterHeuristic implements ElementHeuristic {

    public static final int MIN_TOKENS = 3;
    public static final int MIN_OBFUSCATED_TOKENS = 3;
    public static final int MIN_TOKEN_LENGTH = 16;

    @Override
    public int order() {
        return 10;
    }

    @Override
    public HideReason reason() {
        return HideReason.OBFUSCATED_CLUSTER;
    }

    @Override
    public HostNode match(HostNode candidate, HeuristicContext context) {
        String cls = candidate.getClassName();
        if (cls.isBlank()) {
            return null;
        }

        String[] tokens = cls.trim().split("\\s+");
        if (tokens.length < MIN_TOKENS) {
            return null;
        }

        int obfuscated = 0;
        for (String t : tokens) {
            if (isObfuscated(t)) {
                obfuscated++;
            }
        }
        if (obfuscated < MIN_OBFUSCATED_TOKENS) {
            return null;
        }

        return candidate.getComputedStyle().isFixedOrAbsolute() ? candidate : null;
    }

    static boolean isObfuscated(String token) {
        if (token.length() < MIN_TOKEN_LENGTH) {
            return false;
        }
        boolean upper = false;
        boolean digitOrUnderscore = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                upper = true;
            } else if ((c >= '0' && c <= '9') || c == '_') {
                digitOrUnderscore = true;
            }
        }
        return upper && digitOrUnderscore;
    }
}
