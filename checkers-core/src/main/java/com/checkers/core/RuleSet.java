package com.checkers.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Rule variant switches consulted by move generation.
 */
public record RuleSet(MidChainPromotion midChainPromotion) {

    public static final RuleSet STANDARD = new RuleSet(MidChainPromotion.CROWNING_ENDS_MOVE);

    public RuleSet {
        Objects.requireNonNull(midChainPromotion, "midChainPromotion");
    }

    public static RuleSet of(MidChainPromotion midChainPromotion) {
        return midChainPromotion == MidChainPromotion.CROWNING_ENDS_MOVE ? STANDARD : new RuleSet(midChainPromotion);
    }

    /**
     * Parses a rule name such as {@code continue_as_king}; case and dashes are ignored.
     */
    public static RuleSet parse(String midChainPromotion) {
        Objects.requireNonNull(midChainPromotion, "midChainPromotion");
        String normalized = midChainPromotion.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return of(MidChainPromotion.valueOf(normalized));
    }

    /**
     * Reads {@code checkers.rules.midChainPromotion} (or {@code CHECKERS_RULES_MID_CHAIN_PROMOTION}),
     * defaulting to {@link #STANDARD}.
     */
    public static RuleSet fromSystemProperties() {
        return of(Settings.readEnum("checkers.rules.midChainPromotion", "CHECKERS_RULES_MID_CHAIN_PROMOTION",
                MidChainPromotion.class, MidChainPromotion.CROWNING_ENDS_MOVE));
    }

    public boolean continuesAfterCrowning() {
        return midChainPromotion == MidChainPromotion.CONTINUE_AS_KING;
    }
}
