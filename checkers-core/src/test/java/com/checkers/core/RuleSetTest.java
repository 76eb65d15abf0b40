package com.checkers.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RuleSetTest {

    private static final String PROPERTY = "checkers.rules.midChainPromotion";

    @AfterEach
    void clearProperty() {
        System.clearProperty(PROPERTY);
    }

    @Test
    void parsesRuleNamesLeniently() {
        assertSame(RuleSet.STANDARD, RuleSet.parse("crowning-ends-move"));
        assertEquals(MidChainPromotion.CONTINUE_AS_KING, RuleSet.parse(" continue_as_king ").midChainPromotion());
        assertThrows(IllegalArgumentException.class, () -> RuleSet.parse("flying-kings"));
    }

    @Test
    void readsSystemProperty() {
        System.setProperty(PROPERTY, "continue-as-king");

        assertEquals(RuleSet.of(MidChainPromotion.CONTINUE_AS_KING), RuleSet.fromSystemProperties());
    }

    @Test
    void badSettingIsReported() {
        System.setProperty(PROPERTY, "sometimes");

        assertThrows(IllegalArgumentException.class, RuleSet::fromSystemProperties);
    }

    @Test
    void numericSettingsFallBackToDefault() {
        assertEquals(7, Settings.readInt("checkers.test.unset", null, 7));
        System.setProperty("checkers.test.number", "x");
        try {
            assertThrows(IllegalArgumentException.class, () -> Settings.readLong("checkers.test.number", null, 1L));
        } finally {
            System.clearProperty("checkers.test.number");
        }
    }
}
