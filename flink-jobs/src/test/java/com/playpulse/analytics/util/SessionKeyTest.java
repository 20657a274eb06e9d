package com.playpulse.analytics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionKeyTest {

    @Test
    void keysJoinTrimmedPartsWithPipe() {
        assertEquals("s1|3", SessionKey.window(" s1 ", 3));
        assertEquals("s1|boss_fight|0", SessionKey.occurrence("s1", "boss_fight", 0));
        assertEquals("s1|59", SessionKey.second("s1", 59));
    }

    @Test
    void blankPartsUseMissingPlaceholder() {
        assertEquals("_missing|0", SessionKey.window(null, 0));
        assertEquals("s1|_missing|2", SessionKey.occurrence("s1", " ", 2));
    }

    @Test
    void blankIdentifiersCountAsMissing() {
        assertTrue(SessionKey.isMissing(null));
        assertTrue(SessionKey.isMissing(" \t"));
        assertFalse(SessionKey.isMissing("sess-42"));
        assertNull(SessionKey.idOrNull(" "));
        assertEquals("demo-platformer", SessionKey.idOrNull(" demo-platformer "));
    }
}
