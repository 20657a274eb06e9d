package com.playpulse.analytics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashingTest {

    @Test
    void sha256HexIsStable() {
        String hash1 = Hashing.sha256Hex("hello");
        String hash2 = Hashing.sha256Hex("hello");

        assertEquals(hash1, hash2);
        assertEquals(64, hash1.length());
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", hash1);
    }

    @Test
    void nullHashesLikeEmptyString() {
        assertEquals(Hashing.sha256Hex(""), Hashing.sha256Hex(null));
    }
}
