package com.qqsuccubus.triviasync.core.hash;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumsTest {

    @Test
    void testSha256Hex_KnownDigest() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", Checksums.sha256Hex("abc"));
    }

    @Test
    void testMurmur3Base36_StableAndCompact() {
        String first = Checksums.murmur3Base36("{\"a\":1}");

        assertEquals(first, Checksums.murmur3Base36("{\"a\":1}"));
        assertNotEquals(first, Checksums.murmur3Base36("{\"a\":2}"));
        assertTrue(first.length() <= 7, first);
        assertTrue(first.matches("[0-9a-z]+"), first);
    }
}
