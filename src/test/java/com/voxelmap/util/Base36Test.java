package com.voxelmap.util;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Base36Test {

    @Test
    void encodesKnownValues() {
        assertEquals("0", Base36.encode(0));
        assertEquals("z", Base36.encode(35));
        assertEquals("10", Base36.encode(36));
        assertEquals("-1", Base36.encode(-1));
        assertEquals("-2s", Base36.encode(-100));
    }

    @Test
    void decodesLegacyChunkNames() {
        assertEquals(35, Base36.decode("z"));
        assertEquals(-100, Base36.decode("-2s"));
        assertThrows(NumberFormatException.class, () -> Base36.decode("c.0"));
    }

    @Property(tries = 300)
    void decodeInvertsEncode(@ForAll long n) {
        assertEquals(n, Base36.decode(Base36.encode(n)));
    }
}
