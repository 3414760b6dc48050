package com.questrail.mdoc.codec.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChunkFramingTest {

    @Test
    void attributeSizeIsMtuMinusAttHeader() {
        assertEquals(20, ChunkFraming.attributeSizeForMtu(23));
        assertEquals(182, ChunkFraming.attributeSizeForMtu(185));
        assertEquals(512, ChunkFraming.attributeSizeForMtu(515));
    }

    @Test
    void attributeSizeIsCappedAt512() {
        assertEquals(512, ChunkFraming.attributeSizeForMtu(517));
        assertEquals(512, ChunkFraming.attributeSizeForMtu(65535));
    }

    @Test
    void mtuBelowMinimumIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChunkFraming.attributeSizeForMtu(22));
    }

    @Test
    void payloadLeavesRoomForMarker() {
        assertEquals(19, ChunkFraming.payloadSizeForAttribute(20));
        assertEquals(511, ChunkFraming.payloadSizeForAttribute(512));
    }
}
