package org.span.placement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Placement Tests")
class PlacementTest {

    @Test
    @DisplayName("place assigns and reassigns vertices")
    void testPlace() {
        Placement placement = new Placement().place(3, 1).place(1, 0).place(2, 1);

        assertEquals(1, placement.serverOf(3));
        assertEquals(3, placement.size());
        assertArrayEquals(new int[]{1, 2, 3}, placement.vertices());
        assertArrayEquals(new int[]{2, 3}, placement.verticesIn(1));

        placement.place(3, 0);
        assertEquals(0, placement.serverOf(3));
        assertEquals(3, placement.size());
        assertArrayEquals(new int[]{1, 3}, placement.verticesIn(0));
        assertArrayEquals(new int[0], placement.verticesIn(7));
    }

    @Test
    @DisplayName("copy is independent of its source")
    void testCopy() {
        Placement original = new Placement().place(0, 1).place(1, 2);
        Placement copy = original.copy();

        assertEquals(original, copy);
        assertEquals(original.hashCode(), copy.hashCode());

        copy.place(0, 2);
        assertEquals(1, original.serverOf(0));
        assertNotEquals(original, copy);
    }

    @Test
    @DisplayName("toString lists assignments in vertex order")
    void testToString() {
        Placement placement = new Placement().place(2, 5).place(0, 4);

        assertEquals("Placement{0->4, 2->5}", placement.toString());
    }

    @Test
    @DisplayName("Exception Path: unplaced vertex lookup carries reason code")
    void testUnplacedVertex() {
        Placement placement = new Placement().place(0, 0);

        assertFalse(placement.contains(1));
        InvalidPlacementException ex = assertThrows(InvalidPlacementException.class, () -> placement.serverOf(1));
        assertEquals(InvalidPlacementException.REASON_UNKNOWN_VERTEX, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[" + InvalidPlacementException.REASON_UNKNOWN_VERTEX + "]"));
    }

    @Test
    @DisplayName("Exception Path: reserved server id is rejected")
    void testReservedServerId() {
        assertThrows(IllegalArgumentException.class, () -> new Placement().place(0, Integer.MIN_VALUE));
    }
}
