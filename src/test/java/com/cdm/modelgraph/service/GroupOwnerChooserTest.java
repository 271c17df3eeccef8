package com.cdm.modelgraph.service;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GroupOwnerChooserTest {

    private final GroupOwnerChooser chooser = new GroupOwnerChooser();

    @Test
    void testHighestCountWins() {
        GroupOwnerChooser.Choice choice = chooser.choose(Map.of("X", 3L, "Y", 1L));

        assertEquals("X", choice.getOwner());
        assertEquals(3L, choice.getOwnerCount());
        assertEquals(List.of("Y"), choice.getOthers());
        assertFalse(choice.isTieBroken());
    }

    @Test
    void testTieGoesToFirstName() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("Zeta", 2L);
        counts.put("Alpha", 2L);
        counts.put("Beta", 1L);

        GroupOwnerChooser.Choice choice = chooser.choose(counts);

        assertEquals("Alpha", choice.getOwner());
        assertEquals(List.of("Zeta", "Beta"), choice.getOthers());
        assertTrue(choice.isTieBroken());
    }

    @Test
    void testSameInputSameAnswer() {
        Map<String, Long> counts = Map.of("P1", 0L, "P2", 0L, "P3", 0L);

        assertEquals(chooser.choose(counts), chooser.choose(new LinkedHashMap<>(counts)));
        assertEquals("P1", chooser.choose(counts).getOwner());
    }

    @Test
    void testNoCandidates() {
        assertThrows(IllegalArgumentException.class, () -> chooser.choose(Map.of()));
    }
}
