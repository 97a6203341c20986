package com.lore.service.ner;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GazetteerTest {

    @Test
    void trimsAndDeduplicatesKeepingFirstSeen() {
        Gazetteer gazetteer = Gazetteer.of(Arrays.asList(" Terra ", "Terra", "", null, "Cadia"));

        assertEquals(2, gazetteer.size());
        assertEquals("Terra", gazetteer.entries().get(0).getCanonical());
        assertEquals("terra", gazetteer.entries().get(0).getKey());
    }

    @Test
    void lookupIsCaseInsensitive() {
        Gazetteer gazetteer = Gazetteer.of(Arrays.asList("Iron Hands"));

        assertTrue(gazetteer.lookup("iron HANDS").isPresent());
        assertFalse(gazetteer.lookup("Iron Warriors").isPresent());
        assertFalse(gazetteer.lookup(null).isPresent());
    }

    @Test
    void lengthBucketsDropEntriesThatCannotReachCutoff() {
        Gazetteer gazetteer = Gazetteer.of(Arrays.asList("Terra", "Abaddon the Despoiler"));

        List<GazetteerEntry> candidates = gazetteer.candidatesFor(5, 82);

        assertEquals(1, candidates.size());
        assertEquals("Terra", candidates.get(0).getCanonical());
        assertEquals(2, gazetteer.candidatesFor(5, 0).size());
    }

    @Test
    void emptyGazetteer() {
        assertTrue(Gazetteer.empty().isEmpty());
        assertTrue(Gazetteer.empty().candidatesFor(4, 50).isEmpty());
    }
}
