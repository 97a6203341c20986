package com.lore.service.ner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class EntityNormalizationServiceTest {

    private Gazetteer gazetteer;
    private InflectionAdapter inflection;
    private EntityNormalizationService service;

    @BeforeEach
    void setUp() {
        gazetteer = Gazetteer.of(Arrays.asList("Abaddon", "Robute Guilliman", "Terra"));
        inflection = mock(InflectionAdapter.class);
        when(inflection.inflect(anyString(), anyString())).thenAnswer(inv -> inv.getArgument(1));
        service = new EntityNormalizationService(gazetteer, new FuzzySpanMatcher(new WordTokenizer()),
            new SpanResolver(), inflection, 82);
    }

    @Test
    void extractReturnsResolvedSpans() {
        List<CandidateSpan> spans = service.extract("Abadon fought Robute Guiliman near Terra");

        assertEquals(3, spans.size());
        assertEquals("Abaddon", spans.get(0).getCanonical());
        assertEquals("Robute Guilliman", spans.get(1).getCanonical());
        assertEquals("Terra", spans.get(2).getCanonical());
    }

    @Test
    @DisplayName("规范化替换所有识别出的实体，偏移量不受前面替换影响")
    void normalizeReplacesEveryEntity() {
        String normalized = service.normalize("Abadon fought Robute Guiliman near Terra");

        assertEquals("Abaddon fought Robute Guilliman near Terra", normalized);
        verify(inflection).inflect("Abadon", "Abaddon");
        verify(inflection).inflect("Robute Guiliman", "Robute Guilliman");
    }

    @Test
    void textWithoutEntitiesIsUnchanged() {
        assertEquals("nothing to see here", service.normalize("nothing to see here"));
        verifyNoInteractions(inflection);
    }

    @Test
    void inflectedFormIsUsedAndCapitalized() {
        when(inflection.inflect("Абаддона", "Абаддон")).thenReturn("абаддона");
        EntityNormalizationService russian = new EntityNormalizationService(
            Gazetteer.of(Arrays.asList("Абаддон")), new FuzzySpanMatcher(new WordTokenizer()),
            new SpanResolver(), inflection, 82);

        assertEquals("Где Абаддона видели?", russian.normalize("Где Абаддона видели?"));
    }

    @Test
    void inflectionFailureFallsBackToCanonical() {
        when(inflection.inflect(anyString(), anyString())).thenThrow(new IllegalStateException("down"));

        assertEquals("Abaddon", service.inflectToMatch("abadon", "Abaddon"));
    }

    @Test
    void emptyInflectionFallsBackToCanonical() {
        when(inflection.inflect(anyString(), anyString())).thenReturn("");

        assertEquals("terra", service.inflectToMatch("tera", "terra"));
    }
}
