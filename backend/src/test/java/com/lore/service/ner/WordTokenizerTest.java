package com.lore.service.ner;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WordTokenizerTest {

    private final WordTokenizer tokenizer = new WordTokenizer();

    @Test
    void emitsWordsWithOffsetsAndSkipsPunctuation() {
        String text = "Horus, Warmaster of the Imperium!";
        List<Token> tokens = tokenizer.tokenize(text);

        assertEquals(5, tokens.size());
        assertEquals("Horus", tokens.get(0).getText());
        assertEquals(0, tokens.get(0).getStart());
        assertEquals(5, tokens.get(0).getEnd());
        Token last = tokens.get(4);
        assertEquals("Imperium", last.getText());
        assertEquals("Imperium", text.substring(last.getStart(), last.getEnd()));
    }

    @Test
    void keepsHyphenatedAndApostropheWordsTogether() {
        List<Token> tokens = tokenizer.tokenize("Eldrad's Craftworld-Ulthwe");

        assertEquals(2, tokens.size());
        assertEquals("Eldrad's", tokens.get(0).getText());
        assertEquals("Craftworld-Ulthwe", tokens.get(1).getText());
    }

    @Test
    void handlesCyrillicText() {
        List<Token> tokens = tokenizer.tokenize("Где сражался Абаддон?");

        assertEquals(3, tokens.size());
        assertEquals("Абаддон", tokens.get(2).getText());
    }

    @Test
    void emptyInputYieldsNoTokens() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("  ,.! ").isEmpty());
    }
}
