package com.wordwatch.bot.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordMatcherTest {
    @Test
    void matchesCaseInsensitivelyAndReportsConfiguredWord() {
        KeywordMatcher matcher = new KeywordMatcher(List.of("spam", "Scam"));

        assertEquals(List.of("spam", "Scam"), matcher.match("SPAM and Spam, a scam or a SCAM"));
        assertEquals(List.of(), matcher.match("nothing to see"));
    }

    @Test
    void treatsWordsLiterally() {
        KeywordMatcher matcher = new KeywordMatcher(List.of("a.b", "(x)"));

        assertEquals(List.of(), matcher.match("axb"));
        assertEquals(List.of("a.b", "(x)"), matcher.match("a.b then (x)"));
    }

    @Test
    void ignoresBlankAndDuplicateWords() {
        KeywordMatcher matcher = new KeywordMatcher(Arrays.asList(" spam ", "", null, "SPAM"));

        assertEquals(List.of("spam"), matcher.words());
        assertEquals(List.of(), matcher.match("   "));
        assertEquals(List.of(), matcher.match(null));
    }

    @Test
    void addAndRemoveAreCaseInsensitive() {
        KeywordMatcher matcher = new KeywordMatcher(List.of());

        assertTrue(matcher.add("Scam"));
        assertFalse(matcher.add("scam"));
        assertFalse(matcher.add("  "));
        assertEquals(1, matcher.size());
        assertEquals(List.of("Scam"), matcher.match("what a scam"));

        assertTrue(matcher.remove("SCAM"));
        assertFalse(matcher.remove("scam"));
        assertEquals(0, matcher.size());
        assertEquals(List.of(), matcher.match("what a scam"));
    }

    @Test
    void matchesNonLatinText() {
        KeywordMatcher matcher = new KeywordMatcher(List.of("ДУРАК", "傻瓜"));

        assertEquals(List.of("ДУРАК", "傻瓜"), matcher.match("ты дурак, 你是傻瓜"));
    }
}
