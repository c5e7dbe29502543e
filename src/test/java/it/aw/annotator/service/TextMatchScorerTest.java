package it.aw.annotator.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextMatchScorerTest {

    @Test
    void exactSubstringScoresHighest() {
        assertEquals(0.9, TextMatchScorer.score("cat", "I have a cat"), 1e-9);
        assertEquals(0.9, TextMatchScorer.score("REMOTE Work", "effects of remote work on teams"), 1e-9);
    }

    @Test
    void queryIsComparedAsGiven() {
        // lo spazio finale esclude la sottostringa esatta, resta il match per parole
        assertEquals(0.6, TextMatchScorer.score("cat ", "I have a cat"), 1e-9);
        assertEquals(0.6, TextMatchScorer.score(" cat", "cat"), 1e-9);
    }

    @Test
    void unrelatedQueryScoresZero() {
        assertEquals(0.0, TextMatchScorer.score("xyz123", "I have a cat"));
    }

    @Test
    void partialWordOverlapIsProportional() {
        double score = TextMatchScorer.score("remote work productivity", "Remote teams and productivity gains");
        assertEquals(0.6 * 2 / 3, score, 1e-9);
    }

    @Test
    void overlapBelowHalfIsSuppressed() {
        assertEquals(0.0, TextMatchScorer.score("remote work productivity", "remote only"));
    }

    @Test
    void exactlyHalfOverlapIsKept() {
        assertEquals(0.3, TextMatchScorer.score("remote labour", "remote teams"), 1e-9);
    }

    @Test
    void shortWordsAreIgnored() {
        assertEquals(0.0, TextMatchScorer.score("to be", "something else"));
    }

    @Test
    void blankInputsScoreZero() {
        assertEquals(0.0, TextMatchScorer.score("   ", "any text"));
        assertEquals(0.0, TextMatchScorer.score("query", ""));
        assertEquals(0.0, TextMatchScorer.score(null, "text"));
    }
}
