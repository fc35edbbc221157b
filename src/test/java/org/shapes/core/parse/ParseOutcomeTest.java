package org.shapes.core.parse;

import org.junit.Test;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;

import java.util.List;

import static org.junit.Assert.*;

public class ParseOutcomeTest {

    @Test
    public void skeletonTextHasNoContent() {
        assertFalse(ParseOutcome.hasContent(null));
        assertFalse(ParseOutcome.hasContent(""));
        assertFalse(ParseOutcome.hasContent("{\n}\n"));
        assertFalse(ParseOutcome.hasContent("-- only a comment\nreturn {\n  {},\n};\n"));
    }

    @Test
    public void anythingElseIsContent() {
        assertTrue(ParseOutcome.hasContent("hello"));
        assertTrue(ParseOutcome.hasContent("{ 5 }"));
        assertTrue(ParseOutcome.hasContent("returned"));
    }

    @Test
    public void recoveredStatusFollowsResultAndSource() {
        ShapesFile empty = new ShapesFile();
        ShapesFile one = new ShapesFile(List.of(new Shape(1)));

        assertEquals(ParseOutcome.Status.RECOVERED, ParseOutcome.recovered(one, "x", "err").status());
        assertEquals(ParseOutcome.Status.EMPTY, ParseOutcome.recovered(empty, "{}", "err").status());

        ParseOutcome nothing = ParseOutcome.recovered(empty, "garbage", "err");
        assertEquals(ParseOutcome.Status.RECOVERED_NOTHING, nothing.status());
        assertTrue(nothing.isSuspicious());
        assertTrue(nothing.usedFallback());
        assertEquals("err", nothing.strictFailure());
    }

    @Test
    public void parsedOutcomeIsStrict() {
        ParseOutcome outcome = ParseOutcome.parsed(new ShapesFile());
        assertFalse(outcome.usedFallback());
        assertFalse(outcome.isSuspicious());
        assertEquals(StrategyId.STRICT, outcome.strategy());
    }
}
