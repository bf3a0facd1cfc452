package com.proofsmith.core.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorSignaturesTest {

    @Test
    void testJoinsErrorLinesAmongFirstThree() {
        String error = "Foo.lean:3:2: error: unknown identifier 'x'\n"
                + "some context\n"
                + "  Foo.lean:5:0: ERROR: unsolved goals\n"
                + "Foo.lean:9:0: error: never scanned";

        assertEquals("Foo.lean:3:2: error: unknown identifier 'x' | Foo.lean:5:0: ERROR: unsolved goals",
                ErrorSignatures.extract(error));
    }

    @Test
    void testEmptyWhenNoErrorMarker() {
        assertEquals("", ErrorSignatures.extract("Execution timed out after 60 seconds"));
        assertEquals("", ErrorSignatures.extract(null));
        assertEquals("", ErrorSignatures.extract("  "));
    }

    @Test
    void testCappedAtTwoHundredChars() {
        String error = "error: " + "x".repeat(500);

        assertEquals(200, ErrorSignatures.extract(error).length());
    }
}
