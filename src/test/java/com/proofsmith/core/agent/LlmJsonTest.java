package com.proofsmith.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmJsonTest {

    @Test
    void testStripsJsonFence() {
        assertEquals("{\"a\": 1}", LlmJson.stripFences("```json\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", LlmJson.stripFences("```\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", LlmJson.stripFences("  {\"a\": 1}  "));
    }

    @Test
    void testReadObjectRejectsNonObjects() {
        assertThrows(JsonProcessingException.class, () -> LlmJson.readObject("[1, 2]"));
        assertThrows(JsonProcessingException.class, () -> LlmJson.readObject("not json at all"));
    }

    @Test
    void testFieldHelpers() throws Exception {
        JsonNode root = LlmJson.readObject(
                "{\"s\": \"x\", \"blank\": \" \", \"list\": [\"a\", \"\", \"b\"], \"one\": \"c\", \"n\": \"0.8\"}");

        assertEquals("x", LlmJson.text(root, "s"));
        assertNull(LlmJson.text(root, "blank"));
        assertNull(LlmJson.text(root, "missing"));
        assertEquals(List.of("a", "b"), LlmJson.textList(root, "list"));
        assertEquals(List.of("c"), LlmJson.textList(root, "one"));
        assertEquals(0.8, LlmJson.number(root, "n", 0.5), 1e-9);
        assertEquals(0.5, LlmJson.number(root, "missing", 0.5), 1e-9);
    }
}
