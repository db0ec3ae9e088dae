package com.example.filterengine.service;

import com.example.filterengine.error.ErrorKind;
import com.example.filterengine.error.Outcome;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestParserTest {

    private final RequestParser parser = new RequestParser();

    @Test
    void testParseEvaluateRequest_Defaults() {
        Outcome<EvaluateCommand> outcome = parser.parseEvaluateRequest(null);

        assertTrue(outcome.isSuccess());
        assertEquals(50, outcome.getValue().getLimit());
        assertNull(outcome.getValue().getModelIds());
    }

    @Test
    void testClampLimit() {
        assertEquals(500, parser.clampLimit(1000));
        assertEquals(500, parser.clampLimit(500));
        assertEquals(1, parser.clampLimit(0));
        assertEquals(1, parser.clampLimit(-7));
        assertEquals(12, parser.clampLimit(12.9));
        assertEquals(50, parser.clampLimit(null));
    }

    @Test
    void testParseEvaluateRequest_NonNumericLimit() {
        Outcome<EvaluateCommand> outcome = parser.parseEvaluateRequest(Map.of("limit", "ten"));

        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.VALIDATION, outcome.getError().getKind());
        assertEquals("limit", outcome.getError().getField());
    }

    @Test
    void testParseEvaluateRequest_ModelIds() {
        Outcome<EvaluateCommand> outcome = parser.parseEvaluateRequest(Map.of("modelIds", List.of("gpt-4"), "limit", 1000));

        assertEquals(List.of("gpt-4"), outcome.getValue().getModelIds());
        assertEquals(500, outcome.getValue().getLimit());
    }

    @Test
    void testParseEvaluateRequest_EmptyModelIdsMeansNoRestriction() {
        assertNull(parser.parseEvaluateRequest(Map.of("modelIds", List.of())).getValue().getModelIds());
    }

    @Test
    void testParseEvaluateRequest_BadModelIds() {
        Map<String, Object> body = new HashMap<>();
        body.put("modelIds", "gpt-4");
        assertEquals("modelIds", parser.parseEvaluateRequest(body).getError().getField());

        body.put("modelIds", List.of("gpt-4", 7));
        assertEquals("modelIds[1]", parser.parseEvaluateRequest(body).getError().getField());
    }

    @Test
    void testParsePaging() {
        Paging defaults = parser.parsePaging(null, "").getValue();
        assertEquals(1, defaults.getPage());
        assertEquals(20, defaults.getPageSize());

        Paging clamped = parser.parsePaging("0", "250").getValue();
        assertEquals(1, clamped.getPage());
        assertEquals(100, clamped.getPageSize());

        assertEquals("pageSize", parser.parsePaging("2", "many").getError().getField());
    }
}
