package com.example.filterengine.controller;

import com.example.filterengine.access.CallerContext;
import com.example.filterengine.error.ErrorKind;
import com.example.filterengine.error.EvaluationError;
import com.example.filterengine.error.Outcome;
import com.example.filterengine.model.FilterRun;
import com.example.filterengine.service.EvaluateResponse;
import com.example.filterengine.service.FilterEvaluationService;
import com.example.filterengine.store.RunPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FilterEvaluationControllerTest {

    @Mock
    private FilterEvaluationService service;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new FilterEvaluationController(service)).build();
    }

    @Test
    void testEvaluate_Success() {
        // Given
        EvaluateResponse response = EvaluateResponse.builder()
                .filterId("f1").filterName("OpenAI only").runId("run-1").durationMs(4)
                .totalEvaluated(2).matchCount(1).results(List.of())
                .build();
        when(service.evaluate(eq("f1"), any(CallerContext.class), anyMap())).thenReturn(Outcome.success(response));

        // When / Then
        client.post().uri("/api/filters/f1/evaluate")
                .header("X-User-Id", "alice")
                .header("X-Team-Id", "team-a")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("limit", 10))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.filterId").isEqualTo("f1")
                .jsonPath("$.totalEvaluated").isEqualTo(2)
                .jsonPath("$.matchCount").isEqualTo(1)
                .jsonPath("$.runId").isEqualTo("run-1");

        ArgumentCaptor<CallerContext> caller = ArgumentCaptor.forClass(CallerContext.class);
        verify(service).evaluate(eq("f1"), caller.capture(), anyMap());
        assertEquals("alice", caller.getValue().getUserId());
        assertEquals("team-a", caller.getValue().getTeamId());
    }

    @Test
    void testEvaluate_MissingUserHeader() {
        client.post().uri("/api/filters/f1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody().jsonPath("$.code").isEqualTo("UNAUTHORIZED");

        verifyNoInteractions(service);
    }

    @Test
    void testEvaluate_ValidationErrorNamesField() {
        when(service.evaluate(eq("f1"), any(CallerContext.class), anyMap()))
                .thenReturn(Outcome.failure(EvaluationError.validation("limit", "limit must be a number")));

        client.post().uri("/api/filters/f1/evaluate")
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("limit", "x"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION")
                .jsonPath("$.field").isEqualTo("limit");
    }

    @Test
    void testGetRun_AccessDenied() {
        when(service.getRun(eq("f1"), eq("r1"), any(CallerContext.class)))
                .thenReturn(Outcome.failure(EvaluationError.of(ErrorKind.ACCESS_DENIED, "You do not have access to this filter")));

        client.get().uri("/api/filters/f1/runs/r1")
                .header("X-User-Id", "bob")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody().jsonPath("$.code").isEqualTo("ACCESS_DENIED");
    }

    @Test
    void testListRuns_PassesPagingThrough() {
        RunPage page = new RunPage(List.of(FilterRun.builder().id("r1").filterId("f1").build()), 1, 2, 5);
        when(service.listRuns(eq("f1"), any(CallerContext.class), eq("2"), eq("5"))).thenReturn(Outcome.success(page));

        client.get().uri("/api/filters/f1/runs?page=2&pageSize=5")
                .header("X-User-Id", "alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.runs[0].id").isEqualTo("r1")
                .jsonPath("$.page").isEqualTo(2)
                .jsonPath("$.total").isEqualTo(1);
    }

    @Test
    void testStatusOf_EveryKindMapped() {
        assertEquals(HttpStatus.BAD_REQUEST, FilterEvaluationController.statusOf(ErrorKind.VALIDATION));
        assertEquals(HttpStatus.NOT_FOUND, FilterEvaluationController.statusOf(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.FORBIDDEN, FilterEvaluationController.statusOf(ErrorKind.ACCESS_DENIED));
        assertEquals(HttpStatus.BAD_GATEWAY, FilterEvaluationController.statusOf(ErrorKind.CATALOG_UNAVAILABLE));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, FilterEvaluationController.statusOf(ErrorKind.PERSISTENCE));
        assertEquals(Map.of("error", "Filter not found", "code", "NOT_FOUND"),
                FilterEvaluationController.error(EvaluationError.notFound("Filter")).getBody());
    }
}
