package com.example.filterengine.service;

import com.example.filterengine.access.CallerContext;
import com.example.filterengine.access.FilterAccessPolicy;
import com.example.filterengine.catalog.ModelCatalog;
import com.example.filterengine.error.CatalogUnavailableException;
import com.example.filterengine.error.ErrorKind;
import com.example.filterengine.error.Outcome;
import com.example.filterengine.error.PersistenceException;
import com.example.filterengine.evaluation.ClauseComparator;
import com.example.filterengine.evaluation.FilterEvaluator;
import com.example.filterengine.model.*;
import com.example.filterengine.store.FilterStore;
import com.example.filterengine.validation.RuleClauseValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FilterEvaluationServiceTest {

    @Mock
    private FilterStore store;

    @Mock
    private FilterAccessPolicy accessPolicy;

    @Mock
    private ModelCatalog modelCatalog;

    @Mock
    private RunRecorder runRecorder;

    @Mock
    private UsageTracker usageTracker;

    private FilterEvaluationService service;

    private final CallerContext caller = CallerContext.of("alice", "team-a");

    private final SavedFilter filter = SavedFilter.builder()
            .id("f1").ownerId("alice").name("OpenAI only").visibility("private").version(1)
            .rules(List.of(RuleClause.builder().field("provider").operator("eq").value("openai").type("hard").build()))
            .build();

    private final List<ModelRecord> catalog = List.of(
            ModelRecord.of(Map.of("id", "gpt-4", "provider", "openai")),
            ModelRecord.of(Map.of("id", "claude-3", "provider", "anthropic")),
            ModelRecord.of(Map.of("id", "gpt-4o-mini", "provider", "openai")));

    @BeforeEach
    void setUp() {
        service = new FilterEvaluationService(store, accessPolicy, new RuleClauseValidator(), modelCatalog,
                new FilterEvaluator(new ClauseComparator()), runRecorder, usageTracker, new RequestParser());
    }

    @Test
    void testEvaluate_Success() {
        // Given
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(true);
        when(modelCatalog.fetchModels()).thenReturn(catalog);
        runTransactionsInline();
        when(runRecorder.recordRun(eq(filter), eq(filter.getRules()), anyList(), any(RunMetadata.class)))
                .thenReturn(FilterRun.builder().id("run-1").filterId("f1").build());

        // When
        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller, Map.of());

        // Then
        assertTrue(outcome.isSuccess());
        EvaluateResponse response = outcome.getValue();
        assertEquals("f1", response.getFilterId());
        assertEquals("OpenAI only", response.getFilterName());
        assertEquals("run-1", response.getRunId());
        assertEquals(3, response.getTotalEvaluated());
        assertEquals(2, response.getMatchCount());
        verify(usageTracker, times(1)).incrementUsage("f1");
    }

    @Test
    void testEvaluate_ModelIdsAndLimitNarrowScope() {
        // Given
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(true);
        when(modelCatalog.fetchModels()).thenReturn(catalog);
        runTransactionsInline();
        when(runRecorder.recordRun(any(), any(), anyList(), any()))
                .thenReturn(FilterRun.builder().id("run-2").filterId("f1").build());

        // When
        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller,
                Map.of("modelIds", List.of("gpt-4o-mini", "claude-3"), "limit", 1));

        // Then
        assertEquals(1, outcome.getValue().getTotalEvaluated());
        // catalog order wins over the order of the allow-list
        assertEquals("claude-3", outcome.getValue().getResults().get(0).getModelId());

        ArgumentCaptor<RunMetadata> meta = ArgumentCaptor.forClass(RunMetadata.class);
        verify(runRecorder).recordRun(any(), any(), anyList(), meta.capture());
        assertEquals(1, meta.getValue().getLimitUsed());
        assertEquals(List.of("gpt-4o-mini", "claude-3"), meta.getValue().getModelIdsFilter());
        assertEquals("alice", meta.getValue().getExecutedBy());
        assertEquals(1, meta.getValue().getEvaluatedModels().size());
    }

    @Test
    void testEvaluate_BadRequestNeverTouchesStore() {
        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller, Map.of("limit", "lots"));

        assertEquals(ErrorKind.VALIDATION, outcome.getError().getKind());
        assertEquals("limit", outcome.getError().getField());
        verifyNoInteractions(store, modelCatalog);
    }

    @Test
    void testEvaluate_FilterNotFound() {
        when(store.findFilter("missing")).thenReturn(Optional.empty());

        Outcome<EvaluateResponse> outcome = service.evaluate("missing", caller, Map.of());

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
        assertEquals("Filter not found", outcome.getError().getMessage());
        verifyNoInteractions(accessPolicy, modelCatalog, runRecorder, usageTracker);
    }

    @Test
    void testEvaluate_AccessDeniedBeforeCatalog() {
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(false);

        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller, Map.of());

        assertEquals(ErrorKind.ACCESS_DENIED, outcome.getError().getKind());
        verifyNoInteractions(modelCatalog, runRecorder, usageTracker);
    }

    @Test
    void testEvaluate_InvalidRulesRejectedBeforeCatalog() {
        SavedFilter broken = filter.toBuilder()
                .rules(List.of(RuleClause.builder().field("provider").operator("like").value("o%").type("hard").build()))
                .build();
        when(store.findFilter("f1")).thenReturn(Optional.of(broken));
        when(accessPolicy.canAccess(caller, broken)).thenReturn(true);

        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller, Map.of());

        assertEquals(ErrorKind.VALIDATION, outcome.getError().getKind());
        assertEquals("rules[0].operator", outcome.getError().getField());
        verifyNoInteractions(modelCatalog, runRecorder, usageTracker);
    }

    @Test
    void testEvaluate_CatalogUnavailable() {
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(true);
        when(modelCatalog.fetchModels()).thenThrow(new CatalogUnavailableException("down", new RuntimeException()));

        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller, Map.of());

        assertEquals(ErrorKind.CATALOG_UNAVAILABLE, outcome.getError().getKind());
        verifyNoInteractions(runRecorder, usageTracker);
    }

    @Test
    void testEvaluate_PersistenceFailureFailsRequest() {
        // Given
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(true);
        when(modelCatalog.fetchModels()).thenReturn(catalog);
        runTransactionsInline();
        when(runRecorder.recordRun(any(), any(), anyList(), any()))
                .thenThrow(new PersistenceException("Failed to insert run"));

        // When
        Outcome<EvaluateResponse> outcome = service.evaluate("f1", caller, Map.of());

        // Then
        assertFalse(outcome.isSuccess());
        assertEquals(ErrorKind.PERSISTENCE, outcome.getError().getKind());
        verify(usageTracker, never()).incrementUsage(anyString());
    }

    @Test
    void testGetRun_NotFound() {
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(true);
        when(store.findRun("f1", "nope")).thenReturn(Optional.empty());

        Outcome<FilterRun> outcome = service.getRun("f1", "nope", caller);

        assertEquals(ErrorKind.NOT_FOUND, outcome.getError().getKind());
        assertEquals("Filter run not found", outcome.getError().getMessage());
    }

    @Test
    void testListRuns_AccessDenied() {
        when(store.findFilter("f1")).thenReturn(Optional.of(filter));
        when(accessPolicy.canAccess(caller, filter)).thenReturn(false);

        assertEquals(ErrorKind.ACCESS_DENIED, service.listRuns("f1", caller, null, null).getError().getKind());
        verify(store, never()).findRuns(anyString(), anyInt(), anyInt());
    }

    @SuppressWarnings("unchecked")
    private void runTransactionsInline() {
        when(store.inTransaction(any())).thenAnswer(invocation -> ((Supplier<Object>) invocation.getArgument(0)).get());
    }
}
