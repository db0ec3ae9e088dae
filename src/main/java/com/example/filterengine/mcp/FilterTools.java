package com.example.filterengine.mcp;

import com.example.filterengine.access.CallerContext;
import com.example.filterengine.error.Outcome;
import com.example.filterengine.service.FilterEvaluationService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exposes evaluation and run history as MCP tools. Results are returned as
 * plain maps; failures come back as {@code {ok:false, error, code, field}}.
 */
@Service
public class FilterTools {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final FilterEvaluationService service;
    private final ObjectMapper objectMapper;

    public FilterTools(FilterEvaluationService service, ObjectMapper objectMapper) {
        this.service = service;
        this.objectMapper = objectMapper;
    }

    @Tool(description = "Evaluate a saved filter against the model catalog and record the run")
    public Map<String, Object> evaluate_filter(String filterId,
                                               String userId,
                                               @ToolParam(required = false) String teamId,
                                               @ToolParam(required = false) List<String> modelIds,
                                               @ToolParam(required = false) Integer limit) {
        if (isAnonymous(userId)) {
            return unauthorized();
        }
        Map<String, Object> body = new HashMap<>();
        if (modelIds != null) {
            body.put("modelIds", modelIds);
        }
        if (limit != null) {
            body.put("limit", limit);
        }
        return toMap(service.evaluate(filterId, CallerContext.of(userId, teamId), body));
    }

    @Tool(description = "List recorded runs of a saved filter, newest first")
    public Map<String, Object> list_filter_runs(String filterId,
                                                String userId,
                                                @ToolParam(required = false) String teamId,
                                                @ToolParam(required = false) Integer page,
                                                @ToolParam(required = false) Integer pageSize) {
        if (isAnonymous(userId)) {
            return unauthorized();
        }
        return toMap(service.listRuns(filterId, CallerContext.of(userId, teamId),
                page == null ? null : page.toString(),
                pageSize == null ? null : pageSize.toString()));
    }

    @Tool(description = "Fetch one recorded run of a saved filter")
    public Map<String, Object> get_filter_run(String filterId,
                                              String runId,
                                              String userId,
                                              @ToolParam(required = false) String teamId) {
        if (isAnonymous(userId)) {
            return unauthorized();
        }
        return toMap(service.getRun(filterId, runId, CallerContext.of(userId, teamId)));
    }

    private static boolean isAnonymous(String userId) {
        return userId == null || userId.isBlank();
    }

    private static Map<String, Object> unauthorized() {
        Map<String, Object> failure = new HashMap<>();
        failure.put("ok", false);
        failure.put("error", "Unauthorized");
        failure.put("code", "UNAUTHORIZED");
        return failure;
    }

    private Map<String, Object> toMap(Outcome<?> outcome) {
        if (!outcome.isSuccess()) {
            Map<String, Object> failure = new HashMap<>(outcome.getError().toMap());
            failure.put("ok", false);
            return failure;
        }
        Map<String, Object> result = new HashMap<>(objectMapper.convertValue(outcome.getValue(), MAP_TYPE));
        result.put("ok", true);
        return result;
    }
}
