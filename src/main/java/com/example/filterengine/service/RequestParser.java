package com.example.filterengine.service;

import com.example.filterengine.error.EvaluationError;
import com.example.filterengine.error.Outcome;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns loosely typed request input (JSON bodies, tool arguments, query strings)
 * into validated commands. Limits are clamped rather than rejected.
 */
@Component
public class RequestParser {

    @Value("${app.evaluate.default-limit:50}")
    private int defaultLimit = 50;

    @Value("${app.evaluate.max-limit:500}")
    private int maxLimit = 500;

    @Value("${app.runs.page-size-default:20}")
    private int defaultPageSize = 20;

    @Value("${app.runs.page-size-max:100}")
    private int maxPageSize = 100;

    public Outcome<EvaluateCommand> parseEvaluateRequest(Map<String, Object> body) {
        Map<String, Object> request = body == null ? Map.of() : body;

        Object rawLimit = request.get("limit");
        if (rawLimit != null && !isNumber(rawLimit)) {
            return Outcome.failure(EvaluationError.validation("limit", "limit must be a number"));
        }
        int limit = clampLimit(rawLimit == null ? null : (Number) rawLimit);

        Object rawIds = request.get("modelIds");
        List<String> modelIds = null;
        if (rawIds != null) {
            if (!(rawIds instanceof List)) {
                return Outcome.failure(EvaluationError.validation("modelIds", "modelIds must be an array of strings"));
            }
            List<?> items = (List<?>) rawIds;
            List<String> ids = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                if (!(item instanceof String)) {
                    return Outcome.failure(EvaluationError.validation("modelIds[" + i + "]", "model id must be a string"));
                }
                ids.add((String) item);
            }
            // an empty allow-list means no restriction
            modelIds = ids.isEmpty() ? null : List.copyOf(ids);
        }
        return Outcome.success(new EvaluateCommand(modelIds, limit));
    }

    /**
     * Absent means the default; above the maximum means the maximum; below one means one.
     */
    public int clampLimit(Number requested) {
        if (requested == null) {
            return defaultLimit;
        }
        double value = requested.doubleValue();
        if (value >= maxLimit) {
            return maxLimit;
        }
        if (value < 1) {
            return 1;
        }
        return (int) value;
    }

    public Outcome<Paging> parsePaging(String page, String pageSize) {
        Integer parsedPage;
        Integer parsedSize;
        try {
            parsedPage = page == null || page.isBlank() ? null : Integer.valueOf(page.trim());
        } catch (NumberFormatException e) {
            return Outcome.failure(EvaluationError.validation("page", "page must be an integer"));
        }
        try {
            parsedSize = pageSize == null || pageSize.isBlank() ? null : Integer.valueOf(pageSize.trim());
        } catch (NumberFormatException e) {
            return Outcome.failure(EvaluationError.validation("pageSize", "pageSize must be an integer"));
        }
        int effectivePage = parsedPage == null ? 1 : Math.max(1, parsedPage);
        int effectiveSize = parsedSize == null ? defaultPageSize : Math.max(1, Math.min(parsedSize, maxPageSize));
        return Outcome.success(new Paging(effectivePage, effectiveSize));
    }

    private static boolean isNumber(Object value) {
        if (!(value instanceof Number)) {
            return false;
        }
        double d = ((Number) value).doubleValue();
        return !Double.isNaN(d) && !Double.isInfinite(d);
    }
}
