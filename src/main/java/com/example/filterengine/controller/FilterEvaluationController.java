package com.example.filterengine.controller;

import com.example.filterengine.access.CallerContext;
import com.example.filterengine.error.ErrorKind;
import com.example.filterengine.error.EvaluationError;
import com.example.filterengine.error.Outcome;
import com.example.filterengine.service.FilterEvaluationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * HTTP surface for evaluation and run history. The caller identity comes from
 * the {@code X-User-Id} / {@code X-Team-Id} headers set by the upstream gateway.
 */
@RestController
@RequestMapping("/api/filters/{filterId}")
public class FilterEvaluationController {

    static final String USER_HEADER = "X-User-Id";
    static final String TEAM_HEADER = "X-Team-Id";

    private final FilterEvaluationService service;

    public FilterEvaluationController(FilterEvaluationService service) {
        this.service = service;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<Object>> evaluate(@PathVariable String filterId,
                                                 @RequestHeader(value = USER_HEADER, required = false) String userId,
                                                 @RequestHeader(value = TEAM_HEADER, required = false) String teamId,
                                                 @RequestBody(required = false) Map<String, Object> body) {
        if (userId == null || userId.isBlank()) {
            return Mono.just(unauthorized());
        }
        CallerContext caller = CallerContext.of(userId, teamId);
        return respond(() -> service.evaluate(filterId, caller, body));
    }

    @GetMapping("/runs")
    public Mono<ResponseEntity<Object>> listRuns(@PathVariable String filterId,
                                                 @RequestHeader(value = USER_HEADER, required = false) String userId,
                                                 @RequestHeader(value = TEAM_HEADER, required = false) String teamId,
                                                 @RequestParam(required = false) String page,
                                                 @RequestParam(required = false) String pageSize) {
        if (userId == null || userId.isBlank()) {
            return Mono.just(unauthorized());
        }
        CallerContext caller = CallerContext.of(userId, teamId);
        return respond(() -> service.listRuns(filterId, caller, page, pageSize));
    }

    @GetMapping("/runs/{runId}")
    public Mono<ResponseEntity<Object>> getRun(@PathVariable String filterId,
                                               @PathVariable String runId,
                                               @RequestHeader(value = USER_HEADER, required = false) String userId,
                                               @RequestHeader(value = TEAM_HEADER, required = false) String teamId) {
        if (userId == null || userId.isBlank()) {
            return Mono.just(unauthorized());
        }
        CallerContext caller = CallerContext.of(userId, teamId);
        return respond(() -> service.getRun(filterId, runId, caller));
    }

    // the service blocks on Mongo and Redis, so keep it off the event loop
    private <T> Mono<ResponseEntity<Object>> respond(Callable<Outcome<T>> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> outcome.isSuccess()
                        ? ResponseEntity.ok((Object) outcome.getValue())
                        : error(outcome.getError()));
    }

    static ResponseEntity<Object> error(EvaluationError error) {
        return ResponseEntity.status(statusOf(error.getKind())).body(error.toMap());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ACCESS_DENIED:
                return HttpStatus.FORBIDDEN;
            case CATALOG_UNAVAILABLE:
                return HttpStatus.BAD_GATEWAY;
            case PERSISTENCE:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Object> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("error", "Unauthorized", "code", "UNAUTHORIZED"));
    }
}
