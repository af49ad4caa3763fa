package com.superintendent.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.superintendent.orchestrator.api.dto.PlanRequest;
import com.superintendent.orchestrator.api.dto.RunResponse;
import com.superintendent.orchestrator.api.dto.SubmitRunRequest;
import com.superintendent.orchestrator.model.InvalidPlanException;
import com.superintendent.orchestrator.plan.PlanJson;
import com.superintendent.orchestrator.service.InvalidRunRequestException;
import com.superintendent.orchestrator.service.Run;
import com.superintendent.orchestrator.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for plans and orchestration runs.
 *
 * POST /plans      : build the plan one agent would execute (dry run)
 * POST /runs       : detect tasks, decide a strategy and start a run
 * GET  /runs/{id}  : poll the state, decision and final result of a run
 */
@RestController
public class RunController {

    private final RunService runService;
    private final PlanJson   planJson;

    public RunController(RunService runService, ObjectMapper objectMapper) {
        this.runService = runService;
        this.planJson   = new PlanJson(objectMapper);
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/plans \
     *     -H "Content-Type: application/json" \
     *     -d '{"repo":"/src/app","task":"Fix the login bug","target":"local"}'
     */
    @PostMapping(path = "/plans", produces = MediaType.APPLICATION_JSON_VALUE)
    public String plan(@RequestBody PlanRequest req) {
        try {
            return planJson.toJson(runService.preview(req.toInput()));
        } catch (InvalidPlanException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Returns 201 with the queued run, or 400 when no tasks were found or
     * autonomous mode would run locally without dangerouslySkipIsolation.
     */
    @PostMapping("/runs")
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        try {
            Run run = runService.submit(req.repo(), req.task(), req.source(),
                    req.overrides(), req.dangerouslySkipIsolation());
            return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
        } catch (InvalidRunRequestException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /** Returns 404 if the run ID is not found. */
    @GetMapping("/runs/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.findById(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
