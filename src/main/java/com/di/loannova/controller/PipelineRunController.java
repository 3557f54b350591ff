package com.di.loannova.controller;

import com.di.loannova.orchestrator.PipelineOrchestrator;
import com.di.loannova.orchestrator.RunRequest;
import com.di.loannova.orchestrator.RunStatus;
import com.di.loannova.orchestrator.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST trigger for a single pipeline run.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/pipeline/run</td>
 *     <td>Run all four phases synchronously; body is optional</td></tr>
 * </table>
 *
 * <p>The response body is always the run summary. Successful and skipped runs return
 * {@code 200}; every other terminal status returns {@code 422} so callers can branch on
 * the HTTP code without parsing the body.
 */
@RestController
@RequestMapping("/api/pipeline")
@Slf4j
@RequiredArgsConstructor
public class PipelineRunController {

    private final PipelineOrchestrator orchestrator;

    @PostMapping("/run")
    public ResponseEntity<RunSummary> run(@RequestBody(required = false) RunRequest request) {
        RunRequest effective = request != null ? request : RunRequest.defaults();
        log.info("[CONTROLLER] POST /api/pipeline/run force={} user={}", effective.force(), effective.user());

        RunSummary summary = orchestrator.run(effective);
        HttpStatus status = summary.getStatus() == RunStatus.SUCCESS || summary.getStatus() == RunStatus.SKIPPED
                ? HttpStatus.OK
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(summary);
    }
}
