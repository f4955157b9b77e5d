package com.marketpulse.dispatch.api;

import com.marketpulse.core.engine.AnalysisService;
import com.marketpulse.core.engine.InputValidationException;
import com.marketpulse.core.engine.PipelineException;
import com.marketpulse.core.engine.QualityRejectedException;
import com.marketpulse.core.engine.SessionAbortedException;
import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.Checkpoint;
import com.marketpulse.core.model.FinalReport;
import com.marketpulse.core.session.AnalysisSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for analysis sessions.
 * <p>
 * POST runs the whole pipeline on the request thread and maps the outcome to a
 * status code. Clients that want live progress pass their own {@code session_id}
 * and subscribe to {@code /{id}/events} before submitting.
 */
@RestController
@RequestMapping("/api/v1/analyses")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;
    private final SseStreamingService sseStreamingService;

    public AnalysisController(AnalysisService analysisService, SseStreamingService sseStreamingService) {
        this.analysisService = analysisService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/analyses: Run an analysis.
     * 200 with the report, 400 on invalid input, 422 on a quality rejection,
     * 500 on an aborted or failed session.
     */
    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(@RequestBody AnalysisRequest request) {
        AnalysisSession session;
        try {
            session = analysisService.open(request);
        } catch (InputValidationException e) {
            log.info("Rejected analysis request: {}", e.getErrors());
            return ResponseEntity.badRequest().body(AnalysisResponse.invalid(e.getErrors()));
        }

        try {
            FinalReport report = analysisService.run(session);
            return ResponseEntity.ok(AnalysisResponse.completed(report));
        } catch (QualityRejectedException e) {
            return ResponseEntity.unprocessableEntity()
                    .body(AnalysisResponse.rejected(e.getSessionId(), e.getReport(), e.getCheckpoints()));
        } catch (SessionAbortedException e) {
            return ResponseEntity.internalServerError()
                    .body(AnalysisResponse.partial(e.getSessionId(), e.getStage(), e.getMessage(),
                            e.getCheckpoints()));
        } catch (PipelineException e) {
            log.error("Session {} failed", session.getId(), e);
            return ResponseEntity.internalServerError()
                    .body(AnalysisResponse.failed(session.getId(), e.getMessage()));
        }
    }

    /**
     * GET /api/v1/analyses/{id}: Session status and per-stage verdicts.
     */
    @GetMapping("/{id}")
    public ResponseEntity<SessionView> getSession(@PathVariable String id) {
        return analysisService.find(id)
                .map(SessionView::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/analyses/{id}/checkpoints: Every checkpoint stored for the session.
     * Works for sessions from earlier runs when the store is persistent.
     */
    @GetMapping("/{id}/checkpoints")
    public ResponseEntity<List<Checkpoint>> getCheckpoints(@PathVariable String id) {
        List<Checkpoint> checkpoints = analysisService.checkpoints(id);
        if (checkpoints.isEmpty() && analysisService.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(checkpoints);
    }

    /**
     * GET /api/v1/analyses/{id}/events: SSE stream of pipeline events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    /**
     * DELETE /api/v1/analyses/{id}: Cancel a running session before its next stage.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (analysisService.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!analysisService.cancel(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "session_id", id,
                    "error", "Session is not running"));
        }
        log.info("Cancellation requested for session {}", id);
        return ResponseEntity.accepted().body(Map.of(
                "session_id", id,
                "status", "CANCELLING"));
    }
}
