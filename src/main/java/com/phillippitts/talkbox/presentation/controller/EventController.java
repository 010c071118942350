package com.phillippitts.talkbox.presentation.controller;

import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.ingest.EventIngestionService;
import com.phillippitts.talkbox.service.ingest.IngestOutcome;
import com.phillippitts.talkbox.service.pipeline.ResponsePipeline;
import com.phillippitts.talkbox.service.queue.EnqueueResult;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatusRegistry;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST entry for text and live-chat events, plus a status snapshot.
 *
 * <p>Events go through the same ingestion path as adapter callbacks, so admin commands work here
 * too. Voice input is not accepted over REST.
 */
@RestController
@RequestMapping("/api")
class EventController {

    private static final Logger LOG = LogManager.getLogger(EventController.class);

    private final EventIngestionService ingestion;
    private final QueueManager queue;
    private final ResponsePipeline pipeline;
    private final ConnectionStatusRegistry connections;

    EventController(EventIngestionService ingestion,
                    QueueManager queue,
                    ResponsePipeline pipeline,
                    ConnectionStatusRegistry connections) {
        this.ingestion = ingestion;
        this.queue = queue;
        this.pipeline = pipeline;
        this.connections = connections;
    }

    @PostMapping("/events")
    ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody EventRequest request) {
        Source source = Source.fromWireName(request.source());
        IngestOutcome outcome = switch (source) {
            case TEXT -> ingestion.onTextCommand(request.userId(), request.userName(), request.content());
            case LIVE_CHAT -> ingestion.onLiveChatMessage(request.userId(), request.userName(), request.content());
            case VOICE -> throw new IllegalArgumentException("Voice events are not accepted over REST");
        };
        LOG.debug("REST event from {} via {}: {}", request.userId(), source, outcome.type());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("outcome", outcome.type().name());
        body.put("timestamp", Instant.now().toString());
        outcome.reply().ifPresent(r -> body.put("message", r));
        if (outcome.enqueueResult() != null) {
            EnqueueResult result = outcome.enqueueResult();
            body.put("status", result.status().name());
            result.queuedItem().ifPresent(item -> {
                body.put("itemId", item.itemId());
                body.put("priority", item.priority().name());
            });
        }
        return ResponseEntity.status(httpStatus(outcome)).body(body);
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("queue", queue.snapshot());
        body.put("pipeline", pipeline.stats());
        body.put("connections", connections.statuses());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }

    private static HttpStatus httpStatus(IngestOutcome outcome) {
        return switch (outcome.type()) {
            case QUEUED -> HttpStatus.ACCEPTED;
            case COMMAND -> HttpStatus.OK;
            case IGNORED -> HttpStatus.BAD_REQUEST;
            case REJECTED -> switch (outcome.enqueueResult().status()) {
                case REJECTED_FULL -> HttpStatus.TOO_MANY_REQUESTS;
                case REJECTED_SOURCE_DISABLED -> HttpStatus.FORBIDDEN;
                default -> HttpStatus.SERVICE_UNAVAILABLE;
            };
        };
    }
}
