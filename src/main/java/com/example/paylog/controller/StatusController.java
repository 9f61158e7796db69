package com.example.paylog.controller;

import com.example.paylog.service.ConnectivityMonitor;
import com.example.paylog.service.DuplicateDetector;
import com.example.paylog.service.PipelineEventBus;
import com.example.paylog.service.PipelineStatistics;
import com.example.paylog.service.SmsIngestionService;
import com.example.paylog.sync.SyncQueueManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/status")
@Tag(name = "Status API", description = "Pipeline counters and intake switch")
public class StatusController {

    @Autowired
    private SmsIngestionService ingestionService;

    @Autowired
    private PipelineStatistics statistics;

    @Autowired
    private SyncQueueManager syncQueueManager;

    @Autowired
    private DuplicateDetector duplicateDetector;

    @Autowired
    private ConnectivityMonitor connectivityMonitor;

    @Autowired
    private PipelineEventBus eventBus;

    @GetMapping
    @Operation(summary = "Pipeline status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new HashMap<>();
        body.put("intakeEnabled", ingestionService.isIntakeEnabled());
        body.put("remoteReachable", connectivityMonitor.isReachable());
        body.put("queueSize", syncQueueManager.queueSize());
        body.put("knownHashes", duplicateDetector.count());
        body.put("statistics", statistics.snapshot());
        body.put("eventsPublished", eventBus.getPublishedEvents());
        body.put("eventsDropped", eventBus.getDroppedEvents());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/intake/stop")
    @Operation(summary = "Stop intake", description = "New messages are refused; in-flight ones complete")
    public ResponseEntity<Map<String, Object>> stopIntake() {
        ingestionService.stopIntake();
        return ResponseEntity.ok(Map.of("intakeEnabled", ingestionService.isIntakeEnabled()));
    }

    @PostMapping("/intake/start")
    @Operation(summary = "Start intake")
    public ResponseEntity<Map<String, Object>> startIntake() {
        ingestionService.startIntake();
        return ResponseEntity.ok(Map.of("intakeEnabled", ingestionService.isIntakeEnabled()));
    }
}
