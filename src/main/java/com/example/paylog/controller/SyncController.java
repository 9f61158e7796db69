package com.example.paylog.controller;

import com.example.paylog.exception.TransactionNotFoundException;
import com.example.paylog.model.QueueEntry;
import com.example.paylog.sync.DrainReport;
import com.example.paylog.sync.SyncQueueManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/sync")
@Tag(name = "Sync API", description = "Retry queue inspection and draining")
public class SyncController {

    @Autowired
    private SyncQueueManager syncQueueManager;

    @PostMapping("/drain")
    @Operation(summary = "Drain queue now", description = "Re-attempts remote delivery of every queued transaction")
    public ResponseEntity<DrainReport> drain() {
        DrainReport report = syncQueueManager.drainQueueNow();
        log.info("Manual drain requested: {}", report);
        return ResponseEntity.ok(report);
    }

    @GetMapping("/queue")
    @Operation(summary = "List queue", description = "Queued transactions with attempts, failure class and last error")
    public ResponseEntity<List<Map<String, Object>>> queue() {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (QueueEntry entry : syncQueueManager.queuedEntries()) {
            Map<String, Object> view = new HashMap<>();
            view.put("transactionId", entry.getTransactionId());
            view.put("state", entry.getState());
            view.put("attempts", entry.getAttempts());
            view.put("failureClass", entry.getFailureClass());
            view.put("lastError", entry.getLastError());
            view.put("enqueuedAt", entry.getEnqueuedAt());
            view.put("lastAttemptAt", entry.getLastAttemptAt());
            view.put("amount", entry.getTransaction().getAmount());
            view.put("senderId", entry.getTransaction().getSenderId());
            entries.add(view);
        }
        return ResponseEntity.ok(entries);
    }

    @PostMapping("/queue/{id}/retry")
    @Operation(summary = "Re-arm entry", description = "Clears a permanent failure so the next drain retries the entry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable String id) {
        if (!syncQueueManager.rearm(id)) {
            throw new TransactionNotFoundException(id);
        }
        Map<String, Object> body = new HashMap<>();
        body.put("transactionId", id);
        body.put("rearmed", true);
        return ResponseEntity.ok(body);
    }
}
