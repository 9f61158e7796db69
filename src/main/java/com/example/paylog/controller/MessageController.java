package com.example.paylog.controller;

import com.example.paylog.exception.InvalidMessageException;
import com.example.paylog.model.ProcessingResult;
import com.example.paylog.model.RawMessage;
import com.example.paylog.service.SmsIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api/messages")
@Tag(name = "Message API", description = "Submit bank/payment SMS for ingestion")
public class MessageController {

    @Autowired
    private SmsIngestionService ingestionService;

    @Autowired
    private Clock clock;

    @PostMapping
    @Operation(summary = "Submit an SMS", description = "Runs a received SMS through detection, extraction, validation and sync")
    public CompletableFuture<ResponseEntity<MessageResponse>> submit(@RequestBody MessageRequest request) {
        if (request.getSender() == null || request.getContent() == null) {
            throw new InvalidMessageException("sender and content are required");
        }
        Instant receivedAt = parseReceivedAt(request.getReceivedAt());
        RawMessage message = new RawMessage(request.getSender(), request.getContent(), receivedAt, request.getThreadId());
        log.debug("Received SMS from {}", request.getSender());

        return ingestionService.submitRawMessage(message, request.getOwnerId(), false)
                .thenApply(result -> ResponseEntity.ok(MessageResponse.from(result)));
    }

    @PostMapping("/manual")
    @Operation(summary = "Manual entry", description = "Submits pasted SMS text; the record is flagged as manual entry")
    public CompletableFuture<ResponseEntity<MessageResponse>> manual(@RequestBody ManualEntryRequest request) {
        if (request.getContent() == null) {
            throw new InvalidMessageException("content is required");
        }
        return ingestionService.submitManualEntry(request.getContent(), request.getSender(), request.getOwnerId())
                .thenApply(result -> ResponseEntity.ok(MessageResponse.from(result)));
    }

    private Instant parseReceivedAt(String receivedAt) {
        if (receivedAt == null || receivedAt.trim().isEmpty()) {
            return clock.instant();
        }
        try {
            return Instant.parse(receivedAt.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidMessageException("receivedAt must be an ISO-8601 instant: " + receivedAt);
        }
    }

    public static class MessageRequest {
        private String sender;
        private String content;
        private String receivedAt;
        private String threadId;
        private String ownerId;

        public String getSender() { return sender; }
        public void setSender(String sender) { this.sender = sender; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }

        public String getReceivedAt() { return receivedAt; }
        public void setReceivedAt(String receivedAt) { this.receivedAt = receivedAt; }

        public String getThreadId() { return threadId; }
        public void setThreadId(String threadId) { this.threadId = threadId; }

        public String getOwnerId() { return ownerId; }
        public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    }

    public static class ManualEntryRequest {
        private String content;
        private String sender;
        private String ownerId;

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }

        public String getSender() { return sender; }
        public void setSender(String sender) { this.sender = sender; }

        public String getOwnerId() { return ownerId; }
        public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    }

    public static class MessageResponse {
        private String status;
        private String transactionId;
        private String dedupHash;
        private List<String> errors;
        private List<String> warnings;

        public MessageResponse() {}

        static MessageResponse from(ProcessingResult result) {
            MessageResponse response = new MessageResponse();
            response.status = result.getStatus().name();
            response.transactionId = result.getTransactionId().orElse(null);
            response.dedupHash = result.getDedupHash();
            response.errors = result.getErrors();
            response.warnings = result.getWarnings();
            return response;
        }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public String getTransactionId() { return transactionId; }
        public void setTransactionId(String transactionId) { this.transactionId = transactionId; }

        public String getDedupHash() { return dedupHash; }
        public void setDedupHash(String dedupHash) { this.dedupHash = dedupHash; }

        public List<String> getErrors() { return errors; }
        public void setErrors(List<String> errors) { this.errors = errors; }

        public List<String> getWarnings() { return warnings; }
        public void setWarnings(List<String> warnings) { this.warnings = warnings; }
    }
}
