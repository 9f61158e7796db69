package com.example.paylog.controller;

import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.service.SmsIngestionService;
import com.example.paylog.service.TransactionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/transactions")
@Tag(name = "Transaction API", description = "Read model of persisted transactions")
public class TransactionController {

    @Autowired
    private TransactionQueryService queryService;

    @Autowired
    private SmsIngestionService ingestionService;

    @GetMapping
    @Operation(summary = "List transactions", description = "Transactions of one owner, newest first")
    public ResponseEntity<List<PersistedTransaction>> list(
            @Parameter(description = "Owner id; defaults to the configured owner")
            @RequestParam(value = "ownerId", required = false) String ownerId) {
        String owner = ownerId == null || ownerId.trim().isEmpty() ? ingestionService.getDefaultOwnerId() : ownerId;
        return ResponseEntity.ok(queryService.findByOwner(owner));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get transaction", description = "One transaction by id")
    public ResponseEntity<PersistedTransaction> get(@PathVariable String id) {
        return ResponseEntity.ok(queryService.getById(id));
    }
}
