package com.example.paylog.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.example.paylog.config.TransactionTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Transaction record as stored locally (JSON in RocksDB) and remotely (row in {@code sms_transaction}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@TableName(value = "sms_transaction", autoResultMap = true)
public class PersistedTransaction {
    @TableId(type = IdType.INPUT)
    private String id;

    private String ownerId;
    private BigDecimal amount;

    @TableField(value = "txn_type", typeHandler = TransactionTypeHandler.class)
    private TransactionType type;

    private String accountRef;

    @TableField("txn_date")
    private String date;

    @TableField("txn_time")
    private String time;

    private String sourceText;
    private String senderId;
    private double confidence;
    private Instant createdAt;
    private boolean synced;
    private String dedupHash;
    private boolean manualEntry;

    public static PersistedTransaction from(ExtractedTransaction extracted, String id, String ownerId,
                                            Instant createdAt, String dedupHash, boolean manualEntry) {
        return PersistedTransaction.builder()
                .id(id)
                .ownerId(ownerId)
                .amount(extracted.getAmount())
                .type(extracted.getType())
                .accountRef(extracted.getAccountRef().orElse(null))
                .date(extracted.getDate())
                .time(extracted.getTime())
                .sourceText(extracted.getSourceText())
                .senderId(extracted.getSenderId())
                .confidence(extracted.getConfidence())
                .createdAt(createdAt)
                .synced(false)
                .dedupHash(dedupHash)
                .manualEntry(manualEntry)
                .build();
    }

    public Optional<String> accountReference() {
        return Optional.ofNullable(accountRef);
    }
}
