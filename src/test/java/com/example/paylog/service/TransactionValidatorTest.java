package com.example.paylog.service;

import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.TransactionType;
import com.example.paylog.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionValidatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-18T06:30:00Z"), ZoneId.of("Asia/Kolkata"));

    private final TransactionValidator validator = new TransactionValidator(CLOCK);

    private PersistedTransaction.PersistedTransactionBuilder valid() {
        return PersistedTransaction.builder()
                .id("txn-1")
                .ownerId("local-user")
                .amount(new BigDecimal("1500.00"))
                .type(TransactionType.DEBIT)
                .accountRef("xxxxxx1234")
                .date("2024-12-15")
                .time("14:30:45")
                .sourceText("Your account XXXXXX1234 has been debited with Rs.1,500.00 on 15-Dec-2024")
                .senderId("VM-HDFCBK")
                .confidence(0.85)
                .createdAt(CLOCK.instant());
    }

    @Test
    void wellFormedRecordPasses() {
        ValidationResult result = validator.validate(valid().build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.hasWarnings()).isFalse();
    }

    @Test
    void missingRequiredFields() {
        ValidationResult result = validator.validate(valid().id(" ").ownerId(null).senderId("").type(null).build());

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).contains(
                "Transaction id is required", "Owner id is required",
                "Sender id is required", "Transaction type is required");
    }

    @Test
    void amountBounds() {
        assertThat(validator.validate(valid().amount(BigDecimal.ZERO).build()).getErrors())
                .containsExactly("Amount must be greater than zero");
        assertThat(validator.validate(valid().amount(new BigDecimal("-5")).build()).isValid()).isFalse();
        assertThat(validator.validate(valid().amount(new BigDecimal("10000000.01")).build()).getErrors())
                .containsExactly("Amount exceeds maximum of 10,000,000");
        assertThat(validator.validate(valid().amount(new BigDecimal("10000000")).build()).isValid()).isTrue();

        ValidationResult small = validator.validate(valid().amount(new BigDecimal("0.50")).build());
        assertThat(small.isValid()).isTrue();
        assertThat(small.getWarnings()).containsExactly("Amount is less than 1");
    }

    @Test
    void dateWindow() {
        assertThat(validator.validate(valid().date("2024-12-18").build()).isValid()).isTrue();
        assertThat(validator.validate(valid().date("2024-12-19").build()).getErrors())
                .containsExactly("Date is in the future: 2024-12-19");
        assertThat(validator.validate(valid().date("2024-09-19").build()).isValid()).isTrue();
        assertThat(validator.validate(valid().date("2024-09-18").build()).getErrors())
                .containsExactly("Date is more than 90 days old: 2024-09-18");
        assertThat(validator.validate(valid().date("2024-13-01").build()).isValid()).isFalse();
        assertThat(validator.validate(valid().date(null).build()).getErrors()).containsExactly("Date is required");
    }

    @Test
    void dateNearAgeLimitWarns() {
        ValidationResult result = validator.validate(valid().date("2024-09-20").build());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactly("Date is close to the 90-day limit: 2024-09-20");
    }

    @Test
    void timeFormat() {
        assertThat(validator.validate(valid().time("23:59:59").build()).isValid()).isTrue();
        assertThat(validator.validate(valid().time("24:00:00").build()).isValid()).isFalse();
        assertThat(validator.validate(valid().time("9:05").build()).isValid()).isFalse();
    }

    @Test
    void suspiciousAccountReferencesOnlyWarn() {
        ValidationResult repeated = validator.validate(valid().accountRef("11111111").build());
        assertThat(repeated.isValid()).isTrue();
        assertThat(repeated.getWarnings()).containsExactly("Account reference is a single repeated digit: 11111111");

        ValidationResult fewDigits = validator.validate(valid().accountRef("xxxxx1").build());
        assertThat(fewDigits.getWarnings()).containsExactly("Account reference has fewer than 2 digits: xxxxx1");

        assertThat(validator.validate(valid().accountRef(null).build()).hasWarnings()).isFalse();
    }

    @Test
    void confidenceRange() {
        assertThat(validator.validate(valid().confidence(1.5).build()).isValid()).isFalse();
        assertThat(validator.validate(valid().confidence(Double.NaN).build()).isValid()).isFalse();

        ValidationResult low = validator.validate(valid().confidence(0.3).build());
        assertThat(low.isValid()).isTrue();
        assertThat(low.getWarnings()).containsExactly("Low extraction confidence: 0.3");
    }
}
