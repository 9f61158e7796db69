package com.example.paylog.service;

import com.example.paylog.model.PersistedTransaction;
import com.example.paylog.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Business-rule checks run on a record before it is persisted. Errors block persistence,
 * warnings are reported but let the record through.
 */
@Component
public class TransactionValidator {

    static final BigDecimal MAX_AMOUNT = new BigDecimal("10000000");
    static final int MAX_AGE_DAYS = 90;
    static final int AGE_WARNING_MARGIN_DAYS = 5;
    static final double LOW_CONFIDENCE = 0.5;

    private static final Pattern TIME = Pattern.compile("^([01][0-9]|2[0-3]):([0-5][0-9]):([0-5][0-9])$");

    private final Clock clock;

    public TransactionValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationResult validate(PersistedTransaction record) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkRequired(record, errors);
        checkAmount(record.getAmount(), errors, warnings);
        checkDate(record.getDate(), errors, warnings);
        checkTime(record.getTime(), errors);
        record.accountReference().ifPresent(account -> checkAccount(account, warnings));
        checkConfidence(record.getConfidence(), errors, warnings);

        return ValidationResult.of(errors, warnings);
    }

    private void checkRequired(PersistedTransaction record, List<String> errors) {
        if (isBlank(record.getId())) errors.add("Transaction id is required");
        if (isBlank(record.getOwnerId())) errors.add("Owner id is required");
        if (isBlank(record.getSourceText())) errors.add("SMS content is required");
        if (isBlank(record.getSenderId())) errors.add("Sender id is required");
        if (record.getType() == null) errors.add("Transaction type is required");
    }

    private void checkAmount(BigDecimal amount, List<String> errors, List<String> warnings) {
        if (amount == null) {
            errors.add("Amount is required");
            return;
        }
        if (amount.signum() <= 0) {
            errors.add("Amount must be greater than zero");
        } else if (amount.compareTo(MAX_AMOUNT) > 0) {
            errors.add("Amount exceeds maximum of 10,000,000");
        } else if (amount.compareTo(BigDecimal.ONE) < 0) {
            warnings.add("Amount is less than 1");
        }
    }

    private void checkDate(String date, List<String> errors, List<String> warnings) {
        if (isBlank(date)) {
            errors.add("Date is required");
            return;
        }
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            errors.add("Date is not a valid YYYY-MM-DD date: " + date);
            return;
        }
        LocalDate today = LocalDate.now(clock);
        if (parsed.isAfter(today)) {
            errors.add("Date is in the future: " + date);
            return;
        }
        long age = ChronoUnit.DAYS.between(parsed, today);
        if (age > MAX_AGE_DAYS) {
            errors.add("Date is more than " + MAX_AGE_DAYS + " days old: " + date);
        } else if (age > MAX_AGE_DAYS - AGE_WARNING_MARGIN_DAYS) {
            warnings.add("Date is close to the " + MAX_AGE_DAYS + "-day limit: " + date);
        }
    }

    private void checkTime(String time, List<String> errors) {
        if (time == null || !TIME.matcher(time).matches()) {
            errors.add("Time must be HH:MM:SS: " + time);
        }
    }

    private void checkAccount(String account, List<String> warnings) {
        if (account.length() < 4 || account.length() > 20) {
            warnings.add("Account reference length is unusual: " + account);
        }
        String digits = account.replaceAll("[^0-9]", "");
        if (digits.length() < 2) {
            warnings.add("Account reference has fewer than 2 digits: " + account);
        } else if (digits.length() == account.length() && digits.chars().allMatch(c -> c == digits.charAt(0))) {
            warnings.add("Account reference is a single repeated digit: " + account);
        }
    }

    private void checkConfidence(double confidence, List<String> errors, List<String> warnings) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            errors.add("Confidence must be between 0 and 1: " + confidence);
        } else if (confidence < LOW_CONFIDENCE) {
            warnings.add("Low extraction confidence: " + confidence);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
