package com.example.paylog.extraction;

import com.example.paylog.model.ExtractedTransaction;
import com.example.paylog.model.RawMessage;
import com.example.paylog.model.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs the extractors over one message and builds the transaction record with a confidence score.
 */
@Slf4j
@Component
public class TransactionAssembler {

    static final double AMOUNT_WEIGHT = 0.30;
    static final double TYPE_WEIGHT = 0.25;
    static final double ACCOUNT_WEIGHT = 0.15;
    static final double DATE_WEIGHT = 0.15;
    static final double TIME_WEIGHT = 0.15;

    private final FinancialContextDetector detector;
    private final AmountExtractor amountExtractor;
    private final TransactionTypeClassifier typeClassifier;
    private final AccountIdentifierExtractor accountExtractor;
    private final DateTimeNormalizer dateTimeNormalizer;

    public TransactionAssembler(FinancialContextDetector detector,
                                AmountExtractor amountExtractor,
                                TransactionTypeClassifier typeClassifier,
                                AccountIdentifierExtractor accountExtractor,
                                DateTimeNormalizer dateTimeNormalizer) {
        this.detector = detector;
        this.amountExtractor = amountExtractor;
        this.typeClassifier = typeClassifier;
        this.accountExtractor = accountExtractor;
        this.dateTimeNormalizer = dateTimeNormalizer;
    }

    /**
     * Empty when the message is not financial or carries no amount.
     */
    public Optional<ExtractedTransaction> assemble(RawMessage message) {
        String content = message.getContent();
        if (!detector.isFinancial(content)) {
            return Optional.empty();
        }

        Optional<AmountMatch> amount = amountExtractor.findPrimary(content);
        if (amount.isEmpty()) {
            log.info("No amount found in financial message from {}: {}", message.getSender(), abbreviate(content));
            return Optional.empty();
        }

        TypeDecision decision = typeClassifier.decide(content, amount.get());
        Optional<String> account = accountExtractor.extractPrimary(content);
        DateTimeResult dateTime = dateTimeNormalizer.extractBoth(content, message.getReceivedAt());

        double confidence = confidence(true, decision.getType() != TransactionType.UNKNOWN,
                account.isPresent(), dateTime.isDateExplicit(), dateTime.isTimeExplicit());

        return Optional.of(ExtractedTransaction.builder()
                .amount(amount.get().getValue())
                .type(decision.getType())
                .accountRef(account.orElse(null))
                .date(dateTime.getDate())
                .time(dateTime.getTime())
                .sourceText(content)
                .senderId(message.getSender())
                .confidence(confidence)
                .build());
    }

    /**
     * Weighted sum of the signals present; each weight is positive and they add up to 1.
     */
    static double confidence(boolean amount, boolean definiteType, boolean account,
                             boolean explicitDate, boolean explicitTime) {
        double score = 0.0;
        if (amount) score += AMOUNT_WEIGHT;
        if (definiteType) score += TYPE_WEIGHT;
        if (account) score += ACCOUNT_WEIGHT;
        if (explicitDate) score += DATE_WEIGHT;
        if (explicitTime) score += TIME_WEIGHT;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static String abbreviate(String content) {
        return content.length() > 50 ? content.substring(0, 50) + "..." : content;
    }
}
