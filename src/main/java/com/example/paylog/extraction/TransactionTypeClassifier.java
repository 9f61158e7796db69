package com.example.paylog.extraction;

import com.example.paylog.model.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Component
public class TransactionTypeClassifier {

    static final List<String> DEBIT_KEYWORDS = List.of(
            "debited", "withdrawn", "transferred out", "paid", "deducted");

    static final List<String> CREDIT_KEYWORDS = List.of(
            "credited", "received", "deposited", "transferred in", "added");

    public TransactionType classify(String text) {
        return decide(text).getType();
    }

    public TypeDecision decide(String text) {
        return decide(text, null);
    }

    /**
     * Classifies {@code text}. When both keyword sets match, the side closest to {@code amount}
     * wins; then the side with more distinct matches; then the side that occurs first.
     *
     * @param amount primary amount span, may be null
     */
    public TypeDecision decide(String text, AmountMatch amount) {
        List<String> debit = matches(text, DEBIT_KEYWORDS);
        List<String> credit = matches(text, CREDIT_KEYWORDS);

        if (debit.isEmpty() && credit.isEmpty()) {
            return new TypeDecision(TransactionType.UNKNOWN, TypeDecision.TieBreak.NONE, debit, credit);
        }
        if (credit.isEmpty()) {
            return new TypeDecision(TransactionType.DEBIT, TypeDecision.TieBreak.NONE, debit, credit);
        }
        if (debit.isEmpty()) {
            return new TypeDecision(TransactionType.CREDIT, TypeDecision.TieBreak.NONE, debit, credit);
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (amount != null) {
            int debitGap = nearestGap(lower, debit, amount);
            int creditGap = nearestGap(lower, credit, amount);
            if (debitGap != creditGap) {
                TransactionType type = debitGap < creditGap ? TransactionType.DEBIT : TransactionType.CREDIT;
                return ambiguous(type, TypeDecision.TieBreak.AMOUNT_PROXIMITY, debit, credit);
            }
        }
        if (debit.size() != credit.size()) {
            TransactionType type = debit.size() > credit.size() ? TransactionType.DEBIT : TransactionType.CREDIT;
            return ambiguous(type, TypeDecision.TieBreak.MATCH_COUNT, debit, credit);
        }
        TransactionType type = firstOccurrence(lower, debit) <= firstOccurrence(lower, credit)
                ? TransactionType.DEBIT : TransactionType.CREDIT;
        return ambiguous(type, TypeDecision.TieBreak.FIRST_OCCURRENCE, debit, credit);
    }

    /**
     * Fraction of the keyword set for {@code type} present in {@code text}; 0 for UNKNOWN.
     */
    public double confidenceFor(String text, TransactionType type) {
        switch (type) {
            case DEBIT:
                return matches(text, DEBIT_KEYWORDS).size() / (double) DEBIT_KEYWORDS.size();
            case CREDIT:
                return matches(text, CREDIT_KEYWORDS).size() / (double) CREDIT_KEYWORDS.size();
            default:
                return 0.0;
        }
    }

    public List<String> matchedKeywords(String text) {
        List<String> all = new ArrayList<>(matches(text, DEBIT_KEYWORDS));
        all.addAll(matches(text, CREDIT_KEYWORDS));
        return all;
    }

    private TypeDecision ambiguous(TransactionType type, TypeDecision.TieBreak rule,
                                   List<String> debit, List<String> credit) {
        log.debug("Both debit {} and credit {} keywords present, resolved {} by {}", debit, credit, type, rule);
        return new TypeDecision(type, rule, debit, credit);
    }

    private static List<String> matches(String text, List<String> keywords) {
        List<String> found = new ArrayList<>();
        if (text == null || text.trim().isEmpty()) {
            return found;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    private static int nearestGap(String lower, List<String> keywords, AmountMatch amount) {
        int best = Integer.MAX_VALUE;
        for (String keyword : keywords) {
            for (int start : TextSpans.occurrences(lower, keyword)) {
                best = Math.min(best, TextSpans.gap(start, start + keyword.length(), amount.getStart(), amount.getEnd()));
            }
        }
        return best;
    }

    private static int firstOccurrence(String lower, List<String> keywords) {
        int first = Integer.MAX_VALUE;
        for (String keyword : keywords) {
            int idx = lower.indexOf(keyword);
            if (idx >= 0) {
                first = Math.min(first, idx);
            }
        }
        return first;
    }
}
