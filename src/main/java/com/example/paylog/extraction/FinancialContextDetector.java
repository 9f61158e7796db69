package com.example.paylog.extraction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristic deciding whether a message talks about money at all.
 * Matching is case-insensitive substring matching over four disjoint keyword sets.
 */
@Component
public class FinancialContextDetector {

    static final List<String> CREDIT_INDICATORS = List.of(
            "credited", "received", "deposited", "transferred in", "added",
            "credit", "deposit", "refund", "cashback");

    static final List<String> DEBIT_INDICATORS = List.of(
            "debited", "withdrawn", "transferred", "paid", "deducted",
            "debit", "withdrawal", "purchase", "spent", "charged");

    static final List<String> AMOUNT_INDICATORS = List.of(
            "rupees", "rs.", "₹", "inr", "amount", "balance", "amt", "total");

    static final List<String> ACCOUNT_INDICATORS = List.of(
            "account", "a/c", "ac no", "acct", "bank", "card", "upi");

    private static final List<List<String>> CATEGORIES = List.of(
            CREDIT_INDICATORS, DEBIT_INDICATORS, AMOUNT_INDICATORS, ACCOUNT_INDICATORS);

    public boolean isFinancial(String text) {
        if (isBlank(text)) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (List<String> category : CATEGORIES) {
            if (matchesAny(lower, category)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fraction of keyword categories with at least one hit, 0.0 to 1.0.
     */
    public double score(String text) {
        if (isBlank(text)) {
            return 0.0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int matched = 0;
        for (List<String> category : CATEGORIES) {
            if (matchesAny(lower, category)) {
                matched++;
            }
        }
        return Math.min(1.0, matched / (double) CATEGORIES.size());
    }

    public List<String> matchedKeywords(String text) {
        List<String> matches = new ArrayList<>();
        if (isBlank(text)) {
            return matches;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (List<String> category : CATEGORIES) {
            for (String keyword : category) {
                if (lower.contains(keyword)) {
                    matches.add(keyword);
                }
            }
        }
        return matches;
    }

    private static boolean matchesAny(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
