package com.example.paylog.extraction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pulls account references out of message text, keeping the sender's masking.
 * <p>
 * Tiers, first non-empty wins: keyword-anchored ("A/c XX1234", "Account No: 1234567890"),
 * masked tokens anywhere ("******5678"), "ending 9012", then bare 8-18 digit runs that do not
 * look like card numbers. Mask characters are normalized to {@code x}; spaces and hyphens are
 * dropped.
 */
@Component
public class AccountIdentifierExtractor {

    private static final Pattern CONTEXT_ANCHORED = Pattern.compile(
            "(?<![A-Za-z])(?:a/?c|account|acct|ending)\\.?\\s*(?:no\\.?|number)?[:\\s]*([xX*0-9][-\\sxX*0-9]{2,20})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern MASKED = Pattern.compile(
            "(?<![A-Za-z])([xX*]{2,}[-\\s]?[0-9]{2,6})(?![0-9])");

    private static final Pattern ENDING = Pattern.compile(
            "ending\\s+([0-9]{4})(?![0-9])", Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_DIGITS = Pattern.compile(
            "(?<![0-9A-Za-z])([0-9]{8,18}|[0-9]{4}(?:[-\\s][0-9]{4,10}){1,3})(?![0-9A-Za-z])");

    private static final Pattern CARD_SHAPE = Pattern.compile(
            "[0-9]{4}[-\\s]?[0-9]{4}[-\\s]?[0-9]{4}[-\\s]?[0-9]{4}");

    static final List<String> PRIMARY_KEYWORDS = List.of(
            "credited to", "debited from", "from account", "to account",
            "a/c", "account", "ac no", "account no", "account number", "acct");

    static final int PROXIMITY_WINDOW = 100;
    static final int CARD_WINDOW = 30;

    public Optional<String> extractPrimary(String text) {
        List<Candidate> candidates = candidates(text);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0).value);
        }
        return Optional.of(selectPrimary(candidates, text));
    }

    /**
     * All accepted references of the winning tier, in discovery order, without repeats.
     */
    public List<String> extractAll(String text) {
        return candidates(text).stream().map(c -> c.value).collect(Collectors.toList());
    }

    public boolean hasAccountIdentifier(String text) {
        return !candidates(text).isEmpty();
    }

    private List<Candidate> candidates(String text) {
        if (text == null || text.trim().isEmpty()) {
            return new ArrayList<>();
        }
        List<Candidate> found = collect(text, CONTEXT_ANCHORED, (raw, m) -> true);
        if (found.isEmpty()) {
            found = collect(text, MASKED, (raw, m) -> true);
        }
        if (found.isEmpty()) {
            found = collect(text, ENDING, (raw, m) -> true);
        }
        if (found.isEmpty()) {
            found = collect(text, BARE_DIGITS, (raw, m) -> !looksLikeCard(text, raw, m.start(1), m.end(1)));
        }
        return found;
    }

    private List<Candidate> collect(String text, Pattern pattern, BiPredicate<String, Matcher> accept) {
        Map<String, Candidate> byValue = new LinkedHashMap<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String raw = m.group(1);
            if (!accept.test(raw, m)) {
                continue;
            }
            String normalized = normalize(raw);
            if (normalized != null) {
                int start = m.start(1);
                int end = start + raw.trim().length();
                byValue.putIfAbsent(normalized, new Candidate(normalized, start, end));
            }
        }
        return new ArrayList<>(byValue.values());
    }

    /**
     * Mask characters become {@code x}, whitespace and hyphens are removed. Returns null for
     * implausible references: shorter than 4, more than 20, fewer than 2 digits, or one repeated digit.
     */
    static String normalize(String raw) {
        StringBuilder sb = new StringBuilder();
        for (char c : raw.trim().toCharArray()) {
            if (c == 'x' || c == 'X' || c == '*') {
                sb.append('x');
            } else if (Character.isDigit(c)) {
                sb.append(c);
            }
        }
        String normalized = sb.toString();
        if (normalized.length() < 4 || normalized.length() > 20) {
            return null;
        }
        String digits = normalized.replace("x", "");
        if (digits.length() < 2) {
            return null;
        }
        if (digits.chars().allMatch(c -> c == digits.charAt(0)) && digits.length() == normalized.length()) {
            return null;
        }
        return normalized;
    }

    private static boolean looksLikeCard(String text, String raw, int start, int end) {
        String digits = raw.replaceAll("[-\\s]", "");
        if (digits.length() == 16) {
            return true;
        }
        String[] groups = raw.split("[-\\s]");
        if (groups.length == 4 && CARD_SHAPE.matcher(raw).matches()) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (int cardAt : TextSpans.occurrences(lower, "card")) {
            if (TextSpans.gap(cardAt, cardAt + 4, start, end) < CARD_WINDOW) {
                return true;
            }
        }
        return false;
    }

    /**
     * Nearest to a primary keyword, references after the keyword winning ties; then the first
     * masked reference; then the first one found.
     */
    private String selectPrimary(List<Candidate> candidates, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Candidate best = null;
        int bestGap = Integer.MAX_VALUE;
        boolean bestAfter = false;
        for (String keyword : PRIMARY_KEYWORDS) {
            for (int kwStart : TextSpans.occurrences(lower, keyword)) {
                int kwEnd = kwStart + keyword.length();
                for (Candidate candidate : candidates) {
                    int gap = TextSpans.gap(kwStart, kwEnd, candidate.start, candidate.end);
                    if (gap > PROXIMITY_WINDOW) {
                        continue;
                    }
                    boolean after = candidate.start >= kwEnd;
                    if (gap < bestGap || (gap == bestGap && after && !bestAfter)) {
                        best = candidate;
                        bestGap = gap;
                        bestAfter = after;
                    }
                }
            }
        }
        if (best != null) {
            return best.value;
        }
        for (Candidate candidate : candidates) {
            if (candidate.value.indexOf('x') >= 0) {
                return candidate.value;
            }
        }
        return candidates.get(0).value;
    }

    private static final class Candidate {
        private final String value;
        private final int start;
        private final int end;

        private Candidate(String value, int start, int end) {
            this.value = value;
            this.start = start;
            this.end = end;
        }
    }
}
