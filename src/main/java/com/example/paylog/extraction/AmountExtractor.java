package com.example.paylog.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the primary monetary amount in a message.
 * <p>
 * Three tiers are tried in order and the first tier with any candidate wins:
 * <ol>
 *     <li>numbers qualified by a currency marker (₹, Rs, Rs., INR, rupees) before or after,</li>
 *     <li>spelled-out amounts such as "Five Thousand Five Hundred" or "Two Lakh",</li>
 *     <li>bare numbers within {@code [1, 100000000]}.</li>
 * </ol>
 * Within a tier the candidate nearest (within 100 characters) to an action keyword wins,
 * otherwise the first one in reading order.
 */
@Slf4j
@Component
public class AmountExtractor {

    private static final String NUMBER = "([0-9][0-9,]*(?:\\.[0-9]{1,2})?)";

    private static final Pattern CURRENCY_PREFIX = Pattern.compile(
            "(?<![A-Za-z])(?:₹|rs\\.?|inr|rupees)\\s*" + NUMBER,
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern CURRENCY_SUFFIX = Pattern.compile(
            "(?<![0-9.,])" + NUMBER + "\\s*(?:₹|rupees|inr|rs\\.?)(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern BARE_NUMBER = Pattern.compile(
            "(?<![0-9A-Za-z.,:/-])" + NUMBER + "(?![0-9A-Za-z:/]|[.,][0-9]|-[0-9])");

    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");

    private static final Pattern CONNECTOR = Pattern.compile("[\\s-]+");

    private static final Pattern CURRENCY_WORD = Pattern.compile(
            "^[\\s-]*(?:rupees?|rs\\.?|inr)(?![A-Za-z])|(?:rupees?|rs\\.?|inr|₹)[\\s-]*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    static final List<String> ACTION_KEYWORDS = List.of(
            "debited", "credited", "paid", "received", "withdrawn", "deposited", "transferred");

    static final int PROXIMITY_WINDOW = 100;

    private static final BigDecimal MIN_BARE = BigDecimal.ONE;
    private static final BigDecimal MAX_BARE = new BigDecimal("100000000");

    private static final Map<String, Long> NUMBER_WORDS = new HashMap<>();

    static {
        String[] units = {"zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine",
                "ten", "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen",
                "eighteen", "nineteen"};
        for (int i = 0; i < units.length; i++) {
            NUMBER_WORDS.put(units[i], (long) i);
        }
        String[] tens = {"twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety"};
        for (int i = 0; i < tens.length; i++) {
            NUMBER_WORDS.put(tens[i], (i + 2) * 10L);
        }
        NUMBER_WORDS.put("hundred", 100L);
        NUMBER_WORDS.put("thousand", 1_000L);
        NUMBER_WORDS.put("lakh", 100_000L);
        NUMBER_WORDS.put("lakhs", 100_000L);
        NUMBER_WORDS.put("lac", 100_000L);
        NUMBER_WORDS.put("lacs", 100_000L);
        NUMBER_WORDS.put("million", 1_000_000L);
        NUMBER_WORDS.put("crore", 10_000_000L);
        NUMBER_WORDS.put("crores", 10_000_000L);
        NUMBER_WORDS.put("billion", 1_000_000_000L);
    }

    public Optional<BigDecimal> extractPrimaryAmount(String text) {
        return findPrimary(text).map(AmountMatch::getValue);
    }

    /**
     * Primary amount with its span, used by the type classifier's proximity tie-break.
     */
    public Optional<AmountMatch> findPrimary(String text) {
        List<AmountMatch> candidates = candidates(text);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0));
        }
        return Optional.of(selectPrimary(candidates, text));
    }

    /**
     * Every candidate of the winning tier in reading order.
     */
    public List<BigDecimal> extractAll(String text) {
        return candidates(text).stream().map(AmountMatch::getValue).collect(Collectors.toList());
    }

    List<AmountMatch> candidates(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Collections.emptyList();
        }
        List<AmountMatch> found = currencyQualified(text);
        if (!found.isEmpty()) {
            return found;
        }
        found = spelledOut(text);
        if (!found.isEmpty()) {
            return found;
        }
        return bareNumbers(text);
    }

    private List<AmountMatch> currencyQualified(String text) {
        // keyed by the number's offset so "INR 500 rupees" yields one candidate
        TreeMap<Integer, AmountMatch> byNumberStart = new TreeMap<>();
        for (Pattern pattern : List.of(CURRENCY_PREFIX, CURRENCY_SUFFIX)) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                BigDecimal value = parseNumber(m.group(1));
                if (value != null) {
                    byNumberStart.putIfAbsent(m.start(1), new AmountMatch(value, m.start(), m.end()));
                }
            }
        }
        return new ArrayList<>(byNumberStart.values());
    }

    private List<AmountMatch> spelledOut(String text) {
        List<AmountMatch> found = new ArrayList<>();
        List<Long> run = new ArrayList<>();
        int runStart = -1;
        int runEnd = -1;
        int lastEnd = -1;

        Matcher m = WORD.matcher(text);
        while (m.find()) {
            String word = m.group().toLowerCase(Locale.ROOT);
            boolean joined = lastEnd >= 0 && CONNECTOR.matcher(text.substring(lastEnd, m.start())).matches();
            Long value = NUMBER_WORDS.get(word);
            if (value != null) {
                if (!run.isEmpty() && !joined) {
                    addSpelledOut(found, run, runStart, runEnd, text);
                    run.clear();
                }
                if (run.isEmpty()) {
                    runStart = m.start();
                }
                run.add(value);
                runEnd = m.end();
                lastEnd = m.end();
            } else if ("and".equals(word) && !run.isEmpty() && joined) {
                lastEnd = m.end();
            } else {
                if (!run.isEmpty()) {
                    addSpelledOut(found, run, runStart, runEnd, text);
                    run.clear();
                }
                lastEnd = -1;
            }
        }
        if (!run.isEmpty()) {
            addSpelledOut(found, run, runStart, runEnd, text);
        }
        return found;
    }

    /**
     * A lone small number word ("one item") only counts next to a currency word.
     */
    private void addSpelledOut(List<AmountMatch> found, List<Long> run, int start, int end, String text) {
        boolean scaled = run.stream().anyMatch(v -> v >= 100);
        if (!scaled && !nearCurrencyWord(text, start, end)) {
            return;
        }
        BigDecimal value = combineWords(run);
        if (value != null) {
            found.add(new AmountMatch(value, start, end));
        }
    }

    private static boolean nearCurrencyWord(String text, int start, int end) {
        String before = text.substring(Math.max(0, start - 8), start);
        String after = text.substring(end, Math.min(text.length(), end + 8));
        return CURRENCY_WORD.matcher(after).find() || CURRENCY_WORD.matcher(before).find();
    }

    /**
     * Accumulate-then-multiply: values below 100 add up, a multiplier scales the running group,
     * and multipliers of a thousand or more flush the group into the total.
     */
    static BigDecimal combineWords(List<Long> values) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal current = BigDecimal.ZERO;
        for (long value : values) {
            if (value < 100) {
                current = current.add(BigDecimal.valueOf(value));
            } else {
                if (current.signum() == 0) {
                    current = BigDecimal.ONE;
                }
                current = current.multiply(BigDecimal.valueOf(value));
                if (value >= 1000) {
                    total = total.add(current);
                    current = BigDecimal.ZERO;
                }
            }
        }
        total = total.add(current);
        return total.signum() > 0 ? total : null;
    }

    private List<AmountMatch> bareNumbers(String text) {
        List<AmountMatch> found = new ArrayList<>();
        Matcher m = BARE_NUMBER.matcher(text);
        while (m.find()) {
            BigDecimal value = parseNumber(m.group(1));
            if (value != null && value.compareTo(MIN_BARE) >= 0 && value.compareTo(MAX_BARE) <= 0) {
                found.add(new AmountMatch(value, m.start(1), m.end(1)));
            }
        }
        return found;
    }

    private AmountMatch selectPrimary(List<AmountMatch> candidates, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        AmountMatch best = null;
        int bestGap = Integer.MAX_VALUE;
        for (String keyword : ACTION_KEYWORDS) {
            for (int kwStart : TextSpans.occurrences(lower, keyword)) {
                int kwEnd = kwStart + keyword.length();
                for (AmountMatch candidate : candidates) {
                    int gap = TextSpans.gap(kwStart, kwEnd, candidate.getStart(), candidate.getEnd());
                    if (gap > PROXIMITY_WINDOW) {
                        continue;
                    }
                    if (gap < bestGap || (gap == bestGap && candidate.getStart() < best.getStart())) {
                        best = candidate;
                        bestGap = gap;
                    }
                }
            }
        }
        if (best != null) {
            log.debug("Primary amount {} chosen by keyword proximity (gap {})", best.getValue(), bestGap);
            return best;
        }
        return candidates.get(0);
    }

    private static BigDecimal parseNumber(String raw) {
        String cleaned = raw.replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        return new BigDecimal(cleaned);
    }
}
