package com.example.paylog.extraction;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the transaction date ({@code YYYY-MM-DD}) and time ({@code HH:MM:SS}) from message text.
 * Anything not found, or not a real calendar date or clock time, comes from the fallback
 * (normally the receipt instant in the configured zone).
 */
@Component
public class DateTimeNormalizer {

    private static final Pattern RELATIVE = Pattern.compile(
            "\\b(today|yesterday|tomorrow)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
            "\\b(\\d{1,2})[-/](\\d{1,2})[-/](\\d{4})\\b");

    private static final Pattern YEAR_MONTH_DAY = Pattern.compile(
            "\\b(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})\\b");

    private static final Pattern DAY_MONTH_SHORT_YEAR = Pattern.compile(
            "\\b(\\d{1,2})[-/](\\d{1,2})[-/](\\d{2})\\b");

    private static final Pattern DAY_MONTH_NAME = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?[-\\s]+"
                    + "(january|february|march|april|may|june|july|august|september|october|november|december"
                    + "|jan|feb|mar|apr|jun|jul|aug|sep|sept|oct|nov|dec)"
                    + "(?:[-\\s,]+(\\d{4}|\\d{2})(?![:\\d]))?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME = Pattern.compile(
            "\\b(\\d{1,2}):(\\d{2})(?::(\\d{2}))?\\s*(am|pm)?\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("january", 1),
            Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("apr", 4), Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("aug", 8), Map.entry("august", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
            Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("dec", 12), Map.entry("december", 12));

    private final ZoneId zoneId;

    public DateTimeNormalizer(@Value("${paylog.zone-id:Asia/Kolkata}") String zoneId) {
        this.zoneId = ZoneId.of(zoneId);
    }

    public String extractDate(String text, Instant fallback) {
        return extractDate(text, LocalDateTime.ofInstant(fallback, zoneId));
    }

    public String extractTime(String text, Instant fallback) {
        return extractTime(text, LocalDateTime.ofInstant(fallback, zoneId));
    }

    public DateTimeResult extractBoth(String text, Instant fallback) {
        return extractBoth(text, LocalDateTime.ofInstant(fallback, zoneId));
    }

    public String extractDate(String text, LocalDateTime fallback) {
        return findDate(text, fallback.toLocalDate()).orElse(formatDate(fallback.toLocalDate()));
    }

    public String extractTime(String text, LocalDateTime fallback) {
        return findTime(text).orElse(formatTime(fallback.getHour(), fallback.getMinute(), fallback.getSecond()));
    }

    public DateTimeResult extractBoth(String text, LocalDateTime fallback) {
        Optional<String> date = findDate(text, fallback.toLocalDate());
        Optional<String> time = findTime(text);
        return new DateTimeResult(
                date.orElse(formatDate(fallback.toLocalDate())),
                time.orElse(formatTime(fallback.getHour(), fallback.getMinute(), fallback.getSecond())),
                date.isPresent(),
                time.isPresent());
    }

    /**
     * First tier with a valid calendar date wins; each tier only considers its first match.
     */
    Optional<String> findDate(String text, LocalDate reference) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }

        Matcher m = RELATIVE.matcher(text);
        if (m.find()) {
            switch (m.group(1).toLowerCase(Locale.ROOT)) {
                case "yesterday":
                    return Optional.of(formatDate(reference.minusDays(1)));
                case "tomorrow":
                    return Optional.of(formatDate(reference.plusDays(1)));
                default:
                    return Optional.of(formatDate(reference));
            }
        }

        m = DAY_MONTH_YEAR.matcher(text);
        if (m.find()) {
            Optional<String> date = validDate(toInt(m.group(3)), toInt(m.group(2)), toInt(m.group(1)));
            if (date.isPresent()) {
                return date;
            }
        }

        m = YEAR_MONTH_DAY.matcher(text);
        if (m.find()) {
            Optional<String> date = validDate(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3)));
            if (date.isPresent()) {
                return date;
            }
        }

        m = DAY_MONTH_SHORT_YEAR.matcher(text);
        if (m.find()) {
            Optional<String> date = validDate(expandYear(toInt(m.group(3))), toInt(m.group(2)), toInt(m.group(1)));
            if (date.isPresent()) {
                return date;
            }
        }

        m = DAY_MONTH_NAME.matcher(text);
        if (m.find()) {
            int month = MONTHS.get(m.group(2).toLowerCase(Locale.ROOT));
            int year = reference.getYear();
            String yearText = m.group(3);
            if (yearText != null) {
                year = yearText.length() == 2 ? expandYear(toInt(yearText)) : toInt(yearText);
            }
            Optional<String> date = validDate(year, month, toInt(m.group(1)));
            if (date.isPresent()) {
                return date;
            }
        }

        return Optional.empty();
    }

    /**
     * First {@code H:MM[:SS][ AM|PM]} occurrence, converted to 24-hour form if in range.
     */
    Optional<String> findTime(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        Matcher m = TIME.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        int hour = toInt(m.group(1));
        int minute = toInt(m.group(2));
        int second = m.group(3) != null ? toInt(m.group(3)) : 0;
        String meridiem = m.group(4);
        if (meridiem != null) {
            if (meridiem.equalsIgnoreCase("pm") && hour != 12) {
                hour += 12;
            } else if (meridiem.equalsIgnoreCase("am") && hour == 12) {
                hour = 0;
            }
        }
        if (hour > 23 || minute > 59 || second > 59) {
            return Optional.empty();
        }
        return Optional.of(formatTime(hour, minute, second));
    }

    /**
     * Two-digit years: 00-50 are 2000s, 51-99 are 1900s.
     */
    static int expandYear(int twoDigitYear) {
        return twoDigitYear <= 50 ? 2000 + twoDigitYear : 1900 + twoDigitYear;
    }

    static boolean isValidDate(int year, int month, int day) {
        if (year < 1 || month < 1 || month > 12 || day < 1) {
            return false;
        }
        return day <= YearMonth.of(year, month).lengthOfMonth();
    }

    private static Optional<String> validDate(int year, int month, int day) {
        if (!isValidDate(year, month, day)) {
            return Optional.empty();
        }
        return Optional.of(String.format("%04d-%02d-%02d", year, month, day));
    }

    private static String formatDate(LocalDate date) {
        return String.format("%04d-%02d-%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    private static String formatTime(int hour, int minute, int second) {
        return String.format("%02d:%02d:%02d", hour, minute, second);
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }
}
