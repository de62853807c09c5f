package com.golfdata.clubtracker.crawl.source;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization shared by the HTML adapters.
 */
public final class ListingTextParser {
    private static final Pattern NON_PRICE_CHARS = Pattern.compile("[^\\d.]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)(19\\d{2}|20\\d{2})(?!\\d)");
    public static final int MIN_MODEL_YEAR = 1990;

    private ListingTextParser() {}

    public static String cleanText(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(raw.replace('\u00A0', ' ')).replaceAll(" ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Keeps digits and dots only. Anything that is then not a nonnegative decimal is no price.
     * Scaled to cents to match the stored column.
     */
    public static BigDecimal parsePrice(String raw) {
        if (raw == null) {
            return null;
        }
        String digits = NON_PRICE_CHARS.matcher(raw).replaceAll("");
        if (digits.isEmpty() || digits.equals(".")) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(digits);
            return value.signum() < 0 ? null : value.setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static TitleParts splitTitle(String title) {
        String cleaned = cleanText(title);
        if (cleaned == null) {
            return null;
        }
        int space = cleaned.indexOf(' ');
        if (space < 0) {
            return new TitleParts(cleaned, cleaned);
        }
        return new TitleParts(cleaned.substring(0, space), cleaned.substring(space + 1).trim());
    }

    /**
     * First four-digit year in the text between {@link #MIN_MODEL_YEAR} and {@code maxYear}.
     */
    public static Integer extractYear(String text, int maxYear) {
        if (text == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(text);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (year >= MIN_MODEL_YEAR && year <= maxYear) {
                return year;
            }
        }
        return null;
    }

    public static String key(String text) {
        String cleaned = cleanText(text);
        return cleaned == null ? "" : cleaned.toLowerCase(Locale.ROOT);
    }

    public record TitleParts(String brand, String model) {}
}
