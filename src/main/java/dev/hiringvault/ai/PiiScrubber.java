package dev.hiringvault.ai;

import dev.hiringvault.model.PiiRecord;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes identity data from free text before it becomes part of a professional profile.
 */
final class PiiScrubber {

    static final Pattern EMAIL = Pattern.compile("[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}", Pattern.CASE_INSENSITIVE);
    static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d ().-]{6,}\\d");
    private static final int MIN_PHONE_DIGITS = 9;

    private PiiScrubber() {
    }

    static String scrub(String text, PiiRecord pii) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String out = EMAIL.matcher(text).replaceAll("[email]");
        out = PHONE.matcher(out).replaceAll(match -> isPhone(match.group()) ? "[phone]" : match.group());
        out = removeLiteral(out, pii.email(), "[email]");
        out = removeLiteral(out, pii.phone(), "[phone]");
        if (pii.realName() != null && !pii.realName().isBlank()) {
            out = removeLiteral(out, pii.realName(), "[name]");
            for (String part : pii.realName().trim().split("\\s+")) {
                if (part.length() > 2) {
                    out = Pattern.compile("(?<![\\w])" + Pattern.quote(part) + "(?![\\w])", Pattern.CASE_INSENSITIVE)
                            .matcher(out)
                            .replaceAll("[name]");
                }
            }
        }
        return out.trim();
    }

    /**
     * First phone-like number with enough digits to not be a date range.
     */
    static String findPhone(String text) {
        Matcher matcher = PHONE.matcher(text);
        while (matcher.find()) {
            if (isPhone(matcher.group())) {
                return matcher.group().trim();
            }
        }
        return "";
    }

    private static boolean isPhone(String candidate) {
        return candidate.chars().filter(Character::isDigit).count() >= MIN_PHONE_DIGITS;
    }

    private static String removeLiteral(String text, String literal, String replacement) {
        if (literal == null || literal.isBlank()) {
            return text;
        }
        return Pattern.compile(Pattern.quote(literal.trim()), Pattern.CASE_INSENSITIVE)
                .matcher(text)
                .replaceAll(replacement);
    }
}
