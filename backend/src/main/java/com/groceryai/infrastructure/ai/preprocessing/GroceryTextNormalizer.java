package com.groceryai.infrastructure.ai.preprocessing;

import com.groceryai.infrastructure.ai.extraction.UnitNormalizer;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brings pasted grocery lists into the shape the extraction prompt and parsers expect.
 * <p>
 * Quantities are spelled the way {@code QuantityParser} reads them ("1&frac12;" becomes "1 1/2"),
 * a unit glued to its amount is split off when {@link UnitNormalizer} knows it ("500g" becomes
 * "500 g"), list bullets become "- ", and one item stays on one line.
 */
@Component
public class GroceryTextNormalizer {

    // Format characters (zero-width, BOM, soft hyphen) and control characters other than line breaks and tabs
    private static final Pattern HIDDEN_CHARS = Pattern.compile("[\\p{Cf}[\\p{Cc}&&[^\\n\\r\\t]]]");

    private static final Map<Character, String> VULGAR_FRACTIONS = Map.of(
            '\u00BD', "1/2",
            '\u2153', "1/3",
            '\u2154', "2/3",
            '\u00BC', "1/4",
            '\u00BE', "3/4",
            '\u215B', "1/8"
    );

    // Optional whole number directly before a fraction glyph, as in "1" followed by one-half
    private static final Pattern FRACTION_GLYPH = Pattern.compile("(\\d+)?([\\u00BD\\u2153\\u2154\\u00BC\\u00BE\\u215B])");

    // Amount glued to letters at the start of a word: "2kg", "1.5l", "3pcs"; emails and codes are left alone
    private static final Pattern GLUED_UNIT = Pattern.compile("(?<![\\w.@/-])(\\d+(?:\\.\\d+)?)([A-Za-z]+)(?![\\w@])");

    private static final Pattern BULLET = Pattern.compile(
            "(?m)^[ \\t]*[\\u2022\\u25E6\\u25AA\\u2023\\u25CF\\u2013*][ \\t]*"
    );

    private static final Pattern INLINE_SPACES = Pattern.compile("[ \\t]+");

    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    /**
     * @param text raw caller text
     * @return the cleaned list, or the input itself when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC)
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace('\u2044', '/');
        result = HIDDEN_CHARS.matcher(result).replaceAll("");

        result = expandFractions(result);
        result = splitGluedUnits(result);
        result = BULLET.matcher(result).replaceAll("- ");

        StringBuilder lines = new StringBuilder(result.length());
        for (String line : result.split("\n", -1)) {
            if (lines.length() > 0) {
                lines.append('\n');
            }
            lines.append(INLINE_SPACES.matcher(line).replaceAll(" ").strip());
        }
        return BLANK_LINES.matcher(lines).replaceAll("\n\n").strip();
    }

    static String expandFractions(String text) {
        Matcher matcher = FRACTION_GLYPH.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String fraction = VULGAR_FRACTIONS.get(matcher.group(2).charAt(0));
            String whole = matcher.group(1);
            String replacement = whole == null ? fraction : whole + " " + fraction;
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String splitGluedUnits(String text) {
        Matcher matcher = GLUED_UNIT.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = UnitNormalizer.isKnown(matcher.group(2))
                    ? matcher.group(1) + " " + matcher.group(2)
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
