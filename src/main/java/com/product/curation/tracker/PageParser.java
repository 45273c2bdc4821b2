package com.product.curation.tracker;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.CRC32C;

/**
 * Reduces a page to the parts the update tracker compares: title, a fingerprint of the
 * visible text, and pricing and feature excerpts.
 *
 * <p>Extraction runs on the visible text with script and style removed and whitespace
 * collapsed. For each excerpt kind, the first {@value #MAX_MATCHES} matches are trimmed,
 * de-duplicated, sorted and joined with {@code " | "}, so the same page always yields the
 * same excerpt.</p>
 */
public class PageParser {

    static final int MAX_MATCHES = 10;
    private static final int MAX_MATCH_LENGTH = 200;
    private static final String SEPARATOR = " | ";

    private static final List<Pattern> PRICING_PATTERNS = List.of(
            Pattern.compile("\\$[\\d,]+(?:\\.\\d{2})?(?:\\s*/?\\s*(?:mo|month|yr|year|user)\\b)?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:free|starter|pro|enterprise|business|team)\\b(?:\\s*(?:plan|tier)\\b)?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:pricing|plans?|subscription)\\b", Pattern.CASE_INSENSITIVE));

    // Group 1 holds the feature text.
    private static final List<Pattern> FEATURE_PATTERNS = List.of(
            Pattern.compile("\\b(?:features?|capabilities|includes?)\\b:?\\s*([^.✓✔•]+)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("[✓✔•]\\s*([^.✓✔•]+)"));

    public PageSnapshot parse(String html) {
        Document doc = Jsoup.parse(html != null ? html : "");
        String title = doc.title().trim();
        doc.select("script, style").remove();
        String text = doc.text();
        return new PageSnapshot(
                title.isEmpty() ? null : title,
                fingerprint(text),
                extractMatches(text, PRICING_PATTERNS, false),
                extractMatches(text, FEATURE_PATTERNS, true));
    }

    /**
     * Non-cryptographic fingerprint of the text: CRC-32C and byte length, in hex.
     */
    static String fingerprint(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        CRC32C crc = new CRC32C();
        crc.update(bytes, 0, bytes.length);
        return String.format(Locale.ROOT, "%08x-%x", crc.getValue(), bytes.length);
    }

    static String extractMatches(String text, List<Pattern> patterns, boolean captureGroup) {
        List<String> matches = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find() && matches.size() < MAX_MATCHES) {
                String match = captureGroup ? matcher.group(1) : matcher.group();
                if (match == null) {
                    continue;
                }
                match = match.trim();
                if (match.length() > MAX_MATCH_LENGTH) {
                    match = match.substring(0, MAX_MATCH_LENGTH).trim();
                }
                if (!match.isEmpty()) {
                    matches.add(match);
                }
            }
        }
        if (matches.isEmpty()) {
            return null;
        }
        return String.join(SEPARATOR, new TreeSet<>(matches));
    }
}
