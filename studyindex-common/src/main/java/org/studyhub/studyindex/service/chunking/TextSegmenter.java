package org.studyhub.studyindex.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into structural units, coarsest first.
 */
public final class TextSegmenter {

    /** Paragraph boundary (a blank line). */
    private static final Pattern PARAGRAPH_BOUNDARY = Pattern.compile("\\n\\s*\\n");

    private static final Pattern LINE_BOUNDARY = Pattern.compile("\\r?\\n");

    /** Terminal punctuation followed by whitespace. */
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private TextSegmenter() {}

    /**
     * Splits text into paragraphs (separated by blank lines).
     */
    public static List<String> splitParagraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        Matcher matcher = PARAGRAPH_BOUNDARY.matcher(text);
        int lastEnd = 0;

        while (matcher.find()) {
            addIfNotBlank(paragraphs, text.substring(lastEnd, matcher.start()));
            lastEnd = matcher.end();
        }

        // Last paragraph
        addIfNotBlank(paragraphs, text.substring(lastEnd));
        return paragraphs;
    }

    public static List<String> splitLines(String paragraph) {
        return splitOn(LINE_BOUNDARY, paragraph);
    }

    public static List<String> splitSentences(String line) {
        return splitOn(SENTENCE_BOUNDARY, line);
    }

    /**
     * Cuts text into parts of at most {@code maxSize} characters, preferring the last
     * space in the second half of the window so words stay intact.
     */
    public static List<String> hardSplit(String text, int maxSize) {
        List<String> parts = new ArrayList<>();
        int offset = 0;

        while (offset < text.length()) {
            int end = Math.min(offset + maxSize, text.length());

            if (end < text.length()) {
                int lastSpace = text.lastIndexOf(' ', end);
                if (lastSpace > offset + (maxSize / 2)) {
                    end = lastSpace;
                }
            }

            addIfNotBlank(parts, text.substring(offset, end));
            offset = end;
        }
        return parts;
    }

    private static List<String> splitOn(Pattern boundary, String text) {
        List<String> parts = new ArrayList<>();
        for (String part : boundary.split(text)) {
            addIfNotBlank(parts, part);
        }
        return parts;
    }

    private static void addIfNotBlank(List<String> target, String part) {
        String stripped = part.strip();
        if (!stripped.isEmpty()) {
            target.add(stripped);
        }
    }
}
