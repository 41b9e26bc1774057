package org.studyhub.studyindex.service.chunking;

import lombok.extern.slf4j.Slf4j;
import org.studyhub.studyindex.model.Chunk;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * Splits long text into overlapping chunks that follow the text's structure.
 *
 * <p>Text is cut on blank lines first. A paragraph longer than {@code chunkSize} is cut on
 * line breaks, and an oversized line is packed sentence by sentence into segments of at most
 * {@code chunkSize} characters (a single oversized sentence is cut on whitespace). Segments are
 * then packed greedily into chunks; each chunk after the first opens with the last
 * {@code overlap} characters of the previous one so neighbouring chunks share context.</p>
 *
 * <p>The carried tail is never trimmed to make room, so a chunk that opens with it may run
 * past {@code chunkSize} by up to {@code overlap} plus one separator.</p>
 */
@Slf4j
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP = 200;

    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final String LINE_SEPARATOR = "\n";
    private static final String SENTENCE_SEPARATOR = " ";

    private final int chunkSize;
    private final int overlap;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    public TextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must be >= 0");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(format(
                    "overlap must be < chunkSize. overlap=%d chunkSize=%d", overlap, chunkSize));
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    /**
     * Chunks {@code text}; every chunk gets a copy of {@code metadata} plus
     * {@code chunk_index} and {@code total_chunks}.
     *
     * @return chunks in reading order, empty for blank input
     */
    public List<Chunk> chunk(String text, Map<String, String> metadata) {
        List<String> texts = split(text);
        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Map<String, String> chunkMetadata = new LinkedHashMap<>();
            if (metadata != null) {
                chunkMetadata.putAll(metadata);
            }
            chunkMetadata.put(Chunk.CHUNK_INDEX, String.valueOf(i));
            chunkMetadata.put(Chunk.TOTAL_CHUNKS, String.valueOf(texts.size()));
            chunks.add(new Chunk(texts.get(i), i, texts.size(), chunkMetadata));
        }
        return chunks;
    }

    /**
     * Chunk texts only, without metadata.
     */
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (Piece segment : segments(text)) {
            String separator = current.isEmpty() ? "" : segment.separator();
            if (!current.isEmpty() && current.length() + separator.length() + segment.text().length() > chunkSize) {
                String emitted = current.toString().strip();
                chunks.add(emitted);

                current.setLength(0);
                current.append(emitted, emitted.length() - Math.min(overlap, emitted.length()), emitted.length());
                separator = current.isEmpty() ? "" : segment.separator();
            }
            current.append(separator).append(segment.text());
        }

        String last = current.toString().strip();
        if (!last.isEmpty()) {
            chunks.add(last);
        }

        log.debug("Split {} chars into {} chunks (chunkSize={}, overlap={})",
                text.length(), chunks.size(), chunkSize, overlap);
        return chunks;
    }

    /**
     * Structural segments no longer than {@code chunkSize}, each tagged with the separator
     * that preceded it in the source.
     */
    private List<Piece> segments(String text) {
        List<Piece> segments = new ArrayList<>();
        for (String paragraph : TextSegmenter.splitParagraphs(text)) {
            if (paragraph.length() <= chunkSize) {
                segments.add(new Piece(paragraph, PARAGRAPH_SEPARATOR));
                continue;
            }
            String separator = PARAGRAPH_SEPARATOR;
            for (String line : TextSegmenter.splitLines(paragraph)) {
                if (line.length() <= chunkSize) {
                    segments.add(new Piece(line, separator));
                } else {
                    for (String packed : packSentences(line)) {
                        segments.add(new Piece(packed, separator));
                        separator = SENTENCE_SEPARATOR;
                    }
                }
                separator = LINE_SEPARATOR;
            }
        }
        return segments;
    }

    /**
     * Joins consecutive sentences of an oversized line into runs of at most {@code chunkSize}.
     */
    private List<String> packSentences(String line) {
        List<String> sentences = new ArrayList<>();
        for (String sentence : TextSegmenter.splitSentences(line)) {
            if (sentence.length() <= chunkSize) {
                sentences.add(sentence);
            } else {
                sentences.addAll(TextSegmenter.hardSplit(sentence, chunkSize));
            }
        }

        List<String> packed = new ArrayList<>();
        StringBuilder run = new StringBuilder();
        for (String sentence : sentences) {
            if (!run.isEmpty() && run.length() + SENTENCE_SEPARATOR.length() + sentence.length() > chunkSize) {
                packed.add(run.toString());
                run.setLength(0);
            }
            if (!run.isEmpty()) {
                run.append(SENTENCE_SEPARATOR);
            }
            run.append(sentence);
        }
        if (!run.isEmpty()) {
            packed.add(run.toString());
        }
        return packed;
    }

    private record Piece(String text, String separator) {
    }
}
