package com.boardrag.pipeline.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.segment.TextSegment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cuts whitespace-separated tokens into windows of {@code chunkSize} tokens, each window starting
 * {@code chunkSize - overlap} tokens after the previous one. Tokens inside a window are joined with a
 * single space. The walk ends once a window start reaches the token count, so the last window may
 * hold only tokens already covered by the one before it.
 */
public class TokenWindowChunker implements DocumentSplitter {

    private final int chunkSize;
    private final int overlap;

    public TokenWindowChunker(int chunkSize, int overlap) {
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative: " + overlap);
        }
        if (chunkSize <= overlap) {
            throw new IllegalArgumentException(
                "chunkSize (" + chunkSize + ") must be larger than overlap (" + overlap + ")");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String[] tokens = text.strip().split("\\s+");
        int step = chunkSize - overlap;
        List<String> chunks = new ArrayList<>();

        for (int start = 0; start < tokens.length; start += step) {
            int end = Math.min(start + chunkSize, tokens.length);
            chunks.add(String.join(" ", Arrays.copyOfRange(tokens, start, end)));
        }
        return chunks;
    }

    @Override
    public List<TextSegment> split(Document document) {
        return chunk(document.text()).stream()
            .map(TextSegment::from)
            .toList();
    }
}
