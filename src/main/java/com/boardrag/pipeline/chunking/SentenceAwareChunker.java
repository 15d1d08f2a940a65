package com.boardrag.pipeline.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.segment.TextSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Character budget splitter for short texts such as summaries. A cut that would land inside a
 * sentence moves back to the nearest preceding terminator, provided that terminator lies past the
 * middle of the window; otherwise the hard cut is kept.
 */
public class SentenceAwareChunker implements DocumentSplitter {

    private final int budget;

    public SentenceAwareChunker(int budget) {
        if (budget < 1) {
            throw new IllegalArgumentException("budget must be positive: " + budget);
        }
        this.budget = budget;
    }

    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;

        while (start < length) {
            int end = Math.min(start + budget, length);
            if (end < length) {
                int terminator = lastTerminator(text, start, end);
                if (terminator >= 0 && terminator - start > budget / 2) {
                    end = terminator + 1;
                }
            }

            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                chunks.add(piece);
            }
            start = end;
        }
        return chunks;
    }

    @Override
    public List<TextSegment> split(Document document) {
        return chunk(document.text()).stream()
            .map(TextSegment::from)
            .toList();
    }

    private static int lastTerminator(String text, int from, int to) {
        for (int i = to - 1; i >= from; i--) {
            char c = text.charAt(i);
            if (c == '.' || c == '!' || c == '?' || c == '\n') {
                return i;
            }
        }
        return -1;
    }
}
