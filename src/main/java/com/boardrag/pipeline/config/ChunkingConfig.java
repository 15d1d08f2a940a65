package com.boardrag.pipeline.config;

import com.boardrag.pipeline.chunking.SentenceAwareChunker;
import com.boardrag.pipeline.chunking.TokenWindowChunker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChunkingConfig {

    @Bean
    public TokenWindowChunker tokenWindowChunker(ChunkingProperties properties) {
        return new TokenWindowChunker(properties.chunkSize(), properties.overlap());
    }

    @Bean
    public SentenceAwareChunker sentenceAwareChunker(ChunkingProperties properties) {
        return new SentenceAwareChunker(properties.summaryBudget());
    }
}
