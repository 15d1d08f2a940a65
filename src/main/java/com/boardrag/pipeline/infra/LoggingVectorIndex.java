package com.boardrag.pipeline.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.UUID;

/**
 * Stand-in until an embedding backend exists: hands out random identifiers and logs deletions.
 */
@Slf4j
@Component
public class LoggingVectorIndex implements VectorIndex {

    @Override
    public String allocateId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public void delete(Collection<String> vectorIds) {
        if (vectorIds.isEmpty()) {
            return;
        }
        log.info("Vector index delete requested for {} vectors", vectorIds.size());
    }
}
