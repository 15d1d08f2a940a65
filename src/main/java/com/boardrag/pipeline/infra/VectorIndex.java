package com.boardrag.pipeline.infra;

import java.util.Collection;

/**
 * External vector store. Only identifier allocation and deletion are needed by the chunk lifecycle.
 */
public interface VectorIndex {

    String allocateId();

    void delete(Collection<String> vectorIds);
}
