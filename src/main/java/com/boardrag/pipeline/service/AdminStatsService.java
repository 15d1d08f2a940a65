package com.boardrag.pipeline.service;

import com.boardrag.pipeline.repository.DocumentChunkRepository;
import com.boardrag.pipeline.repository.DocumentFileRepository;
import com.boardrag.pipeline.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AdminStatsService {

    private final DocumentRepository documentRepository;
    private final DocumentFileRepository fileRepository;
    private final DocumentChunkRepository chunkRepository;

    @Transactional(readOnly = true)
    public AdminStats collect() {
        return new AdminStats(
            documentRepository.countByStatus(),
            documentRepository.countVectorized(),
            fileRepository.countByStatus(),
            chunkRepository.countAll()
        );
    }
}
