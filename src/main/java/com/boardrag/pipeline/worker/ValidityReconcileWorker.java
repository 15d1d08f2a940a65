package com.boardrag.pipeline.worker;

import com.boardrag.pipeline.service.ChunkLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

@Component
@Slf4j
@RequiredArgsConstructor
public class ValidityReconcileWorker {

    private final ChunkLifecycleService chunkLifecycle;

    @Scheduled(cron = "${app.validity.cron:0 0 1 * * *}")
    public void reconcile() {
        int count = chunkLifecycle.reconcileExpired(OffsetDateTime.now());
        if (count > 0) {
            log.info("Validity check removed vectors of {} document(s)", count);
        }
    }
}
