package com.boardrag.pipeline.service;

import com.boardrag.pipeline.config.UploadProperties;
import com.boardrag.pipeline.exception.FileValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.util.unit.DataSize;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a whole batch before any storage or database work. One bad file rejects the batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UploadValidator {

    private final UploadProperties properties;

    /**
     * @return the batch with repeated filenames removed, first occurrence kept, request order preserved
     */
    public List<IncomingFile> validate(List<IncomingFile> files) {
        if (files == null || files.isEmpty()) {
            throw new FileValidationException(null, "No files were provided");
        }

        List<IncomingFile> unique = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (IncomingFile file : files) {
            if (!StringUtils.hasText(file.originalFilename())) {
                throw new FileValidationException(null, "Every file needs a filename");
            }
            if (seen.add(file.originalFilename())) {
                unique.add(file);
            } else {
                log.debug("Dropping repeated upload entry {}", file.originalFilename());
            }
        }

        unique.forEach(this::validateFile);
        return unique;
    }

    public void validateFile(IncomingFile file) {
        String extension = file.extension();
        DataSize limit = properties.maxSizeFor(extension)
            .orElseThrow(() -> new FileValidationException(file.originalFilename(),
                "File type not allowed: " + file.originalFilename()
                    + ". Allowed types: " + String.join(", ", properties.allowedTypes().keySet())));

        if (file.size() <= 0) {
            throw new FileValidationException(file.originalFilename(), "File is empty: " + file.originalFilename());
        }
        if (file.size() > limit.toBytes()) {
            throw new FileValidationException(file.originalFilename(),
                "File " + file.originalFilename() + " exceeds the " + limit.toMegabytes() + "MB limit for ." + extension);
        }
    }
}
