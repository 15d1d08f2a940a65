package com.boardrag.pipeline.service;

import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.InputStreamSource;
import org.springframework.web.multipart.MultipartFile;

import java.util.Locale;

/**
 * An uploaded file as received from the caller, before anything is written.
 */
public record IncomingFile(
    String originalFilename,
    String contentType,
    long size,
    InputStreamSource content
) {

    public static IncomingFile of(MultipartFile file) {
        return new IncomingFile(file.getOriginalFilename(), file.getContentType(), file.getSize(), file);
    }

    public static IncomingFile of(String filename, byte[] bytes) {
        return new IncomingFile(filename, null, bytes.length, new ByteArrayResource(bytes));
    }

    /**
     * Lowercase extension without the dot, or an empty string when the name has none.
     */
    public String extension() {
        if (originalFilename == null) {
            return "";
        }
        int dot = originalFilename.lastIndexOf('.');
        if (dot < 0 || dot == originalFilename.length() - 1) {
            return "";
        }
        return originalFilename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
