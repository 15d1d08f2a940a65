package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.infra.ObjectStream;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.service.CreateDocumentCommand;
import com.boardrag.pipeline.service.DocumentService;
import com.boardrag.pipeline.service.FileDownload;
import com.boardrag.pipeline.service.IncomingFile;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    static final String USER_HEADER = "X-User-Id";

    private final DocumentService documentService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentCreateResponse> createDocument(
        @RequestHeader(USER_HEADER) String userId,
        @RequestParam String title,
        @RequestParam(required = false) String summary,
        @RequestParam(required = false) List<String> tags,
        @RequestParam(name = "is_public", defaultValue = "true") boolean isPublic,
        @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startDate,
        @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endDate,
        @RequestParam(defaultValue = "true") boolean deferred,
        @RequestParam(name = "files", required = false) List<MultipartFile> files) {

        CreateDocumentCommand command = new CreateDocumentCommand(userId, title, summary, tags, isPublic, startDate, endDate);
        var result = documentService.createDocument(command, toIncoming(files), deferred);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentCreateResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(DocumentResponse.from(documentService.getById(id)));
    }

    @GetMapping("/supported-types")
    public ResponseEntity<Map<String, Long>> supportedTypes() {
        Map<String, Long> limits = new LinkedHashMap<>();
        documentService.supportedTypes().forEach((type, size) -> limits.put(type, size.toMegabytes()));
        return ResponseEntity.ok(limits);
    }

    @GetMapping("/{id}/files/status")
    public ResponseEntity<List<FileStatusResponse>> fileStatuses(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.getFileStatuses(id).stream()
            .map(FileStatusResponse::from)
            .toList());
    }

    @PostMapping(value = "/{id}/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<List<FileUploadResponse>> addFiles(
        @RequestHeader(USER_HEADER) String userId,
        @PathVariable UUID id,
        @RequestParam(name = "files", required = false) List<MultipartFile> files) {

        var accepted = documentService.addFiles(id, toIncoming(files), userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(accepted.stream()
            .map(FileUploadResponse::from)
            .toList());
    }

    @PostMapping(value = "/{id}/files/{fileId}/reupload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FileUploadResponse> reupload(
        @RequestHeader(USER_HEADER) String userId,
        @PathVariable UUID id,
        @PathVariable UUID fileId,
        @RequestParam("file") MultipartFile file) {

        var result = documentService.reupload(id, fileId, IncomingFile.of(file), userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(FileUploadResponse.from(result));
    }

    @DeleteMapping("/{id}/files/{fileId}")
    public ResponseEntity<Void> removeFile(@PathVariable UUID id, @PathVariable UUID fileId) {
        documentService.removeFile(id, fileId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/files/{fileId}/visibility")
    public ResponseEntity<FileStatusResponse> setVisibility(
        @RequestHeader(USER_HEADER) String userId,
        @PathVariable UUID id,
        @PathVariable UUID fileId,
        @Valid @RequestBody VisibilityRequest request) {

        var file = documentService.setFileVisibility(id, fileId, request.isPublic(), userId);
        return ResponseEntity.ok(FileStatusResponse.from(file, file.processingStatus() == FileProcessingStatus.COMPLETED));
    }

    @GetMapping("/{id}/files/{fileId}/download-url")
    public ResponseEntity<DownloadUrlResponse> downloadUrl(
        @PathVariable UUID id,
        @PathVariable UUID fileId,
        @RequestParam(name = "expires_in", required = false) Long expiresInSeconds) {

        Duration ttl = expiresInSeconds != null ? Duration.ofSeconds(expiresInSeconds) : null;
        return ResponseEntity.ok(DownloadUrlResponse.from(documentService.downloadUrl(id, fileId, ttl)));
    }

    @GetMapping("/{id}/files/{fileId}/download")
    public ResponseEntity<StreamingResponseBody> download(@PathVariable UUID id, @PathVariable UUID fileId) {
        FileDownload download = documentService.openDownload(id, fileId);
        ObjectStream stream = download.stream();

        StreamingResponseBody body = out -> {
            try (stream) {
                stream.transferTo(out);
            }
        };

        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                .filename(download.file().originalFilename(), StandardCharsets.UTF_8)
                .build()
                .toString())
            .contentType(MediaType.parseMediaType(stream.getContentType() != null
                ? stream.getContentType()
                : MediaType.APPLICATION_OCTET_STREAM_VALUE))
            .contentLength(stream.getSize())
            .body(body);
    }

    @GetMapping("/{id}/chunks")
    public ResponseEntity<List<ChunkResponse>> chunks(@PathVariable UUID id) {
        return ResponseEntity.ok(documentService.listChunks(id).stream()
            .map(ChunkResponse::from)
            .toList());
    }

    private static List<IncomingFile> toIncoming(List<MultipartFile> files) {
        if (files == null) {
            return List.of();
        }
        return files.stream()
            .map(IncomingFile::of)
            .toList();
    }
}
