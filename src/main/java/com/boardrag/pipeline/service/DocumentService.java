package com.boardrag.pipeline.service;

import com.boardrag.pipeline.model.Document;
import com.boardrag.pipeline.model.DocumentChunk;
import com.boardrag.pipeline.model.DocumentFile;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface DocumentService {
    DocumentCreateResult createDocument(CreateDocumentCommand command, List<IncomingFile> files, boolean deferred);
    Document getById(UUID id);
    List<FileAcceptResult> addFiles(UUID documentId, List<IncomingFile> files, String requestedBy);
    List<FileStatusView> getFileStatuses(UUID documentId);
    FileAcceptResult reupload(UUID documentId, UUID fileId, IncomingFile file, String requestedBy);
    void removeFile(UUID documentId, UUID fileId);
    DocumentFile setFileVisibility(UUID documentId, UUID fileId, boolean isPublic, String requestedBy);
    DownloadLink downloadUrl(UUID documentId, UUID fileId, Duration ttl);
    FileDownload openDownload(UUID documentId, UUID fileId);
    List<DocumentChunk> listChunks(UUID documentId);
    Map<String, DataSize> supportedTypes();
}
