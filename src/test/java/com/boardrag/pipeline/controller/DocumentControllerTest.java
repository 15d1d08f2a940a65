package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.Fixtures;
import com.boardrag.pipeline.exception.DocumentNotFoundException;
import com.boardrag.pipeline.exception.FileValidationException;
import com.boardrag.pipeline.exception.IllegalStatusTransitionException;
import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.infra.ObjectStream;
import com.boardrag.pipeline.model.DocumentFile;
import com.boardrag.pipeline.model.FileProcessingStatus;
import com.boardrag.pipeline.service.DocumentCreateResult;
import com.boardrag.pipeline.service.DocumentService;
import com.boardrag.pipeline.service.DownloadLink;
import com.boardrag.pipeline.service.FileAcceptResult;
import com.boardrag.pipeline.service.FileDownload;
import com.boardrag.pipeline.service.FileStatusView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DocumentController.class)
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DocumentService documentService;

    @Test
    @DisplayName("POST /documents should create the document and return 201 with the main task")
    void createDocument_ShouldReturn201() throws Exception {
        UUID docId = UUID.randomUUID();
        UUID taskId = UUID.randomUUID();
        FileAcceptResult accepted = new FileAcceptResult(UUID.randomUUID(), "minutes.pdf", "k.pdf", "pdf", 3,
            FileProcessingStatus.PENDING, taskId, null);
        when(documentService.createDocument(any(), anyList(), eq(true)))
            .thenReturn(new DocumentCreateResult(Fixtures.document(docId), List.of(accepted), taskId));

        mockMvc.perform(multipart("/documents")
                .file(new MockMultipartFile("files", "minutes.pdf", "application/pdf", new byte[]{1, 2, 3}))
                .param("title", "Board minutes")
                .param("tags", "board", "2024")
                .header(DocumentController.USER_HEADER, "user-1"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.document.id").value(docId.toString()))
            .andExpect(jsonPath("$.main_task_id").value(taskId.toString()))
            .andExpect(jsonPath("$.files[0].filename").value("minutes.pdf"))
            .andExpect(jsonPath("$.files[0].status").value("PENDING"));

        verify(documentService).createDocument(argThat(command ->
            "user-1".equals(command.ownerId()) && command.tags().equals(List.of("board", "2024"))), anyList(), eq(true));
    }

    @Test
    @DisplayName("POST /documents should return 400 when a file is rejected")
    void createDocument_ShouldReturn400_WhenFileInvalid() throws Exception {
        when(documentService.createDocument(any(), anyList(), anyBoolean()))
            .thenThrow(new FileValidationException("virus.exe", "File type not allowed: virus.exe"));

        mockMvc.perform(multipart("/documents")
                .file(new MockMultipartFile("files", "virus.exe", "application/octet-stream", new byte[]{1}))
                .param("title", "Board minutes")
                .header(DocumentController.USER_HEADER, "user-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.message").value("File type not allowed: virus.exe"));
    }

    @Test
    @DisplayName("POST /documents should return 400 without the user header")
    void createDocument_ShouldReturn400_WhenUserMissing() throws Exception {
        mockMvc.perform(multipart("/documents").param("title", "Board minutes"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("GET /documents/{id} should return 404 when the document does not exist")
    void getDocument_ShouldReturn404_WhenNotFound() throws Exception {
        UUID docId = UUID.randomUUID();
        when(documentService.getById(docId)).thenThrow(new DocumentNotFoundException(docId));

        mockMvc.perform(get("/documents/{id}", docId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Document not found: " + docId))
            .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /documents/supported-types should list limits in megabytes")
    void supportedTypes_ShouldReturnMegabytes() throws Exception {
        when(documentService.supportedTypes()).thenReturn(Map.of("pdf", DataSize.ofMegabytes(50)));

        mockMvc.perform(get("/documents/supported-types"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pdf").value(50));
    }

    @Test
    @DisplayName("GET /documents/{id}/files/status should report storage presence")
    void fileStatuses_ShouldReturnPresence() throws Exception {
        UUID docId = UUID.randomUUID();
        DocumentFile file = Fixtures.file(UUID.randomUUID(), docId, "minutes.pdf", FileProcessingStatus.FAILED);
        when(documentService.getFileStatuses(docId)).thenReturn(List.of(new FileStatusView(file, false)));

        mockMvc.perform(get("/documents/{id}/files/status", docId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].file_id").value(file.id().toString()))
            .andExpect(jsonPath("$[0].status").value("FAILED"))
            .andExpect(jsonPath("$[0].exists_in_storage").value(false));
    }

    @Test
    @DisplayName("POST /documents/{id}/files/{fileId}/reupload should return 409 for a file in flight")
    void reupload_ShouldReturn409_WhenProcessing() throws Exception {
        UUID docId = UUID.randomUUID();
        UUID fileId = UUID.randomUUID();
        when(documentService.reupload(eq(docId), eq(fileId), any(), eq("user-1")))
            .thenThrow(new IllegalStatusTransitionException(fileId, FileProcessingStatus.PROCESSING, FileProcessingStatus.PROCESSING));

        mockMvc.perform(multipart("/documents/{id}/files/{fileId}/reupload", docId, fileId)
                .file(new MockMultipartFile("file", "minutes.pdf", "application/pdf", new byte[]{1}))
                .header(DocumentController.USER_HEADER, "user-1"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE"));
    }

    @Test
    @DisplayName("DELETE /documents/{id}/files/{fileId} should return 204")
    void removeFile_ShouldReturn204() throws Exception {
        UUID docId = UUID.randomUUID();
        UUID fileId = UUID.randomUUID();

        mockMvc.perform(delete("/documents/{id}/files/{fileId}", docId, fileId))
            .andExpect(status().isNoContent());

        verify(documentService).removeFile(docId, fileId);
    }

    @Test
    @DisplayName("PATCH /documents/{id}/files/{fileId}/visibility should require is_public")
    void setVisibility_ShouldValidateBody() throws Exception {
        mockMvc.perform(patch("/documents/{id}/files/{fileId}/visibility", UUID.randomUUID(), UUID.randomUUID())
                .header(DocumentController.USER_HEADER, "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("GET /documents/{id}/files/{fileId}/download-url should pass the requested lifetime")
    void downloadUrl_ShouldUseRequestedTtl() throws Exception {
        UUID docId = UUID.randomUUID();
        UUID fileId = UUID.randomUUID();
        when(documentService.downloadUrl(docId, fileId, Duration.ofSeconds(600)))
            .thenReturn(new DownloadLink(fileId, "minutes.pdf", "https://files.example.org/k.pdf?sig=1", Instant.now()));

        mockMvc.perform(get("/documents/{id}/files/{fileId}/download-url", docId, fileId).param("expires_in", "600"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.url").value("https://files.example.org/k.pdf?sig=1"));
    }

    @Test
    @DisplayName("GET /documents/{id}/files/{fileId}/download should stream the stored bytes")
    void download_ShouldStreamFile() throws Exception {
        UUID docId = UUID.randomUUID();
        DocumentFile file = Fixtures.file(UUID.randomUUID(), docId, "minutes.txt", FileProcessingStatus.COMPLETED);
        byte[] content = "board minutes".getBytes(StandardCharsets.UTF_8);
        ObjectStream stream = new ObjectStream(new ByteArrayInputStream(content), content.length, "text/plain", 4);
        when(documentService.openDownload(docId, file.id())).thenReturn(new FileDownload(file, stream));

        MvcResult started = mockMvc.perform(get("/documents/{id}/files/{fileId}/download", docId, file.id()))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", containsString("minutes.txt")))
            .andExpect(content().bytes(content));
    }

    @Test
    @DisplayName("GET /documents/{id}/files/{fileId}/download should return 502 when storage fails")
    void download_ShouldReturn502_WhenStorageFails() throws Exception {
        UUID docId = UUID.randomUUID();
        UUID fileId = UUID.randomUUID();
        when(documentService.openDownload(docId, fileId)).thenThrow(new StorageException("k.pdf", "connection reset"));

        mockMvc.perform(get("/documents/{id}/files/{fileId}/download", docId, fileId))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.errorCode").value("STORAGE_UNAVAILABLE"));
    }
}
