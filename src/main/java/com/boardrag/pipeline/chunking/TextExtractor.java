package com.boardrag.pipeline.chunking;

import com.boardrag.pipeline.exception.StorageException;
import com.boardrag.pipeline.exception.TextExtractionException;
import com.boardrag.pipeline.exception.UnsupportedFileTypeException;
import com.boardrag.pipeline.infra.ObjectStore;
import com.boardrag.pipeline.infra.ObjectStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.microsoft.ooxml.OOXMLParser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pulls a stored file into a temporary local copy and extracts plain text from it. PDF pages are
 * separated by a blank line, DOCX paragraphs by a newline. Any parser failure surfaces as a
 * {@link TextExtractionException}; storage errors and unsupported types pass through unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextExtractor {

    private static final Set<String> SUPPORTED_TYPES = Set.of("pdf", "docx", "txt");
    private static final String DOCX_MIME = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    private final ObjectStore objectStore;

    public static boolean supports(String fileType) {
        return fileType != null && SUPPORTED_TYPES.contains(normalize(fileType));
    }

    public String extractText(String storageKey, String fileType) {
        String type = fileType == null ? "" : normalize(fileType);
        Path localCopy = null;
        try {
            localCopy = Files.createTempFile("extract-", "." + (type.isEmpty() ? "bin" : type));
            try (ObjectStream stream = objectStore.streamGet(storageKey);
                 OutputStream out = Files.newOutputStream(localCopy)) {
                stream.transferTo(out);
            }

            String text = switch (type) {
                case "pdf" -> extractPdf(localCopy);
                case "docx" -> extractDocx(localCopy);
                case "txt" -> extractPlain(localCopy);
                default -> throw new UnsupportedFileTypeException(fileType);
            };
            log.debug("Extracted {} characters from {}", text.length(), storageKey);
            return text;
        } catch (IOException | TikaException | SAXException e) {
            throw new TextExtractionException(storageKey, e);
        } catch (UnsupportedFileTypeException | StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Unexpected failure extracting {} as {}: {}", storageKey, type, e.toString());
            throw new TextExtractionException(storageKey, e);
        } finally {
            removeQuietly(localCopy);
        }
    }

    private String extractPdf(Path file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document).strip();
                if (!pageText.isEmpty()) {
                    pages.add(pageText);
                }
            }
            return String.join("\n\n", pages);
        }
    }

    private String extractDocx(Path file) throws IOException, TikaException, SAXException {
        BodyContentHandler handler = new BodyContentHandler(-1);
        Metadata metadata = new Metadata();
        metadata.set(Metadata.CONTENT_TYPE, DOCX_MIME);
        try (InputStream in = Files.newInputStream(file)) {
            new OOXMLParser().parse(in, handler, metadata, new ParseContext());
        }
        return handler.toString().strip();
    }

    private String extractPlain(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private void removeQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", file, e.getMessage());
        }
    }

    private static String normalize(String fileType) {
        String type = fileType.toLowerCase(Locale.ROOT).strip();
        return type.startsWith(".") ? type.substring(1) : type;
    }
}
