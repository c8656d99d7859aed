package com.example.redline.web;

import com.example.redline.domain.AnalysisRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns an uploaded plain-text document into an analysis request. Binary formats are refused by
 * their leading signature rather than by the declared content type.
 */
@Component
public class MultipartDocumentInputAdapter {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public AnalysisRequest adapt(MultipartFile file, String documentId) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File must not be empty");
        }
        byte[] bytes;
        try (InputStream inputStream = file.getInputStream()) {
            bytes = inputStream.readAllBytes();
        }
        if (isBinaryDocument(bytes)) {
            throw new ResponseStatusException(
                    HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Only plain text documents are supported");
        }
        String text = decode(bytes);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File contains no text");
        }
        return new AnalysisRequest(documentId, describeFilename(file), text);
    }

    public String describeFilename(MultipartFile file) {
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || originalFilename.isBlank()) {
            return "upload.txt";
        }
        String trimmed = originalFilename.trim();
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Document is not UTF-8 text", ex);
        }
    }

    private boolean isBinaryDocument(byte[] bytes) {
        if (bytes.length < 4) {
            return false;
        }
        int header = ((bytes[0] & 0xFF) << 24)
                | ((bytes[1] & 0xFF) << 16)
                | ((bytes[2] & 0xFF) << 8)
                | (bytes[3] & 0xFF);
        return header == 0x25504446 // %PDF
                || header == 0x504B0304 // zip, docx
                || header == 0x504B0506
                || header == 0x504B0708
                || header == 0xD0CF11E0; // legacy .doc
    }
}
