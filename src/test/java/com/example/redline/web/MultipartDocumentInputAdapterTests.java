package com.example.redline.web;

import com.example.redline.domain.AnalysisRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultipartDocumentInputAdapterTests {
    private final MultipartDocumentInputAdapter adapter = new MultipartDocumentInputAdapter();

    @Test
    void plainTextUploadBecomesARequest() throws IOException {
        byte[] bytes = "\uFEFFSection 501 of title 26, United States Code, is amended.".getBytes(StandardCharsets.UTF_8);

        AnalysisRequest request =
                adapter.adapt(new MockMultipartFile("file", "bills/hr1234.txt", "text/plain", bytes), "doc-1");

        assertThat(request.documentId()).isEqualTo("doc-1");
        assertThat(request.name()).isEqualTo("hr1234.txt");
        assertThat(request.text()).startsWith("Section 501");
    }

    @Test
    void pdfUploadIsRejected() {
        byte[] pdf = "%PDF-1.7\n...".getBytes(StandardCharsets.US_ASCII);

        assertRejected(new MockMultipartFile("file", "bill.pdf", "application/pdf", pdf), HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @Test
    void wordDocumentIsRejectedWhateverItsDeclaredType() {
        byte[] docx = {0x50, 0x4B, 0x03, 0x04, 0x14, 0x00};

        assertRejected(new MockMultipartFile("file", "bill.txt", "text/plain", docx), HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @Test
    void invalidUtf8IsRejected() {
        byte[] latin1 = {0x41, (byte) 0xC3, 0x28, 0x41, 0x42};

        assertRejected(new MockMultipartFile("file", "bill.txt", "text/plain", latin1), HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @Test
    void emptyAndBlankUploadsAreBadRequests() {
        assertRejected(new MockMultipartFile("file", "bill.txt", "text/plain", new byte[0]), HttpStatus.BAD_REQUEST);
        assertRejected(
                new MockMultipartFile("file", "bill.txt", "text/plain", "  \n\t ".getBytes(StandardCharsets.UTF_8)),
                HttpStatus.BAD_REQUEST);
    }

    @Test
    void missingFilenameGetsADefault() {
        MockMultipartFile file = new MockMultipartFile("file", "", "text/plain", "text".getBytes(StandardCharsets.UTF_8));

        assertThat(adapter.describeFilename(file)).isEqualTo("upload.txt");
    }

    private void assertRejected(MockMultipartFile file, HttpStatus status) {
        assertThatThrownBy(() -> adapter.adapt(file, "doc-1"))
                .isInstanceOfSatisfying(
                        ResponseStatusException.class, ex -> assertThat(ex.getStatusCode()).isEqualTo(status));
    }
}
