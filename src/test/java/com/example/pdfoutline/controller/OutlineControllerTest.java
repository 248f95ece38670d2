package com.example.pdfoutline.controller;

import com.example.pdfoutline.exception.OutlineExtractionException;
import com.example.pdfoutline.model.DocumentOutline;
import com.example.pdfoutline.model.HeadingLevel;
import com.example.pdfoutline.model.OutlineEntry;
import com.example.pdfoutline.service.OutlineExtractionService;
import com.example.pdfoutline.service.PdfBookmarkWriterService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutlineControllerTest {

    private static final DocumentOutline OUTLINE = new DocumentOutline("Annual Report 2024", List.of(
            new OutlineEntry(HeadingLevel.H1, "Overview", 2),
            new OutlineEntry(HeadingLevel.H3, "Details", 3)));

    @Mock
    private OutlineExtractionService outlineExtractionService;

    @Mock
    private PdfBookmarkWriterService bookmarkWriterService;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private OutlineController outlineController;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(outlineController, "maxFileSizeMb", 1L);
    }

    @Test
    void extractOutline_ShouldReturnOutlineJson_WhenFileIsPdf() throws IOException {
        // given
        MockMultipartFile file = pdf("report.pdf");
        when(outlineExtractionService.extract(file)).thenReturn(OUTLINE);

        // when
        ResponseEntity<String> response = outlineController.extractOutline(file);

        // then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = objectMapper.readTree(response.getBody());
        assertEquals("Annual Report 2024", body.get("title").asText());
        assertEquals("H1", body.get("outline").get(0).get("level").asText());
        assertEquals("Overview", body.get("outline").get(0).get("text").asText());
        assertEquals(2, body.get("outline").get(0).get("page").asInt());
    }

    @Test
    void extractOutline_ShouldReturnBadRequest_WhenFileIsEmpty() {
        // given
        MockMultipartFile file = new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[0]);

        // when
        ResponseEntity<String> response = outlineController.extractOutline(file);

        // then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(outlineExtractionService);
    }

    @Test
    void extractOutline_ShouldReturnBadRequest_WhenExtensionIsNotPdf() {
        // given
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "content".getBytes());

        // when
        ResponseEntity<String> response = outlineController.extractOutline(file);

        // then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void extractOutline_ShouldReturnBadRequest_WhenFileIsTooLarge() throws IOException {
        // given
        MockMultipartFile file = new MockMultipartFile("file", "big.pdf", "application/pdf", new byte[2 * 1024 * 1024]);

        // when
        ResponseEntity<String> response = outlineController.extractOutline(file);

        // then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(MediaType.APPLICATION_JSON, response.getHeaders().getContentType());
        JsonNode body = objectMapper.readTree(response.getBody());
        assertFalse(body.get("success").asBoolean());
        assertEquals("upload exceeds the 1 MB limit", body.get("error").asText());
        assertTrue(body.has("timestamp"));
        verifyNoInteractions(outlineExtractionService);
    }

    @Test
    void extractOutline_ShouldReturnServerError_WhenDocumentCannotBeRead() throws IOException {
        // given
        MockMultipartFile file = pdf("broken.pdf");
        when(outlineExtractionService.extract(file))
                .thenThrow(new OutlineExtractionException("broken.pdf", "Failed to read PDF broken.pdf", new IOException("EOF")));

        // when
        ResponseEntity<String> response = outlineController.extractOutline(file);

        // then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        JsonNode body = objectMapper.readTree(response.getBody());
        assertFalse(body.get("success").asBoolean());
        assertTrue(body.get("error").asText().contains("broken.pdf"));
    }

    @Test
    void addBookmarks_ShouldReturnBookmarkedPdf() throws IOException {
        // given
        MockMultipartFile file = pdf("report.pdf");
        byte[] bookmarked = "%PDF-bookmarked".getBytes();
        when(outlineExtractionService.extract(any(byte[].class), eq("report.pdf"))).thenReturn(OUTLINE);
        when(bookmarkWriterService.addBookmarks(any(byte[].class), eq(OUTLINE))).thenReturn(bookmarked);

        // when
        ResponseEntity<?> response = outlineController.addBookmarks(file);

        // then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(MediaType.APPLICATION_PDF, response.getHeaders().getContentType());
        assertArrayEquals(bookmarked, (byte[]) response.getBody());
        assertTrue(response.getHeaders().getFirst("Content-Disposition").contains("report_with_bookmarks.pdf"));
    }

    @Test
    void batchOutline_ShouldReportFailuresAndContinue() throws IOException {
        // given
        MockMultipartFile good = pdf("good.pdf");
        MockMultipartFile bad = pdf("bad.pdf");
        MockMultipartFile text = new MockMultipartFile("files", "notes.txt", "text/plain", "x".getBytes());
        when(outlineExtractionService.extract(good)).thenReturn(OUTLINE);
        when(outlineExtractionService.extract(bad))
                .thenThrow(new OutlineExtractionException("bad.pdf", "Failed to read PDF bad.pdf", new IOException("EOF")));

        // when
        ResponseEntity<String> response = outlineController.batchOutline(new MockMultipartFile[]{good, bad, text});

        // then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = objectMapper.readTree(response.getBody());
        assertEquals(3, body.get("total").asInt());
        assertEquals(1, body.get("success").asInt());
        assertEquals(2, body.get("failed").asInt());
        assertEquals("Annual Report 2024", body.get("results").get("good.pdf").get("title").asText());
        assertTrue(body.get("results").get("bad.pdf").has("error"));
        verify(outlineExtractionService, times(2)).extract(any(MockMultipartFile.class));
    }

    private static MockMultipartFile pdf(String name) {
        return new MockMultipartFile("file", name, "application/pdf", "%PDF-1.4 test".getBytes());
    }
}
