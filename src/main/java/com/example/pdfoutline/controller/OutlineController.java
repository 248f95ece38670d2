package com.example.pdfoutline.controller;

import com.example.pdfoutline.exception.OutlineExtractionException;
import com.example.pdfoutline.model.DocumentOutline;
import com.example.pdfoutline.service.OutlineExtractionService;
import com.example.pdfoutline.service.PdfBookmarkWriterService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Outline extraction endpoints.
 */
@RestController
@RequestMapping("/api/pdf")
@CrossOrigin(origins = "*")
public class OutlineController {

    private static final Logger logger = LoggerFactory.getLogger(OutlineController.class);

    @Value("${pdf.outline.max-file-size-mb:500}")
    private long maxFileSizeMb;

    @Autowired
    private OutlineExtractionService outlineExtractionService;

    @Autowired
    private PdfBookmarkWriterService bookmarkWriterService;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * Title and headings of an uploaded PDF.
     */
    @PostMapping(value = "/outline", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> extractOutline(@RequestParam("file") MultipartFile file) {
        long startTime = System.currentTimeMillis();

        Optional<String> rejection = checkUpload(file);
        if (rejection.isPresent()) {
            logger.warn("Rejected upload {}: {}", uploadName(file), rejection.get());
            return jsonError(HttpStatus.BAD_REQUEST, rejection.get());
        }

        try {
            logger.info("Extracting outline from: {}", file.getOriginalFilename());
            DocumentOutline outline = outlineExtractionService.extract(file);

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Outline extracted: {} headings in {} ms", outline.getOutline().size(), duration);

            return ResponseEntity.ok()
                    .header("X-Processing-Time-Ms", String.valueOf(duration))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(outline));

        } catch (OutlineExtractionException e) {
            logger.error("Failed to extract outline from {}: {}", e.getSourceName(), e.getMessage(), e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read document: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error extracting outline: {}", e.getMessage(), e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error: " + e.getMessage());
        }
    }

    /**
     * The uploaded PDF with its detected outline embedded as bookmarks.
     */
    @PostMapping(value = "/add-bookmarks", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> addBookmarks(@RequestParam("file") MultipartFile file) {
        long startTime = System.currentTimeMillis();

        Optional<String> rejection = checkUpload(file);
        if (rejection.isPresent()) {
            logger.warn("Rejected upload {}: {}", uploadName(file), rejection.get());
            return jsonError(HttpStatus.BAD_REQUEST, rejection.get());
        }

        try {
            logger.info("Processing PDF: {}, size: {} bytes", file.getOriginalFilename(), file.getSize());

            byte[] original = file.getBytes();
            DocumentOutline outline = outlineExtractionService.extract(original, file.getOriginalFilename());
            byte[] result = bookmarkWriterService.addBookmarks(original, outline);

            long duration = System.currentTimeMillis() - startTime;
            logger.info("PDF processed successfully in {} ms", duration);

            String filename = bookmarkedFilename(file.getOriginalFilename());
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename*=UTF-8''" + encodeFilename(filename))
                    .header("X-Processing-Time-Ms", String.valueOf(duration))
                    .contentType(MediaType.APPLICATION_PDF)
                    .body(result);

        } catch (OutlineExtractionException e) {
            logger.error("Failed to extract outline from {}: {}", e.getSourceName(), e.getMessage(), e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read document: " + e.getMessage());
        } catch (IOException e) {
            logger.error("IO error processing PDF: {}", e.getMessage(), e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "File processing failed: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error processing PDF: {}", e.getMessage(), e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error: " + e.getMessage());
        }
    }

    /**
     * Outlines of several PDFs. A failing file is reported in the summary and does not stop the others.
     */
    @PostMapping(value = "/batch-outline", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> batchOutline(@RequestParam("files") MultipartFile[] files) {
        logger.info("Batch processing {} files", files.length);

        Map<String, Object> response = new LinkedHashMap<>();
        int successCount = 0;
        int failCount = 0;
        Map<String, Object> results = new LinkedHashMap<>();

        for (MultipartFile file : files) {
            Optional<String> rejection = checkUpload(file);
            if (rejection.isPresent()) {
                results.put(file.getOriginalFilename(), Map.of("error", "Rejected: " + rejection.get()));
                failCount++;
                continue;
            }

            try {
                results.put(file.getOriginalFilename(), outlineExtractionService.extract(file));
                successCount++;
            } catch (Exception e) {
                logger.error("Error processing file {}: {}", file.getOriginalFilename(), e.getMessage(), e);
                results.put(file.getOriginalFilename(), Map.of("error", "Failed: " + e.getMessage()));
                failCount++;
            }
        }

        response.put("total", files.length);
        response.put("success", successCount);
        response.put("failed", failCount);
        response.put("results", results);

        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(response));
        } catch (Exception e) {
            logger.error("Failed to serialize batch response: {}", e.getMessage(), e);
            return jsonError(HttpStatus.INTERNAL_SERVER_ERROR, "Response serialization failed");
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "PDF Outline Service");
        health.put("version", "1.0");
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new HashMap<>();
        info.put("serviceName", "PDF Outline Service");
        info.put("version", "1.0");
        info.put("algorithm", "font-metric heading classification");
        info.put("supportedFormats", new String[]{"PDF"});
        info.put("maxFileSizeMB", maxFileSizeMb);
        info.put("headingLevels", new String[]{"H1", "H2", "H3", "H4"});
        return ResponseEntity.ok(info);
    }

    // ========== Helpers ==========

    /**
     * Why an upload cannot be processed, or empty when it is an acceptable PDF.
     */
    private Optional<String> checkUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return Optional.of("no content uploaded");
        }
        if (file.getSize() > maxFileSizeMb * 1024 * 1024) {
            return Optional.of("upload exceeds the " + maxFileSizeMb + " MB limit");
        }
        String contentType = file.getContentType();
        if (contentType != null
                && !MediaType.APPLICATION_PDF_VALUE.equals(contentType)
                && !MediaType.APPLICATION_OCTET_STREAM_VALUE.equals(contentType)) {
            return Optional.of("content type " + contentType + " is not a PDF");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return Optional.of("file name must end with .pdf");
        }
        return Optional.empty();
    }

    private static String uploadName(MultipartFile file) {
        return file == null ? null : file.getOriginalFilename();
    }

    private static String bookmarkedFilename(String uploadName) {
        if (uploadName == null) {
            return "outline_bookmarks.pdf";
        }
        return uploadName.replaceFirst("[.][^.]+$", "") + "_with_bookmarks.pdf";
    }

    private static String encodeFilename(String filename) {
        return URLEncoder.encode(filename, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private ResponseEntity<String> jsonError(HttpStatus status, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        error.put("error", message);
        error.put("timestamp", System.currentTimeMillis());

        String body;
        try {
            body = objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize error body: {}", e.getMessage(), e);
            body = "{\"success\":false}";
        }
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
