package com.mikov.emailverifier.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.emailverifier.bulk.CsvRecordSource;
import com.mikov.emailverifier.bulk.NdjsonProgressSink;
import com.mikov.emailverifier.model.EmailValidationRequest;
import com.mikov.emailverifier.services.BulkValidationService;
import com.mikov.emailverifier.services.EmailVerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for single and bulk email validation
 *
 * @author zahari.mikov
 */
@RestController
@RequestMapping("/api")
public class EmailValidationController {

    private static final Logger logger = LoggerFactory.getLogger(EmailValidationController.class);

    public static final MediaType APPLICATION_NDJSON = MediaType.parseMediaType("application/x-ndjson");
    private static final String CSV_CONTENT_TYPE = "text/csv";

    private final EmailVerificationService emailVerificationService;
    private final BulkValidationService bulkValidationService;
    private final ObjectMapper objectMapper;

    public EmailValidationController(final EmailVerificationService emailVerificationService,
                                     final BulkValidationService bulkValidationService,
                                     final ObjectMapper objectMapper) {
        this.emailVerificationService = emailVerificationService;
        this.bulkValidationService = bulkValidationService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> validate(@RequestBody(required = false) final EmailValidationRequest request) {
        if (request == null || request.getEmail() == null || request.getEmail().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("valid", false, "reason", "Email is required"));
        }

        try {
            return ResponseEntity.ok(emailVerificationService.validateOne(request.getEmail()));
        } catch (final RuntimeException e) {
            logger.error("Error validating email {}: {}", request.getEmail(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("valid", false, "reason", "Server error occurred"));
        }
    }

    @PostMapping(value = "/validate/bulk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StreamingResponseBody> validateBulk(
            @RequestParam(value = "file", required = false) final MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new BulkUploadException("CSV file is required");
        }

        if (!isCsv(file)) {
            logger.warn("Rejected bulk upload {} with content type {}", file.getOriginalFilename(), file.getContentType());
            throw new BulkUploadException("Only CSV files are allowed");
        }

        logger.info("Received bulk validation upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        final var content = file.getBytes();
        final StreamingResponseBody body = output -> bulkValidationService.validateBatch(
                new CsvRecordSource(new ByteArrayInputStream(content)),
                new NdjsonProgressSink(objectMapper, output));

        return ResponseEntity.ok()
                .contentType(APPLICATION_NDJSON)
                .body(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @ExceptionHandler(BulkUploadException.class)
    public ResponseEntity<Map<String, String>> handleBulkUploadError(final BulkUploadException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private boolean isCsv(final MultipartFile file) {
        final var filename = file.getOriginalFilename();
        return CSV_CONTENT_TYPE.equals(file.getContentType())
                || (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".csv"));
    }

    static class BulkUploadException extends RuntimeException {
        BulkUploadException(final String message) {
            super(message);
        }
    }
}
