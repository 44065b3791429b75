package com.mikov.emailverifier.services;

import com.mikov.emailverifier.bulk.BatchProgressSink;
import com.mikov.emailverifier.bulk.RecordSource;
import com.mikov.emailverifier.model.BatchProgressEvent;
import com.mikov.emailverifier.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Service for bulk email verification.
 * Validates rows in fixed-size batches, concurrently within a batch and
 * sequentially across batches, reporting progress after every batch.
 *
 * @author zahari.mikov
 */
@Service
public class BulkValidationService {
    private static final Logger logger = LoggerFactory.getLogger(BulkValidationService.class);

    public static final String PROCESSING_ERROR = "Failed to process records";
    private static final String EMAIL_FIELD = "email";

    private final EmailVerificationService emailVerificationService;
    private final Executor executor;
    private final int batchSize;

    public BulkValidationService(final EmailVerificationService emailVerificationService,
                                 @Qualifier("bulkValidationExecutor") final Executor executor,
                                 @Value("${emailverifier.bulk.batch-size:10}") final int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        this.emailVerificationService = emailVerificationService;
        this.executor = executor;
        this.batchSize = batchSize;
    }

    public void validateBatch(final List<Map<String, String>> records, final BatchProgressSink sink) {
        validateBatch(() -> records, sink);
    }

    /**
     * Runs a bulk job to completion. The sink receives one progress event per
     * batch followed by a single complete event, or a single error event if the
     * rows cannot be read or an event cannot be delivered.
     *
     * @param source supplies the rows
     * @param sink   receives the events
     */
    public void validateBatch(final RecordSource source, final BatchProgressSink sink) {
        try {
            final var records = source.readRecords();
            final var total = records.size();
            final var results = new ArrayList<Map<String, Object>>(total);
            logger.info("Starting bulk validation of {} records in batches of {}", total, batchSize);

            for (int start = 0; start < total; start += batchSize) {
                final var batch = records.subList(start, Math.min(start + batchSize, total));
                final var processed = processBatch(batch);
                results.addAll(processed);

                final var progress = Math.min(100.0, (double) results.size() / total * 100);
                logger.debug("Processed {}/{} records ({}%)", results.size(), total, progress);
                sink.accept(BatchProgressEvent.progress(progress, processed));
            }

            sink.accept(BatchProgressEvent.complete(results));
            logger.info("Completed bulk validation of {} records", total);
        } catch (final IOException | RuntimeException e) {
            logger.error("Bulk validation aborted: {}", e.getMessage(), e);
            sendError(sink);
        }
    }

    private List<Map<String, Object>> processBatch(final List<Map<String, String>> batch) {
        final var futures = batch.stream()
                .map(record -> CompletableFuture.supplyAsync(() -> processRecord(record), executor))
                .collect(Collectors.toList());

        return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
    }

    private Map<String, Object> processRecord(final Map<String, String> record) {
        final var processed = new LinkedHashMap<String, Object>(record);
        final var email = findEmail(record);
        if (email == null) {
            return processed;
        }

        final var result = emailVerificationService.validateOne(email);
        processed.put("validation_result", result.isValid() ? "Valid" : "Invalid");
        processed.put("validation_reason", result.getReason());
        annotateChecks(processed, result);
        return processed;
    }

    private void annotateChecks(final Map<String, Object> processed, final VerificationResult result) {
        final var checks = result.getChecks();
        processed.put("mx_check", checks.isMx());
        processed.put("dns_check", checks.isDns());
        processed.put("spf_check", checks.isSpf());
        processed.put("mailbox_check", checks.isMailbox());
        processed.put("smtp_check", checks.isSmtp());
    }

    private String findEmail(final Map<String, String> record) {
        for (final var entry : record.entrySet()) {
            if (entry.getKey() != null && EMAIL_FIELD.equalsIgnoreCase(entry.getKey().trim())
                    && entry.getValue() != null && !entry.getValue().isBlank()) {
                return entry.getValue().trim();
            }
        }
        return null;
    }

    private void sendError(final BatchProgressSink sink) {
        try {
            sink.accept(BatchProgressEvent.error(PROCESSING_ERROR));
        } catch (final IOException | RuntimeException e) {
            logger.warn("Could not deliver error event: {}", e.getMessage());
        }
    }
}
