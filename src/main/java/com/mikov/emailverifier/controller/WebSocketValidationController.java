package com.mikov.emailverifier.controller;

import com.mikov.emailverifier.bulk.StompProgressSink;
import com.mikov.emailverifier.model.BulkValidationRequest;
import com.mikov.emailverifier.services.BulkValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.List;
import java.util.Map;

/**
 * Controller for WebSocket-based bulk validation
 */
@Controller
public class WebSocketValidationController {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketValidationController.class);

    private final SimpMessagingTemplate messagingTemplate;
    private final BulkValidationService bulkValidationService;

    public WebSocketValidationController(final SimpMessagingTemplate messagingTemplate,
                                         final BulkValidationService bulkValidationService) {
        this.messagingTemplate = messagingTemplate;
        this.bulkValidationService = bulkValidationService;
    }

    @MessageMapping("/validate/bulk")
    public void validateBulk(@Payload final BulkValidationRequest request) {
        final var sessionId = request.getSessionId();
        final var records = request.getRecords() != null ? request.getRecords() : List.<Map<String, String>>of();

        logger.info("Received bulk validation request for {} records, session: {}", records.size(), sessionId);
        bulkValidationService.validateBatch(records, new StompProgressSink(messagingTemplate, sessionId));
    }
}
