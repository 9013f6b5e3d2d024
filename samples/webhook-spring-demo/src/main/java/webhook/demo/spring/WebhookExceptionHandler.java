package webhook.demo.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import webhook.QueueOverloadedException;

import java.util.Map;

/**
 * Maps failures of {@link WebhookController} to the JSON error bodies webhook senders expect.
 */
@RestControllerAdvice(assignableTypes = WebhookController.class)
public class WebhookExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(WebhookExceptionHandler.class);

    @ExceptionHandler(QueueOverloadedException.class)
    public ResponseEntity<Map<String, String>> overloaded(QueueOverloadedException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Map<String, String>> invalidPayload(Exception e) {
        log.debug("Rejected webhook payload: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON payload");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        log.error("Error handling webhook", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
