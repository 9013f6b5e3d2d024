package webhook.demo.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import webhook.WebhookQueue;

import java.util.Map;

@RestController
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookQueue<Object> queue;

    public WebhookController(WebhookQueue<Object> queue) {
        this.queue = queue;
    }

    /**
     * Admits a webhook payload. Overload surfaces as {@link webhook.QueueOverloadedException}
     * and is mapped to 429 by {@link WebhookExceptionHandler}.
     */
    @PostMapping("/webhook")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> receive(@RequestBody Map<String, Object> payload) {
        queue.enqueue(payload);
        log.debug("Webhook accepted, queue size {}", queue.size());
        return Map.of("status", "Accepted");
    }
}
