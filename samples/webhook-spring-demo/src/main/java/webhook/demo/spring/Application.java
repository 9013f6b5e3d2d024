package webhook.demo.spring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot demo for the webhook queue.
 * <p>
 * Run with: mvn install -DskipTests && mvn -f samples/webhook-spring-demo/pom.xml spring-boot:run
 * <p>
 * Endpoints:
 * POST /webhook     - accept a JSON object for asynchronous processing (202, or 429 when overloaded)
 * GET  /health      - liveness
 * GET  /metrics     - Prometheus metrics
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
