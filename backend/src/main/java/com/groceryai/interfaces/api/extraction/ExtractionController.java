package com.groceryai.interfaces.api.extraction;

import com.groceryai.application.extraction.GroceryExtractionService;
import com.groceryai.domain.extraction.model.ExtractionOutcome;
import com.groceryai.domain.invocation.model.HealthStatus;
import com.groceryai.infrastructure.ai.InvocationClient;
import com.groceryai.infrastructure.ai.retry.CancellationToken;
import com.groceryai.interfaces.api.dto.ExtractionRequest;
import com.groceryai.interfaces.api.dto.ExtractionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ExtractionController {

    private final GroceryExtractionService extractionService;
    private final InvocationClient invocationClient;

    @PostMapping("/extractions")
    public ResponseEntity<ExtractionResponse> extract(@Valid @RequestBody ExtractionRequest request) {
        CancellationToken cancellation = request.timeoutSeconds() == null
                ? CancellationToken.none()
                : CancellationToken.withDeadline(Duration.ofSeconds(request.timeoutSeconds()));

        ExtractionOutcome outcome = extractionService.extract(
                request.text(),
                Boolean.TRUE.equals(request.useKnowledgeBase()),
                cancellation);

        HttpStatus status = outcome instanceof ExtractionOutcome.Blocked
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(ExtractionResponse.from(outcome));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = invocationClient.healthCheck();
        return ResponseEntity.status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }
}
