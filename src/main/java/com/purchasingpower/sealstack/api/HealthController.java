package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.search.SealStackService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness check reporting how many patterns are loaded.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthController {

    private final SealStackService sealStackService;

    /**
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public HealthResponse health() {
        int patterns = sealStackService.stats().getTotalPatterns();
        return new HealthResponse(
                patterns > 0 ? "UP" : "EMPTY",
                patterns,
                patterns > 0 ? "Pattern store loaded" : "Pattern table has no patterns"
        );
    }

    /**
     * Response DTO for health check.
     */
    public record HealthResponse(
            String status,
            int totalPatterns,
            String message
    ) {}
}
