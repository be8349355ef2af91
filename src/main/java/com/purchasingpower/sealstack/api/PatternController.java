package com.purchasingpower.sealstack.api;

import com.purchasingpower.sealstack.assembly.ModuleResult;
import com.purchasingpower.sealstack.core.Pattern;
import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.search.RetrievalOutcome;
import com.purchasingpower.sealstack.search.SealStackService;
import com.purchasingpower.sealstack.store.CoordinateSpace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for pattern retrieval and module assembly.
 *
 * <p>Domain failures (malformed coordinate, missing pattern, empty module) are
 * mapped to HTTP statuses by {@link ApiExceptionHandler}.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/patterns")
@RequiredArgsConstructor
public class PatternController {

    private final SealStackService sealStackService;

    /**
     * Exact lookup by coordinate.
     *
     * GET /api/v1/patterns/{coordinate}
     */
    @GetMapping("/{coordinate}")
    public ResponseEntity<PatternResponse> retrieve(@PathVariable String coordinate) {
        Pattern pattern = sealStackService.retrieve(coordinate);
        return ResponseEntity.ok(PatternResponse.success(PatternDto.from(pattern)));
    }

    /**
     * Stored patterns nearest to a coordinate, plus how crowded its neighbourhood is.
     * The coordinate does not have to be stored.
     *
     * GET /api/v1/patterns/L4.Q3.TECH.WEB.MIDDLEWARE.AUTH[C3]/nearest?k=5&radius=0.5
     */
    @GetMapping("/{coordinate}/nearest")
    public ResponseEntity<NearestResponse> nearest(@PathVariable String coordinate,
                                                   @RequestParam(defaultValue = "5") int k,
                                                   @RequestParam(defaultValue = "0.5") double radius) {
        List<CoordinateSpace.Neighbor> neighbors = sealStackService.nearest(coordinate, k);
        int density = sealStackService.density(coordinate, radius);
        return ResponseEntity.ok(NearestResponse.success(coordinate, density, neighbors));
    }

    /**
     * Keyword search, optionally restricted to one layer and/or lexicon.
     *
     * GET /api/v1/patterns/search?query=flask&layer=4&lexicon=TECH
     */
    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestParam(required = false) String query,
                                                 @RequestParam(required = false) Integer layer,
                                                 @RequestParam(required = false) String lexicon) {
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest()
                .body(SearchResponse.error("Query is required"));
        }

        SealLayer sealLayer = layer != null ? SealLayer.of(layer) : null;
        List<PatternDto> results = sealStackService.search(query, sealLayer, lexicon).stream()
            .map(PatternDto::from)
            .collect(Collectors.toList());

        return ResponseEntity.ok(SearchResponse.success(query, results));
    }

    /**
     * Assemble a multi-layer module.
     *
     * POST /api/v1/patterns/modules
     */
    @PostMapping("/modules")
    public ResponseEntity<ModuleResponse> buildModule(@RequestBody ModuleRequestBody request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest()
                .body(ModuleResponse.error("Query is required"));
        }

        ModuleResult result = sealStackService.buildModule(request.getQuery());
        return ResponseEntity.ok(ModuleResponse.success(request.getQuery(), result));
    }

    /**
     * Look up several coordinates at once.
     *
     * POST /api/v1/patterns/batch
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchRetrieveResponse> batch(@RequestBody BatchRetrieveRequest request) {
        if (request.getCoordinates() == null || request.getCoordinates().isEmpty()) {
            return ResponseEntity.badRequest()
                .body(BatchRetrieveResponse.error("coordinates array required"));
        }

        List<RetrievalOutcome> outcomes = sealStackService.retrieveAll(request.getCoordinates());
        return ResponseEntity.ok(BatchRetrieveResponse.success(outcomes));
    }

    /**
     * Store statistics.
     *
     * GET /api/v1/patterns/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        SealStackService.StoreStats stats = sealStackService.stats();

        Map<String, Long> byLayer = new LinkedHashMap<>();
        stats.getPatternsByLayer().forEach((layer, count) -> byLayer.put(layer.name(), count));

        return ResponseEntity.ok(StatsResponse.builder()
            .totalPatterns(stats.getTotalPatterns())
            .patternsByLayer(byLayer)
            .patternsByLexicon(new LinkedHashMap<>(stats.getPatternsByLexicon()))
            .build());
    }
}
