package com.socialfusion.admin.adapter.in.web;

import com.socialfusion.admin.application.port.in.ClearCachesUseCase;
import com.socialfusion.admin.application.port.in.GetStatsUseCase;
import com.socialfusion.admin.application.port.in.GetStatsUseCase.FeedStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "Cache and filter diagnostics")
public class AdminController {

    private final ClearCachesUseCase clearCachesUseCase;
    private final GetStatsUseCase getStatsUseCase;

    public AdminController(ClearCachesUseCase clearCachesUseCase, GetStatsUseCase getStatsUseCase) {
        this.clearCachesUseCase = clearCachesUseCase;
        this.getStatsUseCase = getStatsUseCase;
    }

    @DeleteMapping("/caches")
    @Operation(summary = "Clear caches", description = "Empties the thread-participant and following caches and resets filter counters")
    public ResponseEntity<ClearResponse> clearCaches() {
        Map<String, Integer> cleared = clearCachesUseCase.clearCaches();
        return ResponseEntity.ok(new ClearResponse("cleared", Instant.now(), cleared));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get filter statistics", description = "Cache sizes and how many posts were hidden or shown on failure")
    public ResponseEntity<FeedStats> stats() {
        return ResponseEntity.ok(getStatsUseCase.getStats());
    }

    public record ClearResponse(
        String status,
        Instant timestamp,
        Map<String, Integer> cleared
    ) {}
}
