package com.socialfusion.adapter.in.web;

import com.socialfusion.application.port.in.GetTimelineUseCase;
import com.socialfusion.domain.model.Page;
import com.socialfusion.domain.model.UnifiedPost;
import com.socialfusion.infrastructure.config.AppProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Timeline", description = "Unified home timeline")
public class TimelineController {

    private final GetTimelineUseCase getTimelineUseCase;
    private final AppProperties appProperties;

    public TimelineController(GetTimelineUseCase getTimelineUseCase, AppProperties appProperties) {
        this.getTimelineUseCase = getTimelineUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping("/timeline")
    @Operation(summary = "Get unified timeline",
        description = "Merges the home timelines of all linked accounts, newest first, with reply filtering applied")
    public ResponseEntity<PageResponse<PostResponse>> getTimeline(
            @Parameter(description = "Number of posts to return (capped at the configured maximum)")
            @RequestParam(required = false) Integer limit) {

        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        int effectiveLimit = limit != null
            ? Math.min(limit, appProperties.getTimeline().getMaxPageSize())
            : appProperties.getTimeline().getDefaultPageSize();

        Page<UnifiedPost> page = getTimelineUseCase.getTimeline(effectiveLimit);
        return ResponseEntity.ok(PageResponse.from(page, PostResponse::from));
    }
}
