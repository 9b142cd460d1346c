package com.socialfusion.adapter.in.web;

import com.socialfusion.application.port.in.ReplyFilteringSettingsUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/settings")
@Tag(name = "Settings", description = "Feed settings")
public class SettingsController {

    private final ReplyFilteringSettingsUseCase settings;

    public SettingsController(ReplyFilteringSettingsUseCase settings) {
        this.settings = settings;
    }

    @GetMapping("/reply-filtering")
    @Operation(summary = "Get reply filtering flag")
    public ResponseEntity<ReplyFilteringSetting> getReplyFiltering() {
        return ResponseEntity.ok(new ReplyFilteringSetting(settings.isReplyFilteringEnabled()));
    }

    @PutMapping("/reply-filtering")
    @Operation(summary = "Switch reply filtering on or off", description = "Takes effect for the next filter pass")
    public ResponseEntity<ReplyFilteringSetting> setReplyFiltering(@Valid @RequestBody ReplyFilteringSetting request) {
        settings.setReplyFilteringEnabled(request.enabled());
        return ResponseEntity.ok(new ReplyFilteringSetting(settings.isReplyFilteringEnabled()));
    }

    public record ReplyFilteringSetting(
        @NotNull(message = "enabled is required")
        Boolean enabled
    ) {}
}
