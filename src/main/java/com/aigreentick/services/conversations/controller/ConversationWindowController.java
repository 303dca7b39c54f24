package com.aigreentick.services.conversations.controller;

import com.aigreentick.services.conversations.constants.ConversationConstants;
import com.aigreentick.services.conversations.constants.WindowStatus;
import com.aigreentick.services.conversations.dto.request.ExtendWindowRequest;
import com.aigreentick.services.conversations.dto.response.ApiResponse;
import com.aigreentick.services.conversations.dto.response.WindowStatusResponse;
import com.aigreentick.services.conversations.entity.ConversationWindow;
import com.aigreentick.services.conversations.service.ConversationWindowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the customer service window
 */
@RestController
@RequestMapping(ConversationConstants.API_V1 + "/conversations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Conversation Windows", description = "Inspect and override the 24h messaging window")
public class ConversationWindowController {

    private final ConversationWindowService windowService;

    @GetMapping("/{organizationId}/{contactPhone}/window")
    @Operation(summary = "Current window status of a conversation")
    public ResponseEntity<ApiResponse<WindowStatusResponse>> getWindow(
            @Parameter(description = "Tenant organization ID") @PathVariable Long organizationId,
            @Parameter(description = "Contact phone in international format") @PathVariable String contactPhone
    ) {
        log.debug("GET /conversations/{}/{}/window", organizationId, contactPhone);
        return ResponseEntity.ok(ApiResponse.success(describe(organizationId, contactPhone, null),
                "Window status fetched"));
    }

    @PostMapping("/{organizationId}/{contactPhone}/window/extend")
    @Operation(summary = "Manually keep the window open", description = "1 to 168 hours from now")
    public ResponseEntity<ApiResponse<WindowStatusResponse>> extendWindow(
            @PathVariable Long organizationId,
            @PathVariable String contactPhone,
            @Valid @RequestBody ExtendWindowRequest request
    ) {
        log.info("POST /conversations/{}/{}/window/extend hours={}", organizationId, contactPhone, request.getHours());
        ConversationWindow window = windowService.extend(organizationId, contactPhone, request.getHours());
        return ResponseEntity.ok(ApiResponse.success(describe(organizationId, contactPhone, window),
                "Window extended"));
    }

    private WindowStatusResponse describe(Long organizationId, String contactPhone, ConversationWindow window) {
        WindowStatus status = windowService.status(organizationId, contactPhone);
        return WindowStatusResponse.builder()
                .organizationId(organizationId)
                .contactPhone(contactPhone)
                .status(status)
                .hoursRemaining(windowService.hoursRemaining(organizationId, contactPhone))
                .canSendFreeMessage(status.allowsFreeMessages())
                .endsAt(window != null ? window.getEndsAt() : null)
                .build();
    }
}
