package com.aigreentick.services.conversations.dto.response;

import com.aigreentick.services.conversations.constants.WindowStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Customer service window of one conversation")
public class WindowStatusResponse {

    private Long organizationId;

    private String contactPhone;

    @Schema(description = "UNKNOWN when the contact never wrote in", example = "ACTIVE")
    private WindowStatus status;

    @Schema(description = "Hours until the window closes", example = "17.5")
    private double hoursRemaining;

    private boolean canSendFreeMessage;

    private LocalDateTime endsAt;
}
