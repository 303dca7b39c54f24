package com.aigreentick.services.conversations.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Manual window extension")
public class ExtendWindowRequest {

    @NotNull(message = "hours is required")
    @Min(value = 1, message = "hours must be at least 1")
    @Max(value = 168, message = "hours must be at most 168")
    @Schema(description = "Hours from now the window stays open", example = "24")
    private Integer hours;
}
