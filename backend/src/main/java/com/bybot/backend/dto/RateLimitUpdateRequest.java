package com.bybot.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitUpdateRequest {

    @NotNull
    @Positive
    private Double maxTokens;

    @NotNull
    @Positive
    private Long intervalSeconds;
}
