package com.example.alarm.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UnsubscribeRequest(
    @NotBlank(message = "user_id is required") String userId,
    @NotBlank(message = "endpoint is required") String endpoint) {}
