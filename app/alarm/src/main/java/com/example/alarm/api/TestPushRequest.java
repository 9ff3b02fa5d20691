/*
 * Where: Alarm API
 * What: Ad-hoc push to every device of one user; title and body fall back to the alarm defaults
 */
package com.example.alarm.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestPushRequest(
    @NotBlank(message = "user_id is required") String userId, String title, String body) {}
