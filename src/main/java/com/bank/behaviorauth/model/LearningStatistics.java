package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@Schema(description = "Phase distribution across known users, derived on demand from per-user state")
public class LearningStatistics {

    @Schema(description = "Users with a phase state", example = "120")
    long totalUsers;

    @Schema(description = "Users in cold_start or learning", example = "35")
    long usersInLearning;

    @Schema(description = "User count per phase", example = "{\"cold_start\": 0, \"learning\": 35, \"gradual_risk\": 40, \"full_auth\": 45}")
    Map<String, Long> phaseDistribution;
}
