package com.bank.behaviorauth.engine.scoring;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body of a scoring model endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelScoreResponse {
    private Double score;
    private Double confidence;
    private String modelVersion;
}
