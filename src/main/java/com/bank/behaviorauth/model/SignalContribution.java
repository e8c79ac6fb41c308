package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One signal's share of the fused risk score")
public class SignalContribution {

    @Schema(description = "Raw signal value in [0,1]", example = "0.62")
    private double value;

    @Schema(description = "Signal confidence in [0,1]", example = "1.0")
    private double confidence;

    @Schema(description = "Effective weight after degraded-signal redistribution", example = "0.2")
    private double weight;

    @Schema(description = "weight x risk distance, the amount added to the fused risk", example = "0.076")
    private double contribution;

    @Schema(description = "Whether the signal was produced under fallback conditions", example = "false")
    private boolean degraded;

    @Schema(description = "Detail from the signal producer", example = "tier=MEDIUM best=0.742 over 5 matches")
    private String detail;
}
