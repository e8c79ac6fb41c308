package com.bank.behaviorauth.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "UI event graph of a session, scored by the graph-anomaly model")
public class SessionGraph {

    @Schema(description = "Event nodes")
    @Builder.Default
    private List<Node> nodes = new ArrayList<>();

    @Schema(description = "Directed transitions between event nodes")
    @Builder.Default
    private List<Edge> edges = new ArrayList<>();

    public boolean isEmpty() {
        return nodes == null || nodes.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "A UI event")
    public static class Node {
        @Schema(description = "Node identifier, unique within the graph", example = "n1")
        private String id;

        @Schema(description = "Event type", example = "touch_down")
        private String type;

        @Schema(description = "Event timestamp in epoch millis", example = "1739886764000")
        private long timestamp;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "A transition between two events")
    public static class Edge {
        @Schema(description = "Source node id", example = "n1")
        private String source;

        @Schema(description = "Target node id", example = "n2")
        private String target;

        @Schema(description = "Transition weight (e.g. dwell time in ms)", example = "120.0")
        private double weight;
    }
}
