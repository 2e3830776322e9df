package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups produced by the table assigner, before anything is written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentPlan {
    // algorithm actually used, after any fallback
    private AssignmentAlgorithm algorithm;
    @Builder.Default
    private List<List<Player>> groups = new ArrayList<>();
    @Builder.Default
    private List<Player> unassigned = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
