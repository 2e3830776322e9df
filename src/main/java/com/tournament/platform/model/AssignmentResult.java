package com.tournament.platform.model;

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
public class AssignmentResult {
    private AssignmentAlgorithm algorithm;
    @Builder.Default
    private List<Table> tables = new ArrayList<>();
    // eligible players left without a seat because the count was not a multiple of 4
    @Builder.Default
    private List<String> unassignedPlayerIds = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
