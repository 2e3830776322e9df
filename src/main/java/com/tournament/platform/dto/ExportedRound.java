package com.tournament.platform.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.tournament.platform.model.Participant;
import com.tournament.platform.model.Round;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A round with its participant snapshots embedded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportedRound {
    @JsonUnwrapped
    private Round round;
    @Builder.Default
    private List<Participant> participants = new ArrayList<>();
}
