package com.tournament.platform.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentExport {
    public static final String CURRENT_VERSION = "1.0";
    
    @JsonProperty("export_version")
    private String exportVersion;
    
    @JsonProperty("exported_at")
    private Instant exportedAt;
    
    @JsonProperty("tournament_id")
    private String tournamentId;
    
    private Tournament tournament;
    
    @Builder.Default
    private List<Player> players = new ArrayList<>();
    
    @Builder.Default
    private List<Table> tables = new ArrayList<>();
    
    @Builder.Default
    private List<ExportedRound> rounds = new ArrayList<>();
}
