package com.tournament.platform.dto;

import com.tournament.platform.model.TournamentType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTournamentRequest {
    @NotBlank(message = "Tournament name cannot be empty")
    @Size(max = 100, message = "Tournament name cannot exceed 100 characters")
    private String name;
    
    @NotNull(message = "Tournament type is required")
    private TournamentType type;
    
    @Min(value = 1, message = "Timer duration must be at least 1 minute")
    @Max(value = 180, message = "Timer duration cannot exceed 180 minutes")
    private Integer timerDuration;
    
    @Min(value = 0, message = "Max players cannot be negative")
    @Max(value = 400, message = "Max players cannot exceed 400")
    private int maxPlayers;
    
    @Min(value = 1, message = "Total rounds must be positive")
    private Integer totalRounds;
    
    // Optional; generated when absent
    @Pattern(regexp = "^[A-Za-z0-9]{4}$", message = "Tournament code must be 4 letters or digits")
    private String tournamentCode;
}
