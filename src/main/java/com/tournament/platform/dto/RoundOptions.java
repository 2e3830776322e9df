package com.tournament.platform.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoundOptions {
    @Min(value = 1, message = "Timer duration must be at least 1 minute")
    @Max(value = 180, message = "Timer duration cannot exceed 180 minutes")
    private Integer timerDuration;
    
    @DecimalMin(value = "0", inclusive = false, message = "Score multiplier must be positive")
    @DecimalMax(value = "100", message = "Score multiplier cannot exceed 100")
    private Double scoreMultiplier;
    
    private boolean playoff;
}
