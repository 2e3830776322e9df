package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal data problem reported to the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityWarning {
    
    public enum Kind {
        ORPHANED_PLAYER_TABLE,
        ORPHANED_TABLE_PLAYER,
        ELIMINATED_PLAYER_SEATED,
        MALFORMED_TABLE,
        MISSING_ROUND_NUMBER,
        UNKNOWN_ROUND,
        WINS_MISMATCH,
        ROUND_STATE_MISMATCH
    }
    
    private Kind kind;
    private String subjectId;
    private String message;
}
