package com.tournament.platform.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A player's state frozen at the start of a round. Used as the baseline for wins
 * gained during the round and for the round's table membership after live tables
 * have been reassigned.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Participant {
    String id;
    String playerId;
    String name;
    int wins;
    double points;
    String tableId;
    Position position;
    Instant lastWinAt;
    Instant snapshotAt;
    
    public static Participant snapshotOf(Player player, Instant snapshotAt) {
        return Participant.builder()
            .id(player.getId())
            .playerId(player.getId())
            .name(player.getName())
            .wins(player.getWins())
            .points(player.getPoints())
            .tableId(player.getTableId())
            .position(player.getPosition())
            .lastWinAt(player.getLastWinAt())
            .snapshotAt(snapshotAt)
            .build();
    }
}
