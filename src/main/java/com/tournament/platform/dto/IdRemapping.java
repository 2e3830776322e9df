package com.tournament.platform.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Old id to new id tables used when importing a tournament. Ids missing from a table
 * are assigned a fresh id on first lookup, and the same old id always maps to the
 * same new id.
 */
public class IdRemapping {
    
    private final Supplier<String> idSupplier;
    private String tournamentId;
    private final Map<String, String> players;
    private final Map<String, String> tables;
    private final Map<String, String> rounds;
    
    public IdRemapping(Supplier<String> idSupplier) {
        this(idSupplier, null, Map.of(), Map.of(), Map.of());
    }
    
    public IdRemapping(Supplier<String> idSupplier,
                       String tournamentId,
                       Map<String, String> players,
                       Map<String, String> tables,
                       Map<String, String> rounds) {
        this.idSupplier = idSupplier;
        this.tournamentId = tournamentId;
        this.players = new HashMap<>(players);
        this.tables = new HashMap<>(tables);
        this.rounds = new HashMap<>(rounds);
    }
    
    public String tournamentId() {
        if (tournamentId == null) {
            tournamentId = idSupplier.get();
        }
        return tournamentId;
    }
    
    public String playerId(String oldId) {
        return remap(players, oldId);
    }
    
    public String tableId(String oldId) {
        return remap(tables, oldId);
    }
    
    public String roundId(String oldId) {
        return remap(rounds, oldId);
    }
    
    public Map<String, String> getPlayers() {
        return Collections.unmodifiableMap(players);
    }
    
    public Map<String, String> getTables() {
        return Collections.unmodifiableMap(tables);
    }
    
    public Map<String, String> getRounds() {
        return Collections.unmodifiableMap(rounds);
    }
    
    private String remap(Map<String, String> table, String oldId) {
        if (oldId == null) {
            return null;
        }
        return table.computeIfAbsent(oldId, k -> idSupplier.get());
    }
}
