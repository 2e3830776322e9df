package com.tournament.platform.repository;

/**
 * Document layout:
 * <pre>
 * tournaments/{id}
 * tournaments/{id}/players/{id}
 * tournaments/{id}/tables/{id}
 * tournaments/{id}/rounds/{id}
 * tournaments/{id}/rounds/{id}/participants/{id}
 * </pre>
 */
public final class TournamentPaths {
    
    public static final String TOURNAMENTS = "tournaments";
    
    private TournamentPaths() {
    }
    
    public static String tournament(String tournamentId) {
        return TOURNAMENTS + "/" + tournamentId;
    }
    
    public static String players(String tournamentId) {
        return tournament(tournamentId) + "/players";
    }
    
    public static String player(String tournamentId, String playerId) {
        return players(tournamentId) + "/" + playerId;
    }
    
    public static String tables(String tournamentId) {
        return tournament(tournamentId) + "/tables";
    }
    
    public static String table(String tournamentId, String tableId) {
        return tables(tournamentId) + "/" + tableId;
    }
    
    public static String rounds(String tournamentId) {
        return tournament(tournamentId) + "/rounds";
    }
    
    public static String round(String tournamentId, String roundId) {
        return rounds(tournamentId) + "/" + roundId;
    }
    
    public static String participants(String tournamentId, String roundId) {
        return round(tournamentId, roundId) + "/participants";
    }
    
    public static String participant(String tournamentId, String roundId, String playerId) {
        return participants(tournamentId, roundId) + "/" + playerId;
    }
    
    /**
     * Collection holding the document at {@code path}.
     */
    public static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Not a document path: " + path);
        }
        return path.substring(0, slash);
    }
    
    public static String idOf(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
    
    /**
     * Top-level document the path belongs to, e.g. {@code tournaments/abc} for any path below it.
     */
    public static String rootOf(String path) {
        String[] segments = path.split("/", 3);
        if (segments.length < 2) {
            throw new IllegalArgumentException("Not a document path: " + path);
        }
        return segments[0] + "/" + segments[1];
    }
}
