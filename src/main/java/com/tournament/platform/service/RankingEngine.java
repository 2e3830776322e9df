package com.tournament.platform.service;

import com.tournament.platform.model.Participant;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.RankedPlayer;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.RoundMultipliers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders the active players of a tournament, best first. Criteria, each deciding only
 * when all earlier ones are equal:
 * <ol>
 *     <li>tournament score, higher first</li>
 *     <li>score in the last completed round, higher first</li>
 *     <li>most recent win first; players who never won go last</li>
 *     <li>table round score: the last completed round's score summed over everyone who
 *     sat at the player's table in that round, per the round's participant snapshots</li>
 *     <li>name, alphabetical (then id), so the order is strict</li>
 * </ol>
 */
@Component
public class RankingEngine {

    private static final Comparator<Scored> ORDER = Comparator
        .comparingDouble((Scored s) -> s.tournamentScore).reversed()
        .thenComparing(Comparator.comparingDouble((Scored s) -> s.roundScore).reversed())
        .thenComparing(s -> s.player.getLastWinAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(Comparator.comparingDouble((Scored s) -> s.tableRoundScore).reversed())
        .thenComparing(s -> s.player.getName(), Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
        .thenComparing(s -> s.player.getId());

    private final ScoreLedger scoreLedger;

    @Autowired
    public RankingEngine(ScoreLedger scoreLedger) {
        this.scoreLedger = scoreLedger;
    }

    /**
     * @param players every player of the tournament; eliminated players are left out of the
     *                result but still count towards their former tablemates' table score
     * @param rounds every round of the tournament
     * @param lastCompletedParticipants participant snapshots of the last completed round,
     *                                  empty when no round has completed
     */
    public List<RankedPlayer> rank(List<Player> players, List<Round> rounds, List<Participant> lastCompletedParticipants) {
        RoundMultipliers multipliers = RoundMultipliers.from(rounds);
        int lastCompleted = multipliers.getLastCompletedRound();

        Map<String, Double> roundScores = new HashMap<>();
        for (Player player : players) {
            double roundScore = lastCompleted > 0 ? scoreLedger.roundScore(player, lastCompleted, multipliers) : 0.0;
            roundScores.put(player.getId(), roundScore);
        }
        Map<String, Double> tableScores = lastCompleted > 0
            ? tableScores(lastCompletedParticipants, roundScores)
            : Map.of();

        List<Scored> scored = new ArrayList<>();
        for (Player player : players) {
            if (player.isEliminated()) {
                continue;
            }
            double roundScore = roundScores.get(player.getId());
            double tableRoundScore = lastCompleted > 0
                ? tableScores.getOrDefault(player.getId(), roundScore)
                : 0.0;
            scored.add(new Scored(player, scoreLedger.tournamentScore(player, multipliers), roundScore, tableRoundScore));
        }
        scored.sort(ORDER);

        List<RankedPlayer> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored current = scored.get(i);
            int rank = i > 0 && current.tiesWith(scored.get(i - 1)) ? ranked.get(i - 1).getRank() : i + 1;
            ranked.add(current.toRankedPlayer(i + 1, rank));
        }
        return ranked;
    }

    /**
     * Table score of every player who had a table in the round. Players without a table in
     * the snapshot are absent and count alone.
     */
    private static Map<String, Double> tableScores(List<Participant> participants, Map<String, Double> roundScores) {
        Map<String, Double> totalsByTable = new HashMap<>();
        for (Participant participant : participants) {
            if (participant.getTableId() != null) {
                totalsByTable.merge(participant.getTableId(),
                    roundScores.getOrDefault(participant.getPlayerId(), 0.0), Double::sum);
            }
        }
        Map<String, Double> byPlayer = new HashMap<>();
        for (Participant participant : participants) {
            if (participant.getTableId() != null) {
                byPlayer.put(participant.getPlayerId(), totalsByTable.get(participant.getTableId()));
            }
        }
        return byPlayer;
    }

    private static final class Scored {
        private final Player player;
        private final double tournamentScore;
        private final double roundScore;
        private final double tableRoundScore;

        Scored(Player player, double tournamentScore, double roundScore, double tableRoundScore) {
            this.player = player;
            this.tournamentScore = tournamentScore;
            this.roundScore = roundScore;
            this.tableRoundScore = tableRoundScore;
        }

        // equal on every criterion except the name
        boolean tiesWith(Scored other) {
            return Double.compare(tournamentScore, other.tournamentScore) == 0
                && Double.compare(roundScore, other.roundScore) == 0
                && Double.compare(tableRoundScore, other.tableRoundScore) == 0
                && Objects.equals(player.getLastWinAt(), other.player.getLastWinAt());
        }

        RankedPlayer toRankedPlayer(int place, int rank) {
            return RankedPlayer.builder()
                .playerId(player.getId())
                .name(player.getName())
                .place(place)
                .rank(rank)
                .tournamentScore(tournamentScore)
                .roundScore(roundScore)
                .tableRoundScore(tableRoundScore)
                .lastWinAt(player.getLastWinAt())
                .wins(player.getEffectiveWins())
                .tableId(player.getTableId())
                .position(player.getPosition())
                .build();
        }
    }
}
