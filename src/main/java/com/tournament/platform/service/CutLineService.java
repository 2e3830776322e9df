package com.tournament.platform.service;

import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.model.CutLinePlan;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.RankedPlayer;
import com.tournament.platform.model.RoundMultipliers;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.repository.DocumentAccess;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Eliminations for cutline tournaments. After round {@code r} of {@code n}, the field is
 * cut to {@code 1 - r/n} of the players who started, rounded to a multiple of four.
 */
@Service
public class CutLineService {

    private static final Logger logger = LoggerFactory.getLogger(CutLineService.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final StandingsService standingsService;

    @Autowired
    public CutLineService(DocumentStore documentStore,
                          TournamentRepository tournamentRepository,
                          StandingsService standingsService) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.standingsService = standingsService;
    }

    public CutLinePlan preview(String tournamentId) {
        Tournament tournament = tournamentRepository.getTournament(documentStore, tournamentId);
        return plan(documentStore, tournament);
    }

    /**
     * Eliminates the players below the cut line when {@code confirm} is true; otherwise only
     * returns the plan. Tables of eliminated players are dissolved, unseating their
     * tablemates, so that no table is left with fewer than four players.
     */
    public CutLinePlan apply(String tournamentId, boolean confirm) {
        if (!confirm) {
            CutLinePlan plan = preview(tournamentId);
            logger.info("Cut line preview for tournament {}: {} of {} active players would be eliminated",
                tournamentId, plan.getEliminated().size(), plan.getActivePlayerCount());
            return plan;
        }

        CutLinePlan applied = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            CutLinePlan plan = plan(tx, tournament);

            Set<String> tablesToDissolve = new LinkedHashSet<>();
            for (RankedPlayer player : plan.getEliminated()) {
                if (player.getTableId() != null) {
                    tablesToDissolve.add(player.getTableId());
                }
            }
            for (String tableId : tablesToDissolve) {
                tournamentRepository.findTable(tx, tournamentId, tableId)
                    .ifPresent(table -> TableAssignmentService.dissolve(tx, tournamentId, table, tournamentRepository));
            }
            for (RankedPlayer player : plan.getEliminated()) {
                Map<String, Object> fields = new HashMap<>(TableAssignmentService.seat(null, null));
                fields.put("eliminated", true);
                fields.put("eliminatedInRound", plan.getCompletedRound());
                tx.update(TournamentPaths.player(tournamentId, player.getPlayerId()), fields);
            }
            return plan;
        });
        logger.info("Cut line after round {} of tournament {}: eliminated {} players, {} remain",
            applied.getCompletedRound(), tournamentId, applied.getEliminated().size(), applied.getTargetRemaining());
        return applied;
    }

    private CutLinePlan plan(DocumentAccess db, Tournament tournament) {
        if (!tournament.isCutline() || tournament.getTotalRounds() == null) {
            throw new PreconditionFailedException("Cut lines only apply to cutline tournaments");
        }
        if (tournament.isRoundInProgress()) {
            throw new PreconditionFailedException(
                "Round " + tournament.getCurrentRound() + " must end before the cut line is applied");
        }
        int completedRound = RoundMultipliers.from(tournamentRepository.findRounds(db, tournament.getId()))
            .getLastCompletedRound();
        if (completedRound < 1) {
            throw new PreconditionFailedException("At least one round must be completed before a cut line");
        }
        int totalRounds = tournament.getTotalRounds();
        if (completedRound >= totalRounds) {
            throw new PreconditionFailedException("No cut line after the final round");
        }

        List<Player> players = tournamentRepository.findPlayers(db, tournament.getId());
        List<RankedPlayer> ranked = standingsService.rank(db, tournament.getId(), players);

        int originalCount = players.size();
        double targetPercentage = 1.0 - (double) completedRound / totalRounds;
        int idealTarget = (int) Math.floor(originalCount * targetPercentage);
        int roundDown = (idealTarget / Table.SEATS) * Table.SEATS;
        int roundUp = ((idealTarget + Table.SEATS - 1) / Table.SEATS) * Table.SEATS;

        boolean downSplits = splitsScoreGroup(ranked, roundDown);
        boolean upSplits = splitsScoreGroup(ranked, roundUp);
        int target;
        String reason;
        if (downSplits && !upSplits) {
            target = roundUp;
            reason = "up to " + roundUp + ", avoids splitting a score group";
        } else if (!downSplits && upSplits) {
            target = roundDown;
            reason = "down to " + roundDown + ", avoids splitting a score group";
        } else if (idealTarget - roundDown < roundUp - idealTarget) {
            target = roundDown;
            reason = "down to " + roundDown + ", closer to ideal";
        } else if (roundUp - idealTarget < idealTarget - roundDown) {
            target = roundUp;
            reason = "up to " + roundUp + ", closer to ideal";
        } else {
            target = roundUp;
            reason = "up to " + roundUp + ", keeps more players";
        }
        target = Math.min(target, ranked.size());

        List<RankedPlayer> eliminated = new ArrayList<>(ranked.subList(target, ranked.size()));
        Collections.reverse(eliminated);
        return CutLinePlan.builder()
            .completedRound(completedRound)
            .totalRounds(totalRounds)
            .originalPlayerCount(originalCount)
            .activePlayerCount(ranked.size())
            .targetPercentage(targetPercentage)
            .idealTarget(idealTarget)
            .targetRemaining(target)
            .reason(reason)
            .eliminated(eliminated)
            .surviving(new ArrayList<>(ranked.subList(0, target)))
            .build();
    }

    /**
     * Whether keeping the top {@code keep} players separates players with the same
     * tournament score.
     */
    private static boolean splitsScoreGroup(List<RankedPlayer> ranked, int keep) {
        if (keep <= 0 || keep >= ranked.size()) {
            return false;
        }
        return Double.compare(ranked.get(keep - 1).getTournamentScore(), ranked.get(keep).getTournamentScore()) == 0;
    }
}
