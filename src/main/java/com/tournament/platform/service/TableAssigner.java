package com.tournament.platform.service;

import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.model.AssignmentAlgorithm;
import com.tournament.platform.model.AssignmentPlan;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Splits eligible players into tables of four. Pure: nothing is written here.
 * <p>
 * The players passed in must already be in ranking order (best first) for the
 * {@code ranking} and {@code round_robin} algorithms. When the count is not a multiple of
 * four, the last {@code n mod 4} players of the order are left unassigned.
 */
public class TableAssigner {

    private static final Logger logger = LoggerFactory.getLogger(TableAssigner.class);

    private final Random random;

    public TableAssigner(Random random) {
        this.random = random;
    }

    public AssignmentPlan assign(List<Player> players, AssignmentAlgorithm algorithm, int upcomingRound) {
        validatePlayers(players);
        if (algorithm == null) {
            throw new InvalidRequestException("Assignment algorithm is required");
        }

        List<String> warnings = new ArrayList<>();
        AssignmentAlgorithm effective = algorithm;
        if (algorithm.needsRanking() && upcomingRound <= 1) {
            String warning = String.format("No score history before round 1, using random instead of %s",
                algorithm.getValue());
            logger.warn(warning);
            warnings.add(warning);
            effective = AssignmentAlgorithm.RANDOM;
        }

        List<Player> ordered = new ArrayList<>(players);
        if (effective == AssignmentAlgorithm.RANDOM) {
            Collections.shuffle(ordered, random);
        }

        int seatedCount = (ordered.size() / Table.SEATS) * Table.SEATS;
        List<Player> seated = ordered.subList(0, seatedCount);
        List<Player> unassigned = new ArrayList<>(ordered.subList(seatedCount, ordered.size()));
        if (!unassigned.isEmpty()) {
            logger.warn("{} players cannot be seated at full tables and stay unassigned", unassigned.size());
        }

        List<List<Player>> groups = effective == AssignmentAlgorithm.ROUND_ROBIN
            ? distribute(seated)
            : partition(seated);

        return AssignmentPlan.builder()
            .algorithm(effective)
            .groups(groups)
            .unassigned(unassigned)
            .warnings(warnings)
            .build();
    }

    private void validatePlayers(List<Player> players) {
        if (players == null) {
            throw new InvalidRequestException("Players cannot be null");
        }
        Set<String> ids = new HashSet<>();
        for (Player player : players) {
            if (!ids.add(player.getId())) {
                throw new InvalidRequestException("Player " + player.getId() + " listed more than once");
            }
        }
        if (players.size() < Table.SEATS) {
            throw new PreconditionFailedException(
                "At least " + Table.SEATS + " eligible players are required, found " + players.size());
        }
    }

    /**
     * Consecutive groups: the first four players form table 1, and so on.
     */
    private static List<List<Player>> partition(List<Player> seated) {
        List<List<Player>> groups = new ArrayList<>();
        for (int i = 0; i < seated.size(); i += Table.SEATS) {
            groups.add(new ArrayList<>(seated.subList(i, i + Table.SEATS)));
        }
        return groups;
    }

    /**
     * Deals players across tables in ranking order: the player at index {@code i} sits at
     * table {@code i mod tableCount}, so each table gets one player from every block of
     * {@code tableCount} consecutive ranks.
     */
    private static List<List<Player>> distribute(List<Player> seated) {
        int tableCount = seated.size() / Table.SEATS;
        List<List<Player>> groups = new ArrayList<>();
        for (int t = 0; t < tableCount; t++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < seated.size(); i++) {
            groups.get(i % tableCount).add(seated.get(i));
        }
        return groups;
    }
}
