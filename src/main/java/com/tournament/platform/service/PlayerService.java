package com.tournament.platform.service;

import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.NotFoundException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PlayerService {

    private static final Logger logger = LoggerFactory.getLogger(PlayerService.class);

    public static final int MAX_NAME_LENGTH = 100;
    public static final int MAX_PLAYERS = 400;

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;

    @Autowired
    public PlayerService(DocumentStore documentStore, TournamentRepository tournamentRepository) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
    }

    /**
     * Adds a player. Names are trimmed and must be unique within the tournament, ignoring case.
     */
    public Player registerPlayer(String tournamentId, String name) {
        String trimmed = validateName(name);
        Player player = documentStore.runTransaction(tx -> {
            Tournament tournament = tournamentRepository.getTournament(tx, tournamentId);
            if (tournament.isCompleted()) {
                throw new PreconditionFailedException("Tournament " + tournamentId + " is completed");
            }
            List<Player> players = tournamentRepository.findPlayers(tx, tournamentId);
            boolean duplicate = players.stream().anyMatch(existing -> existing.getName().equalsIgnoreCase(trimmed));
            if (duplicate) {
                throw new PreconditionFailedException("A player named " + trimmed + " already exists");
            }
            int capacity = tournament.getMaxPlayers() > 0 ? tournament.getMaxPlayers() : MAX_PLAYERS;
            if (players.size() >= capacity) {
                throw new PreconditionFailedException("Tournament is full (" + capacity + " players)");
            }

            Player created = Player.builder()
                .id(documentStore.generateId())
                .name(trimmed)
                .wins(0)
                .points(0)
                .scoreEvents(new ArrayList<>())
                .eliminated(false)
                .addedAt(documentStore.serverTimestamp())
                .build();
            tournamentRepository.savePlayer(tx, tournamentId, created);
            return created;
        });
        logger.info("Registered player {} ({}) in tournament {}", player.getName(), player.getId(), tournamentId);
        return player;
    }

    private static String validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidRequestException("Player name cannot be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new InvalidRequestException("Player name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    public List<Player> listPlayers(String tournamentId) {
        tournamentRepository.getTournament(documentStore, tournamentId);
        return tournamentRepository.findPlayers(documentStore, tournamentId);
    }

    public Player getPlayer(String tournamentId, String playerId) {
        return tournamentRepository.getPlayer(documentStore, tournamentId, playerId);
    }

    /**
     * Removes a player who is not seated. Participant snapshots of past rounds are kept.
     */
    public void removePlayer(String tournamentId, String playerId) {
        documentStore.runTransaction(tx -> {
            Player player = tournamentRepository.getPlayer(tx, tournamentId, playerId);
            if (player.isSeated()) {
                throw new PreconditionFailedException(
                    "Player " + player.getName() + " is seated at table " + player.getTableId() + "; delete the table first");
            }
            tx.delete(TournamentPaths.player(tournamentId, playerId));
            return null;
        });
        logger.info("Removed player {} from tournament {}", playerId, tournamentId);
    }

    /**
     * Adds to the player's points without reading them first.
     */
    public void adjustPoints(String tournamentId, String playerId, double delta) {
        try {
            documentStore.atomicIncrement(TournamentPaths.player(tournamentId, playerId), "points", delta);
        } catch (NotFoundException e) {
            throw new NotFoundException("Player not found: " + playerId);
        }
        logger.info("Adjusted points of player {} in tournament {} by {}", playerId, tournamentId, delta);
    }
}
