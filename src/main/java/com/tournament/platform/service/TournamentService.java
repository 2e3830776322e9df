package com.tournament.platform.service;

import com.tournament.platform.dto.CreateTournamentRequest;
import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.model.TournamentStatus;
import com.tournament.platform.model.TournamentType;
import com.tournament.platform.repository.DocumentAccess;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentPaths;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class TournamentService {

    private static final Logger logger = LoggerFactory.getLogger(TournamentService.class);

    public static final int DEFAULT_TIMER_MINUTES = 5;
    static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int CODE_LENGTH = 4;
    static final int MAX_CODE_ATTEMPTS = 10;

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final RequestValidator requestValidator;
    private final Random random;

    @Autowired
    public TournamentService(DocumentStore documentStore,
                             TournamentRepository tournamentRepository,
                             RequestValidator requestValidator,
                             Random random) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.requestValidator = requestValidator;
        this.random = random;
    }

    /**
     * Creates a tournament in staging. The code is checked for uniqueness, or generated,
     * inside the same transaction that writes the tournament.
     */
    public Tournament createTournament(CreateTournamentRequest request) {
        requestValidator.validate(request);
        validateRounds(request);

        Tournament tournament = documentStore.runTransaction(tx -> {
            Set<String> takenCodes = takenCodes(tx);
            String code;
            if (request.getTournamentCode() != null) {
                code = normalizeCode(request.getTournamentCode());
                if (takenCodes.contains(code)) {
                    throw new PreconditionFailedException("Tournament code " + code + " is already in use");
                }
            } else {
                code = generateUniqueCode(takenCodes);
            }

            Tournament created = Tournament.builder()
                .id(documentStore.generateId())
                .name(request.getName().trim())
                .type(request.getType())
                .timerDuration(request.getTimerDuration() != null ? request.getTimerDuration() : DEFAULT_TIMER_MINUTES)
                .maxPlayers(request.getMaxPlayers())
                .totalRounds(request.getTotalRounds())
                .status(TournamentStatus.STAGING)
                .currentRound(0)
                .roundInProgress(false)
                .tournamentCode(code)
                .lastTableNumber(0)
                .createdAt(documentStore.serverTimestamp())
                .build();
            tournamentRepository.saveTournament(tx, created);
            return created;
        });
        logger.info("Created {} tournament '{}' with id {} and code {}",
            tournament.getType().getValue(), tournament.getName(), tournament.getId(), tournament.getTournamentCode());
        return tournament;
    }

    private void validateRounds(CreateTournamentRequest request) {
        if (request.getType() == TournamentType.CUTLINE && request.getTotalRounds() == null) {
            throw new InvalidRequestException("Cutline tournaments need a total number of rounds");
        }
        if (request.getType() == TournamentType.STANDARD && request.getTotalRounds() != null) {
            throw new InvalidRequestException("Total rounds only apply to cutline tournaments");
        }
    }

    public Tournament getTournament(String tournamentId) {
        return tournamentRepository.getTournament(documentStore, tournamentId);
    }

    public List<Tournament> listTournaments() {
        return tournamentRepository.findAllTournaments(documentStore);
    }

    /**
     * Case-insensitive lookup by tournament code.
     */
    public Optional<Tournament> findByCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return Optional.empty();
        }
        String normalized = normalizeCode(code);
        return tournamentRepository.findAllTournaments(documentStore).stream()
            .filter(tournament -> normalized.equalsIgnoreCase(tournament.getTournamentCode()))
            .findFirst();
    }

    public Tournament completeTournament(String tournamentId) {
        Tournament tournament = documentStore.runTransaction(tx -> {
            Tournament existing = tournamentRepository.getTournament(tx, tournamentId);
            if (existing.isRoundInProgress()) {
                throw new PreconditionFailedException(
                    "Round " + existing.getCurrentRound() + " is still in progress");
            }
            Instant now = documentStore.serverTimestamp();
            Map<String, Object> fields = new HashMap<>();
            fields.put("status", TournamentStatus.COMPLETED.getValue());
            fields.put("completedAt", tournamentRepository.toValue(now));
            tx.update(TournamentPaths.tournament(tournamentId), fields);
            existing.setStatus(TournamentStatus.COMPLETED);
            existing.setCompletedAt(now);
            return existing;
        });
        logger.info("Completed tournament {}", tournamentId);
        return tournament;
    }

    /**
     * Deletes the tournament with all its players, tables, rounds and participants.
     */
    public void deleteTournament(String tournamentId) {
        int deleted = documentStore.runTransaction(tx -> {
            tournamentRepository.getTournament(tx, tournamentId);
            int count = 0;
            for (Round round : tournamentRepository.findRounds(tx, tournamentId)) {
                count += deleteCollection(tx, TournamentPaths.participants(tournamentId, round.getId()));
                tx.delete(TournamentPaths.round(tournamentId, round.getId()));
                count++;
            }
            count += deleteCollection(tx, TournamentPaths.players(tournamentId));
            count += deleteCollection(tx, TournamentPaths.tables(tournamentId));
            tx.delete(TournamentPaths.tournament(tournamentId));
            return count + 1;
        });
        logger.info("Deleted tournament {} ({} documents)", tournamentId, deleted);
    }

    private static int deleteCollection(DocumentAccess db, String collectionPath) {
        List<Map<String, Object>> documents = db.list(collectionPath);
        for (Map<String, Object> document : documents) {
            db.delete(collectionPath + "/" + document.get("id"));
        }
        return documents.size();
    }

    Set<String> takenCodes(DocumentAccess db) {
        return tournamentRepository.findAllTournaments(db).stream()
            .map(Tournament::getTournamentCode)
            .filter(code -> code != null)
            .map(TournamentService::normalizeCode)
            .collect(Collectors.toSet());
    }

    /**
     * Random code not in {@code takenCodes}.
     *
     * @throws PreconditionFailedException if no free code was found within the attempt limit
     */
    String generateUniqueCode(Set<String> takenCodes) {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            StringBuilder code = new StringBuilder(CODE_LENGTH);
            for (int i = 0; i < CODE_LENGTH; i++) {
                code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
            }
            if (!takenCodes.contains(code.toString())) {
                return code.toString();
            }
        }
        throw new PreconditionFailedException(
            "Could not generate a unique tournament code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    static String normalizeCode(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
