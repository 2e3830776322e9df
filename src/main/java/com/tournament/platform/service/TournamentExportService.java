package com.tournament.platform.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.platform.dto.ExportedRound;
import com.tournament.platform.dto.IdRemapping;
import com.tournament.platform.dto.TournamentExport;
import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.exception.PreconditionFailedException;
import com.tournament.platform.exception.TournamentException;
import com.tournament.platform.model.Participant;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.Position;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.repository.DocumentMapper;
import com.tournament.platform.repository.DocumentStore;
import com.tournament.platform.repository.TournamentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Versioned JSON snapshot of a whole tournament, and its import under new ids.
 */
@Service
public class TournamentExportService {

    private static final Logger logger = LoggerFactory.getLogger(TournamentExportService.class);

    private final DocumentStore documentStore;
    private final TournamentRepository tournamentRepository;
    private final TournamentService tournamentService;
    private final DocumentMapper documentMapper;

    @Autowired
    public TournamentExportService(DocumentStore documentStore,
                                   TournamentRepository tournamentRepository,
                                   TournamentService tournamentService,
                                   DocumentMapper documentMapper) {
        this.documentStore = documentStore;
        this.tournamentRepository = tournamentRepository;
        this.tournamentService = tournamentService;
        this.documentMapper = documentMapper;
    }

    public TournamentExport export(String tournamentId) {
        Tournament tournament = tournamentRepository.getTournament(documentStore, tournamentId);
        List<ExportedRound> rounds = new ArrayList<>();
        for (Round round : tournamentRepository.findRounds(documentStore, tournamentId)) {
            rounds.add(ExportedRound.builder()
                .round(round)
                .participants(new ArrayList<>(tournamentRepository.findParticipants(documentStore, tournamentId, round.getId())))
                .build());
        }
        TournamentExport export = TournamentExport.builder()
            .exportVersion(TournamentExport.CURRENT_VERSION)
            .exportedAt(documentStore.serverTimestamp())
            .tournamentId(tournamentId)
            .tournament(tournament)
            .players(new ArrayList<>(tournamentRepository.findPlayers(documentStore, tournamentId)))
            .tables(new ArrayList<>(tournamentRepository.findTables(documentStore, tournamentId)))
            .rounds(rounds)
            .build();
        logger.info("Exported tournament {}: {} players, {} tables, {} rounds",
            tournamentId, export.getPlayers().size(), export.getTables().size(), rounds.size());
        return export;
    }

    public void writeExport(TournamentExport export, Path file) {
        try {
            objectMapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), export);
            logger.info("Wrote export of tournament {} to {}", export.getTournamentId(), file);
        } catch (IOException e) {
            throw new TournamentException("Failed to write export to " + file, "EXPORT_FAILED", e);
        }
    }

    public TournamentExport readExport(Path file) {
        try {
            return objectMapper().readValue(file.toFile(), TournamentExport.class);
        } catch (IOException e) {
            throw new TournamentException("Failed to read export from " + file, "IMPORT_FAILED", e);
        }
    }

    public Tournament importState(TournamentExport export) {
        return importState(export, new IdRemapping(documentStore::generateId));
    }

    /**
     * Writes the exported tournament under the ids given by {@code remapping}, in one
     * transaction, rewriting every reference between players, tables and participants.
     */
    public Tournament importState(TournamentExport export, IdRemapping remapping) {
        validateExport(export);

        Tournament imported = documentStore.runTransaction(tx -> {
            String tournamentId = remapping.tournamentId();
            if (tournamentRepository.findTournament(tx, tournamentId).isPresent()) {
                throw new PreconditionFailedException("Tournament " + tournamentId + " already exists");
            }

            Tournament tournament = copy(export.getTournament(), Tournament.class);
            tournament.setId(tournamentId);
            Set<String> takenCodes = tournamentService.takenCodes(tx);
            String code = tournament.getTournamentCode() == null ? null : TournamentService.normalizeCode(tournament.getTournamentCode());
            if (code == null || takenCodes.contains(code)) {
                String replacement = tournamentService.generateUniqueCode(takenCodes);
                logger.warn("Tournament code {} is already in use, imported tournament gets code {}", code, replacement);
                code = replacement;
            }
            tournament.setTournamentCode(code);
            tournamentRepository.saveTournament(tx, tournament);

            for (Player source : export.getPlayers()) {
                Player player = copy(source, Player.class);
                player.setId(remapping.playerId(source.getId()));
                player.setTableId(remapping.tableId(source.getTableId()));
                tournamentRepository.savePlayer(tx, tournamentId, player);
            }

            for (Table source : export.getTables()) {
                Table table = copy(source, Table.class);
                table.setId(remapping.tableId(source.getId()));
                List<String> members = new ArrayList<>();
                Map<String, Position> positions = new LinkedHashMap<>();
                for (String playerId : source.getPlayers()) {
                    members.add(remapping.playerId(playerId));
                }
                source.getPositions().forEach((playerId, position) -> positions.put(remapping.playerId(playerId), position));
                table.setPlayers(members);
                table.setPositions(positions);
                tournamentRepository.saveTable(tx, tournamentId, table);
            }

            for (ExportedRound source : export.getRounds()) {
                Round round = copy(source.getRound(), Round.class);
                round.setId(remapping.roundId(source.getRound().getId()));
                tournamentRepository.saveRound(tx, tournamentId, round);
                for (Participant participant : source.getParticipants()) {
                    String playerId = remapping.playerId(participant.getPlayerId());
                    tournamentRepository.saveParticipant(tx, tournamentId, round.getId(), participant.toBuilder()
                        .id(playerId)
                        .playerId(playerId)
                        .tableId(remapping.tableId(participant.getTableId()))
                        .build());
                }
            }
            return tournament;
        });
        logger.info("Imported tournament {} from export of {} as {} (code {})",
            imported.getName(), export.getTournamentId(), imported.getId(), imported.getTournamentCode());
        return imported;
    }

    private void validateExport(TournamentExport export) {
        if (export == null || export.getTournament() == null) {
            throw new InvalidRequestException("Export contains no tournament");
        }
        if (!TournamentExport.CURRENT_VERSION.equals(export.getExportVersion())) {
            throw new InvalidRequestException("Unsupported export version: " + export.getExportVersion());
        }
        for (ExportedRound round : export.getRounds()) {
            if (round.getRound() == null) {
                throw new InvalidRequestException("Export contains a round without data");
            }
        }
    }

    private <T> T copy(T source, Class<T> type) {
        return documentMapper.fromDocument(documentMapper.toDocument(source), type);
    }

    private ObjectMapper objectMapper() {
        return documentMapper.getObjectMapper();
    }
}
