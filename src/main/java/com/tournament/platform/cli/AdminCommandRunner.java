package com.tournament.platform.cli;

import com.tournament.platform.dto.CreateTournamentRequest;
import com.tournament.platform.dto.RoundOptions;
import com.tournament.platform.dto.TournamentExport;
import com.tournament.platform.exception.InvalidRequestException;
import com.tournament.platform.model.AssignmentAlgorithm;
import com.tournament.platform.model.AssignmentResult;
import com.tournament.platform.model.CutLinePlan;
import com.tournament.platform.model.IntegrityWarning;
import com.tournament.platform.model.Player;
import com.tournament.platform.model.RankedPlayer;
import com.tournament.platform.model.RepairReport;
import com.tournament.platform.model.Round;
import com.tournament.platform.model.Table;
import com.tournament.platform.model.Tournament;
import com.tournament.platform.model.TournamentType;
import com.tournament.platform.service.CutLineService;
import com.tournament.platform.service.IntegrityAuditService;
import com.tournament.platform.service.PlayerService;
import com.tournament.platform.service.RoundLifecycleService;
import com.tournament.platform.service.ScoreEventRepairService;
import com.tournament.platform.service.StandingsService;
import com.tournament.platform.service.TableAssignmentService;
import com.tournament.platform.service.TournamentExportService;
import com.tournament.platform.service.TournamentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Runs a single operator command when the application is started with
 * {@code --command=<name>}, for example:
 * <pre>
 * --command=start-round --tournament=ABCD
 * --command=auto-assign --tournament=ABCD --algorithm=round_robin
 * --command=cutline --tournament=ABCD --confirm
 * --command=repair-scores --tournament=ABCD --live
 * </pre>
 * {@code --tournament} accepts a tournament id or its four-character code.
 */
@Component
public class AdminCommandRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AdminCommandRunner.class);

    private final TournamentService tournamentService;
    private final PlayerService playerService;
    private final RoundLifecycleService roundLifecycleService;
    private final TableAssignmentService tableAssignmentService;
    private final StandingsService standingsService;
    private final CutLineService cutLineService;
    private final ScoreEventRepairService scoreEventRepairService;
    private final IntegrityAuditService integrityAuditService;
    private final TournamentExportService tournamentExportService;
    private final Map<String, Consumer<ApplicationArguments>> commands;

    @Autowired
    public AdminCommandRunner(TournamentService tournamentService,
                              PlayerService playerService,
                              RoundLifecycleService roundLifecycleService,
                              TableAssignmentService tableAssignmentService,
                              StandingsService standingsService,
                              CutLineService cutLineService,
                              ScoreEventRepairService scoreEventRepairService,
                              IntegrityAuditService integrityAuditService,
                              TournamentExportService tournamentExportService) {
        this.tournamentService = tournamentService;
        this.playerService = playerService;
        this.roundLifecycleService = roundLifecycleService;
        this.tableAssignmentService = tableAssignmentService;
        this.standingsService = standingsService;
        this.cutLineService = cutLineService;
        this.scoreEventRepairService = scoreEventRepairService;
        this.integrityAuditService = integrityAuditService;
        this.tournamentExportService = tournamentExportService;
        this.commands = registerCommands();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("command")) {
            return;
        }
        String command = required(args, "command");
        logger.info("Running command {}", command);
        execute(command, args);
    }

    void execute(String command, ApplicationArguments args) {
        Consumer<ApplicationArguments> handler = commands.get(command);
        if (handler == null) {
            throw new InvalidRequestException("Unknown command: " + command + ", expected one of " + commands.keySet());
        }
        handler.accept(args);
    }

    private Map<String, Consumer<ApplicationArguments>> registerCommands() {
        Map<String, Consumer<ApplicationArguments>> handlers = new LinkedHashMap<>();
        handlers.put("create-tournament", this::createTournament);
        handlers.put("add-player", args -> {
            Player player = playerService.registerPlayer(tournamentId(args), required(args, "name"));
            logger.info("Player {} added with id {}", player.getName(), player.getId());
        });
        handlers.put("stage-round", this::stageRound);
        handlers.put("start-round", args -> {
            Round round = roundLifecycleService.startRound(tournamentId(args));
            logger.info("Round {} started", round.getRoundNumber());
        });
        handlers.put("end-round", args -> {
            Round round = roundLifecycleService.endRound(tournamentId(args));
            logger.info("Round {} ended", round.getRoundNumber());
        });
        handlers.put("reopen-round", args -> {
            Round round = roundLifecycleService.reopenRound(tournamentId(args));
            logger.info("Round {} reopened", round.getRoundNumber());
        });
        handlers.put("record-win", args -> {
            String tournamentId = tournamentId(args);
            String playerId = required(args, "player");
            String delta = optional(args, "delta");
            roundLifecycleService.recordGame(tournamentId, playerId, null, delta != null ? parseInt("delta", delta) : 1);
        });
        handlers.put("auto-assign", this::autoAssign);
        handlers.put("clear-tables", args -> {
            int cleared = tableAssignmentService.clearTables(tournamentId(args));
            logger.info("Cleared {} tables", cleared);
        });
        handlers.put("standings", args -> printStandings(standingsService.standings(tournamentId(args))));
        handlers.put("cutline", this::cutLine);
        handlers.put("repair-scores", args -> {
            RepairReport report = scoreEventRepairService.repair(tournamentId(args), args.containsOption("live"));
            logger.info("{} events inferred, {} unmatched{}", report.getInferred().size(),
                report.getUnmatched().size(), report.isApplied() ? "" : " (dry run, pass --live to apply)");
        });
        handlers.put("audit", args -> {
            List<IntegrityWarning> warnings = integrityAuditService.audit(tournamentId(args));
            logger.info(warnings.isEmpty() ? "No integrity problems found" : warnings.size() + " integrity warnings");
        });
        handlers.put("export", args -> {
            TournamentExport export = tournamentExportService.export(tournamentId(args));
            tournamentExportService.writeExport(export, Paths.get(required(args, "file")));
        });
        handlers.put("import", args -> {
            TournamentExport export = tournamentExportService.readExport(Paths.get(required(args, "file")));
            Tournament imported = tournamentExportService.importState(export);
            logger.info("Imported as tournament {} with code {}", imported.getId(), imported.getTournamentCode());
        });
        handlers.put("delete-tournament", args -> {
            String tournamentId = tournamentId(args);
            if (!args.containsOption("confirm")) {
                throw new InvalidRequestException("Deleting a tournament requires --confirm");
            }
            tournamentService.deleteTournament(tournamentId);
        });
        return handlers;
    }

    private void createTournament(ApplicationArguments args) {
        String type = optional(args, "type");
        String rounds = optional(args, "rounds");
        String timer = optional(args, "timer");
        String maxPlayers = optional(args, "max-players");
        CreateTournamentRequest request = CreateTournamentRequest.builder()
            .name(required(args, "name"))
            .type(type != null ? TournamentType.valueOf(type.toUpperCase(Locale.ROOT)) : TournamentType.STANDARD)
            .totalRounds(rounds != null ? parseInt("rounds", rounds) : null)
            .timerDuration(timer != null ? parseInt("timer", timer) : null)
            .maxPlayers(maxPlayers != null ? parseInt("max-players", maxPlayers) : 0)
            .tournamentCode(optional(args, "code"))
            .build();
        Tournament tournament = tournamentService.createTournament(request);
        logger.info("Tournament {} created with id {} and code {}",
            tournament.getName(), tournament.getId(), tournament.getTournamentCode());
    }

    private void stageRound(ApplicationArguments args) {
        String timer = optional(args, "timer");
        String multiplier = optional(args, "multiplier");
        RoundOptions options = RoundOptions.builder()
            .timerDuration(timer != null ? parseInt("timer", timer) : null)
            .scoreMultiplier(multiplier != null ? parseDouble("multiplier", multiplier) : null)
            .playoff(args.containsOption("playoff"))
            .build();
        Round round = roundLifecycleService.stageRound(tournamentId(args), options);
        logger.info("Round {} staged", round.getRoundNumber());
    }

    private void autoAssign(ApplicationArguments args) {
        String algorithm = optional(args, "algorithm");
        AssignmentResult result = tableAssignmentService.autoAssign(tournamentId(args),
            algorithm != null ? AssignmentAlgorithm.fromValue(algorithm) : AssignmentAlgorithm.RANDOM);
        for (Table table : result.getTables()) {
            logger.info("Table {}: {}", table.getTableNumber(), table.getPositions());
        }
        result.getWarnings().forEach(logger::warn);
    }

    private void cutLine(ApplicationArguments args) {
        CutLinePlan plan = cutLineService.apply(tournamentId(args), args.containsOption("confirm"));
        logger.info("After round {}/{}: keep {} of {} ({}; ideal {})", plan.getCompletedRound(), plan.getTotalRounds(),
            plan.getTargetRemaining(), plan.getActivePlayerCount(), plan.getReason(), plan.getIdealTarget());
        for (RankedPlayer player : plan.getEliminated()) {
            logger.info("  cut: #{} {} ({} points)", player.getPlace(), player.getName(), player.getTournamentScore());
        }
        if (!args.containsOption("confirm")) {
            logger.info("Preview only, pass --confirm to eliminate");
        }
    }

    private void printStandings(List<RankedPlayer> standings) {
        for (RankedPlayer player : standings) {
            logger.info("{}. {} score={} round={} table={} lastWin={}", player.getRank(), player.getName(),
                player.getTournamentScore(), player.getRoundScore(), player.getTableRoundScore(), player.getLastWinAt());
        }
    }

    private String tournamentId(ApplicationArguments args) {
        String reference = required(args, "tournament");
        if (reference.length() == 4) {
            return tournamentService.findByCode(reference)
                .map(Tournament::getId)
                .orElse(reference);
        }
        return reference;
    }

    private static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Missing required option --" + name);
        }
        return value;
    }

    private static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("--" + name + " must be a whole number, got " + value);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("--" + name + " must be a number, got " + value);
        }
    }
}
