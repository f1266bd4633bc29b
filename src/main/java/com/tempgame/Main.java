package com.tempgame;

import static com.google.common.base.Preconditions.checkArgument;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;

import com.google.common.base.Stopwatch;
import com.tempgame.model.Player;
import com.tempgame.model.TargetSet;
import com.tempgame.model.TemporalGraph;
import com.tempgame.model.UnknownVertexException;
import com.tempgame.output.Formatter;
import com.tempgame.parser.GraphParser;
import com.tempgame.parser.MalformedInputException;
import com.tempgame.parser.TargetParser;
import com.tempgame.solver.BackwardInductionSolver;
import com.tempgame.solver.Retention;
import com.tempgame.solver.SolverOptions;
import com.tempgame.solver.StrategyExtractor;
import com.tempgame.solver.TargetPolicy;
import com.tempgame.solver.WinningSetTable;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;

@Command(
    name = "tempgame",
    mixinStandardHelpOptions = true,
    version = "Temporal Reachability Game Solver 0.1",
    description = "Computes the vertices from which a player can force a visit to a target set by a deadline "
        + "in a temporal graph with punctual edges")
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int EXIT_UNKNOWN_VERTEX = 3;
    static final int EXIT_MALFORMED_INPUT = 4;

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    @Parameters(index = "0", paramLabel = "<graph>", description = "Temporal graph file")
    private Path graphFile;

    @Parameters(index = "1", paramLabel = "<target>", description = "Comma-separated target vertices")
    private String target;

    @Parameters(index = "2", paramLabel = "<deadline>", description = "Time by which the target has to be visited")
    private int deadline;

    @Option(
        names = {"--format"},
        description = "Graph file format. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private GraphParser.Format format = GraphParser.Format.AUTO;

    @Option(
        names = {"--reacher"},
        description = "Player trying to reach the target. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Player reacher = Player.CONTROLLER;

    @Option(
        names = {"--policy"},
        description = "When a target visit counts. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private TargetPolicy policy = TargetPolicy.BY_DEADLINE;

    @Option(
        names = {"--retention"},
        description = "Rows of the table to keep. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private Retention retention = Retention.ALL;

    @Option(
        names = {"--no-periodicity"},
        description = "Compute every step instead of replaying detected cycles")
    private boolean noPeriodicity = false;

    @Option(
        names = {"--threads"},
        description = "Threads evaluating a single step, default: ${DEFAULT-VALUE}")
    private int threads = 1;

    @Option(
        names = {"--max-tracked-states"},
        description = "States remembered for cycle detection, default: ${DEFAULT-VALUE}")
    private int maxTrackedStates = SolverOptions.DEFAULT_MAX_TRACKED_STATES;

    @Option(
        names = {"--table"},
        description = "Write every retained row instead of only time 0")
    private boolean writeTable = false;

    @Option(
        names = {"--strategy"},
        description = "Write the witnessing moves of each time step")
    private boolean writeStrategy = false;

    @Option(
        names = {"-O", "--output"},
        description = "Destination of the results, - for standard output")
    private String writeOutput = "-";

    private Main() {}

    static CommandLine commandLine() {
        return new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionExceptionHandler(Main::handleExecutionException);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    private static int handleExecutionException(Exception ex, CommandLine commandLine,
        CommandLine.ParseResult parseResult) throws Exception {
        String kind;
        int code;
        if (ex instanceof UnknownVertexException) {
            kind = "UnknownVertex";
            code = EXIT_UNKNOWN_VERTEX;
        } else if (ex instanceof MalformedInputException) {
            kind = "MalformedInput";
            code = EXIT_MALFORMED_INPUT;
        } else if (ex instanceof IOException) {
            kind = "IOError";
            code = CommandLine.ExitCode.SOFTWARE;
        } else if (ex instanceof IllegalArgumentException) {
            kind = "InvalidArgument";
            code = CommandLine.ExitCode.SOFTWARE;
        } else {
            throw ex;
        }
        log.log(Level.FINE, "Failed", ex);
        commandLine.getErr().println("%s: %s".formatted(kind, ex.getMessage()));
        return code;
    }

    @Override
    public Integer call() throws IOException {
        checkArgument(deadline >= 0, "Deadline must be non-negative, got %s", deadline);
        checkArgument(!writeStrategy || retention == Retention.ALL, "Writing strategies requires retention ALL");

        Stopwatch overall = Stopwatch.createStarted();
        TemporalGraph graph = GraphParser.parse(graphFile, format);
        TargetSet targetSet = TargetParser.parse(target, graph);
        log.log(Level.INFO, () -> "Read %s in %s".formatted(graph, overall));

        SolverOptions options = SolverOptions.defaults()
            .withReacher(reacher)
            .withTargetPolicy(policy)
            .withRetention(retention)
            .withPeriodicityDetection(!noPeriodicity)
            .withParallelism(threads)
            .withMaxTrackedStates(maxTrackedStates);

        WinningSetTable table;
        try (BackwardInductionSolver solver = new BackwardInductionSolver(graph, options)) {
            table = solver.solve(targetSet, deadline);
        }

        PrintStream stream = open(writeOutput);
        try {
            if (writeTable) {
                Formatter.writeTable(table, graph, stream);
            } else {
                stream.println(Formatter.format(table.initial(), graph));
            }
            if (writeStrategy) {
                Formatter.writeStrategy(StrategyExtractor.of(graph, table, targetSet, options), table, stream);
            }
        } finally {
            if (stream == System.out) {
                stream.flush();
            } else {
                stream.close();
            }
        }
        log.log(Level.INFO, () -> "Solving took %s overall".formatted(overall));
        return CommandLine.ExitCode.OK;
    }
}
