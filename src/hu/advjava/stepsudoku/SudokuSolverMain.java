package hu.advjava.stepsudoku;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line front end.
 *
 * <pre>
 *   SudokuSolverMain [puzzle-file | example-name] [--steps]
 * </pre>
 * Without a puzzle {@link ExamplePuzzle#MINIMAL_1} is solved. Exit code 0 when solved, 1 when the solver
 * reports an error, 2 when the input could not be read.
 */
public class SudokuSolverMain {

    private static final Logger log = LogManager.getLogger(SudokuSolverMain.class);

    public static void main(String[] args) {
        System.exit(run(Arrays.asList(args), System.out));
    }

    static int run(List<String> args, PrintStream out) {
        boolean steps = args.contains("--steps");
        List<String> rest = args.stream().filter(a -> !a.equals("--steps")).collect(Collectors.toList());

        int[] puzzle;
        try {
            puzzle = rest.isEmpty() ? ExamplePuzzle.MINIMAL_1.getBoard() : read(rest.get(0));
        } catch (IOException e) {
            log.error("Cannot read puzzle {}", rest.get(0), e);
            out.println("Bad input: " + e.getMessage());
            return 2;
        }

        StepRecorder recorder = new StepRecorder();
        SolveResult result = SudokuSolver.solveWithSteps(puzzle, steps ? recorder : StepSink.NONE);

        if (steps) {
            recorder.events().stream().map(StepEvent::describe).forEach(out::println);
            out.println(recorder.summary().entrySet().stream()
                    .map(e -> e.getKey().label() + "=" + e.getValue())
                    .collect(Collectors.joining(", ", "Steps: ", "")));
        }
        if (!result.ok()) {
            out.println(result.error().map(ErrorKind::getMessage).orElse("Failed."));
            if (!result.conflicts().isEmpty()) out.println("Conflicting cells: " + result.conflicts());
            return 1;
        }
        out.println("Solved:");
        out.print(GridIO.format(result.grid().orElseThrow()));
        return 0;
    }

    private static int[] read(String arg) throws IOException {
        var example = ExamplePuzzle.find(arg);
        if (example.isPresent()) return example.get().getBoard();
        return GridIO.load(Path.of(arg));
    }
}
