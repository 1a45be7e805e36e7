package hu.advjava.stepsudoku;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/** A few well known puzzles with their solutions, used as server resources and by the command line tool. */
public enum ExamplePuzzle {
    EASY_1("Easy, solved by deduction alone",
            "003020600900305001001806400008102900700000008006708200002609500800203009005010300",
            "483921657967345821251876493548132976729564138136798245372689514814253769695417382"),
    MINIMAL_1("17 clues, needs a few guesses",
            "000000012008030000000000040120500000000004700060000000507000300000620000000100000",
            "346795812258431697971862543129576438835214769764389251517948326493627185682153974"),
    EXTREME_1("Hard, deep backtracking",
            "800000000003600000070090200050007000000045700000100030001000068008500010090000400",
            "812753649943682175675491283154237896369845721287169534521974368438526917796318452"),
    EMPTY("No clues at all",
            "000000000000000000000000000000000000000000000000000000000000000000000000000000000",
            "123456789456789123789123456231674895875912364694538217317265948542897631968341572");

    private final String title;
    private final String board;
    private final String solution;

    private ExamplePuzzle(String title, String board, String solution) {
        this.title = title;
        this.board = board;
        this.solution = solution;
    }

    public String getTitle() {
        return title;
    }

    public int[] getBoard() {
        return digits(board);
    }

    /** The solution this solver finds; for {@link #EMPTY} just one of many. */
    public int[] getSolution() {
        return digits(solution);
    }

    public String getUri() {
        return toUri.apply(name());
    }

    public static final Function<String, String> toUri = name ->
            "sudoku://examples/%s".formatted(name.toLowerCase().replace('_', '-'));

    /** Case-insensitive lookup by enum name ({@code easy_1}) or by resource URI. */
    public static Optional<ExamplePuzzle> find(String nameOrUri) {
        return Arrays.stream(values())
                .filter(e -> e.name().equalsIgnoreCase(nameOrUri) || e.getUri().equalsIgnoreCase(nameOrUri))
                .findFirst();
    }

    private static int[] digits(String s) {
        return s.chars().map(ch -> ch - '0').toArray();
    }
}
