package FSA;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import FSA.Format.BAFormat;
import FSA.Format.TextFormat;
import FSA.Model.Automaton;
import FSA.Model.AutomatonException;
import FSA.Model.Determinization;
import FSA.Model.NamedAutomaton;
import net.automatalib.exception.FormatException;

public class FSACommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  /**
   * Pipeline stages, used to name the failing stage in error messages.
   */
  enum Stage {
    READ, VALIDATE, TRIM, DETERMINIZE, MINIMIZE, COMBINE, CHECK, WRITE;

    String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private record Step(String flag, String operand) { }

  private static final class StageException extends Exception {
    private final Stage stage;

    StageException(Stage stage, String message, Throwable cause) {
      super(message, cause);
      this.stage = stage;
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    String format = null;
    List<Step> steps = new ArrayList<>();
    List<String> queries = new ArrayList<>();
    String equalsFile = null;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg.toLowerCase(Locale.ROOT)) {
        case "--debug" -> PowersetDeterminizer.DEBUG = true;
        case "--trim", "--determinize", "--partial", "--minimize", "--brzozowski", "--complement" ->
            steps.add(new Step(arg.toLowerCase(Locale.ROOT), null));
        case "--union", "--intersect", "--difference", "--format", "--accepts", "--equals" -> {
          // Require a value that isn't another flag
          if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
            err.println("Missing value for " + arg);
            return printUsage(err);
          }
          String value = args[++i]; // consume the value
          switch (arg.toLowerCase(Locale.ROOT)) {
            case "--format" -> format = value;
            case "--accepts" -> queries.add(value);
            case "--equals" -> equalsFile = value;
            default -> steps.add(new Step(arg.toLowerCase(Locale.ROOT), value));
          }
        }
        default -> {
          if (arg.startsWith("-")) {
            // Unknown flag
            err.println("Unknown flag " + arg);
            return printUsage(err);
          }
          positional.add(arg);
        }
      }
    }

    if (positional.size() != 2) {
      return printUsage(err);
    }
    if (format != null && !format.equalsIgnoreCase("text") && !format.equalsIgnoreCase("ba")) {
      err.println("Unknown format " + format);
      return printUsage(err);
    }
    if (steps.isEmpty()) {
      steps.add(new Step("--determinize", null)); // what the tool does by default
    }

    try {
      NamedAutomaton<String> current = read(Paths.get(positional.get(0)), format);
      out.println("Input automaton size: " + current.automaton().size());
      out.println("Alphabet size: " + current.automaton().numInputs());

      for (Step step : steps) {
        current = apply(step, current, format, out);
      }

      final Automaton<String> result = current.automaton();
      for (String query : queries) {
        List<String> word = parseWord(query);
        boolean accepted = inStage(Stage.CHECK, () -> Equivalence.accepts(result, word));
        out.println("accepts [" + query + "]: " + accepted);
      }
      if (equalsFile != null) {
        reportEquality(result, read(Paths.get(equalsFile), format).automaton(), out);
      }

      write(Paths.get(positional.get(1)), format, current);
      out.println("Wrote " + result.size() + " states to " + positional.get(1));
      return EXIT_OK;
    } catch (StageException e) {
      err.println(e.stage.label() + ": " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static int printUsage(PrintStream err) {
    err.println("FSA [flags] <input automaton> <output automaton>");
    err.println("[--debug] : Additional debug/progress output");
    err.println("[--format text|ba] : File format; default by extension (.ba is BA, anything else text)");
    err.println();
    err.println("Transformations, applied in the given order (default: --determinize):");
    err.println("  --trim: remove unreachable and dead states.");
    err.println("  --determinize: subset construction, completed with a sink state.");
    err.println("  --partial: subset construction without a sink state.");
    err.println("  --minimize: minimal complete DFA by partition refinement.");
    err.println("  --brzozowski: minimal complete DFA by Brzozowski's double-reversal algorithm.");
    err.println("  --complement: complement language.");
    err.println("  --union <file>, --intersect <file>, --difference <file>: combine with another automaton.");
    err.println();
    err.println("Queries on the result:");
    err.println("  --accepts <s1,s2,...>: whether the word is accepted; an empty value is the empty word.");
    err.println("  --equals <file>: language equality with another automaton.");
    return EXIT_USAGE;
  }

  /**
   * Apply one step. Subset construction names its states after the subsets of input states; every other step
   * leaves states named by index.
   */
  private static NamedAutomaton<String> apply(Step step, NamedAutomaton<String> input, String format, PrintStream out)
      throws StageException {
    long before = System.currentTimeMillis();
    final Automaton<String> automaton = input.automaton();
    if (step.flag().equals("--determinize") || step.flag().equals("--partial")) {
      final boolean complete = step.flag().equals("--determinize");
      final Determinization<String> det =
          inStage(Stage.DETERMINIZE, () -> PowersetDeterminizer.determinizeWithSubsets(automaton, complete));
      report(step, automaton, det.automaton(), before, out);
      return new NamedAutomaton<>(det.automaton(), det.labels(input.stateNames()));
    }
    Automaton<String> result = switch (step.flag()) {
      case "--trim" -> inStage(Stage.TRIM, () -> NFATrim.trim(automaton));
      case "--minimize" -> inStage(Stage.MINIMIZE, () -> Minimizer.minimize(automaton));
      case "--brzozowski" -> inStage(Stage.MINIMIZE, () -> Minimizer.brzozowski(automaton));
      case "--complement" -> inStage(Stage.COMBINE, () -> BooleanOperations.complement(automaton));
      default -> {
        Automaton<String> operand = read(Paths.get(step.operand()), format).automaton();
        yield switch (step.flag()) {
          case "--union" -> inStage(Stage.COMBINE, () -> BooleanOperations.union(automaton, operand));
          case "--intersect" -> inStage(Stage.COMBINE, () -> BooleanOperations.intersection(automaton, operand));
          case "--difference" -> inStage(Stage.COMBINE, () -> BooleanOperations.difference(automaton, operand));
          default -> throw new IllegalStateException("Unexpected step: " + step.flag());
        };
      }
    };
    report(step, automaton, result, before, out);
    return new NamedAutomaton<>(result, null);
  }

  private static void report(Step step, Automaton<String> input, Automaton<String> result, long before,
                             PrintStream out) {
    long after = System.currentTimeMillis();
    out.println(step.flag().substring(2) + ": " + input.size() + " -> " + result.size() + " states ("
        + ((after - before) / 1000f) + "s)");
  }

  private static void reportEquality(Automaton<String> automaton, Automaton<String> other, PrintStream out)
      throws StageException {
    Optional<List<String>> separating = inStage(Stage.CHECK, () -> Equivalence.findSeparatingWord(automaton, other));
    if (separating.isEmpty()) {
      out.println("equals: true");
    } else {
      out.println("equals: false, separating word [" + String.join(",", separating.get()) + "]");
    }
  }

  static List<String> parseWord(String value) {
    if (value.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(value.split(","));
  }

  private static boolean isBA(Path path, String format) {
    if (format != null) {
      return format.equalsIgnoreCase("ba");
    }
    return path.getFileName() != null && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".ba");
  }

  // BA files keep no state names
  private static NamedAutomaton<String> read(Path path, String format) throws StageException {
    try {
      return isBA(path, format) ? new NamedAutomaton<>(BAFormat.read(path), null) : TextFormat.readNamed(path);
    } catch (IOException e) {
      throw new StageException(Stage.READ, "Failed to read " + path + ": " + e.getMessage(), e);
    } catch (FormatException | AutomatonException e) {
      throw new StageException(Stage.VALIDATE, path + ": " + e.getMessage(), e);
    }
  }

  private static void write(Path path, String format, NamedAutomaton<String> named) throws StageException {
    try {
      if (isBA(path, format)) {
        BAFormat.write(named.automaton(), path);
      } else {
        TextFormat.write(named.automaton(), named.stateNames(), path);
      }
    } catch (IOException | FormatException | IllegalArgumentException e) {
      throw new StageException(Stage.WRITE, "Failed to write " + path + ": " + e.getMessage(), e);
    }
  }

  private interface StageAction<T> {
    T get();
  }

  private static <T> T inStage(Stage stage, StageAction<T> action) throws StageException {
    try {
      return action.get();
    } catch (AutomatonException | IllegalStateException | IllegalArgumentException e) {
      throw new StageException(stage, e.getMessage(), e);
    }
  }
}
