package FSA.Format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import FSA.Model.Automaton;
import FSA.Model.AutomatonBuilder;
import FSA.Model.NamedAutomaton;
import FSA.Model.Transition;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.exception.FormatException;

/**
 * Line-oriented automaton format.
 * <pre>
 * States
 * 3
 * q0 q1 q2
 * Initial state
 * q0
 * Accepting states
 * 1
 * q2
 * Alphabet
 * 2
 * a b
 * Transitions
 * 3
 * q0 a q1
 * q1 -1 q2
 * q2 b q2
 * </pre>
 * Every counted section is a header, a count line and that many whitespace separated items, possibly spread over
 * several lines. Transitions are one per line, {@code -1} denoting epsilon. The initial state section is optional and
 * defaults to the first listed state. Blank lines and lines starting with {@code #} are skipped. Spanish headers
 * ({@code Estados}, {@code Estados de aceptación}, {@code Alfabeto}, {@code Transiciones}) are accepted too.
 */
public final class TextFormat {
    public static final String EPSILON = "-1";

    private TextFormat() {}

    private enum Section {
        STATES, INITIAL, ACCEPTING, ALPHABET, TRANSITIONS;

        static Section of(String line) {
            return switch (line.toLowerCase(Locale.ROOT)) {
                case "states", "estados" -> STATES;
                case "initial state", "initial", "estado inicial" -> INITIAL;
                case "accepting states", "estados de aceptación", "estados de aceptacion" -> ACCEPTING;
                case "alphabet", "alfabeto" -> ALPHABET;
                case "transitions", "transiciones" -> TRANSITIONS;
                default -> null;
            };
        }
    }

    private record Token(String value, int line) { }

    private record RawTransition(String source, String symbol, String target, int line) { }

    public static Automaton<String> read(Path path) throws IOException, FormatException {
        return readNamed(path).automaton();
    }

    public static NamedAutomaton<String> readNamed(Path path) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseNamed(reader);
        }
    }

    /**
     * Malformed UTF-8 fails with a {@link java.nio.charset.CharacterCodingException}, as in {@link #read(Path)}.
     */
    public static Automaton<String> parse(InputStream is) throws IOException, FormatException {
        return parse(new InputStreamReader(is, StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)));
    }

    public static Automaton<String> parse(Reader input) throws IOException, FormatException {
        return parseNamed(input).automaton();
    }

    /**
     * Parse, keeping the declared state names by index.
     */
    public static NamedAutomaton<String> parseNamed(Reader input) throws IOException, FormatException {
        final BufferedReader reader = input instanceof BufferedReader b ? b : new BufferedReader(input);

        final List<Token> states = new ArrayList<>();
        final List<Token> accepting = new ArrayList<>();
        final List<Token> symbols = new ArrayList<>();
        final List<RawTransition> transitions = new ArrayList<>();
        Token initial = null;

        Section section = null;
        int expected = -1; // -1: count line pending
        int found = 0;
        int sectionLine = 0;
        int lineNo = 0;
        boolean seenStates = false;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            final Section header = Section.of(line);
            if (header != null) {
                checkComplete(section, expected, found, sectionLine);
                section = header;
                sectionLine = lineNo;
                expected = header == Section.INITIAL ? 1 : -1;
                found = 0;
                seenStates |= header == Section.STATES;
                continue;
            }
            if (section == null) {
                throw error(lineNo, "Unexpected line before any section header: '" + line + "'");
            }

            if (expected < 0) {
                expected = parseCount(line, lineNo);
                continue;
            }

            final String[] tokens = line.split("\\s+");
            if (section == Section.TRANSITIONS) {
                if (found == expected) {
                    throw error(lineNo, "More transitions than the declared " + expected);
                }
                if (tokens.length != 3) {
                    throw error(lineNo, "Transition needs <source> <symbol> <target>, got '" + line + "'");
                }
                transitions.add(new RawTransition(tokens[0], tokens[1], tokens[2], lineNo));
                found++;
                continue;
            }

            for (String token : tokens) {
                if (found == expected) {
                    throw error(lineNo, "More items than the declared " + expected + " in section " + section);
                }
                final Token t = new Token(token, lineNo);
                switch (section) {
                    case STATES -> states.add(t);
                    case INITIAL -> initial = t;
                    case ACCEPTING -> accepting.add(t);
                    case ALPHABET -> symbols.add(t);
                    default -> throw new IllegalStateException("Unhandled section " + section);
                }
                found++;
            }
        }
        checkComplete(section, expected, found, sectionLine);

        if (!seenStates || states.isEmpty()) {
            throw error(lineNo, "No states declared");
        }
        return build(states, initial, accepting, symbols, transitions);
    }

    private static NamedAutomaton<String> build(List<Token> states, Token initial, List<Token> accepting,
                                           List<Token> symbols, List<RawTransition> transitions) throws FormatException {
        final List<String> alphabetSymbols = new ArrayList<>();
        for (Token symbol : symbols) {
            if (EPSILON.equals(symbol.value())) {
                throw error(symbol.line(), "'" + EPSILON + "' is reserved for epsilon transitions");
            }
            if (alphabetSymbols.contains(symbol.value())) {
                throw error(symbol.line(), "Duplicate symbol '" + symbol.value() + "'");
            }
            alphabetSymbols.add(symbol.value());
        }
        final Alphabet<String> alphabet = Alphabets.fromCollection(alphabetSymbols);
        final AutomatonBuilder<String> builder = Automaton.builder(alphabet);

        final Map<String, Integer> index = new LinkedHashMap<>();
        for (Token state : states) {
            if (index.containsKey(state.value())) {
                throw error(state.line(), "Duplicate state '" + state.value() + "'");
            }
            index.put(state.value(), builder.addState(false));
        }
        builder.setInitial(initial == null ? 0 : lookup(index, initial.value(), initial.line()));
        for (Token state : accepting) {
            builder.setAccepting(lookup(index, state.value(), state.line()), true);
        }
        for (RawTransition t : transitions) {
            final int source = lookup(index, t.source(), t.line());
            final int target = lookup(index, t.target(), t.line());
            if (EPSILON.equals(t.symbol())) {
                builder.addEpsilonTransition(source, target);
            } else if (alphabet.contains(t.symbol())) {
                builder.addTransition(source, t.symbol(), target);
            } else {
                throw error(t.line(), "Unknown symbol '" + t.symbol() + "'");
            }
        }
        return new NamedAutomaton<>(builder.build(), new ArrayList<>(index.keySet()));
    }

    private static int lookup(Map<String, Integer> index, String name, int line) throws FormatException {
        final Integer state = index.get(name);
        if (state == null) {
            throw error(line, "Unknown state '" + name + "'");
        }
        return state;
    }

    private static int parseCount(String line, int lineNo) throws FormatException {
        try {
            final int count = Integer.parseInt(line);
            if (count < 0) {
                throw error(lineNo, "Negative count " + count);
            }
            return count;
        } catch (NumberFormatException e) {
            throw error(lineNo, "Expected a count, got '" + line + "'");
        }
    }

    private static void checkComplete(Section section, int expected, int found, int sectionLine) throws FormatException {
        if (section == null) {
            return;
        }
        if (expected < 0) {
            throw error(sectionLine, "Section " + section + " has no count");
        }
        if (found < expected) {
            throw error(sectionLine, "Section " + section + " declares " + expected + " items but has " + found);
        }
    }

    private static FormatException error(int line, String message) {
        return new FormatException("line " + line + ": " + message);
    }

    /**
     * Write states by index, so that parsing the output yields an equal automaton.
     */
    public static void write(Automaton<?> automaton, Writer out) throws IOException {
        write(automaton, null, out);
    }

    /**
     * Write with the given state names; parsing the output still yields an equal automaton.
     * @param stateNames - one distinct name per state, or null to name states by index
     * @throws IllegalArgumentException if a state name or symbol would not read back as written: empty, containing
     * whitespace, starting with {@code #}, or equal to a section header; symbols may also not be {@code -1}
     */
    public static void write(Automaton<?> automaton, List<String> stateNames, Writer out) throws IOException {
        final String nl = System.lineSeparator();
        final int size = automaton.size();
        final List<String> names = stateNames(size, stateNames);

        out.write("States" + nl + size + nl);
        out.write(itemLine(names) + nl);

        out.write("Initial state" + nl + names.get(automaton.getInitialState()) + nl);

        final BitSet accepting = automaton.getAcceptingStates();
        out.write("Accepting states" + nl + accepting.cardinality() + nl);
        if (!accepting.isEmpty()) {
            final List<String> items = new ArrayList<>();
            for (int q = accepting.nextSetBit(0); q >= 0; q = accepting.nextSetBit(q + 1)) {
                items.add(names.get(q));
            }
            out.write(itemLine(items) + nl);
        }

        out.write("Alphabet" + nl + automaton.numInputs() + nl);
        if (automaton.numInputs() > 0) {
            final List<String> items = new ArrayList<>();
            for (Object symbol : automaton.getInputAlphabet()) {
                final String name = String.valueOf(symbol);
                if (name.equals(EPSILON)) {
                    throw new IllegalArgumentException("Symbol '" + name + "' is reserved for epsilon transitions");
                }
                checkToken(name, "Symbol");
                items.add(name);
            }
            out.write(itemLine(items) + nl);
        }

        out.write("Transitions" + nl + automaton.transitionCount() + nl);
        for (int q = 0; q < size; q++) {
            for (Transition<?> t : automaton.getTransitions(q)) {
                out.write(names.get(t.source()) + " " + (t.isEpsilon() ? EPSILON : String.valueOf(t.symbol())) + " "
                    + names.get(t.target()) + nl);
            }
        }
        out.flush();
    }

    private static List<String> stateNames(int size, List<String> stateNames) {
        if (stateNames == null) {
            final List<String> names = new ArrayList<>(size);
            for (int q = 0; q < size; q++) {
                names.add(String.valueOf(q));
            }
            return names;
        }
        if (stateNames.size() != size) {
            throw new IllegalArgumentException(stateNames.size() + " state names for " + size + " states");
        }
        if (new HashSet<>(stateNames).size() != size) {
            throw new IllegalArgumentException("State names are not distinct: " + stateNames);
        }
        for (String name : stateNames) {
            checkToken(name, "State name");
        }
        return stateNames;
    }

    // a token must read back as the same single item
    private static void checkToken(String name, String what) {
        if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(what + " '" + name + "' is empty or contains whitespace");
        }
        if (name.startsWith("#")) {
            throw new IllegalArgumentException(what + " '" + name + "' would be read as a comment");
        }
        if (Section.of(name) != null) {
            throw new IllegalArgumentException(what + " '" + name + "' would be read as a section header");
        }
    }

    // "estado inicial" is a header even though neither word is
    private static String itemLine(List<String> items) {
        final String line = String.join(" ", items);
        if (Section.of(line) != null) {
            throw new IllegalArgumentException("Items " + items + " would be read as a section header");
        }
        return line;
    }

    public static void write(Automaton<?> automaton, Path path) throws IOException {
        write(automaton, null, path);
    }

    public static void write(Automaton<?> automaton, List<String> stateNames, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(automaton, stateNames, writer);
        }
    }

    public static String serialize(Automaton<?> automaton) {
        final StringWriter sw = new StringWriter();
        try {
            write(automaton, sw);
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringWriter does not throw
        }
        return sw.toString();
    }
}
