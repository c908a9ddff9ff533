package FSA.Format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import FSA.Model.AutomataLibAdapter;
import FSA.Model.Automaton;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * BA format, described at https://languageinclusion.org/doku.php?id=tools.
 * <p>
 * We just use the parser and writer from AutomataLib and convert from/to a {@code CompactNFA<String>}.
 */
public final class BAFormat {

    private BAFormat() {}

    public static Automaton<String> parse(InputStream is) throws IOException, FormatException {
        final CompactNFA<String> automaton = BAParsers.nfa().readModel(is).model;
        return AutomataLibAdapter.fromNFA(automaton, automaton.getInputAlphabet());
    }

    public static Automaton<String> read(Path path) throws IOException, FormatException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    /**
     * A BA file without accepting states reads as "every state accepts", so an automaton without accepting states
     * is written with an extra unreachable accepting state.
     * @throws FormatException if the automaton has epsilon transitions, which BA cannot express
     */
    public static <I> void write(Automaton<I> automaton, OutputStream os) throws IOException, FormatException {
        if (automaton.hasEpsilonTransitions()) {
            throw new FormatException("BA format cannot express epsilon transitions; determinize first");
        }
        final CompactNFA<I> nfa = AutomataLibAdapter.toCompactNFA(automaton);
        if (automaton.getAcceptingStates().isEmpty()) {
            nfa.addState(true);
        }
        new BAWriter<I>().writeModel(os, nfa, automaton.getInputAlphabet());
    }

    public static <I> void write(Automaton<I> automaton, Path path) throws IOException, FormatException {
        try (OutputStream os = Files.newOutputStream(path)) {
            write(automaton, os);
        }
    }
}
