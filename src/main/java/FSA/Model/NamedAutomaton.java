package FSA.Model;

import java.util.List;

/**
 * An automaton together with the names of its states, by index, as read from or written to a file.
 */
public record NamedAutomaton<I>(Automaton<I> automaton, List<String> stateNames) { }
