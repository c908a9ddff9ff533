package FSA.Format;

import FSA.Equivalence;
import FSA.Minimizer;
import FSA.NFATrim;
import FSA.PowersetDeterminizer;
import FSA.TestAutomata;
import FSA.Model.Automaton;
import net.automatalib.exception.FormatException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

public class BAFormatTest {
  private static Path getFilePath(String resourcePath) throws URISyntaxException {
    return Paths.get(Objects.requireNonNull(
        BAFormatTest.class.getClassLoader().getResource(resourcePath)).toURI());
  }

  @Test
  void testSmallBA() throws URISyntaxException, IOException, FormatException {
    Path filePath = getFilePath("ends-with-b.ba");
    Assertions.assertTrue(filePath.toFile().exists());
    Automaton<String> nfa = BAFormat.read(filePath);
    Assertions.assertEquals(2, nfa.size());
    Assertions.assertEquals(2, nfa.numInputs());
    Assertions.assertEquals(3, nfa.transitionCount());
    for (List<String> word : TestAutomata.allWords(TestAutomata.ab(), 5)) {
      boolean endsWithB = !word.isEmpty() && word.get(word.size() - 1).equals("b");
      Assertions.assertEquals(endsWithB, Equivalence.accepts(nfa, word), word.toString());
    }
    Assertions.assertTrue(Equivalence.languageEquals(TestAutomata.endsWithB(), nfa));
  }

  @Test
  void testRoundTrip() throws IOException, FormatException {
    Automaton<String> dfa = PowersetDeterminizer.determinize(TestAutomata.endsWithB());
    ByteArrayOutputStream os = new ByteArrayOutputStream();
    BAFormat.write(dfa, os);
    Automaton<String> back = BAFormat.parse(new ByteArrayInputStream(os.toByteArray()));
    Assertions.assertTrue(Equivalence.languageEquals(dfa, back));
  }

  @Test
  void testEmptyLanguageRoundTrip(@TempDir Path dir) throws IOException, FormatException {
    Automaton<String> empty = NFATrim.emptyLanguage(TestAutomata.ab());
    Path file = dir.resolve("empty.ba");
    BAFormat.write(empty, file);
    Automaton<String> back = BAFormat.read(file);
    Assertions.assertTrue(Equivalence.isEmpty(back));
    Assertions.assertEquals(1, NFATrim.trim(Minimizer.minimize(back)).size());
  }

  @Test
  void testEpsilonNotWritable() {
    Assertions.assertThrows(FormatException.class,
        () -> BAFormat.write(TestAutomata.epsilonExample(), new ByteArrayOutputStream()));
  }
}
