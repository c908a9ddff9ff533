package FSA.Model;

import java.util.BitSet;

/**
 * Worklist entry of the subset construction: a set of input states and the output state it was assigned.
 */
public record DeterminizeRecord(BitSet inputState, int outputState) {

  @Override
  public String toString() {
    return outputState + ": " + inputState;
  }
}
