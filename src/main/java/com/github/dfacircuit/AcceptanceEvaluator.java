package com.github.dfacircuit;

import java.util.List;

/**
 * Decides membership of an input sequence in the language of a {@link TransitionTable}. Both the
 * sequential automaton (ground truth) and the composition circuit (the reduction) implement this,
 * and both must return agreeing results for every input.
 */
public interface AcceptanceEvaluator {

  /**
   * Run the whole input from the start state and report accepted, rejected or aborted. Undefined
   * transitions are reported through {@link RunResult}, never thrown.
   */
  RunResult evaluate(final List<Symbol> input) throws AutomatonException;

  /**
   * The table this evaluator interprets.
   */
  TransitionTable getTable();

}
