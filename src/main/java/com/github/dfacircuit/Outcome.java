package com.github.dfacircuit;

/**
 * Three-valued verdict of running an input through the automaton or its circuit.
 */
public enum Outcome {
  // input consumed, final state is accepting
  ACCEPTED,
  // input consumed, final state is not accepting
  REJECTED,
  // run stopped early on an undefined transition
  ABORTED;
}
