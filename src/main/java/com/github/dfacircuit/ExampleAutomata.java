package com.github.dfacircuit;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.github.dfacircuit.TransitionTable.TransitionTableBuilder;

/**
 * Ready-made tables for demos and tests.
 */
public final class ExampleAutomata {
  public static final List<String> ACCEPT_EXAMPLE = Collections
      .unmodifiableList(Arrays.asList("alpha", "beta", "beta", "gamma", "phi", "gamma"));
  public static final List<String> REJECT_EXAMPLE = Collections
      .unmodifiableList(Arrays.asList("alpha", "beta", "beta", "gamma", "phi", "phi"));

  /**
   * States {0,1,2,3} over {alpha,beta,gamma,phi}, start 0, accepting {2,3}. From any state alpha,
   * beta and gamma move to 1, 2 and 3 respectively and phi returns to 0.
   */
  public static TransitionTable fourStateTable() throws AutomatonException {
    return fourStateBuilder().build();
  }

  /**
   * The four state table with the (1, gamma) entry missing.
   */
  public static TransitionTable partialFourStateTable() throws AutomatonException {
    final TransitionTableBuilder builder = TransitionTableBuilder.newBuilder().states(0, 1, 2, 3)
        .alphabet("alpha", "beta", "gamma", "phi").start(0).accepting(2, 3);
    for (int from = 0; from <= 3; from++) {
      builder.transition(from, "alpha", 1).transition(from, "beta", 2).transition(from, "phi", 0);
      if (from != 1) {
        builder.transition(from, "gamma", 3);
      }
    }
    return builder.build();
  }

  /**
   * Counts symbols modulo {@code modulus}: accepts inputs whose length is a multiple of it.
   */
  public static TransitionTable lengthModuloTable(final int modulus) throws AutomatonException {
    final TransitionTableBuilder builder =
        TransitionTableBuilder.newBuilder().alphabet("a", "b").start(0).accepting(0);
    for (int state = 0; state < modulus; state++) {
      builder.states(state).transition(state, "a", (state + 1) % modulus)
          .transition(state, "b", (state + 1) % modulus);
    }
    return builder.build();
  }

  public static List<Symbol> acceptExample() throws AutomatonException {
    return Symbol.sequence(ACCEPT_EXAMPLE);
  }

  public static List<Symbol> rejectExample() throws AutomatonException {
    return Symbol.sequence(REJECT_EXAMPLE);
  }

  private static TransitionTableBuilder fourStateBuilder() {
    return TransitionTableBuilder.newBuilder().states(0, 1, 2, 3)
        .alphabet("alpha", "beta", "gamma", "phi").transitionFromAll("alpha", 1)
        .transitionFromAll("beta", 2).transitionFromAll("gamma", 3).transitionFromAll("phi", 0)
        .start(0).accepting(2, 3);
  }

  private ExampleAutomata() {}
}
