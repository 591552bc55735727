package com.github.dfacircuit;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the example automaton and its circuit reduction on the symbols given as arguments, or on
 * {@link ExampleAutomata#ACCEPT_EXAMPLE} when there are none.
 */
public final class DfaCircuitDemo {
  private static final Logger logger = LogManager.getLogger(DfaCircuitDemo.class.getSimpleName());

  public static void main(String args[]) throws AutomatonException {
    final TransitionTable table = ExampleAutomata.fourStateTable();
    final List<Symbol> input = args.length == 0 ? ExampleAutomata.acceptExample()
        : Symbol.sequence(args);

    final RunResult dfaResult = new SequentialAutomaton(table).run(input);
    logger.info(dfaResult.isAccepted() ? "DFA accepted input" : "DFA rejected input");

    try (CircuitEvaluator evaluator =
        new CircuitEvaluator(table, CircuitConfiguration.defaults())) {
      final RunResult circuitResult = evaluator.evaluate(input);
      logger.info(circuitResult.isAccepted() ? "NC1 accepted input" : "NC1 rejected input");
      logger.info(evaluator.getStatistics());
      if (!dfaResult.agreesWith(circuitResult)) {
        logger.error("DFA and NC1 disagree: " + dfaResult + " vs " + circuitResult);
      }
    }
  }

  private DfaCircuitDemo() {}
}
