package com.github.dfacircuit;

import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfacircuit.AutomatonException.Code;

/**
 * Walks an input through the {@link TransitionTable} one symbol at a time from the start state.
 * This is the ground truth the composition circuit is checked against.
 * 
 * Instances hold a mutable cursor and are not thread-safe; the table they read is. Create one
 * automaton per thread, they are cheap.
 */
public final class SequentialAutomaton implements AcceptanceEvaluator {
  private static final Logger logger =
      LogManager.getLogger(SequentialAutomaton.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();
  private final TransitionTable table;

  private State cursor = State.UNDEFINED;
  // number of symbols consumed since the last reset
  private int position;
  private UndefinedTransition fault;
  private boolean completed;

  public SequentialAutomaton(final TransitionTable table) throws AutomatonException {
    if (table == null) {
      throw new AutomatonException(Code.INVALID_TABLE, "Transition table cannot be null");
    }
    this.table = table;
  }

  /**
   * Go to start state.
   */
  public void reset() {
    cursor = table.getStart();
    position = 0;
    fault = null;
    completed = false;
  }

  /**
   * Feed one symbol. Returns the new cursor, or {@link State#UNDEFINED} when the table has no entry
   * for (cursor, symbol); from then on every step is a no-op until {@link #reset()}.
   */
  public State step(final Symbol symbol) {
    if (cursor.isUndefined()) {
      return cursor;
    }
    final State next = table.lookup(cursor, symbol);
    if (next.isUndefined()) {
      fault = new UndefinedTransition(cursor, symbol, position);
      logWarning(automatonId, fault.toString());
    }
    cursor = next;
    position++;
    return cursor;
  }

  /**
   * Reset, then feed every symbol in order, stopping at the first undefined transition.
   */
  public RunResult run(final List<Symbol> input) throws AutomatonException {
    if (input == null) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    reset();
    for (final Symbol symbol : input) {
      if (symbol == null) {
        throw new AutomatonException(Code.INVALID_INPUT);
      }
      if (step(symbol).isUndefined()) {
        return RunResult.aborted(fault);
      }
    }
    completed = true;
    final RunResult result = RunResult.completed(cursor, accepted());
    logDebug(automatonId, "Ran " + input.size() + " symbols: " + result);
    return result;
  }

  @Override
  public RunResult evaluate(final List<Symbol> input) throws AutomatonException {
    return run(input);
  }

  /**
   * Check if in an accepting state. Only meaningful after a completed {@link #run(List)}; an
   * aborted run is never accepted.
   */
  public boolean accepted() {
    return table.isAccepting(cursor);
  }

  public boolean isCompleted() {
    return completed;
  }

  public State getCursor() {
    return cursor;
  }

  public UndefinedTransition getFault() {
    return fault;
  }

  public String getId() {
    return automatonId;
  }

  @Override
  public TransitionTable getTable() {
    return table;
  }

  private static void logWarning(final String automatonId, final String message) {
    logger.warn(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }

}
