package com.github.dfacircuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfacircuit.AutomatonException.Code;

/**
 * The atomic composable unit of the circuit: the transition behavior induced by a run of input
 * symbols, starting with a single symbol at a leaf.
 * 
 * A function covers a contiguous slice of the input, {@link #getOffset()} onwards. Its positions
 * never change after construction. The evaluation cursor is private to the instance and reset on
 * every {@link #eval()}, so re-evaluating is always safe and yields the same answer.
 */
public final class SymbolFunction {
  private static final Logger logger = LogManager.getLogger(SymbolFunction.class.getSimpleName());

  private final TransitionTable table;
  private final List<Symbol> positions;
  private final int offset;

  private final String functionId = UUID.randomUUID().toString();
  private volatile State cursor = State.UNDEFINED;
  private volatile RunResult lastResult;

  private SymbolFunction(final TransitionTable table, final List<Symbol> positions,
      final int offset) {
    this.table = table;
    this.positions = Collections.unmodifiableList(positions);
    this.offset = offset;
  }

  /**
   * Leaf function for the symbol found at {@code position} of the input.
   */
  public static SymbolFunction leaf(final TransitionTable table, final Symbol symbol,
      final int position) throws AutomatonException {
    if (table == null) {
      throw new AutomatonException(Code.INVALID_TABLE, "Transition table cannot be null");
    }
    if (symbol == null || position < 0) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    final List<Symbol> positions = new ArrayList<>(1);
    positions.add(symbol);
    return new SymbolFunction(table, positions, position);
  }

  /**
   * Concatenate-then-delegate: returns a new function covering this function's positions followed
   * by {@code next}'s. {@code next} must start right where this one ends, which keeps the
   * concatenation in input order.
   */
  public SymbolFunction followedBy(final SymbolFunction next) throws AutomatonException {
    if (next == null || next.table != table) {
      throw new AutomatonException(Code.INVALID_INPUT,
          "Only functions over the same transition table can be composed");
    }
    if (next.offset != offset + positions.size()) {
      throw new AutomatonException(Code.INVALID_INPUT,
          String.format("Function at offset %d cannot follow span [%d, %d)", next.offset, offset,
              offset + positions.size()));
    }
    final List<Symbol> concatenated = new ArrayList<>(positions.size() + next.positions.size());
    concatenated.addAll(positions);
    concatenated.addAll(next.positions);
    return new SymbolFunction(table, concatenated, offset);
  }

  /**
   * Reset the cursor to the table's start state and feed every position in order, stopping at the
   * first undefined transition.
   */
  public RunResult evaluate() {
    return evaluate(functionId);
  }

  /**
   * As {@link #evaluate()}, logging under the id of the circuit this function is the root of. The
   * walk only touches locals; the cursor and last result are published once it is done, so
   * concurrent evaluations of one function never see each other's progress.
   */
  RunResult evaluate(final String circuitId) {
    State current = table.getStart();
    RunResult result = null;
    for (int index = 0; index < positions.size(); index++) {
      final Symbol symbol = positions.get(index);
      final State next = table.lookup(current, symbol);
      if (next.isUndefined()) {
        final UndefinedTransition fault = new UndefinedTransition(current, symbol, offset + index);
        logWarning(circuitId, fault.toString());
        current = State.UNDEFINED;
        result = RunResult.aborted(fault);
        break;
      }
      current = next;
    }
    if (result == null) {
      result = RunResult.completed(current, table.isAccepting(current));
    }
    cursor = current;
    lastResult = result;
    return result;
  }

  /**
   * Evaluate the function on its positions from the start state. Returns true iff accepted.
   */
  public boolean eval() {
    return evaluate().isAccepted();
  }

  /**
   * Result of the last {@link #eval()}; false before any evaluation and after an aborted one.
   */
  public boolean accepted() {
    final RunResult result = lastResult;
    return result != null && result.isAccepted();
  }

  /**
   * Derive the entry->exit map of this whole slice by folding its per-symbol maps left to right.
   */
  public StateMap toStateMap() {
    StateMap map = StateMap.forSymbol(table, positions.get(0), offset);
    for (int index = 1; index < positions.size(); index++) {
      map = map.followedBy(StateMap.forSymbol(table, positions.get(index), offset + index));
    }
    return map;
  }

  public List<Symbol> getPositions() {
    return positions;
  }

  public int getOffset() {
    return offset;
  }

  public int size() {
    return positions.size();
  }

  public State getCursor() {
    return cursor;
  }

  public TransitionTable getTable() {
    return table;
  }

  public String getId() {
    return functionId;
  }

  private static void logWarning(final String circuitId, final String message) {
    logger.warn(new StringBuilder().append("[c:").append(circuitId).append("] ").append(message)
        .toString());
  }

  @Override
  public String toString() {
    return "SymbolFunction [offset=" + offset + ", positions=" + positions + "]";
  }
}
