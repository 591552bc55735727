package com.github.dfacircuit;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The net effect of a span of input: for every entry state of the table, either the exit state
 * after consuming the span or the first undefined transition hit while doing so.
 * 
 * Two adjacent spans combine with {@link #followedBy(StateMap)} without replaying any symbol, which
 * is what lets every gate of a circuit level be computed independently of its siblings. Instances
 * are immutable.
 */
public final class StateMap {
  private final TransitionTable table;
  private final Map<State, State> exits;
  private final Map<State, UndefinedTransition> faults;
  // first input position covered and number of positions covered
  private final int offset;
  private final int span;

  private StateMap(final TransitionTable table, final Map<State, State> exits,
      final Map<State, UndefinedTransition> faults, final int offset, final int span) {
    this.table = table;
    this.exits = Collections.unmodifiableMap(exits);
    this.faults = Collections.unmodifiableMap(faults);
    this.offset = offset;
    this.span = span;
  }

  /**
   * Local transition function of one symbol sitting at {@code position} of the input.
   */
  static StateMap forSymbol(final TransitionTable table, final Symbol symbol,
      final int position) {
    final Map<State, State> exits = new HashMap<>();
    final Map<State, UndefinedTransition> faults = new HashMap<>();
    for (final State entry : table.getStates()) {
      final State exit = table.lookup(entry, symbol);
      if (exit.isUndefined()) {
        faults.put(entry, new UndefinedTransition(entry, symbol, position));
      } else {
        exits.put(entry, exit);
      }
    }
    return new StateMap(table, exits, faults, position, 1);
  }

  /**
   * This span, then {@code next} immediately to its right. A fault inside this span wins over any
   * fault of {@code next}, so the composed map always reports the leftmost one.
   */
  StateMap followedBy(final StateMap next) {
    final Map<State, State> exits = new HashMap<>();
    final Map<State, UndefinedTransition> faults = new HashMap<>();
    for (final State entry : table.getStates()) {
      final UndefinedTransition ownFault = this.faults.get(entry);
      if (ownFault != null) {
        faults.put(entry, ownFault);
        continue;
      }
      final State middle = this.exits.get(entry);
      final UndefinedTransition nextFault = next.faults.get(middle);
      if (nextFault != null) {
        faults.put(entry, nextFault);
      } else {
        exits.put(entry, next.exits.get(middle));
      }
    }
    return new StateMap(table, exits, faults, offset, span + next.span);
  }

  /**
   * Exit state reached from {@code entry}, {@link State#UNDEFINED} on a fault.
   */
  public State exitOf(final State entry) {
    final State exit = exits.get(entry);
    return exit == null ? State.UNDEFINED : exit;
  }

  public UndefinedTransition faultOf(final State entry) {
    return faults.get(entry);
  }

  /**
   * Outcome of entering the span from the table's start state.
   */
  public RunResult fromStart() {
    final State start = table.getStart();
    final UndefinedTransition fault = faults.get(start);
    if (fault != null) {
      return RunResult.aborted(fault);
    }
    final State exit = exits.get(start);
    return RunResult.completed(exit, table.isAccepting(exit));
  }

  public int getOffset() {
    return offset;
  }

  public int getSpan() {
    return span;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("StateMap [offset=").append(offset)
        .append(", span=").append(span).append(", ");
    for (final State entry : table.getStates()) {
      builder.append(entry.getId()).append("->");
      final State exit = exits.get(entry);
      builder.append(exit == null ? "!" : String.valueOf(exit.getId())).append(' ');
    }
    return builder.append(']').toString();
  }
}
