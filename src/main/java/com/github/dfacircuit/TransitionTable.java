package com.github.dfacircuit;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfacircuit.AutomatonException.Code;

/**
 * The immutable program every evaluator interprets: a possibly partial mapping (state, symbol) ->
 * state, plus the start state and the accepting-state set.
 * 
 * Notes for users:<br>
 * 1. this table is immutable once built and therefore thread-safe. One table is meant to be shared
 * by reference across any number of automata, symbol functions and circuits.<br>
 * 
 * 2. a missing (state, symbol) entry is legal. It is a fault of the run that hits it, not of the
 * table, see {@link #lookup(State, Symbol)}.<br>
 * 
 * 3. use {@link TransitionTableBuilder} to build it. The builder only checks shape: that every
 * referenced state is declared and that the mandatory parts are present.<br>
 */
public final class TransitionTable {
  private static final Logger logger = LogManager.getLogger(TransitionTable.class.getSimpleName());

  private final SortedSet<State> states;
  private final Set<Symbol> alphabet;
  // K=(fromState, symbol), V=toState. Fully hydrated at build time, never modified afterwards.
  private final Map<TransitionKey, State> transitions;
  private final State start;
  private final Set<State> accepting;

  private TransitionTable(final SortedSet<State> states, final Set<Symbol> alphabet,
      final Map<TransitionKey, State> transitions, final State start,
      final Set<State> accepting) {
    this.states = Collections.unmodifiableSortedSet(states);
    this.alphabet = Collections.unmodifiableSet(alphabet);
    this.transitions = Collections.unmodifiableMap(transitions);
    this.start = start;
    this.accepting = Collections.unmodifiableSet(accepting);
  }

  /**
   * Returns the target state, or {@link State#UNDEFINED} when the table has no entry for the pair.
   * Looking up from {@link State#UNDEFINED} always yields {@link State#UNDEFINED}.
   */
  public State lookup(final State state, final Symbol symbol) {
    final State next = transitions.get(new TransitionKey(state, symbol));
    return next == null ? State.UNDEFINED : next;
  }

  public boolean isAccepting(final State state) {
    return accepting.contains(state);
  }

  public SortedSet<State> getStates() {
    return states;
  }

  public Set<Symbol> getAlphabet() {
    return alphabet;
  }

  public State getStart() {
    return start;
  }

  public Set<State> getAccepting() {
    return accepting;
  }

  /**
   * True iff every (state, symbol) pair has an entry.
   */
  public boolean isTotal() {
    return transitions.size() == states.size() * alphabet.size();
  }

  public int transitionCount() {
    return transitions.size();
  }

  @Override
  public String toString() {
    return "TransitionTable [states=" + states.size() + ", alphabet=" + alphabet + ", transitions="
        + transitions.size() + ", start=" + start.getId() + ", accepting=" + accepting + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build transition tables. States are given by
   * their non-negative ids and symbols by their labels; everything is resolved in {@link #build()}.
   */
  public final static class TransitionTableBuilder {
    private final Set<Integer> stateIds = new LinkedHashSet<>();
    private final Map<Integer, String> stateNames = new HashMap<>();
    private final Set<String> symbolLabels = new LinkedHashSet<>();
    // K=fromState id, V=(symbol label -> toState id)
    private final Map<Integer, Map<String, Integer>> transitionIds = new LinkedHashMap<>();
    private Integer startId;
    private final Set<Integer> acceptingIds = new LinkedHashSet<>();

    public static TransitionTableBuilder newBuilder() {
      return new TransitionTableBuilder();
    }

    public TransitionTableBuilder states(final int... ids) {
      for (int id : ids) {
        stateIds.add(id);
      }
      return this;
    }

    public TransitionTableBuilder state(final int id, final String name) {
      stateIds.add(id);
      stateNames.put(id, name);
      return this;
    }

    public TransitionTableBuilder alphabet(final String... labels) {
      for (String label : labels) {
        symbolLabels.add(label == null ? null : label.trim());
      }
      return this;
    }

    /**
     * Redefining an existing (from, symbol) pair replaces its target; the table stays
     * deterministic.
     */
    public TransitionTableBuilder transition(final int from, final String symbol, final int to) {
      Map<String, Integer> targets = transitionIds.get(from);
      if (targets == null) {
        targets = new LinkedHashMap<>();
        transitionIds.put(from, targets);
      }
      targets.put(symbol == null ? null : symbol.trim(), to);
      return this;
    }

    /**
     * Shortcut to send every state to {@code to} on {@code symbol}.
     */
    public TransitionTableBuilder transitionFromAll(final String symbol, final int to) {
      for (Integer from : stateIds) {
        transition(from, symbol, to);
      }
      return this;
    }

    public TransitionTableBuilder start(final int id) {
      this.startId = id;
      return this;
    }

    public TransitionTableBuilder accepting(final int... ids) {
      for (int id : ids) {
        acceptingIds.add(id);
      }
      return this;
    }

    public TransitionTable build() throws AutomatonException {
      validate();
      final Map<Integer, State> resolved = new HashMap<>();
      final SortedSet<State> states = new TreeSet<>();
      for (Integer id : stateIds) {
        final State state = State.of(id, Optional.ofNullable(stateNames.get(id)));
        resolved.put(id, state);
        states.add(state);
      }
      final Map<String, Symbol> symbols = new LinkedHashMap<>();
      for (String label : symbolLabels) {
        symbols.put(label, Symbol.of(label));
      }
      final Map<TransitionKey, State> transitions = new HashMap<>();
      for (Map.Entry<Integer, Map<String, Integer>> from : transitionIds.entrySet()) {
        for (Map.Entry<String, Integer> entry : from.getValue().entrySet()) {
          transitions.put(
              new TransitionKey(resolved.get(from.getKey()), symbols.get(entry.getKey())),
              resolved.get(entry.getValue()));
        }
      }
      final Set<State> accepting = new LinkedHashSet<>();
      for (Integer id : acceptingIds) {
        accepting.add(resolved.get(id));
      }
      final TransitionTable table = new TransitionTable(states,
          new LinkedHashSet<>(symbols.values()), transitions, resolved.get(startId), accepting);
      logger.info("Successfully hydrated " + table);
      return table;
    }

    private void validate() throws AutomatonException {
      StringBuilder messages = new StringBuilder();
      if (stateIds.isEmpty()) {
        messages.append("States cannot be empty. ");
      }
      for (Integer id : stateIds) {
        if (id < 0) {
          messages.append("State ids must be non-negative, found ").append(id).append(". ");
        }
      }
      if (symbolLabels.isEmpty()) {
        messages.append("Alphabet cannot be empty. ");
      }
      for (String label : symbolLabels) {
        if (label == null || label.isEmpty()) {
          messages.append("Alphabet cannot hold null or blank symbols. ");
        }
      }
      if (startId == null) {
        messages.append("Start state cannot be null. ");
      } else if (!stateIds.contains(startId)) {
        messages.append("Start state ").append(startId).append(" is not a declared state. ");
      }
      for (Integer id : acceptingIds) {
        if (!stateIds.contains(id)) {
          messages.append("Accepting state ").append(id).append(" is not a declared state. ");
        }
      }
      for (Map.Entry<Integer, Map<String, Integer>> from : transitionIds.entrySet()) {
        for (Map.Entry<String, Integer> entry : from.getValue().entrySet()) {
          final String transition =
              "(" + from.getKey() + ", " + entry.getKey() + ")->" + entry.getValue();
          if (!stateIds.contains(from.getKey()) || !stateIds.contains(entry.getValue())) {
            messages.append("Transition ").append(transition)
                .append(" references an undeclared state. ");
          }
          if (!symbolLabels.contains(entry.getKey())) {
            messages.append("Transition ").append(transition)
                .append(" uses a symbol outside the alphabet. ");
          }
        }
      }
      if (messages.length() > 0) {
        throw new AutomatonException(Code.INVALID_TABLE, messages.toString().trim());
      }
    }

    private TransitionTableBuilder() {}
  }

}
