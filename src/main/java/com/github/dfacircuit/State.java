package com.github.dfacircuit;

import java.util.Optional;

import com.github.dfacircuit.AutomatonException.Code;

/**
 * This object represents an immutable automaton state. States are identified by a non-negative id
 * and ordered by it; the name is cosmetic and does not take part in equality.
 */
public final class State implements Comparable<State> {
  /**
   * Sentinel for "no state": the cursor lands here once a transition is undefined.
   */
  public static final State UNDEFINED = new State(-1, "UNDEF");

  final static int maxStateNameLength = 20;
  private final int id;
  private final String name;

  private State(final int id, final String name) {
    this.id = id;
    this.name = name;
  }

  public static State of(final int id) throws AutomatonException {
    return of(id, Optional.empty());
  }

  /**
   * State name is optional and defaults to the id.
   */
  public static State of(final int id, final Optional<String> name) throws AutomatonException {
    if (id < 0) {
      throw new AutomatonException(Code.INVALID_STATE,
          "State id must be non-negative, found " + id);
    }
    String stateName = String.valueOf(id);
    if (name != null && name.isPresent()) {
      if (name.get().trim().length() <= maxStateNameLength) {
        stateName = name.get().trim();
      } else {
        throw new AutomatonException(Code.INVALID_STATE,
            "State name cannot be greater than " + maxStateNameLength + " characters");
      }
    }
    return new State(id, stateName);
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isUndefined() {
    return id == UNDEFINED.id;
  }

  @Override
  public int compareTo(final State other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    return id == other.id;
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", name=" + name + "]";
  }
}
