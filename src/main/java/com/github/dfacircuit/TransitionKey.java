package com.github.dfacircuit;

/**
 * The (state, symbol) pair a transition table is keyed by.
 */
public final class TransitionKey {
  private final State state;
  private final Symbol symbol;

  public TransitionKey(final State state, final Symbol symbol) {
    this.state = state;
    this.symbol = symbol;
  }

  public State getState() {
    return state;
  }

  public Symbol getSymbol() {
    return symbol;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((state == null) ? 0 : state.hashCode());
    result = prime * result + ((symbol == null) ? 0 : symbol.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    TransitionKey other = (TransitionKey) obj;
    if (state == null ? other.state != null : !state.equals(other.state)) {
      return false;
    }
    return symbol == null ? other.symbol == null : symbol.equals(other.symbol);
  }

  @Override
  public String toString() {
    return "(" + (state == null ? null : state.getId()) + ", " + symbol + ")";
  }
}
