package com.github.dfacircuit;

/**
 * Diagnostic for a missing (state, symbol) entry: which state the cursor was in, which symbol was
 * fed, and the zero-based position of that symbol in the run's input.
 */
public final class UndefinedTransition {
  private final State state;
  private final Symbol symbol;
  private final int position;

  public UndefinedTransition(final State state, final Symbol symbol, final int position) {
    this.state = state;
    this.symbol = symbol;
    this.position = position;
  }

  public State getState() {
    return state;
  }

  public Symbol getSymbol() {
    return symbol;
  }

  public int getPosition() {
    return position;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + position;
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
    UndefinedTransition other = (UndefinedTransition) obj;
    return position == other.position && state.equals(other.state)
        && symbol.equals(other.symbol);
  }

  @Override
  public String toString() {
    return String.format("transition from %d on input %s at position %d not defined",
        state.getId(), symbol, position);
  }
}
