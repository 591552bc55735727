package com.github.dfacircuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.dfacircuit.AutomatonException.Code;

/**
 * An input symbol, identified by its label.
 */
public final class Symbol {
  private final String label;

  private Symbol(final String label) {
    this.label = label;
  }

  public static Symbol of(final String label) throws AutomatonException {
    if (label == null || label.trim().isEmpty()) {
      throw new AutomatonException(Code.INVALID_SYMBOL);
    }
    return new Symbol(label.trim());
  }

  /**
   * Convenience to turn labels into an input sequence, order preserved.
   */
  public static List<Symbol> sequence(final String... labels) throws AutomatonException {
    if (labels == null) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    final List<Symbol> symbols = new ArrayList<>(labels.length);
    for (final String label : labels) {
      symbols.add(of(label));
    }
    return Collections.unmodifiableList(symbols);
  }

  public static List<Symbol> sequence(final List<String> labels) throws AutomatonException {
    if (labels == null) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    return sequence(labels.toArray(new String[labels.size()]));
  }

  public String getLabel() {
    return label;
  }

  @Override
  public int hashCode() {
    return label.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Symbol)) {
      return false;
    }
    return label.equals(((Symbol) obj).label);
  }

  @Override
  public String toString() {
    return label;
  }
}
