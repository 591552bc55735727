package com.github.dfacircuit;

import java.util.Optional;

/**
 * This object encapsulates the result of feeding an input sequence through either the sequential
 * automaton or the composition circuit.
 * 
 * Accepted and rejected runs carry the final state and no {@link #error}. Aborted runs report
 * {@link State#UNDEFINED} as their final state and carry an {@link AutomatonException} with code
 * {@link AutomatonException.Code#UNDEFINED_TRANSITION} holding the offending state, symbol and
 * position.
 * 
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class RunResult {
  private final Outcome outcome;
  private final State finalState;
  private final AutomatonException error;

  private RunResult(final Outcome outcome, final State finalState,
      final AutomatonException error) {
    this.outcome = outcome;
    this.finalState = finalState;
    this.error = error;
  }

  static RunResult completed(final State finalState, final boolean accepting) {
    return new RunResult(accepting ? Outcome.ACCEPTED : Outcome.REJECTED, finalState, null);
  }

  static RunResult aborted(final UndefinedTransition undefinedTransition) {
    return new RunResult(Outcome.ABORTED, State.UNDEFINED,
        new AutomatonException(undefinedTransition));
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public State getFinalState() {
    return finalState;
  }

  public AutomatonException getError() {
    return error;
  }

  public Optional<UndefinedTransition> getUndefinedTransition() {
    return error == null ? Optional.empty() : Optional.ofNullable(error.getUndefinedTransition());
  }

  public boolean isAccepted() {
    return outcome == Outcome.ACCEPTED;
  }

  public boolean isAborted() {
    return outcome == Outcome.ABORTED;
  }

  /**
   * Equal outcome, final state and abort point. The exception instances themselves are not
   * compared.
   */
  public boolean agreesWith(final RunResult other) {
    return other != null && outcome == other.outcome && finalState.equals(other.finalState)
        && getUndefinedTransition().equals(other.getUndefinedTransition());
  }

  @Override
  public String toString() {
    return "RunResult [outcome=" + outcome + ", finalState=" + finalState + ", error="
        + (error == null ? null : error.getMessage()) + "]";
  }
}
