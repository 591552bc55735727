package com.github.dfacircuit;

/**
 * Unified single exception that's thrown and handled by the automaton and its circuit reduction.
 * The idea is to use the code enum to encapsulate various error/exception conditions. Undefined
 * transitions are the one condition that is normally reported instead of thrown: see
 * {@link RunResult#getError()}.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final transient UndefinedTransition undefinedTransition;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.undefinedTransition = null;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.undefinedTransition = null;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
    this.undefinedTransition = null;
  }

  public AutomatonException(final UndefinedTransition undefinedTransition) {
    super(Code.UNDEFINED_TRANSITION.getDescription() + ": " + undefinedTransition);
    this.code = Code.UNDEFINED_TRANSITION;
    this.undefinedTransition = undefinedTransition;
  }

  public Code getCode() {
    return code;
  }

  /**
   * Only set for {@link Code#UNDEFINED_TRANSITION}, null otherwise.
   */
  public UndefinedTransition getUndefinedTransition() {
    return undefinedTransition;
  }

  public static enum Code {
    // 1.
    UNDEFINED_TRANSITION("Transition table has no entry for the current state and input symbol"),
    // 2.
    INVALID_STATE("State is null or not part of the transition table's state set"),
    // 3.
    INVALID_SYMBOL("Symbol label cannot be null or blank"),
    // 4.
    INVALID_TABLE("Transition table is malformed"),
    // 5.
    INVALID_INPUT("Input sequence is null, empty or holds null symbols"),
    // 6.
    INVALID_CIRCUIT_CONFIG("Circuit configuration is invalid"),
    // 7.
    EVALUATOR_CLOSED("Circuit evaluator is closed and cannot service requests"),
    // 8.
    INTERRUPTED("Circuit evaluation was interrupted"),
    // 9.
    EVALUATION_FAILURE(
        "Circuit evaluation failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
