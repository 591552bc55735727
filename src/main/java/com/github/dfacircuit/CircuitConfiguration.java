package com.github.dfacircuit;

/**
 * This class encapsulates all the configuration parameters for the {@link CircuitEvaluator}. Use
 * the {@code CircuitConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. If parallelism is not set, or set to a non-positive value, one worker per available processor
 * is used. It only matters for {@link EvaluationMode#PARALLEL_BOTTOM_UP}.<br>
 * 2. Gate detail logging emits one debug line per composed gate; keep it off for long inputs.<br>
 */
public final class CircuitConfiguration {
  final static int maxParallelism = 1024;
  private final EvaluationMode evaluationMode;
  private final int parallelism;
  private final boolean logGateDetail;

  public EvaluationMode getEvaluationMode() {
    return evaluationMode;
  }

  public int getParallelism() {
    return parallelism;
  }

  public boolean getLogGateDetail() {
    return logGateDetail;
  }

  /**
   * Parallel bottom-up evaluation on all available processors.
   */
  public static CircuitConfiguration defaults() throws AutomatonException {
    return CircuitConfigurationBuilder.newBuilder()
        .evaluationMode(EvaluationMode.PARALLEL_BOTTOM_UP).build();
  }

  public final static class CircuitConfigurationBuilder {
    private EvaluationMode evaluationMode;
    private int parallelism;
    private boolean logGateDetail;

    public static CircuitConfigurationBuilder newBuilder() {
      return new CircuitConfigurationBuilder();
    }

    public CircuitConfigurationBuilder evaluationMode(final EvaluationMode evaluationMode) {
      this.evaluationMode = evaluationMode;
      return this;
    }

    public CircuitConfigurationBuilder parallelism(final int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public CircuitConfigurationBuilder logGateDetail(final boolean logGateDetail) {
      this.logGateDetail = logGateDetail;
      return this;
    }

    public CircuitConfiguration build() throws AutomatonException {
      final CircuitConfiguration config =
          new CircuitConfiguration(evaluationMode, parallelism, logGateDetail);
      config.validate();
      return config;
    }

    private CircuitConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (evaluationMode == null) {
      messages.append("EvaluationMode cannot be null. ");
    }
    if (parallelism > maxParallelism) {
      messages.append("Parallelism cannot exceed " + maxParallelism + ". ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_CIRCUIT_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "CircuitConfiguration [evaluationMode=" + evaluationMode + ", parallelism="
        + parallelism + ", logGateDetail=" + logGateDetail + "]";
  }

  private CircuitConfiguration(final EvaluationMode evaluationMode, final int parallelism,
      final boolean logGateDetail) {
    this.evaluationMode = evaluationMode;
    this.logGateDetail = logGateDetail;
    if (parallelism <= 0) {
      this.parallelism = Runtime.getRuntime().availableProcessors();
    } else {
      this.parallelism = parallelism;
    }
  }

}
