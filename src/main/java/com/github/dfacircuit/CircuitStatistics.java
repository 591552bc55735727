package com.github.dfacircuit;

/**
 * Snapshot of a circuit's shape and, once evaluated, of its last evaluation.
 */
public final class CircuitStatistics {
  private final String circuitId;
  private final int leafCount;
  private final int gateCount;
  private final int promotedCount;
  private final int depth;
  private final EvaluationMode lastMode;
  private final long lastElapsedMillis;

  CircuitStatistics(final String circuitId, final int leafCount, final int gateCount,
      final int promotedCount, final int depth, final EvaluationMode lastMode,
      final long lastElapsedMillis) {
    this.circuitId = circuitId;
    this.leafCount = leafCount;
    this.gateCount = gateCount;
    this.promotedCount = promotedCount;
    this.depth = depth;
    this.lastMode = lastMode;
    this.lastElapsedMillis = lastElapsedMillis;
  }

  CircuitStatistics evaluated(final EvaluationMode mode, final long elapsedMillis) {
    return new CircuitStatistics(circuitId, leafCount, gateCount, promotedCount, depth, mode,
        elapsedMillis);
  }

  public String getCircuitId() {
    return circuitId;
  }

  public int getLeafCount() {
    return leafCount;
  }

  /**
   * Compositions performed, always leafCount - 1.
   */
  public int getGateCount() {
    return gateCount;
  }

  /**
   * Odd gates carried up a level without being composed.
   */
  public int getPromotedCount() {
    return promotedCount;
  }

  public int getDepth() {
    return depth;
  }

  /**
   * Null until the circuit has been evaluated.
   */
  public EvaluationMode getLastMode() {
    return lastMode;
  }

  public long getLastElapsedMillis() {
    return lastElapsedMillis;
  }

  @Override
  public String toString() {
    return "CircuitStatistics [circuitId=" + circuitId + ", leafCount=" + leafCount
        + ", gateCount=" + gateCount + ", promotedCount=" + promotedCount + ", depth=" + depth
        + ", lastMode=" + lastMode + ", lastElapsedMillis=" + lastElapsedMillis + "]";
  }

}
