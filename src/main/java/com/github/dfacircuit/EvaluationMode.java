package com.github.dfacircuit;

/**
 * This represents the strategy used by the circuit evaluator to compute the root gate.
 */
public enum EvaluationMode {
  // reset the root to the start state and replay its positions left to right
  REPLAY,
  // combine child entry->exit maps level by level on the caller thread
  BOTTOM_UP,
  // as BOTTOM_UP, with each level's gates computed concurrently and a barrier between levels
  PARALLEL_BOTTOM_UP;
}
