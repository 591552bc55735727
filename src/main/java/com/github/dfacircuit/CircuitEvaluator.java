package com.github.dfacircuit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfacircuit.AutomatonException.Code;
import com.github.dfacircuit.CompositionTree.Gate;

/**
 * Evaluates a {@link CompositionTree} down to a single accept/reject bit.
 * 
 * Notes for users:<br>
 * 1. {@link EvaluationMode#REPLAY} resets the root to the start state and replays its positions.
 * Both bottom-up modes never replay: each leaf derives its entry->exit {@link StateMap} from the
 * table and each gate combines its children's maps, one level at a time. The root map is applied
 * to the start state once, at the end.<br>
 * 
 * 2. in {@link EvaluationMode#PARALLEL_BOTTOM_UP} the gates of one level run as independent tasks
 * on a bounded pool owned by this evaluator. A level only starts once every gate of the previous
 * level is done.<br>
 * 
 * 3. all modes yield the same {@link RunResult} for the same tree, abort point included.<br>
 * 
 * 4. this evaluator is thread-safe; one instance can serve any number of trees over the same
 * table, and one tree can be evaluated from several threads at once in every mode.
 * {@link #close()} it to release the worker pool.<br>
 */
public final class CircuitEvaluator implements AcceptanceEvaluator, AutoCloseable {
  private static final Logger logger =
      LogManager.getLogger(CircuitEvaluator.class.getSimpleName());

  private final String evaluatorId = UUID.randomUUID().toString();
  private final TransitionTable table;
  private final CircuitConfiguration config;
  private final ExecutorService workers;
  private final AtomicBoolean alive = new AtomicBoolean();

  private volatile RunResult output;
  private volatile CircuitStatistics lastStatistics;

  public CircuitEvaluator(final TransitionTable table, final CircuitConfiguration config)
      throws AutomatonException {
    if (table == null) {
      throw new AutomatonException(Code.INVALID_TABLE, "Transition table cannot be null");
    }
    if (config == null) {
      throw new AutomatonException(Code.INVALID_CIRCUIT_CONFIG);
    }
    this.table = table;
    this.config = config;
    if (config.getEvaluationMode() == EvaluationMode.PARALLEL_BOTTOM_UP) {
      workers = Executors.newFixedThreadPool(config.getParallelism(), new GateWorkerFactory());
    } else {
      workers = null;
    }
    alive.set(true);
    logInfo(evaluatorId, "Fired up circuit evaluator with " + config);
  }

  /**
   * Build the circuit for {@code input} and evaluate its top gate.
   */
  @Override
  public RunResult evaluate(final List<Symbol> input) throws AutomatonException {
    return evalTop(CompositionTree.build(table, input));
  }

  /**
   * Evaluate the top gate of a pre-built tree and remember the result as this evaluator's output.
   */
  public RunResult evalTop(final CompositionTree tree) throws AutomatonException {
    if (!alive.get()) {
      throw new AutomatonException(Code.EVALUATOR_CLOSED);
    }
    if (tree == null || tree.getTable() != table) {
      throw new AutomatonException(Code.INVALID_INPUT,
          "Circuit must be built over this evaluator's transition table");
    }
    final long startMillis = System.currentTimeMillis();
    final RunResult result;
    switch (config.getEvaluationMode()) {
      case REPLAY:
        result = tree.getRoot().getFunction().evaluate(tree.getId());
        break;
      case BOTTOM_UP:
      case PARALLEL_BOTTOM_UP:
        result = evaluateBottomUp(tree).fromStart();
        break;
      default:
        throw new AutomatonException(Code.INVALID_CIRCUIT_CONFIG,
            "Unsupported evaluation mode " + config.getEvaluationMode());
    }
    final long elapsedMillis = System.currentTimeMillis() - startMillis;
    output = result;
    lastStatistics = tree.getStatistics().evaluated(config.getEvaluationMode(), elapsedMillis);
    logInfo(tree.getId(), String.format("Evaluated %d leaves in %s mode, %dms: %s",
        tree.getLeafCount(), config.getEvaluationMode(), elapsedMillis, result.getOutcome()));
    return result;
  }

  /**
   * Compute every gate's entry->exit map, leaves first, and return the root's.
   */
  StateMap evaluateBottomUp(final CompositionTree tree) throws AutomatonException {
    final Map<Gate, StateMap> maps = new ConcurrentHashMap<>();
    for (int level = 0; level <= tree.getDepth(); level++) {
      final List<Callable<StateMap>> tasks = new ArrayList<>();
      for (final Gate gate : tree.getLevel(level)) {
        tasks.add(new Callable<StateMap>() {
          @Override
          public StateMap call() {
            final StateMap map;
            if (gate.isLeaf()) {
              map = gate.getFunction().toStateMap();
            } else {
              map = maps.get(gate.getLeft()).followedBy(maps.get(gate.getRight()));
            }
            maps.put(gate, map);
            if (config.getLogGateDetail()) {
              logDebug(tree.getId(), gate + " " + map);
            }
            return map;
          }
        });
      }
      runLevel(tasks);
    }
    return maps.get(tree.getRoot());
  }

  // returns only once every task of the level is done
  private void runLevel(final List<Callable<StateMap>> tasks) throws AutomatonException {
    if (workers == null || tasks.size() == 1) {
      for (final Callable<StateMap> task : tasks) {
        try {
          task.call();
        } catch (Exception problem) {
          throw new AutomatonException(Code.EVALUATION_FAILURE, problem);
        }
      }
      return;
    }
    try {
      for (final Future<StateMap> future : workers.invokeAll(tasks)) {
        future.get();
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new AutomatonException(Code.INTERRUPTED, exception);
    } catch (ExecutionException exception) {
      throw new AutomatonException(Code.EVALUATION_FAILURE, exception.getCause());
    }
  }

  /**
   * Result of the last evaluated top gate; false before any evaluation.
   */
  public boolean accepted() {
    final RunResult result = output;
    return result != null && result.isAccepted();
  }

  public RunResult getOutput() {
    return output;
  }

  /**
   * Statistics of the last evaluated circuit, null before any evaluation.
   */
  public CircuitStatistics getStatistics() {
    return lastStatistics;
  }

  public CircuitConfiguration getConfiguration() {
    return config;
  }

  @Override
  public TransitionTable getTable() {
    return table;
  }

  public String getId() {
    return evaluatorId;
  }

  public boolean alive() {
    return alive.get();
  }

  /**
   * Shutdown the worker pool, if any. Evaluations in flight are allowed to finish.
   */
  @Override
  public void close() {
    if (!alive.compareAndSet(true, false)) {
      logInfo(evaluatorId, "Circuit evaluator is already closed");
      return;
    }
    if (workers != null) {
      workers.shutdown();
      try {
        if (!workers.awaitTermination(10L, TimeUnit.SECONDS)) {
          workers.shutdownNow();
        }
      } catch (InterruptedException exception) {
        workers.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    logInfo(evaluatorId, "Successfully shut down circuit evaluator");
  }

  private static void logInfo(final String circuitId, final String message) {
    logger.info(new StringBuilder().append("[c:").append(circuitId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String circuitId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[c:").append(circuitId).append("] ")
          .append(message).toString());
    }
  }

  private static final class GateWorkerFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread worker = new Thread(runnable, "gate-worker-" + counter.incrementAndGet());
      worker.setDaemon(true);
      return worker;
    }
  }

}
