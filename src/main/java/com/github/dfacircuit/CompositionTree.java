package com.github.dfacircuit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfacircuit.AutomatonException.Code;

/**
 * Balanced binary composition of per-symbol {@link SymbolFunction}s, one leaf per input symbol.
 * 
 * The tree is built level by level: adjacent gates of the current level are paired left to right
 * and composed into one gate of the next level; a lone gate left over at the end of an odd level is
 * promoted unchanged. This yields exactly ceil(log2 n) levels above the leaves, and the root always
 * covers the whole input in its original order.
 * 
 * Trees are immutable once built and may be evaluated any number of times.
 */
public final class CompositionTree {
  private static final Logger logger = LogManager.getLogger(CompositionTree.class.getSimpleName());

  private final String circuitId = UUID.randomUUID().toString();
  private final TransitionTable table;
  private final Gate root;
  // levels.get(0) holds the leaves, levels.get(k) the gates composed during round k
  private final List<List<Gate>> levels;
  private final int promotedCount;

  private CompositionTree(final TransitionTable table, final Gate root,
      final List<List<Gate>> levels, final int promotedCount) {
    this.table = table;
    this.root = root;
    this.levels = levels;
    this.promotedCount = promotedCount;
  }

  /**
   * Build the circuit for {@code input} over {@code table}. The input must hold at least one symbol.
   */
  public static CompositionTree build(final TransitionTable table, final List<Symbol> input)
      throws AutomatonException {
    if (table == null) {
      throw new AutomatonException(Code.INVALID_TABLE, "Transition table cannot be null");
    }
    if (input == null || input.isEmpty()) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    final List<SymbolFunction> leaves = new ArrayList<>(input.size());
    for (int position = 0; position < input.size(); position++) {
      leaves.add(SymbolFunction.leaf(table, input.get(position), position));
    }
    return build(leaves);
  }

  /**
   * Build the circuit over ready-made leaves, given in input order.
   */
  public static CompositionTree build(final List<SymbolFunction> leaves)
      throws AutomatonException {
    if (leaves == null || leaves.isEmpty() || leaves.contains(null)) {
      throw new AutomatonException(Code.INVALID_INPUT);
    }
    final List<List<Gate>> levels = new ArrayList<>();
    Deque<Gate> current = new ArrayDeque<>(leaves.size());
    for (final SymbolFunction leaf : leaves) {
      current.add(new Gate(leaf, null, null, 0));
    }
    levels.add(Collections.unmodifiableList(new ArrayList<>(current)));

    int promoted = 0;
    int round = 0;
    while (current.size() > 1) {
      round++;
      final Deque<Gate> next = new ArrayDeque<>((current.size() + 1) / 2);
      final List<Gate> composed = new ArrayList<>(current.size() / 2);
      while (!current.isEmpty()) {
        final Gate left = current.poll();
        final Gate right = current.poll();
        if (right == null) {
          // odd one out, carried forward as is
          next.add(left);
          promoted++;
        } else {
          final Gate gate = new Gate(left.function.followedBy(right.function), left, right, round);
          next.add(gate);
          composed.add(gate);
        }
      }
      levels.add(Collections.unmodifiableList(composed));
      current = next;
    }

    final Gate root = current.peek();
    final CompositionTree tree = new CompositionTree(leaves.get(0).getTable(), root,
        Collections.unmodifiableList(levels), promoted);
    logger.info(new StringBuilder().append("[c:").append(tree.circuitId).append("] Built ")
        .append(tree.getStatistics()).toString());
    return tree;
  }

  public Gate getRoot() {
    return root;
  }

  /**
   * Number of composition levels above the leaves, ceil(log2 n).
   */
  public int getDepth() {
    return levels.size() - 1;
  }

  /**
   * Gates of one level: 0 for the leaves, k for the gates composed in the k-th pairing round.
   * Promoted gates belong to the level that created them.
   */
  public List<Gate> getLevel(final int level) {
    return levels.get(level);
  }

  public List<Gate> getLeaves() {
    return levels.get(0);
  }

  public int getLeafCount() {
    return levels.get(0).size();
  }

  public int getGateCount() {
    int gates = 0;
    for (int level = 1; level < levels.size(); level++) {
      gates += levels.get(level).size();
    }
    return gates;
  }

  public int getPromotedCount() {
    return promotedCount;
  }

  public TransitionTable getTable() {
    return table;
  }

  public String getId() {
    return circuitId;
  }

  public CircuitStatistics getStatistics() {
    return new CircuitStatistics(circuitId, getLeafCount(), getGateCount(), promotedCount,
        getDepth(), null, 0L);
  }

  /**
   * One node of the circuit. Leaves have no children; every other gate combines exactly two, the
   * left one covering the earlier half of its span.
   */
  public final static class Gate {
    private final SymbolFunction function;
    private final Gate left;
    private final Gate right;
    private final int level;

    private Gate(final SymbolFunction function, final Gate left, final Gate right,
        final int level) {
      this.function = function;
      this.left = left;
      this.right = right;
      this.level = level;
    }

    public SymbolFunction getFunction() {
      return function;
    }

    public Gate getLeft() {
      return left;
    }

    public Gate getRight() {
      return right;
    }

    public int getLevel() {
      return level;
    }

    public boolean isLeaf() {
      return left == null;
    }

    /**
     * Longest path down to a leaf, 0 for a leaf.
     */
    public int height() {
      if (isLeaf()) {
        return 0;
      }
      return 1 + Math.max(left.height(), right.height());
    }

    @Override
    public String toString() {
      return "Gate [level=" + level + ", offset=" + function.getOffset() + ", span="
          + function.size() + "]";
    }
  }

}
