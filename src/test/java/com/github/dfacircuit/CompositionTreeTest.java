package com.github.dfacircuit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.dfacircuit.AutomatonException.Code;
import com.github.dfacircuit.CompositionTree.Gate;

/**
 * Tests for the shape of composition trees.
 */
public class CompositionTreeTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final String[] LABELS = {"alpha", "beta", "gamma", "phi"};

  @Test
  public void testRootPreservesInputOrder() throws AutomatonException {
    final TransitionTable table = ExampleAutomata.fourStateTable();
    for (int length = 1; length <= 70; length++) {
      final List<Symbol> input = input(length);
      final CompositionTree tree = CompositionTree.build(table, input);
      assertEquals("length " + length, input, tree.getRoot().getFunction().getPositions());
      assertEquals(0, tree.getRoot().getFunction().getOffset());
    }
  }

  @Test
  public void testEveryGateCoversItsChildrenInOrder() throws AutomatonException {
    final CompositionTree tree = CompositionTree.build(ExampleAutomata.fourStateTable(), input(13));
    for (int level = 1; level <= tree.getDepth(); level++) {
      for (final Gate gate : tree.getLevel(level)) {
        final List<Symbol> expected = new ArrayList<>();
        expected.addAll(gate.getLeft().getFunction().getPositions());
        expected.addAll(gate.getRight().getFunction().getPositions());
        assertEquals(expected, gate.getFunction().getPositions());
        assertTrue(gate.getLeft().getLevel() < gate.getLevel());
        assertTrue(gate.getRight().getLevel() < gate.getLevel());
      }
    }
  }

  @Test
  public void testDepthIsCeilLog2() throws AutomatonException {
    final TransitionTable table = ExampleAutomata.fourStateTable();
    final int[][] expectations = {{1, 0}, {2, 1}, {3, 2}, {5, 3}, {8, 3}, {100, 7}};
    for (final int[] expectation : expectations) {
      final CompositionTree tree = CompositionTree.build(table, input(expectation[0]));
      assertEquals("length " + expectation[0], expectation[1], tree.getDepth());
      assertEquals("length " + expectation[0], expectation[1], tree.getRoot().height());
    }
  }

  @Test
  public void testGateAndPromotionCounts() throws AutomatonException {
    final TransitionTable table = ExampleAutomata.fourStateTable();
    // 5 -> 2 + promoted, 3 -> 1 + promoted, 2 -> 1
    final CompositionTree five = CompositionTree.build(table, input(5));
    assertEquals(5, five.getLeafCount());
    assertEquals(4, five.getGateCount());
    assertEquals(2, five.getPromotedCount());
    assertEquals(2, five.getLevel(1).size());
    assertEquals(1, five.getLevel(2).size());
    assertEquals(1, five.getLevel(3).size());

    final CompositionTree eight = CompositionTree.build(table, input(8));
    assertEquals(7, eight.getGateCount());
    assertEquals(0, eight.getPromotedCount());

    final CircuitStatistics statistics = five.getStatistics();
    assertEquals(five.getId(), statistics.getCircuitId());
    assertEquals(3, statistics.getDepth());
    assertEquals(null, statistics.getLastMode());
  }

  @Test
  public void testSingleSymbolRootIsTheLeaf() throws AutomatonException {
    final TransitionTable table = ExampleAutomata.fourStateTable();
    final SymbolFunction leaf = SymbolFunction.leaf(table, Symbol.of("beta"), 0);
    final CompositionTree tree = CompositionTree.build(Collections.singletonList(leaf));
    assertSame(leaf, tree.getRoot().getFunction());
    assertTrue(tree.getRoot().isLeaf());
    assertEquals(0, tree.getDepth());
    assertEquals(0, tree.getGateCount());
    assertTrue(tree.getRoot().getFunction().eval());
  }

  @Test
  public void testEmptyInputIsRejected() throws AutomatonException {
    try {
      CompositionTree.build(ExampleAutomata.fourStateTable(), Collections.<Symbol>emptyList());
      fail("a circuit needs at least one leaf");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_INPUT, expected.getCode());
    }
  }

  @Test
  public void testRootEvalIsIdempotent() throws AutomatonException {
    final CompositionTree tree =
        CompositionTree.build(ExampleAutomata.fourStateTable(), ExampleAutomata.acceptExample());
    final SymbolFunction root = tree.getRoot().getFunction();
    assertTrue(root.eval());
    assertTrue(root.eval());
  }

  static List<Symbol> input(final int length) throws AutomatonException {
    final List<Symbol> input = new ArrayList<>(length);
    for (int index = 0; index < length; index++) {
      // stride 3 over 4 labels so neighbours differ
      input.add(Symbol.of(LABELS[(index * 3) % LABELS.length]));
    }
    return input;
  }

}
