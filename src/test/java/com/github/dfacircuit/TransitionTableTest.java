package com.github.dfacircuit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Optional;

import org.junit.Test;

import com.github.dfacircuit.AutomatonException.Code;
import com.github.dfacircuit.TransitionTable.TransitionTableBuilder;

/**
 * Tests for building and querying transition tables.
 */
public class TransitionTableTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testFourStateTable() throws AutomatonException {
    final TransitionTable table = ExampleAutomata.fourStateTable();
    assertEquals(4, table.getStates().size());
    assertEquals(4, table.getAlphabet().size());
    assertEquals(16, table.transitionCount());
    assertTrue(table.isTotal());
    assertEquals(State.of(0), table.getStart());
    assertTrue(table.isAccepting(State.of(2)));
    assertTrue(table.isAccepting(State.of(3)));
    assertFalse(table.isAccepting(State.of(0)));

    // phi always returns to 0, alpha/beta/gamma go to 1/2/3 from anywhere
    for (final State from : table.getStates()) {
      assertEquals(State.of(0), table.lookup(from, Symbol.of("phi")));
      assertEquals(State.of(1), table.lookup(from, Symbol.of("alpha")));
      assertEquals(State.of(2), table.lookup(from, Symbol.of("beta")));
      assertEquals(State.of(3), table.lookup(from, Symbol.of("gamma")));
    }
  }

  @Test
  public void testMissingEntryIsUndefined() throws AutomatonException {
    final TransitionTable table = ExampleAutomata.partialFourStateTable();
    assertFalse(table.isTotal());
    assertEquals(State.UNDEFINED, table.lookup(State.of(1), Symbol.of("gamma")));
    assertEquals(State.of(3), table.lookup(State.of(2), Symbol.of("gamma")));
    // symbols outside the alphabet have no entries at all
    assertEquals(State.UNDEFINED, table.lookup(State.of(0), Symbol.of("omega")));
    // nothing leaves the sentinel
    assertEquals(State.UNDEFINED, table.lookup(State.UNDEFINED, Symbol.of("alpha")));
  }

  @Test
  public void testEmptyAcceptingSetIsLegal() throws AutomatonException {
    final TransitionTable table = TransitionTableBuilder.newBuilder().states(0).alphabet("a")
        .transition(0, "a", 0).start(0).build();
    assertTrue(table.getAccepting().isEmpty());
    assertFalse(table.isAccepting(table.getStart()));
  }

  @Test
  public void testRedefinedTransitionReplacesTarget() throws AutomatonException {
    final TransitionTable table = TransitionTableBuilder.newBuilder().states(0, 1).alphabet("a")
        .transition(0, "a", 0).transition(0, "a", 1).start(0).build();
    assertEquals(1, table.transitionCount());
    assertEquals(State.of(1), table.lookup(State.of(0), Symbol.of("a")));
  }

  @Test
  public void testStateNames() throws AutomatonException {
    final TransitionTable table = TransitionTableBuilder.newBuilder().state(0, "idle")
        .state(1, "busy").alphabet("go").transition(0, "go", 1).start(0).accepting(1).build();
    assertEquals("idle", table.getStart().getName());
    // names are cosmetic, ids decide equality
    assertEquals(State.of(1), table.lookup(table.getStart(), Symbol.of("go")));
  }

  @Test
  public void testStartMustBeDeclared() {
    assertInvalidTable(TransitionTableBuilder.newBuilder().states(0, 1).alphabet("a").start(7));
    assertInvalidTable(TransitionTableBuilder.newBuilder().states(0, 1).alphabet("a"));
  }

  @Test
  public void testShapeValidation() {
    // no states
    assertInvalidTable(TransitionTableBuilder.newBuilder().alphabet("a").start(0));
    // no alphabet
    assertInvalidTable(TransitionTableBuilder.newBuilder().states(0).start(0));
    // accepting state outside states
    assertInvalidTable(
        TransitionTableBuilder.newBuilder().states(0).alphabet("a").start(0).accepting(1));
    // target outside states
    assertInvalidTable(TransitionTableBuilder.newBuilder().states(0).alphabet("a")
        .transition(0, "a", 5).start(0));
    // symbol outside alphabet
    assertInvalidTable(TransitionTableBuilder.newBuilder().states(0).alphabet("a")
        .transition(0, "b", 0).start(0));
    // negative ids collide with the sentinel
    assertInvalidTable(TransitionTableBuilder.newBuilder().states(-1, 0).alphabet("a").start(0));
  }

  @Test
  public void testStateAndSymbolShape() throws AutomatonException {
    try {
      State.of(-1);
      fail("negative state ids are reserved");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      Symbol.of("  ");
      fail("blank symbols are not allowed");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_SYMBOL, expected.getCode());
    }
    assertTrue(State.UNDEFINED.isUndefined());
    assertFalse(State.of(0).isUndefined());
    assertTrue(State.of(1).compareTo(State.of(2)) < 0);
    assertEquals(Symbol.of("alpha"), Symbol.of(" alpha "));
  }

  @Test
  public void testTransitionKey() throws AutomatonException {
    final TransitionKey key = new TransitionKey(State.of(1), Symbol.of("gamma"));
    assertEquals(new TransitionKey(State.of(1, Optional.of("one")), Symbol.of("gamma")), key);
    assertEquals(key.hashCode(),
        new TransitionKey(State.of(1), Symbol.of(" gamma ")).hashCode());
    assertFalse(key.equals(new TransitionKey(State.of(1), Symbol.of("beta"))));
    assertFalse(key.equals(new TransitionKey(State.of(2), Symbol.of("gamma"))));
    assertEquals("(1, gamma)", key.toString());
  }

  @Test
  public void testPerStateTransitionsStayApart() throws AutomatonException {
    // same symbol from different states, and the same target reached on different symbols
    final TransitionTable table = TransitionTableBuilder.newBuilder().states(0, 1, 2)
        .alphabet("a", "b").transition(0, "a", 1).transition(1, "a", 2).transition(0, "b", 2)
        .start(0).build();
    assertEquals(3, table.transitionCount());
    assertEquals(State.of(1), table.lookup(State.of(0), Symbol.of("a")));
    assertEquals(State.of(2), table.lookup(State.of(1), Symbol.of("a")));
    assertEquals(State.of(2), table.lookup(State.of(0), Symbol.of("b")));
    assertEquals(State.UNDEFINED, table.lookup(State.of(1), Symbol.of("b")));
  }

  @Test
  public void testExampleInputsAreReadOnly() throws AutomatonException {
    try {
      ExampleAutomata.ACCEPT_EXAMPLE.set(0, "phi");
      fail("example inputs are shared and must not change");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      ExampleAutomata.REJECT_EXAMPLE.add("gamma");
      fail("example inputs are shared and must not change");
    } catch (UnsupportedOperationException expected) {
    }
    assertEquals(Symbol.sequence("alpha", "beta", "beta", "gamma", "phi", "gamma"),
        ExampleAutomata.acceptExample());
    assertEquals(6, ExampleAutomata.rejectExample().size());
  }

  private static void assertInvalidTable(final TransitionTableBuilder builder) {
    try {
      builder.build();
      fail("table should have been rejected");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_TABLE, expected.getCode());
    }
  }

}
