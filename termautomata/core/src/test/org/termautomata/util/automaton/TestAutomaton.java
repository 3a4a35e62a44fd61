/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.termautomata.util.automaton;

import static org.junit.Assert.*;

import java.util.Collections;

import org.termautomata.util.BytesRef;
import org.termautomata.util.TermAutomataTestCase;

public class TestAutomaton extends TermAutomataTestCase {

  public void testSingletonForm() {
    Automaton a = BasicAutomata.makeString("ab𐐀");
    assertTrue(a.isSingleton());
    assertEquals("ab𐐀", a.getSingleton());
    assertEquals(4, a.getNumberOfStates());
    assertEquals(3, a.getNumberOfTransitions());
    assertTrue(BasicOperations.run(a, "ab𐐀"));
    assertFalse(BasicOperations.run(a, "ab"));

    Automaton expanded = a.clone();
    expanded.expandSingleton();
    assertFalse(expanded.isSingleton());
    assertTrue(expanded.isDeterministic());
    assertEquals(4, expanded.getNumberOfStates());
    assertEquals(3, expanded.getNumberOfTransitions());
    assertTrue(BasicOperations.run(expanded, "ab𐐀"));
    assertTrue(a.isSingleton());
  }

  public void testEqualsIsLanguageEquality() {
    Automaton a1 = new RegExp("a|b").toAutomaton();
    Automaton a2 = new RegExp("[ab]").toAutomaton();
    assertEquals(a1, a2);
    assertEquals(a1.hashCode(), a2.hashCode());

    Automaton singleton = BasicAutomata.makeString("ab");
    Automaton explicit = BasicAutomata.makeString(new int[] {'a', 'b'}, 0, 2);
    assertFalse(explicit.isSingleton());
    assertEquals(singleton, explicit);
    assertEquals(explicit, singleton);
    assertEquals(singleton.hashCode(), explicit.hashCode());

    assertFalse(a1.equals(singleton));
    assertFalse(a1.equals("a|b"));
  }

  public void testCloneIsIndependent() {
    Automaton a = new RegExp("ab*").toAutomaton();
    Automaton b = a.clone();
    assertNotSame(a.getInitialState(), b.getInitialState());
    b.getInitialState().setAccept(true);
    b.restoreInvariant();
    assertFalse(BasicOperations.run(a, ""));
    assertTrue(BasicOperations.run(b, ""));
    assertTrue(BasicOperations.run(a, "abbb"));
    assertTrue(BasicOperations.run(b, "abbb"));
  }

  public void testNumberedStates() {
    Automaton a = new RegExp("abc|abd").toAutomaton();
    State[] states = a.getNumberedStates();
    assertSame(a.getInitialState(), states[0]);
    for (int i = 0; i < states.length; i++) {
      assertEquals(i, states[i].getNumber());
    }
    // cached until cleared
    assertSame(states, a.getNumberedStates());
    a.clearNumberedStates();
    assertNotSame(states, a.getNumberedStates());
  }

  public void testSetNumberedStatesWithCount() {
    State s0 = new State();
    State s1 = new State();
    s1.setAccept(true);
    s0.addTransition(new Transition('x', s1));
    s0.number = 0;
    s1.number = 1;
    Automaton a = new Automaton(s0);
    State[] buffer = new State[8];
    buffer[0] = s0;
    buffer[1] = s1;
    a.setNumberedStates(buffer, 2);
    assertEquals(2, a.getNumberedStates().length);
    assertEquals(2, a.getNumberOfStates());
    assertEquals(1, a.getNumberOfTransitions());
  }

  public void testAcceptStates() {
    Automaton a = new RegExp("a(b|cd)?").toAutomaton();
    assertEquals(2, a.getAcceptStates().size());
    for (State s : a.getAcceptStates()) {
      assertTrue(s.isAccept());
    }
  }

  public void testRemoveDeadTransitions() {
    State s0 = new State();
    State live = new State();
    State dead = new State();
    live.setAccept(true);
    s0.addTransition(new Transition('a', live));
    s0.addTransition(new Transition('b', dead));
    dead.addTransition(new Transition('c', dead));
    Automaton a = new Automaton(s0);
    assertEquals(3, a.getNumberOfStates());
    a.removeDeadTransitions();
    assertEquals(2, a.getNumberOfStates());
    assertEquals(1, a.getNumberOfTransitions());
    assertTrue(BasicOperations.run(a, "a"));
  }

  public void testReduceMergesAdjacentIntervals() {
    State s0 = new State();
    State s1 = new State();
    s1.setAccept(true);
    s0.addTransition(new Transition('a', 'c', s1));
    s0.addTransition(new Transition('d', 'f', s1));
    s0.addTransition(new Transition('b', 'e', s1));
    Automaton a = new Automaton(s0);
    a.reduce();
    assertEquals(1, a.getNumberOfTransitions());
    Transition t = s0.getTransitions().iterator().next();
    assertEquals('a', t.getMin());
    assertEquals('f', t.getMax());
    assertSame(s1, t.getDest());
  }

  public void testSortedTransitions() {
    Automaton a = new RegExp("[c-d]x|ay|[b-z]").toAutomaton();
    a = a.clone();
    Transition[][] sorted = a.getSortedTransitions();
    for (Transition[] transitions : sorted) {
      for (int i = 1; i < transitions.length; i++) {
        assertTrue(Transition.COMPARE_BY_MIN_MAX_THEN_DEST.compare(transitions[i - 1], transitions[i]) <= 0);
      }
    }
  }

  public void testToStringAndDot() {
    Automaton a = new RegExp("ab|c").toAutomaton();
    String s = a.toString();
    assertTrue(s, s.startsWith("initial state: "));
    String dot = a.toDot();
    assertTrue(dot, dot.startsWith("digraph Automaton {"));
    assertTrue(BasicAutomata.makeString("xy").toString().startsWith("singleton: xy"));
    assertTrue(a.ramBytesUsed() > 0);
    assertTrue(BasicAutomata.makeString("xy").ramBytesUsed() > 0);
  }

  public void testInfo() {
    Automaton a = BasicAutomata.makeAnyChar();
    assertNull(a.getInfo());
    a.setInfo("label");
    assertEquals("label", a.getInfo());
  }

  public void testMakeCharRange() {
    Automaton a = BasicAutomata.makeCharRange('b', 'd');
    assertTrue(BasicOperations.run(a, "c"));
    assertFalse(BasicOperations.run(a, "a"));
    assertTrue(BasicAutomata.makeCharRange('q', 'q').isSingleton());
    try {
      BasicAutomata.makeCharRange('d', 'b');
      fail("inverted range must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  public void testMakeInterval() {
    Automaton free = BasicAutomata.makeInterval(7, 12, 0);
    for (String s : new String[] {"7", "9", "10", "12", "007", "0012"}) {
      assertTrue(s, BasicOperations.run(free, s));
    }
    for (String s : new String[] {"", "0", "6", "13", "70", "x"}) {
      assertFalse(s, BasicOperations.run(free, s));
    }
    Automaton fixed = BasicAutomata.makeInterval(7, 12, 3);
    assertTrue(BasicOperations.run(fixed, "007"));
    assertTrue(BasicOperations.run(fixed, "012"));
    assertFalse(BasicOperations.run(fixed, "7"));
    assertFalse(BasicOperations.run(fixed, "0012"));

    try {
      BasicAutomata.makeInterval(12, 7, 0);
      fail("min > max must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    try {
      BasicAutomata.makeInterval(1, 100, 2);
      fail("max does not fit in 2 digits");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  public void testMakeStringUnion() {
    assertTrue(BasicOperations.isEmpty(BasicAutomata.makeStringUnion(Collections.<BytesRef>emptyList())));
  }

  public void testConvenienceMethodsDelegate() {
    Automaton a = BasicAutomata.makeString("ab");
    Automaton b = BasicAutomata.makeString("cd");
    assertTrue(BasicOperations.run(a.concatenate(b), "abcd"));
    assertTrue(BasicOperations.run(a.union(b), "cd"));
    assertTrue(BasicOperations.run(a.optional(), ""));
    assertTrue(BasicOperations.run(a.repeat(), "ababab"));
    assertTrue(BasicOperations.run(a.repeat(2), "abab"));
    assertFalse(BasicOperations.run(a.repeat(2, 3), "ab"));
    assertTrue(BasicOperations.run(a.complement(), "ba"));
    assertTrue(BasicOperations.isEmpty(a.minus(a)));
    assertTrue(BasicOperations.isEmpty(a.intersection(b)));
    assertTrue(a.subsetOf(a.union(b)));
    assertTrue(BasicAutomata.makeEmptyString().isEmptyString());
  }
}
