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

import java.util.ArrayList;
import java.util.List;

import org.termautomata.util.TermAutomataTestCase;
import org.termautomata.util.TestUtil;
import org.termautomata.util.UnicodeUtil;

public class TestLevenshteinAutomata extends TermAutomataTestCase {

  public void testCat() {
    final LevenshteinAutomata plain = new LevenshteinAutomata("cat", false);
    final CharacterRunAutomaton one = new CharacterRunAutomaton(plain.toAutomaton(1));
    for (String s : new String[] {"cat", "at", "ct", "ca", "cats", "bat", "cbt", "scat"}) {
      assertTrue(s, one.run(s));
    }
    for (String s : new String[] {"", "c", "act", "tac", "dog", "catss"}) {
      assertFalse(s, one.run(s));
    }

    final LevenshteinAutomata transposing = new LevenshteinAutomata("cat", true);
    final CharacterRunAutomaton oneT = new CharacterRunAutomaton(transposing.toAutomaton(1));
    assertTrue(oneT.run("act"));
    assertTrue(oneT.run("cta"));
    assertFalse(oneT.run("tac"));

    final CharacterRunAutomaton two = new CharacterRunAutomaton(plain.toAutomaton(2));
    assertTrue(two.run("act"));
    assertTrue(two.run("c"));
    assertTrue(two.run("gat"));
    assertFalse(two.run("dog"));
  }

  public void testDistanceZero() {
    final Automaton a = new LevenshteinAutomata("foo", true).toAutomaton(0);
    assertTrue(a.isSingleton());
    assertEquals("foo", a.getSingleton());
    assertEquals("barfoo", new LevenshteinAutomata("foo", false).toAutomaton(0, "bar").getSingleton());
  }

  public void testUnsupportedDistance() {
    final LevenshteinAutomata lev = new LevenshteinAutomata("foo", false);
    for (int n : new int[] {-1, LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE + 1}) {
      try {
        lev.toAutomaton(n);
        fail("distance " + n + " must be rejected");
      } catch (IllegalArgumentException expected) {
        // expected
      }
    }
  }

  public void testAlphaMax() {
    try {
      new LevenshteinAutomata(new int[] {'a', 300}, 255, false);
      fail("symbol above alphaMax must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    final Automaton a = new LevenshteinAutomata(new int[] {'a', 'b'}, 255, false).toAutomaton(1);
    for (State s : a.getNumberedStates()) {
      for (Transition t : s.getTransitions()) {
        assertTrue(t.getMax() <= 255);
      }
    }
  }

  public void testPrefix() {
    final Automaton a = new LevenshteinAutomata("bar", false).toAutomaton(1, "foo");
    assertTrue(a.isDeterministic());
    final CharacterRunAutomaton run = new CharacterRunAutomaton(a);
    assertTrue(run.run("foobar"));
    assertTrue(run.run("fooba"));
    assertTrue(run.run("foobaz"));
    assertFalse(run.run("fobar"));
    assertFalse(run.run("bar"));
    assertFalse(run.run("xoobar"));
  }

  public void testSupplementaryCharacters() {
    final CharacterRunAutomaton run = new CharacterRunAutomaton(new LevenshteinAutomata("𐐀b", false).toAutomaton(1));
    assertTrue(run.run("𐐀b"));
    assertTrue(run.run("b"));
    assertTrue(run.run("𐐀"));
    assertTrue(run.run("𐐁b"));
    assertFalse(run.run("xy"));
  }

  public void testEmptyWord() {
    final CharacterRunAutomaton run = new CharacterRunAutomaton(new LevenshteinAutomata("", false).toAutomaton(1));
    assertTrue(run.run(""));
    assertTrue(run.run("x"));
    assertFalse(run.run("xy"));
  }

  /**
   * Tests all strings over a small alphabet against a direct edit distance
   * computation. The alphabet has one letter that never occurs in the words.
   */
  public void testAgainstEditDistance() {
    final int iters = atLeast(8);
    for (int iter = 0; iter < iters; iter++) {
      final String word = TestUtil.randomSimpleStringRange(random(), 'a', 'c', 4);
      for (boolean transpositions : new boolean[] {false, true}) {
        final LevenshteinAutomata builder = new LevenshteinAutomata(word, transpositions);
        for (int n = 0; n <= LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE; n++) {
          final Automaton a = builder.toAutomaton(n);
          if (!a.isSingleton()) {
            assertTrue(a.isDeterministic());
            assertNoDeadStates(a);
          }
          assertLanguage(word, a, n, transpositions);
        }
      }
    }
  }

  private void assertLanguage(String word, Automaton a, int n, boolean transpositions) {
    final CharacterRunAutomaton run = new CharacterRunAutomaton(a);
    final int[] target = UnicodeUtil.toUTF32(word);
    final char[] alphabet = {'a', 'b', 'c', 'z'};
    List<String> strings = new ArrayList<>();
    strings.add("");
    for (int length = 0; length <= word.length() + n; length++) {
      final List<String> longer = new ArrayList<>();
      for (String s : strings) {
        final boolean expected = AutomatonTestUtil.editDistance(target, UnicodeUtil.toUTF32(s), transpositions) <= n;
        assertEquals("word=" + word + " n=" + n + " transpositions=" + transpositions + " s=" + s, expected, run.run(s));
        if (length < word.length() + n) {
          for (char c : alphabet) {
            longer.add(s + c);
          }
        }
      }
      strings = longer;
    }
    // anything longer is always too far away
    assertFalse(run.run(word + "zzz".substring(0, n + 1)));
  }

  private static void assertNoDeadStates(Automaton a) {
    final Automaton pruned = a.clone();
    pruned.removeDeadTransitions();
    assertEquals(a.getNumberOfStates(), pruned.getNumberOfStates());
  }
}
