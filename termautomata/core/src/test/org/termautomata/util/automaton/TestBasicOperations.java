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
import java.util.Arrays;
import java.util.List;

import org.termautomata.util.TermAutomataTestCase;
import org.termautomata.util.TestUtil;

public class TestBasicOperations extends TermAutomataTestCase {

  private static Automaton regexp(String s) {
    return new RegExp(s, RegExp.NONE).toAutomaton();
  }

  private void assertAccepts(Automaton a, String... strings) {
    for (String s : strings) {
      assertTrue("should accept " + s, BasicOperations.run(a, s));
    }
  }

  private void assertRejects(Automaton a, String... strings) {
    for (String s : strings) {
      assertFalse("should reject " + s, BasicOperations.run(a, s));
    }
  }

  public void testConcatenate() {
    Automaton a = BasicOperations.concatenate(regexp("a+"), regexp("b|c"));
    assertAccepts(a, "ab", "aaac");
    assertRejects(a, "", "a", "b", "abc");

    Automaton strings = BasicOperations.concatenate(BasicAutomata.makeString("foo"), BasicAutomata.makeString("bar"));
    assertTrue(strings.isSingleton());
    assertEquals("foobar", strings.getSingleton());

    assertTrue(BasicOperations.isEmpty(BasicOperations.concatenate(BasicAutomata.makeEmpty(), regexp("a*"))));
  }

  public void testConcatenateList() {
    Automaton a = regexp("ab?");
    Automaton a2 = BasicOperations.concatenate(Arrays.asList(a, BasicAutomata.makeEmptyString(), a));
    assertAccepts(a2, "aa", "aba", "abab", "aab");
    assertRejects(a2, "a", "ab", "abb");
    // the aliased argument is left untouched
    assertAccepts(a, "a", "ab");
    assertRejects(a, "aa");

    assertTrue(BasicOperations.concatenate(new ArrayList<Automaton>()).isEmptyString());
    assertTrue(BasicOperations.isEmpty(BasicOperations.concatenate(Arrays.asList(a, BasicAutomata.makeEmpty()))));
  }

  public void testOptional() {
    Automaton a = BasicOperations.optional(regexp("ab"));
    assertAccepts(a, "", "ab");
    assertRejects(a, "a", "abab");
  }

  public void testRepeat() {
    Automaton a = regexp("ab");
    assertAccepts(BasicOperations.repeat(a), "", "ab", "ababab");
    assertAccepts(BasicOperations.repeat(a, 2), "abab", "ababab");
    assertRejects(BasicOperations.repeat(a, 2), "", "ab");
    Automaton minMax = BasicOperations.repeat(a, 1, 2);
    assertAccepts(minMax, "ab", "abab");
    assertRejects(minMax, "", "ababab");
    assertTrue(BasicOperations.repeat(a, 0, 0).isEmptyString());
    assertTrue(BasicOperations.isEmpty(BasicOperations.repeat(a, 3, 2)));
    assertRejects(a, "", "abab");
  }

  public void testRepeatRejectsNegativeMin() {
    try {
      BasicOperations.repeat(regexp("a"), -1);
      fail("negative min must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    try {
      BasicOperations.repeat(regexp("a"), -1, 3);
      fail("negative min must be rejected");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  /** The input of repeat(min) is also part of the concatenation, so building the star in place would be wrong. */
  public void testRepeatMinWithMutation() {
    AutomatonConfig mutate = AutomatonConfig.DEFAULT.setAllowMutate(true);
    Automaton a = BasicOperations.repeat(BasicAutomata.makeCharRange('a', 'b'), 1, mutate);
    assertAccepts(a, "a", "abba");
    assertRejects(a, "");
    a = BasicOperations.repeat(BasicAutomata.makeCharRange('a', 'b'), 2, mutate);
    assertAccepts(a, "ab", "abba");
    assertRejects(a, "", "a");
  }

  public void testComplement() {
    Automaton a = BasicOperations.complement(regexp("a*"));
    assertAccepts(a, "b", "ab", "aab", "𐐀");
    assertRejects(a, "", "a", "aaaa");
    assertTrue(a.isDeterministic());
    assertTrue(BasicOperations.isTotal(Automaton.minimize(BasicOperations.complement(BasicAutomata.makeEmpty()))));
    assertTrue(BasicOperations.isEmpty(BasicOperations.complement(BasicAutomata.makeAnyString())));
  }

  public void testMinusAndIntersection() {
    Automaton a1 = regexp("[a-c]+");
    Automaton a2 = regexp("b*");
    Automaton minus = BasicOperations.minus(a1, a2);
    assertAccepts(minus, "a", "ab", "cb");
    assertRejects(minus, "", "b", "bbb", "d");
    Automaton inter = BasicOperations.intersection(a1, a2);
    assertAccepts(inter, "b", "bbb");
    assertRejects(inter, "", "a");

    assertTrue(BasicOperations.isEmpty(BasicOperations.minus(a1, a1)));
    assertEquals("abc", BasicOperations.intersection(BasicAutomata.makeString("abc"), a1).getSingleton());
    assertTrue(BasicOperations.isEmpty(BasicOperations.intersection(BasicAutomata.makeString("abd"), a1)));
  }

  public void testUnion() {
    Automaton a = BasicOperations.union(regexp("ab"), regexp("c*"));
    assertAccepts(a, "ab", "", "ccc");
    assertRejects(a, "abc", "a");

    Automaton x = regexp("x+");
    Automaton u = BasicOperations.union(Arrays.asList(x, BasicAutomata.makeEmpty(), x, BasicAutomata.makeString("yz")));
    assertAccepts(u, "x", "xxx", "yz");
    assertRejects(u, "", "y", "xyz");
    assertAccepts(x, "x");
    assertRejects(x, "yz");

    assertTrue(BasicOperations.isEmpty(BasicOperations.union(new ArrayList<Automaton>())));
  }

  public void testSameLanguageAndSubset() {
    assertTrue(BasicOperations.sameLanguage(regexp("(a|b)*"), regexp("(a*b*)*")));
    assertFalse(BasicOperations.sameLanguage(regexp("(a|b)*"), regexp("(ab)*")));
    assertTrue(BasicOperations.subsetOf(regexp("(ab)*"), regexp("(a|b)*")));
    assertFalse(BasicOperations.subsetOf(regexp("(a|b)*"), regexp("(ab)*")));
    assertTrue(BasicOperations.subsetOf(BasicAutomata.makeString("abab"), regexp("(ab)*")));
    assertTrue(BasicOperations.sameLanguage(BasicAutomata.makeString("ab"), regexp("a(b)")));
  }

  public void testEmptinessPredicates() {
    assertTrue(BasicOperations.isEmpty(BasicAutomata.makeEmpty()));
    assertFalse(BasicOperations.isEmpty(BasicAutomata.makeEmptyString()));
    assertTrue(BasicOperations.isEmptyString(BasicAutomata.makeEmptyString()));
    assertFalse(BasicOperations.isEmptyString(regexp("a?")));
    assertTrue(BasicOperations.isTotal(BasicAutomata.makeAnyString()));
    assertFalse(BasicOperations.isTotal(regexp(".")));
  }

  public void testDefaultConfigLeavesInputsAlone() {
    Automaton a1 = regexp("ab*");
    Automaton a2 = regexp("c|d");
    int states1 = a1.getNumberOfStates();
    int states2 = a2.getNumberOfStates();
    BasicOperations.union(a1, a2);
    BasicOperations.concatenate(a1, a2);
    BasicOperations.optional(a1);
    BasicOperations.repeat(a2);
    BasicOperations.complement(a1);
    BasicOperations.minus(a1, a2);
    assertEquals(states1, a1.getNumberOfStates());
    assertEquals(states2, a2.getNumberOfStates());
    assertAccepts(a1, "a", "abb");
    assertRejects(a1, "", "c");
    assertAccepts(a2, "c", "d");
    assertRejects(a2, "", "cd");
  }

  public void testMinimizeAlways() {
    AutomatonConfig config = AutomatonConfig.DEFAULT.setMinimizeAlways(true);
    Automaton a = BasicOperations.union(regexp("ab"), regexp("cb"), config);
    assertTrue(a.isDeterministic());
    // initial, after a|c, after b
    assertEquals(3, a.getNumberOfStates());
  }

  public void testRunNondeterministic() {
    Automaton a = BasicOperations.union(regexp("ab*"), regexp("a(c|b)"));
    assertFalse(a.isDeterministic());
    assertAccepts(a, "a", "ab", "ac", "abbb");
    assertRejects(a, "", "acc", "b");
  }

  /** Compares the operations against membership of the operands, for random expressions and strings. */
  public void testRandomOperations() {
    final int iters = atLeast(20);
    for (int iter = 0; iter < iters; iter++) {
      final Automaton a1 = AutomatonTestUtil.randomAutomaton(random());
      final Automaton a2 = AutomatonTestUtil.randomAutomaton(random());
      final Automaton union = BasicOperations.union(a1, a2);
      final Automaton concat = BasicOperations.concatenate(a1, a2);
      final Automaton inter = BasicOperations.intersection(a1, a2);
      final Automaton minus = BasicOperations.minus(a1, a2);
      final Automaton compl = BasicOperations.complement(a1);
      final Automaton star = BasicOperations.repeat(a1);
      final List<String> strings = new ArrayList<>();
      for (int i = 0; i < 50; i++) {
        strings.add(TestUtil.randomSimpleStringRange(random(), 'a', 'f', 6));
      }
      for (String s : strings) {
        final boolean in1 = AutomatonTestUtil.accepts(a1, s);
        final boolean in2 = AutomatonTestUtil.accepts(a2, s);
        assertEquals(in1 || in2, BasicOperations.run(union, s));
        assertEquals(in1 && in2, BasicOperations.run(inter, s));
        assertEquals(in1 && !in2, BasicOperations.run(minus, s));
        assertEquals(!in1, BasicOperations.run(compl, s));
        if (in1) {
          assertTrue(BasicOperations.run(star, s));
        }
        boolean split = false;
        for (int i = 0; i <= s.length() && !split; i++) {
          split = AutomatonTestUtil.accepts(a1, s.substring(0, i)) && AutomatonTestUtil.accepts(a2, s.substring(i));
        }
        assertEquals(s, split, BasicOperations.run(concat, s));
      }
      assertTrue(BasicOperations.subsetOf(inter, union));
      assertTrue(BasicOperations.subsetOf(minus, a1));
      assertTrue(BasicOperations.sameLanguage(union, BasicOperations.union(a2, a1)));
    }
  }
}
