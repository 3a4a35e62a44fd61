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
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import org.termautomata.util.BytesRef;
import org.termautomata.util.IntsRef;
import org.termautomata.util.TermAutomataTestCase;
import org.termautomata.util.TestUtil;

public class TestDaciukMihovAutomatonBuilder extends TermAutomataTestCase {

  private static IntsRef codePoints(String s) {
    final int[] cps = s.codePoints().toArray();
    return new IntsRef(cps, 0, cps.length);
  }

  private static List<BytesRef> utf8(String... strings) {
    final List<BytesRef> list = new ArrayList<>();
    for (String s : strings) {
      list.add(new BytesRef(s));
    }
    return list;
  }

  private static void assertMinimal(Automaton a) {
    final Automaton m = a.clone();
    MinimizationOperations.minimize(m);
    assertEquals(m.getNumberOfStates(), a.getNumberOfStates());
  }

  public void testBasic() {
    final Automaton a = DaciukMihovAutomatonBuilder.build(utf8("a", "ab", "abc", "b"));
    assertTrue(a.isDeterministic());
    for (String s : new String[] {"a", "ab", "abc", "b"}) {
      assertTrue(s, BasicOperations.run(a, s));
    }
    for (String s : new String[] {"", "ac", "abcd", "ba", "c"}) {
      assertFalse(s, BasicOperations.run(a, s));
    }
    assertMinimal(a);
  }

  public void testSharedSuffixes() {
    final Automaton a = DaciukMihovAutomatonBuilder.build(utf8("bing", "ring", "sing", "wing"));
    // the four words share every state after the first letter
    assertEquals(5, a.getNumberOfStates());
    assertMinimal(a);
  }

  public void testUnsortedInput() {
    final DaciukMihovAutomatonBuilder builder = new DaciukMihovAutomatonBuilder();
    builder.add(codePoints("b"));
    try {
      builder.add(codePoints("a"));
      fail();
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage(), expected.getMessage().startsWith("Input must be in sorted order"));
    }
  }

  public void testCompleteOnlyOnce() {
    final DaciukMihovAutomatonBuilder builder = new DaciukMihovAutomatonBuilder();
    builder.add(codePoints("abc"));
    final Automaton a = builder.complete();
    assertTrue(BasicOperations.run(a, "abc"));
    try {
      builder.add(codePoints("abd"));
      fail();
    } catch (IllegalStateException expected) {
      // expected
    }
    try {
      builder.complete();
      fail();
    } catch (IllegalStateException expected) {
      // expected
    }
  }

  public void testDuplicatesAndEmptyString() {
    final DaciukMihovAutomatonBuilder builder = new DaciukMihovAutomatonBuilder();
    builder.add(codePoints(""));
    builder.add(codePoints("x"));
    builder.add(codePoints("x"));
    builder.add(codePoints("xy"));
    final Automaton a = builder.complete();
    assertTrue(BasicOperations.run(a, ""));
    assertTrue(BasicOperations.run(a, "x"));
    assertTrue(BasicOperations.run(a, "xy"));
    assertFalse(BasicOperations.run(a, "y"));
    assertMinimal(a);
  }

  public void testNoInput() {
    final Automaton a = new DaciukMihovAutomatonBuilder().complete();
    assertTrue(BasicOperations.isEmpty(a));
  }

  public void testSupplementaryCodePoints() {
    final List<String> strings = new ArrayList<>(Arrays.asList("𐐀", "𐐀x", "ﬀ", "z"));
    final List<BytesRef> bytes = utf8(strings.toArray(new String[0]));
    Collections.sort(bytes);
    final Automaton a = DaciukMihovAutomatonBuilder.build(bytes);
    for (String s : strings) {
      assertTrue(s, BasicOperations.run(a, s));
    }
    assertFalse(BasicOperations.run(a, "x"));
  }

  /** Random sets of strings must give the language of the plain union, with a minimal automaton. */
  public void testRandomSets() {
    final int iters = atLeast(20);
    for (int iter = 0; iter < iters; iter++) {
      final TreeSet<BytesRef> sorted = new TreeSet<>();
      final List<Automaton> singles = new ArrayList<>();
      final int count = TestUtil.nextInt(random(), 1, 50);
      for (int i = 0; i < count; i++) {
        final String s = random().nextBoolean()
            ? TestUtil.randomSimpleStringRange(random(), 'a', 'd', 6)
            : TestUtil.randomUnicodeString(random(), 4);
        sorted.add(new BytesRef(s));
        singles.add(BasicAutomata.makeString(s));
      }
      final Automaton a = BasicAutomata.makeStringUnion(sorted);
      assertTrue(BasicOperations.sameLanguage(a, BasicOperations.union(singles)));
      assertMinimal(a);
    }
  }
}
