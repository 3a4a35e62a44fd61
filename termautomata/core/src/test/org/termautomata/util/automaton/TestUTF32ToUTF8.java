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

import java.util.Random;

import org.termautomata.util.BytesRef;
import org.termautomata.util.TermAutomataTestCase;
import org.termautomata.util.TestUtil;
import org.termautomata.util.UnicodeUtil;

public class TestUTF32ToUTF8 extends TermAutomataTestCase {

  private static final int MAX_UNICODE = Character.MAX_CODE_POINT;

  private static boolean isSurrogate(int code) {
    return code >= UnicodeUtil.UNI_SUR_HIGH_START && code <= UnicodeUtil.UNI_SUR_LOW_END;
  }

  private static BytesRef toUTF8(int codePoint) {
    return new BytesRef(new String(Character.toChars(codePoint)));
  }

  private int getCodeStart(Random r) {
    switch (r.nextInt(4)) {
      case 0:
        return TestUtil.nextInt(r, 0, 128);
      case 1:
        return TestUtil.nextInt(r, 128, 2048);
      case 2:
        return TestUtil.nextInt(r, 2048, 65536);
      default:
        return TestUtil.nextInt(r, 65536, 1 + MAX_UNICODE);
    }
  }

  /** Converts random code point ranges and probes code points inside, outside and on the edges. */
  public void testRandomRanges() {
    final int iters = atLeast(100);
    for (int iter = 0; iter < iters; iter++) {
      int x1 = getCodeStart(random());
      int x2 = getCodeStart(random());
      final int startCode = Math.min(Math.min(x1, x2), MAX_UNICODE);
      final int endCode = Math.min(Math.max(x1, x2), MAX_UNICODE);
      final ByteRunAutomaton run = new ByteRunAutomaton(BasicAutomata.makeCharRange(startCode, endCode));

      for (int i = 0; i < 50; i++) {
        final int code;
        switch (random().nextInt(5)) {
          case 0:
            code = startCode;
            break;
          case 1:
            code = endCode;
            break;
          case 2:
            code = Math.max(0, startCode - 1);
            break;
          case 3:
            code = Math.min(MAX_UNICODE, endCode + 1);
            break;
          default:
            code = TestUtil.nextInt(random(), 0, MAX_UNICODE);
        }
        if (isSurrogate(code)) {
          continue;
        }
        final BytesRef utf8 = toUTF8(code);
        final boolean expected = code >= startCode && code <= endCode;
        assertEquals("code=" + code + " range=" + startCode + "-" + endCode, expected,
            run.run(utf8.bytes, utf8.offset, utf8.length));
      }
    }
  }

  /** Every sequence length boundary. */
  public void testEncodingBoundaries() {
    final int[] edges = {0, 0x7f, 0x80, 0x7ff, 0x800, 0xd7ff, 0xe000, 0xffff, 0x10000, MAX_UNICODE};
    for (int min : edges) {
      for (int max : edges) {
        if (min > max) {
          continue;
        }
        final ByteRunAutomaton run = new ByteRunAutomaton(BasicAutomata.makeCharRange(min, max));
        for (int code : edges) {
          final BytesRef utf8 = toUTF8(code);
          assertEquals(min + "-" + max + " code=" + code, code >= min && code <= max,
              run.run(utf8.bytes, utf8.offset, utf8.length));
        }
      }
    }
  }

  public void testSpecialCase() {
    // a-z followed by a three byte code point range
    final Automaton a = new RegExp("[a-z][\u0800-\ufffd]").toAutomaton();
    final ByteRunAutomaton run = new ByteRunAutomaton(a);
    final BytesRef yes = new BytesRef("q中");
    final BytesRef no = new BytesRef("q߿");
    assertTrue(run.run(yes.bytes, yes.offset, yes.length));
    assertFalse(run.run(no.bytes, no.offset, no.length));
  }

  public void testSingletonAndEmpty() {
    final ByteRunAutomaton single = new ByteRunAutomaton(BasicAutomata.makeString("héllo𐐀"));
    final BytesRef yes = new BytesRef("héllo𐐀");
    final BytesRef no = new BytesRef("hello");
    assertTrue(single.run(yes.bytes, yes.offset, yes.length));
    assertFalse(single.run(no.bytes, no.offset, no.length));

    final ByteRunAutomaton empty = new ByteRunAutomaton(BasicAutomata.makeEmpty());
    assertFalse(empty.run(new byte[0], 0, 0));
    final ByteRunAutomaton emptyString = new ByteRunAutomaton(BasicAutomata.makeEmptyString());
    assertTrue(emptyString.run(new byte[0], 0, 0));
  }

  public void testConvertedLabelsAreBytes() {
    final Automaton utf8 = new UTF32ToUTF8().convert(BasicAutomata.makeAnyString());
    for (State s : utf8.getNumberedStates()) {
      for (Transition t : s.getTransitions()) {
        assertTrue(t.getMin() >= 0);
        assertTrue(t.getMax() <= 0xff);
      }
    }
  }

  /** The byte and char based run automata must agree on random strings and regexps. */
  public void testRandomRegexps() {
    final int num = atLeast(50);
    for (int i = 0; i < num; i++) {
      final Automaton a = AutomatonTestUtil.randomAutomaton(random());
      final CharacterRunAutomaton cra = new CharacterRunAutomaton(a);
      final ByteRunAutomaton bra = new ByteRunAutomaton(a);
      final AutomatonTestUtil.RandomAcceptedStrings accepted = BasicOperations.isEmpty(a) ? null
          : new AutomatonTestUtil.RandomAcceptedStrings(a);
      for (int j = 0; j < 50; j++) {
        final String s;
        if (accepted != null && random().nextBoolean()) {
          final int[] codePoints = accepted.getRandomAcceptedString(random());
          s = UnicodeUtil.newString(codePoints, 0, codePoints.length);
          assertTrue(s, cra.run(s));
        } else if (random().nextBoolean()) {
          s = TestUtil.randomUnicodeString(random());
        } else {
          s = TestUtil.randomSimpleStringRange(random(), 'a', 'f', 6);
        }
        final BytesRef utf8 = new BytesRef(s);
        assertEquals(s, cra.run(s), bra.run(utf8.bytes, utf8.offset, utf8.length));
        assertEquals(s, BasicOperations.run(a, s), cra.run(s));
      }
    }
  }
}
