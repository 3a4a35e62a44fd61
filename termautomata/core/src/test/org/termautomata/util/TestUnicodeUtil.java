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
package org.termautomata.util;

import static org.junit.Assert.*;

public class TestUnicodeUtil extends TermAutomataTestCase {

  public void testCodePointCount() {
    assertEquals(0, UnicodeUtil.codePointCount(new BytesRef("")));
    assertEquals(3, UnicodeUtil.codePointCount(new BytesRef("abc")));
    assertEquals(4, UnicodeUtil.codePointCount(new BytesRef("aé中𐐀")));
    try {
      UnicodeUtil.codePointCount(new BytesRef(new byte[] {(byte) 0x80}));
      fail();
    } catch (IllegalArgumentException expected) {
      assertTrue(expected.getMessage().startsWith("invalid utf8 header byte 128"));
    }
    try {
      UnicodeUtil.codePointCount(new BytesRef(new byte[] {(byte) 0xe4, (byte) 0xb8}));
      fail();
    } catch (IllegalArgumentException expected) {
      assertEquals("utf8 content truncated", expected.getMessage());
    }
  }

  public void testUnpairedSurrogateIsReplaced() {
    final BytesRef utf8 = new BytesRef("a\ud800b");
    assertEquals("a�b", utf8.utf8ToString());
    assertFalse(UnicodeUtil.validUTF16String("a\ud800b"));
    assertFalse(UnicodeUtil.validUTF16String("\udc00"));
    assertTrue(UnicodeUtil.validUTF16String("a𐐀"));
  }

  public void testNewStringRejectsInvalidCodePoints() {
    try {
      UnicodeUtil.newString(new int[] {'a', Character.MAX_CODE_POINT + 1}, 0, 2);
      fail();
    } catch (IllegalArgumentException expected) {
      // expected
    }
    try {
      UnicodeUtil.newString(new int[] {'a'}, 0, -1);
      fail();
    } catch (IllegalArgumentException expected) {
      // expected
    }
    assertEquals("b𐐀", UnicodeUtil.newString(new int[] {'a', 'b', 0x10400}, 1, 2));
  }

  public void testRandomConversions() {
    final int iters = atLeast(200);
    for (int i = 0; i < iters; i++) {
      final String s = TestUtil.randomUnicodeString(random());
      assertTrue(UnicodeUtil.validUTF16String(s));

      final BytesRef utf8 = new BytesRef(s);
      assertEquals(s, utf8.utf8ToString());
      assertEquals(s.codePointCount(0, s.length()), UnicodeUtil.codePointCount(utf8));

      final int[] expected = s.codePoints().toArray();
      assertArrayEquals(expected, UnicodeUtil.toUTF32(s));
      final int[] decoded = new int[utf8.length];
      final int count = UnicodeUtil.UTF8toUTF32(utf8, decoded);
      assertEquals(expected.length, count);
      for (int j = 0; j < count; j++) {
        assertEquals(expected[j], decoded[j]);
      }
      assertEquals(s, UnicodeUtil.newString(expected, 0, expected.length));
    }
  }

  public void testUTF8OrderMatchesCodePointOrder() {
    final int iters = atLeast(200);
    for (int i = 0; i < iters; i++) {
      final String a = TestUtil.randomUnicodeString(random(), 6);
      final String b = TestUtil.randomUnicodeString(random(), 6);
      final int byCodePoints = Integer.signum(compareCodePoints(UnicodeUtil.toUTF32(a), UnicodeUtil.toUTF32(b)));
      final int byBytes = Integer.signum(new BytesRef(a).compareTo(new BytesRef(b)));
      assertEquals(a + " vs " + b, byCodePoints, byBytes);
    }
  }

  private static int compareCodePoints(int[] a, int[] b) {
    return new IntsRef(a, 0, a.length).compareTo(new IntsRef(b, 0, b.length));
  }
}
