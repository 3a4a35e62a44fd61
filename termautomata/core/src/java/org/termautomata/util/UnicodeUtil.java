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


/**
 * Class to encode java's UTF16 char[] into UTF8 byte[]
 * without always allocating a new byte[] as
 * String.getBytes(StandardCharsets.UTF_8) does, and to walk
 * UTF8 byte[] as code points.
 *
 * @termautomata.internal
 */
public final class UnicodeUtil {

  private UnicodeUtil() {} // no instance

  public static final int UNI_SUR_HIGH_START = 0xD800;
  public static final int UNI_SUR_HIGH_END = 0xDBFF;
  public static final int UNI_SUR_LOW_START = 0xDC00;
  public static final int UNI_SUR_LOW_END = 0xDFFF;
  public static final int UNI_REPLACEMENT_CHAR = 0xFFFD;

  /** Maximum number of UTF8 bytes per UTF16 character. */
  public static final int MAX_UTF8_BYTES_PER_CHAR = 3;

  private static final long UNI_MAX_BMP = 0x0000FFFF;

  private static final long HALF_SHIFT = 10;

  private static final int SURROGATE_OFFSET =
    Character.MIN_SUPPLEMENTARY_CODE_POINT -
    (UNI_SUR_HIGH_START << HALF_SHIFT) - UNI_SUR_LOW_START;

  /** Returns the number of bytes a UTF8 encoding of {@code length} UTF16 chars can take at most. */
  public static int maxUTF8Length(int utf16Length) {
    return Math.multiplyExact(utf16Length, MAX_UTF8_BYTES_PER_CHAR);
  }

  /** Encode characters from this String, starting at offset
   *  for length characters. Output to the destination array
   *  will begin at {@code outOffset}. It should be large enough
   *  to hold {@link #maxUTF8Length(int)} bytes.
   *  <p>
   *  Unpaired surrogates are replaced with {@link #UNI_REPLACEMENT_CHAR}.
   *
   *  @return the number of bytes written
   */
  public static int UTF16toUTF8(final CharSequence s, final int offset, final int length, byte[] out, int outOffset) {
    final int end = offset + length;

    int upto = outOffset;
    for(int i=offset;i<end;i++) {
      final int code = (int) s.charAt(i);

      if (code < 0x80)
        out[upto++] = (byte) code;
      else if (code < 0x800) {
        out[upto++] = (byte) (0xC0 | (code >> 6));
        out[upto++] = (byte)(0x80 | (code & 0x3F));
      } else if (code < 0xD800 || code > 0xDFFF) {
        out[upto++] = (byte)(0xE0 | (code >> 12));
        out[upto++] = (byte)(0x80 | ((code >> 6) & 0x3F));
        out[upto++] = (byte)(0x80 | (code & 0x3F));
      } else {
        // surrogate pair
        // confirm valid high surrogate
        if (code < 0xDC00 && (i < end-1)) {
          int utf32 = (int) s.charAt(i+1);
          // confirm valid low surrogate and write pair
          if (utf32 >= 0xDC00 && utf32 <= 0xDFFF) {
            utf32 = (code << 10) + utf32 + SURROGATE_OFFSET;
            i++;
            out[upto++] = (byte)(0xF0 | (utf32 >> 18));
            out[upto++] = (byte)(0x80 | ((utf32 >> 12) & 0x3F));
            out[upto++] = (byte)(0x80 | ((utf32 >> 6) & 0x3F));
            out[upto++] = (byte)(0x80 | (utf32 & 0x3F));
            continue;
          }
        }
        // replace unpaired surrogate or out-of-order low surrogate
        // with substitution character
        out[upto++] = (byte) 0xEF;
        out[upto++] = (byte) 0xBF;
        out[upto++] = (byte) 0xBD;
      }
    }
    return upto - outOffset;
  }

  /**
   * Returns the number of code points in this UTF8 sequence.
   *
   * <p>This method assumes valid UTF8 input. This method
   * <strong>does not perform</strong> full UTF8 validation, it will check only the
   * first byte of each codepoint (for multi-byte sequences any bytes after
   * the head are skipped).
   *
   * @throws IllegalArgumentException If invalid codepoint header byte occurs or the
   *    content is prematurely truncated.
   */
  public static int codePointCount(BytesRef utf8) {
    int pos = utf8.offset;
    final int limit = pos + utf8.length;
    final byte[] bytes = utf8.bytes;

    int codePointCount = 0;
    for (; pos < limit; codePointCount++) {
      int v = bytes[pos] & 0xFF;
      if (v <   /* 0xxx xxxx */ 0x80) { pos += 1; continue; }
      if (v >=  /* 110x xxxx */ 0xc0) {
        if (v < /* 111x xxxx */ 0xe0) { pos += 2; continue; }
        if (v < /* 1111 xxxx */ 0xf0) { pos += 3; continue; }
        if (v < /* 1111 1xxx */ 0xf8) { pos += 4; continue; }
        // fallthrough, consider 5 and 6 byte sequences invalid.
      }

      // Anything not covered above is invalid UTF8.
      throw new IllegalArgumentException("invalid utf8 header byte " + v + " at offset " + (pos - utf8.offset));
    }

    // Check if we didn't go over the limit on the last character.
    if (pos > limit) throw new IllegalArgumentException("utf8 content truncated");

    return codePointCount;
  }

  /**
   * This method assumes valid UTF8 input. This method
   * <strong>does not perform</strong> full UTF8 validation, it will check only the
   * first byte of each codepoint (for multi-byte sequences any bytes after
   * the head are skipped). It is the responsibility of the caller to make sure
   * that the destination array is large enough.
   *
   * @throws IllegalArgumentException If invalid codepoint header byte occurs or the
   *    content is prematurely truncated.
   * @return the number of code points written to {@code ints}
   */
  public static int UTF8toUTF32(final BytesRef utf8, final int[] ints) {
    int utf32Count = 0;
    int utf8Upto = utf8.offset;
    final byte[] bytes = utf8.bytes;
    final int utf8Limit = utf8.offset + utf8.length;
    while(utf8Upto < utf8Limit) {
      final int numBytes = utf8CodeLength(bytes[utf8Upto] & 0xFF, utf8Upto - utf8.offset);
      int v = 0;
      switch (numBytes) {
        case 1:
          ints[utf32Count++] = bytes[utf8Upto++];
          continue;
        case 2:
          // 5 useful bits
          v = bytes[utf8Upto++] & 31;
          break;
        case 3:
          // 4 useful bits
          v = bytes[utf8Upto++] & 15;
          break;
        case 4:
          // 3 useful bits
          v = bytes[utf8Upto++] & 7;
          break;
        default :
          throw new AssertionError("unreachable: " + numBytes);
      }

      if (utf8Upto - 1 + numBytes > utf8Limit) {
        throw new IllegalArgumentException("utf8 content truncated");
      }
      final int limit = utf8Upto + numBytes-1;
      while(utf8Upto < limit) {
        v = v << 6 | bytes[utf8Upto++]&63;
      }
      ints[utf32Count++] = v;
    }

    return utf32Count;
  }

  private static int utf8CodeLength(int leadByte, int position) {
    if (leadByte < 0x80) return 1;
    if (leadByte >= 0xc0) {
      if (leadByte < 0xe0) return 2;
      if (leadByte < 0xf0) return 3;
      if (leadByte < 0xf8) return 4;
    }
    throw new IllegalArgumentException("invalid utf8 header byte " + leadByte + " at offset " + position);
  }

  /** Returns the code points of {@code s}. */
  public static int[] toUTF32(CharSequence s) {
    final int[] out = new int[s.length()];
    int upto = 0;
    for (int i = 0; i < s.length(); ) {
      final int cp = Character.codePointAt(s, i);
      out[upto++] = cp;
      i += Character.charCount(cp);
    }
    if (upto == out.length) {
      return out;
    }
    int[] result = new int[upto];
    System.arraycopy(out, 0, result, 0, upto);
    return result;
  }

  /**
   * Create a String from an array of code points.
   *
   * @param codePoints The code array
   * @param offset The start of the text in the code point array
   * @param count The number of code points
   * @return a String representing the code points between offset and count
   * @throws IllegalArgumentException If an invalid code point is encountered
   * @throws IndexOutOfBoundsException If the offset or count are out of bounds.
   */
  public static String newString(int[] codePoints, int offset, int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0 (got " + count + ")");
    }
    char[] chars = new char[count];
    int w = 0;
    for (int r = offset, e = offset + count; r < e; ++r) {
      int cp = codePoints[r];
      if (cp < 0 || cp > Character.MAX_CODE_POINT) {
        throw new IllegalArgumentException("invalid code point " + cp + " at index " + r);
      }
      if (cp <= UNI_MAX_BMP) {
        chars = ArrayUtil.grow(chars, w + 1);
        chars[w++] = (char) cp;
      } else {
        chars = ArrayUtil.grow(chars, w + 2);
        chars[w++] = Character.highSurrogate(cp);
        chars[w++] = Character.lowSurrogate(cp);
      }
    }
    return new String(chars, 0, w);
  }

  /** Decodes UTF8 bytes to a String. Invalid input is handled as in {@link #UTF8toUTF32}. */
  public static String newString(BytesRef utf8) {
    final int[] ints = new int[utf8.length];
    final int count = UTF8toUTF32(utf8, ints);
    return newString(ints, 0, count);
  }

  /** Returns false if {@code s} holds an unpaired surrogate. */
  public static boolean validUTF16String(CharSequence s) {
    final int size = s.length();
    for(int i=0;i<size;i++) {
      char ch = s.charAt(i);
      if (ch >= UNI_SUR_HIGH_START && ch <= UNI_SUR_HIGH_END) {
        if (i < size-1) {
          i++;
          char nextCH = s.charAt(i);
          if (nextCH >= UNI_SUR_LOW_START && nextCH <= UNI_SUR_LOW_END) {
            // Valid surrogate pair
          } else
            // Unmatched high surrogate
            return false;
        } else
          // Unmatched high surrogate
          return false;
      } else if (ch >= UNI_SUR_LOW_START && ch <= UNI_SUR_LOW_END)
        // Unmatched low surrogate
        return false;
    }

    return true;
  }
}
