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


import java.util.Comparator;

/**
 * <code>Automaton</code> transition.
 * <p>
 * A transition, which belongs to a source state, consists of a Unicode
 * codepoint interval and a destination state.
 *
 * @termautomata.experimental
 */
public class Transition implements Cloneable {

  /*
   * CLASS INVARIANT: min<=max
   */

  final int min;
  final int max;
  final State to;

  /**
   * Constructs a new singleton interval transition.
   *
   * @param c transition codepoint
   * @param to destination state
   */
  public Transition(int c, State to) {
    assert c >= 0;
    min = max = c;
    this.to = to;
  }

  /**
   * Constructs a new transition. Both end points are included in the interval.
   *
   * @param min transition interval minimum
   * @param max transition interval maximum
   * @param to destination state
   */
  public Transition(int min, int max, State to) {
    assert min >= 0;
    assert max >= 0;
    if (max < min) {
      int t = max;
      max = min;
      min = t;
    }
    this.min = min;
    this.max = max;
    this.to = to;
  }

  /** Returns minimum of this transition interval. */
  public int getMin() {
    return min;
  }

  /** Returns maximum of this transition interval. */
  public int getMax() {
    return max;
  }

  /** Returns destination of this transition. */
  public State getDest() {
    return to;
  }

  /**
   * Checks for equality.
   *
   * @param obj object to compare with
   * @return true if <code>obj</code> is a transition with same character
   *         interval and destination state as this transition.
   */
  @Override
  public boolean equals(Object obj) {
    if (obj instanceof Transition) {
      Transition t = (Transition) obj;
      return t.min == min && t.max == max && t.to == to;
    } else return false;
  }

  /**
   * Returns hash code. The hash code is based on the character interval (not
   * the destination state).
   *
   * @return hash code
   */
  @Override
  public int hashCode() {
    return min * 2 + max * 3;
  }

  /**
   * Clones this transition.
   *
   * @return clone with same character interval and destination state
   */
  @Override
  public Transition clone() {
    try {
      return (Transition) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new RuntimeException(e);
    }
  }

  static void appendCharString(int c, StringBuilder b) {
    if (c >= 0x21 && c <= 0x7e && c != '\\' && c != '"') b.appendCodePoint(c);
    else {
      b.append("\\\\U");
      String s = Integer.toHexString(c);
      if (c < 0x10) b.append("0000000").append(s);
      else if (c < 0x100) b.append("000000").append(s);
      else if (c < 0x1000) b.append("00000").append(s);
      else if (c < 0x10000) b.append("0000").append(s);
      else if (c < 0x100000) b.append("000").append(s);
      else if (c < 0x1000000) b.append("00").append(s);
      else if (c < 0x10000000) b.append("0").append(s);
      else b.append(s);
    }
  }

  /**
   * Returns a string describing this state. Normally invoked via
   * {@link Automaton#toString()}.
   */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    appendCharString(min, b);
    if (min != max) {
      b.append("-");
      appendCharString(max, b);
    }
    b.append(" -> ").append(to.number);
    return b.toString();
  }

  void appendDot(StringBuilder b) {
    b.append(" -> ").append(to.number).append(" [label=\"");
    appendCharString(min, b);
    if (min != max) {
      b.append("-");
      appendCharString(max, b);
    }
    b.append("\"]\n");
  }

  private static final class CompareByDestThenMinMaxSingle implements Comparator<Transition> {
    @Override
    public int compare(Transition t1, Transition t2) {
      if (t1.to != t2.to) {
        if (t1.to.id < t2.to.id) return -1;
        else if (t1.to.id > t2.to.id) return 1;
      }
      if (t1.min < t2.min) return -1;
      if (t1.min > t2.min) return 1;
      if (t1.max > t2.max) return -1;
      if (t1.max < t2.max) return 1;
      return 0;
    }
  }

  /** Sorts by destination state, then min, then max (descending). */
  public static final Comparator<Transition> COMPARE_BY_DEST_THEN_MIN_MAX = new CompareByDestThenMinMaxSingle();

  private static final class CompareByMinMaxThenDestSingle implements Comparator<Transition> {
    @Override
    public int compare(Transition t1, Transition t2) {
      if (t1.min < t2.min) return -1;
      if (t1.min > t2.min) return 1;
      if (t1.max > t2.max) return -1;
      if (t1.max < t2.max) return 1;
      if (t1.to != t2.to) {
        if (t1.to.id < t2.to.id) return -1;
        if (t1.to.id > t2.to.id) return 1;
      }
      return 0;
    }
  }

  /** Sorts by min, then max (descending), then destination state. */
  public static final Comparator<Transition> COMPARE_BY_MIN_MAX_THEN_DEST = new CompareByMinMaxThenDestSingle();
}
