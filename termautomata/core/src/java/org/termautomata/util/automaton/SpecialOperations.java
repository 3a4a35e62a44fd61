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


import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Set;

import org.termautomata.util.ArrayUtil;
import org.termautomata.util.BytesRef;
import org.termautomata.util.IntsRef;
import org.termautomata.util.UnicodeUtil;

/**
 * Special automata operations.
 *
 * @termautomata.experimental
 */
final public class SpecialOperations {

  private SpecialOperations() {}

  /**
   * Finds the largest entry whose value is less than or equal to c, or 0 if
   * there is no such entry.
   */
  static int findIndex(int c, int[] points) {
    int a = 0;
    int b = points.length;
    while (b - a > 1) {
      int d = (a + b) >>> 1;
      if (points[d] > c) b = d;
      else if (points[d] < c) a = d;
      else return d;
    }
    return a;
  }

  /**
   * Returns true if the language of this automaton is finite. The automaton
   * must not have transitions to dead states.
   */
  public static boolean isFinite(Automaton a) {
    if (a.isSingleton()) return true;
    final State[] states = a.getNumberedStates();
    final BitSet path = new BitSet(states.length);
    final BitSet visited = new BitSet(states.length);
    // explicit depth-first stack: the state and the index of its next transition to explore
    final State[] stack = new State[states.length];
    final int[] upto = new int[states.length];
    int depth = 0;
    stack[0] = a.initial;
    path.set(a.initial.number);
    while (depth >= 0) {
      final State s = stack[depth];
      if (upto[depth] < s.numTransitions) {
        final State to = s.transitionsArray[upto[depth]++].to;
        if (path.get(to.number)) {
          return false;
        }
        if (!visited.get(to.number)) {
          depth++;
          stack[depth] = to;
          upto[depth] = 0;
          path.set(to.number);
        }
      } else {
        path.clear(s.number);
        visited.set(s.number);
        depth--;
      }
    }
    return true;
  }

  /**
   * Returns the longest string that is a prefix of all accepted strings and
   * visits each state at most once.  The automaton must be deterministic and
   * have no transitions to dead states.
   *
   * @return common prefix
   */
  public static String getCommonPrefix(Automaton a) {
    if (a.isSingleton()) return a.getSingleton();
    StringBuilder b = new StringBuilder();
    HashSet<State> visited = new HashSet<>();
    State s = a.initial;
    boolean done;
    do {
      done = true;
      visited.add(s);
      if (!s.accept && s.numTransitions() == 1) {
        Transition t = s.getTransitions().iterator().next();
        if (t.min == t.max && !visited.contains(t.to)) {
          b.appendCodePoint(t.min);
          s = t.to;
          done = false;
        }
      }
    } while (!done);
    return b.toString();
  }

  /**
   * Returns the common prefix of a binary automaton, one whose labels are
   * bytes, such as the output of {@link UTF32ToUTF8}.
   */
  public static BytesRef getCommonPrefixBytesRef(Automaton a) {
    if (a.isSingleton()) return new BytesRef(a.getSingleton());
    BytesRef ref = new BytesRef(10);
    HashSet<State> visited = new HashSet<>();
    State s = a.initial;
    boolean done;
    do {
      done = true;
      visited.add(s);
      if (!s.accept && s.numTransitions() == 1) {
        Transition t = s.getTransitions().iterator().next();
        if (t.min == t.max && !visited.contains(t.to)) {
          if (ref.bytes.length < ref.length + 1) {
            ref.bytes = ArrayUtil.grow(ref.bytes, ref.length + 1);
          }
          ref.bytes[ref.length++] = (byte) t.min;
          s = t.to;
          done = false;
        }
      }
    } while (!done);
    return ref;
  }

  /**
   * Returns the longest string that is a suffix of all accepted strings and
   * visits each state at most once.
   *
   * @return common suffix
   */
  public static String getCommonSuffix(Automaton a) {
    if (a.isSingleton()) // if singleton, the suffix is the string itself.
      return a.getSingleton();

    // reverse the language of the automaton, then reverse its common prefix.
    Automaton r = a.clone();
    reverse(r);
    r.determinize();
    return new StringBuilder(SpecialOperations.getCommonPrefix(r)).reverse().toString();
  }

  /**
   * Returns the common suffix of a binary automaton, one whose labels are
   * bytes.
   */
  public static BytesRef getCommonSuffixBytesRef(Automaton a) {
    if (a.isSingleton()) // if singleton, the suffix is the string itself.
      return new BytesRef(a.getSingleton());

    // reverse the language of the automaton, then reverse its common prefix.
    Automaton r = a.clone();
    reverse(r);
    r.determinize();
    BytesRef ref = SpecialOperations.getCommonPrefixBytesRef(r);
    reverseBytes(ref);
    return ref;
  }

  private static void reverseBytes(BytesRef ref) {
    if (ref.length <= 1) return;
    int num = ref.length >> 1;
    for (int i = ref.offset; i < ( ref.offset + num ); i++) {
      byte b = ref.bytes[i];
      ref.bytes[i] = ref.bytes[ref.offset * 2 + ref.length - i - 1];
      ref.bytes[ref.offset * 2 + ref.length - i - 1] = b;
    }
  }

  /**
   * Reverses the language of the given (non-singleton) automaton while returning
   * the set of new initial states.
   */
  public static Set<State> reverse(Automaton a) {
    a.expandSingleton();
    // reverse all edges
    HashMap<State, HashSet<Transition>> m = new HashMap<>();
    State[] states = a.getNumberedStates();
    Set<State> accept = new HashSet<>();
    for (State s : states)
      if (s.isAccept())
        accept.add(s);
    for (State r : states) {
      m.put(r, new HashSet<Transition>());
      r.accept = false;
    }
    for (State r : states)
      for (Transition t : r.getTransitions())
        m.get(t.to).add(new Transition(t.min, t.max, r));
    for (State r : states) {
      Set<Transition> tr = m.get(r);
      r.setTransitions(tr.toArray(new Transition[tr.size()]));
    }
    // make new initial+final states
    a.initial.accept = true;
    a.initial = new State();
    for (State r : accept)
      a.initial.addEpsilon(r); // ensures that all initial states are reachable
    a.deterministic = false;
    a.clearNumberedStates();
    return accept;
  }

  /**
   * Returns the set of accepted strings, assuming that at most
   * <code>limit</code> strings are accepted. If more than <code>limit</code>
   * strings are accepted, the first limit strings found are returned. If
   * <code>limit</code>&lt;0, then the limit is infinite.
   *
   * @throws IllegalArgumentException if the automaton has cycles
   */
  public static Set<IntsRef> getFiniteStrings(Automaton a, int limit) {
    HashSet<IntsRef> strings = new HashSet<>();
    if (limit == 0) {
      return strings;
    }
    if (a.isSingleton()) {
      final int[] codePoints = UnicodeUtil.toUTF32(a.getSingleton());
      strings.add(new IntsRef(codePoints, 0, codePoints.length));
      return strings;
    }
    FiniteStringsIterator iterator = new FiniteStringsIterator(a);
    for (IntsRef finiteString; (finiteString = iterator.next()) != null;) {
      strings.add(IntsRef.deepCopyOf(finiteString));
      if (limit > 0 && strings.size() == limit) {
        break;
      }
    }
    return strings;
  }
}
