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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.termautomata.util.ArrayUtil;
import org.termautomata.util.IntsRef;
import org.termautomata.util.TestUtil;
import org.termautomata.util.UnicodeUtil;

/**
 * Utilities for testing automata: random automata and regular expressions,
 * plus slow but simple reference versions of the real algorithms.
 */
public final class AutomatonTestUtil {

  private AutomatonTestUtil() {}

  /**
   * A random regular expression together with an equivalent
   * {@link java.util.regex.Pattern} (compiled with {@code DOTALL}).
   */
  public static final class RandomRegexp {
    public final String regexp;
    public final String javaRegexp;

    RandomRegexp(String regexp, String javaRegexp) {
      this.regexp = regexp;
      this.javaRegexp = javaRegexp;
    }

    @Override
    public String toString() {
      return regexp + " (java: " + javaRegexp + ")";
    }
  }

  /**
   * Returns a random regular expression over the letters {@code a..e} that
   * only uses operators {@link java.util.regex.Pattern} understands the same
   * way.
   */
  public static RandomRegexp randomRegexp(Random r) {
    final StringBuilder ours = new StringBuilder();
    final StringBuilder java = new StringBuilder();
    appendRandomRegexp(r, 3, ours, java);
    return new RandomRegexp(ours.toString(), java.toString());
  }

  private static void appendRandomRegexp(Random r, int depth, StringBuilder ours, StringBuilder java) {
    final int op = depth == 0 ? r.nextInt(4) : r.nextInt(11);
    switch (op) {
      case 0: {
        final char c = (char) TestUtil.nextInt(r, 'a', 'e');
        ours.append(c);
        java.append(c);
        break;
      }
      case 1:
        ours.append('.');
        java.append('.');
        break;
      case 2: {
        final char from = (char) TestUtil.nextInt(r, 'a', 'd');
        final char to = (char) TestUtil.nextInt(r, from, 'e');
        final String clazz = (r.nextBoolean() ? "[^" : "[") + from + "-" + to + "]";
        ours.append(clazz);
        java.append(clazz);
        break;
      }
      case 3: {
        final String s = TestUtil.randomSimpleStringRange(r, 'a', 'e', 3);
        ours.append('"').append(s).append('"');
        java.append("(?:").append(s).append(')');
        break;
      }
      case 4:
      case 5:
        ours.append('(');
        java.append("(?:");
        appendRandomRegexp(r, depth - 1, ours, java);
        appendRandomRegexp(r, depth - 1, ours, java);
        ours.append(')');
        java.append(')');
        break;
      case 6:
      case 7:
        ours.append('(');
        java.append("(?:");
        appendRandomRegexp(r, depth - 1, ours, java);
        ours.append('|');
        java.append('|');
        appendRandomRegexp(r, depth - 1, ours, java);
        ours.append(')');
        java.append(')');
        break;
      default: {
        final String suffix;
        switch (r.nextInt(5)) {
          case 0: suffix = "*"; break;
          case 1: suffix = "+"; break;
          case 2: suffix = "?"; break;
          case 3: suffix = "{" + r.nextInt(3) + "}"; break;
          default: {
            final int min = r.nextInt(3);
            suffix = "{" + min + "," + (min + r.nextInt(3)) + "}";
          }
        }
        ours.append('(');
        java.append("(?:");
        appendRandomRegexp(r, depth - 1, ours, java);
        ours.append(')').append(suffix);
        java.append(')').append(suffix);
      }
    }
  }

  /** Returns a random automaton built from a random regular expression. */
  public static Automaton randomAutomaton(Random r) {
    final Automaton a = new RegExp(randomRegexp(r).regexp, RegExp.NONE).toAutomaton();
    if (r.nextBoolean()) {
      return BasicOperations.complement(a);
    }
    return a;
  }

  /**
   * Returns a random, usually non-deterministic automaton over {@code a..e}
   * with up to {@code maxStates} states. It may have dead states.
   */
  public static Automaton randomNFA(Random r, int maxStates) {
    final State[] states = new State[TestUtil.nextInt(r, 1, maxStates)];
    for (int i = 0; i < states.length; i++) {
      states[i] = new State();
      states[i].setAccept(r.nextInt(3) == 0);
    }
    for (State s : states) {
      final int numTransitions = r.nextInt(4);
      for (int i = 0; i < numTransitions; i++) {
        final int min = TestUtil.nextInt(r, 'a', 'e');
        final int max = r.nextBoolean() ? min : TestUtil.nextInt(r, min, 'e');
        s.addTransition(new Transition(min, max, states[r.nextInt(states.length)]));
      }
    }
    final Automaton a = new Automaton(states[0]);
    a.setDeterministic(false);
    return a;
  }

  /**
   * Returns true if {@code a} accepts the code points {@code s}, by tracking
   * the set of reachable states.
   */
  public static boolean accepts(Automaton a, int[] s) {
    if (a.isSingleton()) {
      return a.getSingleton().equals(UnicodeUtil.newString(s, 0, s.length));
    }
    Set<State> current = new HashSet<>();
    current.add(a.getInitialState());
    for (int c : s) {
      final Set<State> next = new HashSet<>();
      for (State state : current) {
        for (Transition t : state.getTransitions()) {
          if (t.min <= c && c <= t.max) {
            next.add(t.to);
          }
        }
      }
      if (next.isEmpty()) {
        return false;
      }
      current = next;
    }
    for (State state : current) {
      if (state.accept) {
        return true;
      }
    }
    return false;
  }

  /** Same as {@link #accepts(Automaton, int[])} for a string. */
  public static boolean accepts(Automaton a, String s) {
    return accepts(a, UnicodeUtil.toUTF32(s));
  }

  /**
   * Simple, unoptimized determinize(): a textbook subset construction over
   * sets of states.
   */
  public static void determinizeSimple(Automaton a) {
    if (a.deterministic || a.isSingleton()) {
      return;
    }
    final Set<State> initialset = new HashSet<>();
    initialset.add(a.initial);
    determinizeSimple(a, initialset);
  }

  /**
   * Simple, original brics implementation of determinize(), starting from the
   * given set of initial states.
   */
  public static void determinizeSimple(Automaton a, Set<State> initialset) {
    final int[] points = a.getStartPoints();
    // subset construction
    final Map<Set<State>, Set<State>> sets = new HashMap<>();
    final LinkedList<Set<State>> worklist = new LinkedList<>();
    final Map<Set<State>, State> newstate = new HashMap<>();
    sets.put(initialset, initialset);
    worklist.add(initialset);
    a.initial = new State();
    newstate.put(initialset, a.initial);
    while (worklist.size() > 0) {
      final Set<State> s = worklist.removeFirst();
      final State r = newstate.get(s);
      for (State q : s) {
        if (q.accept) {
          r.accept = true;
          break;
        }
      }
      for (int n = 0; n < points.length; n++) {
        final Set<State> p = new HashSet<>();
        for (State q : s) {
          for (Transition t : q.getTransitions()) {
            if (t.min <= points[n] && points[n] <= t.max) {
              p.add(t.to);
            }
          }
        }
        if (!sets.containsKey(p)) {
          sets.put(p, p);
          worklist.add(p);
          newstate.put(p, new State());
        }
        final State q = newstate.get(p);
        final int min = points[n];
        final int max;
        if (n + 1 < points.length) {
          max = points[n + 1] - 1;
        } else {
          max = Character.MAX_CODE_POINT;
        }
        r.addTransition(new Transition(min, max, q));
      }
    }
    a.deterministic = true;
    a.clearNumberedStates();
    a.removeDeadTransitions();
  }

  /**
   * Minimizes by reversing, determinizing, reversing and determinizing again
   * (Brzozowski's algorithm).
   */
  public static void minimizeSimple(Automaton a) {
    if (a.isSingleton()) {
      return;
    }
    determinizeSimple(a, SpecialOperations.reverse(a));
    determinizeSimple(a, SpecialOperations.reverse(a));
  }

  /**
   * Returns true if the language of this automaton is finite, with a plain
   * recursive depth first search.
   */
  public static boolean isFiniteSlow(Automaton a) {
    if (a.isSingleton()) {
      return true;
    }
    return isFiniteSlow(a.initial, new HashSet<State>());
  }

  private static boolean isFiniteSlow(State s, HashSet<State> path) {
    path.add(s);
    for (Transition t : s.getTransitions()) {
      if (path.contains(t.to) || !isFiniteSlow(t.to, path)) {
        return false;
      }
    }
    path.remove(s);
    return true;
  }

  /**
   * Returns all accepted strings of a finite automaton, enumerated recursively
   * one code point at a time. Only usable for small alphabets.
   */
  public static Set<IntsRef> getFiniteStringsRecursive(Automaton a) {
    final Set<IntsRef> strings = new HashSet<>();
    if (a.isSingleton()) {
      final int[] codePoints = UnicodeUtil.toUTF32(a.getSingleton());
      strings.add(new IntsRef(codePoints, 0, codePoints.length));
      return strings;
    }
    collect(a.initial, new int[0], strings);
    return strings;
  }

  private static void collect(State s, int[] prefix, Set<IntsRef> strings) {
    if (s.accept) {
      strings.add(new IntsRef(prefix.clone(), 0, prefix.length));
    }
    for (Transition t : s.getTransitions()) {
      for (int c = t.min; c <= t.max; c++) {
        final int[] next = ArrayUtil.growExact(prefix, prefix.length + 1);
        next[prefix.length] = c;
        collect(t.to, next, strings);
      }
    }
  }

  /**
   * Generates random strings accepted by an automaton. Surrogate code points
   * are never emitted, so every string is also a valid Java string.
   */
  public static final class RandomAcceptedStrings {

    private final Map<Transition, Boolean> leadsToAccept;
    private final Automaton a;

    public RandomAcceptedStrings(Automaton a) {
      this.a = a.isSingleton() ? a.cloneExpanded() : a;
      // reverse reachability from the accept states over transitions with usable labels
      final State[] states = this.a.getNumberedStates();
      final List<List<Transition>> incoming = new ArrayList<>();
      for (int i = 0; i < states.length; i++) {
        incoming.add(new ArrayList<Transition>());
      }
      final Map<Transition, State> source = new IdentityHashMap<>();
      for (State s : states) {
        for (Transition t : s.getTransitions()) {
          if (hasUsableLabel(t)) {
            incoming.get(t.to.number).add(t);
            source.put(t, s);
          }
        }
      }
      leadsToAccept = new IdentityHashMap<>();
      final BitSet live = new BitSet(states.length);
      final ArrayDeque<State> worklist = new ArrayDeque<>();
      for (State s : states) {
        if (s.accept) {
          live.set(s.number);
          worklist.add(s);
        }
      }
      while (!worklist.isEmpty()) {
        final State s = worklist.removeFirst();
        for (Transition t : incoming.get(s.number)) {
          leadsToAccept.put(t, Boolean.TRUE);
          final State from = source.get(t);
          if (!live.get(from.number)) {
            live.set(from.number);
            worklist.add(from);
          }
        }
      }
      if (!live.get(this.a.initial.number)) {
        throw new IllegalArgumentException("this automaton accepts nothing");
      }
    }

    private static boolean hasUsableLabel(Transition t) {
      return t.min < UnicodeUtil.UNI_SUR_HIGH_START || t.max > UnicodeUtil.UNI_SUR_LOW_END;
    }

    /** Returns the code points of a random accepted string. */
    public int[] getRandomAcceptedString(Random r) {
      final List<Integer> soFar = new ArrayList<>();
      State s = a.initial;
      while (true) {
        if (s.accept && (s.numTransitions == 0 || r.nextInt(4) == 0 || soFar.size() > 30)) {
          break;
        }
        final List<Transition> live = new ArrayList<>();
        for (Transition t : s.getTransitions()) {
          if (leadsToAccept.containsKey(t)) {
            live.add(t);
          }
        }
        if (live.isEmpty()) {
          assert s.accept;
          break;
        }
        final Transition t = live.get(r.nextInt(live.size()));
        soFar.add(randomLabel(r, t));
        s = t.to;
      }
      final int[] result = new int[soFar.size()];
      for (int i = 0; i < result.length; i++) {
        result[i] = soFar.get(i);
      }
      return result;
    }

    private static int randomLabel(Random r, Transition t) {
      final int c;
      if (t.max - t.min < 16 || r.nextBoolean()) {
        c = t.min + r.nextInt(Math.min(t.max - t.min, 15) + 1);
      } else {
        c = t.min + r.nextInt(t.max - t.min + 1);
      }
      if (c < UnicodeUtil.UNI_SUR_HIGH_START || c > UnicodeUtil.UNI_SUR_LOW_END) {
        return c;
      }
      // hasUsableLabel guarantees one of the two ends is outside the surrogates
      if (t.max > UnicodeUtil.UNI_SUR_LOW_END) {
        return UnicodeUtil.UNI_SUR_LOW_END + 1;
      }
      return t.min;
    }
  }

  /** Levenshtein distance between two code point sequences. */
  public static int editDistance(int[] s, int[] t, boolean transpositions) {
    final int[][] d = new int[s.length + 1][t.length + 1];
    for (int i = 0; i <= s.length; i++) {
      d[i][0] = i;
    }
    for (int j = 0; j <= t.length; j++) {
      d[0][j] = j;
    }
    for (int i = 1; i <= s.length; i++) {
      for (int j = 1; j <= t.length; j++) {
        final int cost = s[i - 1] == t[j - 1] ? 0 : 1;
        d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
        if (transpositions && i > 1 && j > 1 && s[i - 1] == t[j - 2] && s[i - 2] == t[j - 1]) {
          d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
        }
      }
    }
    return d[s.length][t.length];
  }
}
