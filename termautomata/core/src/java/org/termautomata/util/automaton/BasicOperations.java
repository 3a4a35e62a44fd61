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
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.termautomata.util.ArrayUtil;
import org.termautomata.util.InfoStream;
import org.termautomata.util.RamUsageEstimator;

/**
 * Basic automata operations.
 * <p>
 * Every operation has a variant taking an {@link AutomatonConfig}; the variant
 * without one uses {@link AutomatonConfig#DEFAULT}, which never modifies the
 * arguments.
 *
 * @termautomata.experimental
 */
final public class BasicOperations {

  private BasicOperations() {}

  /**
   * Returns an automaton that accepts the concatenation of the languages of the
   * given automata.
   * <p>
   * Complexity: linear in number of states.
   */
  static public Automaton concatenate(Automaton a1, Automaton a2) {
    return concatenate(a1, a2, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the concatenation of the languages of the
   * given automata.
   * <p>
   * Complexity: linear in number of states.
   */
  static public Automaton concatenate(Automaton a1, Automaton a2, AutomatonConfig config) {
    if (a1.isSingleton() && a2.isSingleton()) {
      return BasicAutomata.makeString(a1.getSingleton() + a2.getSingleton());
    }
    if (isEmpty(a1) || isEmpty(a2)) {
      return BasicAutomata.makeEmpty();
    }
    // adding epsilon transitions with the NFA concatenation algorithm
    // in this case always produces a resulting DFA, preventing expensive
    // redundant determinize() calls for this common case.
    boolean deterministic = a1.isSingleton() && a2.isDeterministic();
    if (a1 == a2) {
      a1 = a1.cloneExpanded();
      a2 = a2.cloneExpanded();
    } else {
      a1 = a1.cloneExpandedIfRequired(config);
      a2 = a2.cloneExpandedIfRequired(config);
    }
    for (State s : a1.getAcceptStates()) {
      s.accept = false;
      s.addEpsilon(a2.initial);
    }
    a1.deterministic = deterministic;
    a1.clearNumberedStates();
    return checkMinimizeAlways(a1, config);
  }

  /**
   * Returns an automaton that accepts the concatenation of the languages of the
   * given automata.
   * <p>
   * Complexity: linear in total number of states.
   */
  static public Automaton concatenate(List<Automaton> l) {
    return concatenate(l, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the concatenation of the languages of the
   * given automata.
   * <p>
   * Complexity: linear in total number of states.
   */
  static public Automaton concatenate(List<Automaton> l, AutomatonConfig config) {
    if (l.isEmpty()) return BasicAutomata.makeEmptyString();
    boolean allSingleton = true;
    for (Automaton a : l)
      if (!a.isSingleton()) {
        allSingleton = false;
        break;
      }
    if (allSingleton) {
      StringBuilder b = new StringBuilder();
      for (Automaton a : l)
        b.append(a.getSingleton());
      return BasicAutomata.makeString(b.toString());
    } else {
      for (Automaton a : l)
        if (isEmpty(a)) return BasicAutomata.makeEmpty();
      final boolean hasAliases = hasAliases(l);
      Automaton b = l.get(0);
      if (hasAliases) b = b.cloneExpanded();
      else b = b.cloneExpandedIfRequired(config);
      Set<State> ac = b.getAcceptStates();
      boolean first = true;
      for (Automaton a : l)
        if (first) first = false;
        else {
          if (a.isEmptyString()) continue;
          Automaton aa = a;
          if (hasAliases) aa = aa.cloneExpanded();
          else aa = aa.cloneExpandedIfRequired(config);
          Set<State> ns = aa.getAcceptStates();
          for (State s : ac) {
            s.accept = false;
            s.addEpsilon(aa.initial);
            if (s.accept) ns.add(s);
          }
          ac = ns;
        }
      b.deterministic = false;
      b.clearNumberedStates();
      return checkMinimizeAlways(b, config);
    }
  }

  /** Returns true if the same automaton instance occurs more than once in {@code l}. */
  private static boolean hasAliases(Collection<Automaton> l) {
    final Set<Automaton> ids = Collections.newSetFromMap(new IdentityHashMap<>());
    ids.addAll(l);
    return ids.size() != l.size();
  }

  /**
   * Returns an automaton that accepts the union of the empty string and the
   * language of the given automaton.
   * <p>
   * Complexity: linear in number of states.
   */
  static public Automaton optional(Automaton a) {
    return optional(a, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the union of the empty string and the
   * language of the given automaton.
   * <p>
   * Complexity: linear in number of states.
   */
  static public Automaton optional(Automaton a, AutomatonConfig config) {
    a = a.cloneExpandedIfRequired(config);
    State s = new State();
    s.addEpsilon(a.initial);
    s.accept = true;
    a.initial = s;
    a.deterministic = false;
    a.clearNumberedStates();
    return checkMinimizeAlways(a, config);
  }

  /**
   * Returns an automaton that accepts the Kleene star (zero or more
   * concatenated repetitions) of the language of the given automaton. Never
   * modifies the input automaton language.
   * <p>
   * Complexity: linear in number of states.
   */
  static public Automaton repeat(Automaton a) {
    return repeat(a, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the Kleene star (zero or more
   * concatenated repetitions) of the language of the given automaton.
   * <p>
   * Complexity: linear in number of states.
   */
  static public Automaton repeat(Automaton a, AutomatonConfig config) {
    a = a.cloneExpandedIfRequired(config);
    State s = new State();
    s.accept = true;
    s.addEpsilon(a.initial);
    for (State p : a.getAcceptStates())
      p.addEpsilon(s);
    a.initial = s;
    a.deterministic = false;
    a.clearNumberedStates();
    return checkMinimizeAlways(a, config);
  }

  /**
   * Returns an automaton that accepts <code>min</code> or more concatenated
   * repetitions of the language of the given automaton.
   * <p>
   * Complexity: linear in number of states and in <code>min</code>.
   */
  static public Automaton repeat(Automaton a, int min) {
    return repeat(a, min, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts <code>min</code> or more concatenated
   * repetitions of the language of the given automaton.
   * <p>
   * Complexity: linear in number of states and in <code>min</code>.
   */
  static public Automaton repeat(Automaton a, int min, AutomatonConfig config) {
    if (min < 0) {
      throw new IllegalArgumentException("min must be >= 0 (got " + min + ")");
    }
    if (min == 0) return repeat(a, config);
    List<Automaton> as = new ArrayList<>();
    while (min-- > 0)
      as.add(a);
    // the star must not be built in place: a is still in the list
    as.add(repeat(a, config.setAllowMutate(false)));
    return concatenate(as, config);
  }

  /**
   * Returns an automaton that accepts between <code>min</code> and
   * <code>max</code> (including both) concatenated repetitions of the language
   * of the given automaton. If <code>min</code> is greater than <code>max</code>
   * the empty language is returned.
   * <p>
   * Complexity: linear in number of states and in <code>min</code> and
   * <code>max</code>.
   */
  static public Automaton repeat(Automaton a, int min, int max) {
    return repeat(a, min, max, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts between <code>min</code> and
   * <code>max</code> (including both) concatenated repetitions of the language
   * of the given automaton. If <code>min</code> is greater than <code>max</code>
   * the empty language is returned.
   * <p>
   * Complexity: linear in number of states and in <code>min</code> and
   * <code>max</code>.
   */
  static public Automaton repeat(Automaton a, int min, int max, AutomatonConfig config) {
    if (min < 0) {
      throw new IllegalArgumentException("min must be >= 0 (got " + min + ")");
    }
    if (min > max) return BasicAutomata.makeEmpty();
    max -= min;
    if (a.isSingleton()) {
      a = a.cloneExpanded();
    }
    Automaton b;
    if (min == 0) b = BasicAutomata.makeEmptyString();
    else if (min == 1) b = a.clone();
    else {
      List<Automaton> as = new ArrayList<>();
      while (min-- > 0)
        as.add(a);
      b = concatenate(as, config);
    }
    if (max > 0) {
      Automaton d = a.clone();
      while (--max > 0) {
        Automaton c = a.clone();
        for (State p : c.getAcceptStates())
          p.addEpsilon(d.initial);
        d = c;
      }
      for (State p : b.getAcceptStates())
        p.addEpsilon(d.initial);
      b.deterministic = false;
      b.clearNumberedStates();
      b = checkMinimizeAlways(b, config);
    }
    return b;
  }

  /**
   * Returns a (deterministic) automaton that accepts the complement of the
   * language of the given automaton.
   * <p>
   * Complexity: linear in number of states (if already deterministic).
   */
  static public Automaton complement(Automaton a) {
    return complement(a, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns a (deterministic) automaton that accepts the complement of the
   * language of the given automaton.
   * <p>
   * Complexity: linear in number of states (if already deterministic).
   */
  static public Automaton complement(Automaton a, AutomatonConfig config) {
    a = a.cloneExpandedIfRequired(config);
    determinize(a, config);
    a.totalize();
    for (State p : a.getNumberedStates())
      p.accept = !p.accept;
    a.removeDeadTransitions();
    return checkMinimizeAlways(a, config);
  }

  /**
   * Returns a (deterministic) automaton that accepts the intersection of the
   * language of <code>a1</code> and the complement of the language of
   * <code>a2</code>. As a side-effect, the automata may be determinized, if not
   * already deterministic.
   * <p>
   * Complexity: quadratic in number of states (if already deterministic).
   */
  static public Automaton minus(Automaton a1, Automaton a2) {
    return minus(a1, a2, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns a (deterministic) automaton that accepts the intersection of the
   * language of <code>a1</code> and the complement of the language of
   * <code>a2</code>.
   * <p>
   * Complexity: quadratic in number of states (if already deterministic).
   */
  static public Automaton minus(Automaton a1, Automaton a2, AutomatonConfig config) {
    if (isEmpty(a1) || a1 == a2) return BasicAutomata.makeEmpty();
    if (isEmpty(a2)) return a1.cloneIfRequired(config);
    if (a1.isSingleton()) {
      if (run(a2, a1.getSingleton())) return BasicAutomata.makeEmpty();
      else return a1.cloneIfRequired(config);
    }
    return intersection(a1, complement(a2, config), config);
  }

  /**
   * Returns an automaton that accepts the intersection of the languages of the
   * given automata. Never modifies the input automata languages.
   * <p>
   * Complexity: quadratic in number of states.
   */
  static public Automaton intersection(Automaton a1, Automaton a2) {
    return intersection(a1, a2, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the intersection of the languages of the
   * given automata. Never modifies the input automata languages.
   * <p>
   * Complexity: quadratic in number of states.
   */
  static public Automaton intersection(Automaton a1, Automaton a2, AutomatonConfig config) {
    if (a1.isSingleton()) {
      if (run(a2, a1.getSingleton())) return a1.cloneIfRequired(config);
      else return BasicAutomata.makeEmpty();
    }
    if (a2.isSingleton()) {
      if (run(a1, a2.getSingleton())) return a2.cloneIfRequired(config);
      else return BasicAutomata.makeEmpty();
    }
    if (a1 == a2) return a1.cloneIfRequired(config);
    Transition[][] transitions1 = a1.getSortedTransitions();
    Transition[][] transitions2 = a2.getSortedTransitions();
    Automaton c = new Automaton();
    ArrayDeque<StatePair> worklist = new ArrayDeque<>();
    HashMap<StatePair,StatePair> newstates = new HashMap<>();
    StatePair p = new StatePair(c.initial, a1.initial, a2.initial);
    worklist.add(p);
    newstates.put(p, p);
    while (worklist.size() > 0) {
      p = worklist.removeFirst();
      p.s.accept = p.s1.accept && p.s2.accept;
      Transition[] t1 = transitions1[p.s1.number];
      Transition[] t2 = transitions2[p.s2.number];
      for (int n1 = 0, b2 = 0; n1 < t1.length; n1++) {
        while (b2 < t2.length && t2[b2].max < t1[n1].min)
          b2++;
        for (int n2 = b2; n2 < t2.length && t1[n1].max >= t2[n2].min; n2++)
          if (t2[n2].max >= t1[n1].min) {
            StatePair q = new StatePair(t1[n1].to, t2[n2].to);
            StatePair r = newstates.get(q);
            if (r == null) {
              q.s = new State();
              worklist.add(q);
              newstates.put(q, q);
              r = q;
            }
            int min = t1[n1].min > t2[n2].min ? t1[n1].min : t2[n2].min;
            int max = t1[n1].max < t2[n2].max ? t1[n1].max : t2[n2].max;
            p.s.addTransition(new Transition(min, max, r.s));
          }
      }
    }
    c.deterministic = a1.deterministic && a2.deterministic;
    c.removeDeadTransitions();
    return checkMinimizeAlways(c, config);
  }

  /** Returns true if these two automata accept exactly the
   *  same language.  This is a costly computation!  Note
   *  also that a1 and a2 will be determinized as a side
   *  effect if {@code config} allows mutation. */
  public static boolean sameLanguage(Automaton a1, Automaton a2) {
    return sameLanguage(a1, a2, AutomatonConfig.DEFAULT);
  }

  /** Returns true if these two automata accept exactly the
   *  same language.  This is a costly computation! */
  public static boolean sameLanguage(Automaton a1, Automaton a2, AutomatonConfig config) {
    if (a1 == a2) {
      return true;
    }
    if (a1.isSingleton() && a2.isSingleton()) {
      return a1.getSingleton().equals(a2.getSingleton());
    } else if (a1.isSingleton()) {
      // subsetOf is faster if the first automaton is a singleton
      return subsetOf(a1, a2, config) && subsetOf(a2, a1, config);
    } else {
      return subsetOf(a2, a1, config) && subsetOf(a1, a2, config);
    }
  }

  /**
   * Returns true if the language of <code>a1</code> is a subset of the language
   * of <code>a2</code>.
   * <p>
   * Complexity: quadratic in number of states.
   */
  public static boolean subsetOf(Automaton a1, Automaton a2) {
    return subsetOf(a1, a2, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns true if the language of <code>a1</code> is a subset of the language
   * of <code>a2</code>. <code>a2</code> is determinized first; in place only if
   * {@code config} allows mutation.
   * <p>
   * Complexity: quadratic in number of states.
   */
  public static boolean subsetOf(Automaton a1, Automaton a2, AutomatonConfig config) {
    if (a1 == a2) return true;
    if (a1.isSingleton()) {
      if (a2.isSingleton()) return a1.getSingleton().equals(a2.getSingleton());
      return run(a2, a1.getSingleton());
    }
    a2 = a2.determinizedIfRequired(config);
    if (a2.isSingleton()) {
      a2 = a2.cloneExpanded();
    }
    Transition[][] transitions1 = a1.getSortedTransitions();
    Transition[][] transitions2 = a2.getSortedTransitions();
    ArrayDeque<StatePair> worklist = new ArrayDeque<>();
    HashSet<StatePair> visited = new HashSet<>();
    StatePair p = new StatePair(a1.initial, a2.initial);
    worklist.add(p);
    visited.add(p);
    while (worklist.size() > 0) {
      p = worklist.removeFirst();
      if (p.s1.accept && !p.s2.accept) {
        return false;
      }
      Transition[] t1 = transitions1[p.s1.number];
      Transition[] t2 = transitions2[p.s2.number];
      for (int n1 = 0, b2 = 0; n1 < t1.length; n1++) {
        while (b2 < t2.length && t2[b2].max < t1[n1].min)
          b2++;
        int min1 = t1[n1].min, max1 = t1[n1].max;

        for (int n2 = b2; n2 < t2.length && t1[n1].max >= t2[n2].min; n2++) {
          if (t2[n2].min > min1) {
            return false;
          }
          if (t2[n2].max < Character.MAX_CODE_POINT) min1 = t2[n2].max + 1;
          else {
            min1 = Character.MAX_CODE_POINT;
            max1 = Character.MIN_CODE_POINT;
          }
          StatePair q = new StatePair(t1[n1].to, t2[n2].to);
          if (!visited.contains(q)) {
            worklist.add(q);
            visited.add(q);
          }
        }
        if (min1 <= max1) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Returns an automaton that accepts the union of the languages of the given
   * automata.
   * <p>
   * Complexity: linear in number of states.
   */
  public static Automaton union(Automaton a1, Automaton a2) {
    return union(a1, a2, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the union of the languages of the given
   * automata.
   * <p>
   * Complexity: linear in number of states.
   */
  public static Automaton union(Automaton a1, Automaton a2, AutomatonConfig config) {
    if ((a1.isSingleton() && a2.isSingleton() && a1.getSingleton().equals(a2.getSingleton()))
        || a1 == a2) return a1.cloneIfRequired(config);
    a1 = a1.cloneExpandedIfRequired(config);
    a2 = a2.cloneExpandedIfRequired(config);
    State s = new State();
    s.addEpsilon(a1.initial);
    s.addEpsilon(a2.initial);
    a1.initial = s;
    a1.deterministic = false;
    a1.clearNumberedStates();
    return checkMinimizeAlways(a1, config);
  }

  /**
   * Returns an automaton that accepts the union of the languages of the given
   * automata.
   * <p>
   * Complexity: linear in number of states.
   */
  public static Automaton union(Collection<Automaton> l) {
    return union(l, AutomatonConfig.DEFAULT);
  }

  /**
   * Returns an automaton that accepts the union of the languages of the given
   * automata.
   * <p>
   * Complexity: linear in number of states.
   */
  public static Automaton union(Collection<Automaton> l, AutomatonConfig config) {
    final boolean hasAliases = hasAliases(l);
    State s = new State();
    for (Automaton b : l) {
      if (isEmpty(b)) continue;
      Automaton bb = b;
      if (hasAliases) bb = bb.cloneExpanded();
      else bb = bb.cloneExpandedIfRequired(config);
      s.addEpsilon(bb.initial);
    }
    Automaton a = new Automaton(s);
    a.deterministic = false;
    return checkMinimizeAlways(a, config);
  }

  // Simple custom ArrayList<Transition>
  private final static class TransitionList {
    Transition[] transitions = new Transition[2];
    int count;

    public void add(Transition t) {
      if (transitions.length == count) {
        Transition[] newArray = new Transition[ArrayUtil.oversize(1+count, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
        System.arraycopy(transitions, 0, newArray, 0, count);
        transitions = newArray;
      }
      transitions[count++] = t;
    }
  }

  // Holds all transitions that start on this int point, or
  // end at this point-1
  private final static class PointTransitions implements Comparable<PointTransitions> {
    int point;
    final TransitionList ends = new TransitionList();
    final TransitionList starts = new TransitionList();
    @Override
    public int compareTo(PointTransitions other) {
      return Integer.compare(point, other.point);
    }

    public void reset(int point) {
      this.point = point;
      ends.count = 0;
      starts.count = 0;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PointTransitions && ((PointTransitions) other).point == point;
    }

    @Override
    public int hashCode() {
      return point;
    }
  }

  private final static class PointTransitionSet {
    int count;
    PointTransitions[] points = new PointTransitions[5];

    private final static int HASHMAP_CUTOVER = 30;
    private final HashMap<Integer,PointTransitions> map = new HashMap<>();
    private boolean useHash = false;

    private PointTransitions next(int point) {
      // 1st time we are seeing this point
      if (count == points.length) {
        final PointTransitions[] newArray = new PointTransitions[ArrayUtil.oversize(1+count, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
        System.arraycopy(points, 0, newArray, 0, count);
        points = newArray;
      }
      PointTransitions points0 = points[count];
      if (points0 == null) {
        points0 = points[count] = new PointTransitions();
      }
      points0.reset(point);
      count++;
      return points0;
    }

    private PointTransitions find(int point) {
      if (useHash) {
        final Integer pi = point;
        PointTransitions p = map.get(pi);
        if (p == null) {
          p = next(point);
          map.put(pi, p);
        }
        return p;
      } else {
        for(int i=0;i<count;i++) {
          if (points[i].point == point) {
            return points[i];
          }
        }

        final PointTransitions p = next(point);
        if (count == HASHMAP_CUTOVER) {
          // switch to HashMap on the fly
          assert map.size() == 0;
          for(int i=0;i<count;i++) {
            map.put(points[i].point, points[i]);
          }
          useHash = true;
        }
        return p;
      }
    }

    public void reset() {
      if (useHash) {
        map.clear();
        useHash = false;
      }
      count = 0;
    }

    public void sort() {
      // Tim sort performs well on already sorted arrays:
      if (count > 1) Arrays.sort(points, 0, count);
    }

    public void add(Transition t) {
      find(t.min).starts.add(t);
      find(1+t.max).ends.add(t);
    }

    @Override
    public String toString() {
      StringBuilder s = new StringBuilder();
      for(int i=0;i<count;i++) {
        if (i > 0) {
          s.append(' ');
        }
        s.append(points[i].point).append(':').append(points[i].starts.count).append(',').append(points[i].ends.count);
      }
      return s.toString();
    }
  }

  /**
   * Determinizes the given automaton.
   * <p>
   * Worst case complexity: exponential in number of states.
   */
  public static void determinize(Automaton a) {
    determinize(a, AutomatonConfig.DEFAULT);
  }

  /**
   * Determinizes the given automaton in place, using the subset construction.
   * Each DFA state stands for the set of NFA states that are active at once;
   * the sets are interned so equal sets map to the same DFA state.
   * <p>
   * Worst case complexity: exponential in number of states.
   */
  public static void determinize(Automaton a, AutomatonConfig config) {
    if (a.deterministic || a.isSingleton()) {
      return;
    }

    final long startNS = System.nanoTime();
    final State[] allStates = a.getNumberedStates();

    // subset construction
    final boolean initAccept = a.initial.accept;
    final int initNumber = a.initial.number;
    a.initial = new State();
    SortedIntSet.FrozenIntSet initialset = new SortedIntSet.FrozenIntSet(initNumber, a.initial);

    ArrayDeque<SortedIntSet.FrozenIntSet> worklist = new ArrayDeque<>();
    Map<IntSet,State> newstate = new HashMap<>();

    worklist.add(initialset);

    a.initial.accept = initAccept;
    newstate.put(initialset, a.initial);

    int newStateUpto = 0;
    State[] newStatesArray = new State[5];
    newStatesArray[newStateUpto] = a.initial;
    a.initial.number = newStateUpto;
    newStateUpto++;

    // like Set<Integer,PointTransitions>
    final PointTransitionSet points = new PointTransitionSet();

    // like SortedMap<Integer,Integer>
    final SortedIntSet statesSet = new SortedIntSet(5);

    while (worklist.size() > 0) {
      final SortedIntSet.FrozenIntSet s = worklist.removeFirst();

      // Collate all outgoing transitions by min/1+max:
      for(int i=0;i<s.values.length;i++) {
        final State s0 = allStates[s.values[i]];
        for(int j=0;j<s0.numTransitions;j++) {
          points.add(s0.transitionsArray[j]);
        }
      }

      if (points.count == 0) {
        // No outgoing transitions -- skip it
        continue;
      }

      points.sort();

      int lastPoint = -1;
      int accCount = 0;

      final State r = s.state;
      for(int i=0;i<points.count;i++) {

        final int point = points.points[i].point;

        if (!statesSet.isEmpty()) {
          assert lastPoint != -1;

          statesSet.computeHash();

          State q = newstate.get(statesSet);
          if (q == null) {
            q = new State();
            final SortedIntSet.FrozenIntSet p = statesSet.freeze(q);
            worklist.add(p);
            newStatesArray = ArrayUtil.grow(newStatesArray, 1+newStateUpto);
            newStatesArray[newStateUpto] = q;
            q.number = newStateUpto;
            newStateUpto++;
            q.accept = accCount > 0;
            newstate.put(p, q);
          } else {
            assert (accCount > 0) == q.accept: "accCount=" + accCount + " vs existing accept=" + q.accept + " states=" + statesSet;
          }

          r.addTransition(new Transition(lastPoint, point-1, q));
        }

        // process transitions that end on this point
        // (closes an overlapping interval)
        Transition[] transitions = points.points[i].ends.transitions;
        int limit = points.points[i].ends.count;
        for(int j=0;j<limit;j++) {
          final Transition t = transitions[j];
          statesSet.decr(t.to.number);
          accCount -= t.to.accept ? 1:0;
        }
        points.points[i].ends.count = 0;

        // process transitions that start on this point
        // (opens a new interval)
        transitions = points.points[i].starts.transitions;
        limit = points.points[i].starts.count;
        for(int j=0;j<limit;j++) {
          final Transition t = transitions[j];
          statesSet.incr(t.to.number);
          accCount += t.to.accept ? 1:0;
        }
        lastPoint = point;
        points.points[i].starts.count = 0;
      }
      points.reset();
      assert statesSet.isEmpty(): "size=" + statesSet.size();
    }
    a.deterministic = true;
    a.setNumberedStates(newStatesArray, newStateUpto);

    final InfoStream infoStream = config.getInfoStream();
    if (infoStream.isEnabled(AutomatonConfig.DET_COMPONENT)) {
      infoStream.message(AutomatonConfig.DET_COMPONENT, "determinized " + allStates.length + " NFA states into "
          + newStateUpto + " DFA states in " + ((System.nanoTime() - startNS) / 1000000) + " msec");
    }
  }

  /**
   * Adds epsilon transitions to the given automaton. This method adds extra
   * character interval transitions that are equivalent to the given set of
   * epsilon transitions.
   *
   * @param pairs collection of {@link StatePair} objects representing pairs of
   *          source/destination states where epsilon transitions should be
   *          added
   */
  public static void addEpsilons(Automaton a, Collection<StatePair> pairs) {
    a.expandSingleton();
    HashMap<State,HashSet<State>> forward = new HashMap<>();
    HashMap<State,HashSet<State>> back = new HashMap<>();
    for (StatePair p : pairs) {
      forward.computeIfAbsent(p.s1, k -> new HashSet<>()).add(p.s2);
      back.computeIfAbsent(p.s2, k -> new HashSet<>()).add(p.s1);
    }
    // calculate epsilon closure
    final Set<StatePair> closure = new HashSet<>(pairs);
    ArrayDeque<StatePair> worklist = new ArrayDeque<>(closure);
    HashSet<StatePair> workset = new HashSet<>(closure);
    while (!worklist.isEmpty()) {
      StatePair p = worklist.removeFirst();
      workset.remove(p);
      HashSet<State> to = forward.get(p.s2);
      HashSet<State> from = back.get(p.s1);
      if (to != null) {
        for (State s : new ArrayList<>(to)) {
          StatePair pp = new StatePair(p.s1, s);
          if (!closure.contains(pp)) {
            closure.add(pp);
            forward.get(p.s1).add(s);
            back.get(s).add(p.s1);
            worklist.add(pp);
            workset.add(pp);
            if (from != null) {
              for (State q : from) {
                StatePair qq = new StatePair(q, p.s1);
                if (!workset.contains(qq)) {
                  worklist.add(qq);
                  workset.add(qq);
                }
              }
            }
          }
        }
      }
    }
    // add transitions
    for (StatePair p : closure)
      p.s1.addEpsilon(p.s2);
    a.deterministic = false;
    a.clearNumberedStates();
  }

  /**
   * Returns true if the given automaton accepts the empty string and nothing
   * else.
   */
  public static boolean isEmptyString(Automaton a) {
    if (a.isSingleton()) return a.getSingleton().length() == 0;
    else return a.initial.accept && a.initial.numTransitions() == 0;
  }

  /**
   * Returns true if the given automaton accepts no strings. The check only
   * looks at the initial state, so the automaton must not have transitions to
   * dead states (see {@link Automaton#removeDeadTransitions()}).
   */
  public static boolean isEmpty(Automaton a) {
    if (a.isSingleton()) return false;
    return !a.initial.accept && a.initial.numTransitions() == 0;
  }

  /**
   * Returns true if the given automaton accepts all strings.
   */
  public static boolean isTotal(Automaton a) {
    if (a.isSingleton()) return false;
    if (a.initial.accept && a.initial.numTransitions() == 1) {
      Transition t = a.initial.getTransitions().iterator().next();
      return t.to == a.initial && t.min == Character.MIN_CODE_POINT
          && t.max == Character.MAX_CODE_POINT;
    }
    return false;
  }

  /**
   * Returns true if the given string is accepted by the automaton.
   * <p>
   * Complexity: linear in the length of the string.
   * <p>
   * <b>Note:</b> for full performance, use the {@link RunAutomaton} class.
   */
  public static boolean run(Automaton a, String s) {
    if (a.isSingleton()) return s.equals(a.getSingleton());
    if (a.deterministic) {
      State p = a.initial;
      for (int i = 0, cp = 0; i < s.length(); i += Character.charCount(cp)) {
        State q = p.step(cp = s.codePointAt(i));
        if (q == null) return false;
        p = q;
      }
      return p.accept;
    } else {
      State[] states = a.getNumberedStates();
      List<State> pp = new ArrayList<>();
      List<State> ppOther = new ArrayList<>();
      BitSet bb = new BitSet(states.length);
      BitSet bbOther = new BitSet(states.length);
      pp.add(a.initial);
      ArrayList<State> dest = new ArrayList<>();
      boolean accept = a.initial.accept;
      for (int i = 0, c = 0; i < s.length(); i += Character.charCount(c)) {
        c = s.codePointAt(i);
        accept = false;
        ppOther.clear();
        bbOther.clear();
        for (State p : pp) {
          dest.clear();
          p.step(c, dest);
          for (State q : dest) {
            if (q.accept) accept = true;
            if (!bbOther.get(q.number)) {
              bbOther.set(q.number);
              ppOther.add(q);
            }
          }
        }
        List<State> tp = pp;
        pp = ppOther;
        ppOther = tp;
        BitSet tb = bb;
        bb = bbOther;
        bbOther = tb;
      }
      return accept;
    }
  }

  private static Automaton checkMinimizeAlways(Automaton a, AutomatonConfig config) {
    if (config.minimizeAlways()) {
      MinimizationOperations.minimize(a, config);
    }
    return a;
  }
}
