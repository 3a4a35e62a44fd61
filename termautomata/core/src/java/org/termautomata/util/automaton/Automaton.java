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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.termautomata.util.ArrayUtil;
import org.termautomata.util.RamUsageEstimator;

/**
 * Finite-state automaton with regular expression operations.
 * <p>
 * Class invariants:
 * <ul>
 * <li>An automaton is either represented explicitly (with {@link State} and
 * {@link Transition} objects) or with a singleton string (see
 * {@link #getSingleton()} and {@link #expandSingleton()}) in case the automaton
 * is known to accept exactly one string. (Implicitly, all states and
 * transitions of an automaton are reachable from its initial state.)
 * <li>Automata are always reduced (see {@link #reduce()}) and have no
 * transitions to dead states (see {@link #removeDeadTransitions()}).
 * <li>If an automaton is nondeterministic, then {@link #isDeterministic()}
 * returns false (but the converse is not required).
 * <li>Automata provided as input to operations are generally assumed to be
 * disjoint.
 * </ul>
 * <p>
 * If the states or transitions are manipulated manually, the
 * {@link #restoreInvariant()} and {@link #setDeterministic(boolean)} methods
 * should be used afterwards to restore representation invariants that are
 * assumed by the built-in automata operations.
 *
 * <p>
 * <b>Note:</b> This class is not thread safe. Operations given an
 * {@link AutomatonConfig} with {@link AutomatonConfig#allowMutate()} set may
 * modify their arguments; the default config never does.
 *
 * @termautomata.experimental
 */
public class Automaton implements Cloneable {

  /**
   * Initial state of this automaton.
   */
  State initial;

  /**
   * If true, then this automaton is definitely deterministic (i.e., there are
   * no choices for any run, but a run may crash).
   */
  boolean deterministic;

  /** Extra data associated with this automaton. */
  transient Object info;

  /**
   * Singleton string. Null if not applicable.
   */
  private String singleton;

  /** Cached result of {@link #getNumberedStates}, cleared by every structural change. */
  private State[] numberedStates;

  /**
   * Constructs a new automaton that accepts the empty language. Using this
   * constructor, automata can be constructed manually from {@link State} and
   * {@link Transition} objects.
   *
   * @see State
   * @see Transition
   */
  public Automaton(State initial) {
    this.initial = initial;
    deterministic = true;
    singleton = null;
  }

  public Automaton() {
    this(new State());
  }

  /** Creates an automaton in singleton form, accepting exactly {@code s}. */
  static Automaton newSingleton(String s) {
    final Automaton a = new Automaton(null);
    a.singleton = s;
    return a;
  }

  /**
   * Returns true if this automaton is in singleton form, ie its graph has not
   * been materialized and it accepts exactly {@link #getSingleton()}.
   */
  public boolean isSingleton() {
    return singleton != null;
  }

  /**
   * Returns the singleton string for this automaton. An automaton that accepts
   * exactly one string <i>may</i> be represented in singleton mode. In that
   * case, this method may be used to obtain the string.
   *
   * @return string, null if this automaton is not in singleton mode.
   */
  public String getSingleton() {
    return singleton;
  }

  /**
   * Gets initial state.
   *
   * @return state
   */
  public State getInitialState() {
    expandSingleton();
    return initial;
  }

  /**
   * Returns deterministic flag for this automaton.
   *
   * @return true if the automaton is definitely deterministic, false if the
   *         automaton may be nondeterministic
   */
  public boolean isDeterministic() {
    return deterministic;
  }

  /**
   * Sets deterministic flag for this automaton. This method should (only) be
   * used if automata are constructed manually.
   *
   * @param deterministic true if the automaton is definitely deterministic,
   *          false if the automaton may be nondeterministic
   */
  public void setDeterministic(boolean deterministic) {
    this.deterministic = deterministic;
  }

  /**
   * Associates extra information with this automaton.
   *
   * @param info extra information
   */
  public void setInfo(Object info) {
    this.info = info;
  }

  /**
   * Returns extra information associated with this automaton.
   *
   * @return extra information
   * @see #setInfo(Object)
   */
  public Object getInfo() {
    return info;
  }

  /**
   * Returns all states reachable from the initial state, in breadth first
   * order. Each state's {@link State#getNumber() number} is its index in the
   * returned array. The array is cached until the automaton is changed by one
   * of the operations in this package.
   */
  public State[] getNumberedStates() {
    if (numberedStates == null) {
      expandSingleton();
      final Set<State> visited = new HashSet<>();
      final ArrayDeque<State> worklist = new ArrayDeque<>();
      State[] states = new State[4];
      int upto = 0;
      worklist.add(initial);
      visited.add(initial);
      initial.number = upto;
      states[upto] = initial;
      upto++;
      while (!worklist.isEmpty()) {
        State s = worklist.removeFirst();
        for (int i=0;i<s.numTransitions;i++) {
          final Transition t = s.transitionsArray[i];
          if (!visited.contains(t.to)) {
            visited.add(t.to);
            worklist.add(t.to);
            t.to.number = upto;
            states = ArrayUtil.grow(states, upto+1);
            states[upto] = t.to;
            upto++;
          }
        }
      }
      if (states.length != upto) {
        states = ArrayUtil.shrink(states, upto);
      }
      numberedStates = states;
    }

    return numberedStates;
  }

  /** Expert: installs a numbering computed elsewhere. Every state must carry its index as number. */
  public void setNumberedStates(State[] states) {
    setNumberedStates(states, states.length);
  }

  /** Expert: installs the first {@code count} entries of {@code states} as the numbering. */
  public void setNumberedStates(State[] states, int count) {
    assert count <= states.length;
    if (count < states.length) {
      numberedStates = Arrays.copyOf(states, count);
    } else {
      numberedStates = states;
    }
    assert assertNumbered();
  }

  private boolean assertNumbered() {
    for (int i = 0; i < numberedStates.length; i++) {
      assert numberedStates[i].number == i : "state " + numberedStates[i].id + " has number " + numberedStates[i].number + " but index " + i;
    }
    return true;
  }

  /** Forgets the cached numbering; must be called after any structural change. */
  public void clearNumberedStates() {
    numberedStates = null;
  }

  /**
   * Returns the set of reachable accept states.
   *
   * @return set of {@link State} objects
   */
  public Set<State> getAcceptStates() {
    expandSingleton();
    HashSet<State> accepts = new HashSet<>();
    for (State s : getNumberedStates()) {
      if (s.accept) {
        accepts.add(s);
      }
    }
    return accepts;
  }

  /**
   * Adds transitions to explicit crash state to ensure that transition function
   * is total.
   */
  void totalize() {
    State s = new State();
    s.addTransition(new Transition(Character.MIN_CODE_POINT, Character.MAX_CODE_POINT,
        s));
    for (State p : getNumberedStates()) {
      int maxi = Character.MIN_CODE_POINT;
      p.sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
      final int count = p.numTransitions;
      for (int i=0;i<count;i++) {
        final Transition t = p.transitionsArray[i];
        if (t.min > maxi) {
          p.addTransition(new Transition(maxi, (t.min - 1), s));
        }
        if (t.max + 1 > maxi) maxi = t.max + 1;
      }
      if (maxi <= Character.MAX_CODE_POINT) {
        p.addTransition(new Transition(maxi, Character.MAX_CODE_POINT, s));
      }
    }
    clearNumberedStates();
  }

  /**
   * Restores representation invariant. This method must be invoked before any
   * built-in automata operation is performed if automaton states or transitions
   * are manipulated manually.
   *
   * @see #setDeterministic(boolean)
   */
  public void restoreInvariant() {
    clearNumberedStates();
    removeDeadTransitions();
  }

  /**
   * Reduces this automaton. An automaton is "reduced" by combining overlapping
   * and adjacent edge intervals with same destination.
   */
  public void reduce() {
    if (isSingleton()) {
      return;
    }
    for (State s : getNumberedStates()) {
      s.reduce();
    }
  }

  /**
   * Returns sorted array of all interval start points.
   */
  int[] getStartPoints() {
    final State[] states = getNumberedStates();
    Set<Integer> pointset = new HashSet<>();
    pointset.add(Character.MIN_CODE_POINT);
    for (State s : states) {
      for (int i=0;i<s.numTransitions;i++) {
        final Transition t = s.transitionsArray[i];
        pointset.add(t.min);
        if (t.max < Character.MAX_CODE_POINT) {
          pointset.add(t.max + 1);
        }
      }
    }
    int[] points = new int[pointset.size()];
    int n = 0;
    for (Integer m : pointset) {
      points[n++] = m;
    }
    Arrays.sort(points);
    return points;
  }

  /**
   * Returns the set of live states. A state is "live" if an accept state is
   * reachable from it.
   *
   * @return set of {@link State} objects
   */
  private BitSet getLiveStates() {
    final State[] states = getNumberedStates();
    final BitSet live = new BitSet(states.length);
    // map<state, set<state>>
    final List<List<State>> map = new ArrayList<>(states.length);
    for (int i = 0; i < states.length; i++) {
      map.add(new ArrayList<>());
    }
    final ArrayDeque<State> worklist = new ArrayDeque<>();
    for (State s : states) {
      if (s.accept) {
        live.set(s.number);
        worklist.add(s);
      }
      for (int i=0;i<s.numTransitions;i++) {
        map.get(s.transitionsArray[i].to.number).add(s);
      }
    }
    while (!worklist.isEmpty()) {
      State s = worklist.removeFirst();
      for (State p : map.get(s.number)) {
        if (!live.get(p.number)) {
          live.set(p.number);
          worklist.add(p);
        }
      }
    }
    return live;
  }

  /**
   * Removes transitions to dead states and calls {@link #reduce()}.
   * (A state is "dead" if no accept state is
   * reachable from it.)
   */
  public void removeDeadTransitions() {
    if (isSingleton()) {
      return;
    }
    final State[] states = getNumberedStates();
    final BitSet live = getLiveStates();
    for (State s : states) {
      // filter out transitions to dead states:
      int upto = 0;
      for (int i=0;i<s.numTransitions;i++) {
        final Transition t = s.transitionsArray[i];
        if (live.get(t.to.number)) {
          s.transitionsArray[upto++] = s.transitionsArray[i];
        }
      }
      Arrays.fill(s.transitionsArray, upto, s.numTransitions, null);
      s.numTransitions = upto;
    }
    clearNumberedStates();
    reduce();
  }

  /**
   * Returns a sorted array of transitions for each state (and sets state
   * numbers).
   */
  public Transition[][] getSortedTransitions() {
    final State[] states = getNumberedStates();
    Transition[][] transitions = new Transition[states.length][];
    for (State s : states) {
      s.sortTransitions(Transition.COMPARE_BY_MIN_MAX_THEN_DEST);
      s.trimTransitionsArray();
      transitions[s.number] = s.transitionsArray;
      assert s.transitionsArray != null;
    }
    return transitions;
  }

  /**
   * Expands singleton representation to normal representation. Does nothing if
   * not in singleton representation.
   */
  public void expandSingleton() {
    if (isSingleton()) {
      State p = new State();
      initial = p;
      for (int i = 0, cp = 0; i < singleton.length(); i += Character.charCount(cp)) {
        State q = new State();
        p.addTransition(new Transition(cp = singleton.codePointAt(i), q));
        p = q;
      }
      p.accept = true;
      deterministic = true;
      singleton = null;
    }
  }

  /**
   * Returns the number of states in this automaton.
   */
  public int getNumberOfStates() {
    if (isSingleton()) return singleton.codePointCount(0, singleton.length()) + 1;
    return getNumberedStates().length;
  }

  /**
   * Returns the number of transitions in this automaton. This number is counted
   * as the total number of edges, where one edge may be a character interval.
   */
  public int getNumberOfTransitions() {
    if (isSingleton()) return singleton.codePointCount(0, singleton.length());
    int c = 0;
    for (State s : getNumberedStates()) {
      c += s.numTransitions();
    }
    return c;
  }

  /**
   * Returns true if the language of this automaton is equal to the language
   * of the given automaton. Implemented using {@link BasicOperations#sameLanguage}.
   */
  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (!(obj instanceof Automaton)) return false;
    Automaton a = (Automaton) obj;
    if (isSingleton() && a.isSingleton()) return singleton.equals(a.singleton);
    return BasicOperations.sameLanguage(this, a);
  }

  /**
   * Returns a hash code consistent with {@link #equals}: it is computed on a
   * minimized copy of this automaton, from its number of states, accept states
   * and transitions. This is expensive; do not put large automata in hash
   * based collections.
   */
  @Override
  public int hashCode() {
    if (isSingleton()) {
      return computeHash(getNumberOfStates(), 1, getNumberOfTransitions());
    }
    final Automaton m = clone();
    MinimizationOperations.minimize(m);
    if (m.isSingleton()) {
      return computeHash(m.getNumberOfStates(), 1, m.getNumberOfTransitions());
    }
    int numAccept = 0;
    int numTransitions = 0;
    final State[] states = m.getNumberedStates();
    for (State s : states) {
      if (s.accept) {
        numAccept++;
      }
      numTransitions += s.numTransitions;
    }
    return computeHash(states.length, numAccept, numTransitions);
  }

  private static int computeHash(int numStates, int numAccept, int numTransitions) {
    return numStates * 3 + numTransitions * 2 + numAccept * 7;
  }

  /**
   * Returns a string representation of this automaton.
   */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    if (isSingleton()) {
      b.append("singleton: ");
      int length = singleton.codePointCount(0, singleton.length());
      int codepoints[] = new int[length];
      for (int i = 0, j = 0, cp = 0; i < singleton.length(); i += Character.charCount(cp))
        codepoints[j++] = cp = singleton.codePointAt(i);
      for (int c : codepoints)
        Transition.appendCharString(c, b);
      b.append("\n");
    } else {
      State[] states = getNumberedStates();
      b.append("initial state: ").append(initial.number).append("\n");
      for (State s : states)
        b.append(s.toString());
    }
    return b.toString();
  }

  /**
   * Returns the dot (graphviz) representation of this automaton.
   * This is extremely useful for visualizing the automaton.
   */
  public String toDot() {
    StringBuilder b = new StringBuilder("digraph Automaton {\n");
    b.append("  rankdir = LR\n");
    State[] states = getNumberedStates();
    for (State s : states) {
      b.append("  ").append(s.number);
      if (s.accept) b.append(" [shape=doublecircle,label=\"\"];\n");
      else b.append(" [shape=circle,label=\"\"];\n");
      if (s == initial) {
        b.append("  initial [shape=plaintext,label=\"\"];\n");
        b.append("  initial -> ").append(s.number).append("\n");
      }
      for (Transition t : s.getTransitions()) {
        b.append("  ").append(s.number);
        t.appendDot(b);
      }
    }
    return b.append("}\n").toString();
  }

  /**
   * Returns a clone of this automaton, expands if singleton.
   */
  Automaton cloneExpanded() {
    Automaton a = clone();
    a.expandSingleton();
    return a;
  }

  /**
   * Returns a clone of this automaton unless {@code config} allows mutation,
   * expands if singleton.
   */
  Automaton cloneExpandedIfRequired(AutomatonConfig config) {
    if (config.allowMutate()) {
      expandSingleton();
      return this;
    } else return cloneExpanded();
  }

  /**
   * Returns a clone of this automaton.
   */
  @Override
  public Automaton clone() {
    try {
      Automaton a = (Automaton) super.clone();
      if (!isSingleton()) {
        HashMap<State,State> m = new HashMap<>();
        State[] states = getNumberedStates();
        for (State s : states) {
          m.put(s, new State());
        }
        for (State s : states) {
          State p = m.get(s);
          p.accept = s.accept;
          if (s == initial) a.initial = p;
          for (Transition t : s.getTransitions())
            p.addTransition(new Transition(t.min, t.max, m.get(t.to)));
        }
      }
      a.clearNumberedStates();
      return a;
    } catch (CloneNotSupportedException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Returns a clone of this automaton, or this automaton itself if
   * {@code config} allows mutation.
   */
  Automaton cloneIfRequired(AutomatonConfig config) {
    if (config.allowMutate()) return this;
    else return clone();
  }

  /**
   * Returns this automaton if it is known to be deterministic, otherwise a
   * determinized automaton: this one when {@code config} allows mutation, a
   * determinized clone otherwise.
   */
  Automaton determinizedIfRequired(AutomatonConfig config) {
    if (deterministic || isSingleton()) {
      return this;
    }
    final Automaton a = cloneIfRequired(config);
    BasicOperations.determinize(a, config);
    return a;
  }

  /** Returns the approximate number of bytes the explicit graph of this automaton takes on the heap. */
  public long ramBytesUsed() {
    if (isSingleton()) {
      return RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + 2L * singleton.length());
    }
    long size = 0;
    for (State s : getNumberedStates()) {
      size += RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + 3 * Integer.BYTES + 2 * RamUsageEstimator.NUM_BYTES_OBJECT_REF);
      size += RamUsageEstimator.shallowSizeOf(s.transitionsArray);
      size += s.numTransitions * RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + 2 * Integer.BYTES + RamUsageEstimator.NUM_BYTES_OBJECT_REF);
    }
    return size;
  }

  /**
   * See {@link BasicOperations#concatenate(Automaton, Automaton)}.
   */
  public Automaton concatenate(Automaton a) {
    return BasicOperations.concatenate(this, a);
  }

  /**
   * See {@link BasicOperations#concatenate(List)}.
   */
  static public Automaton concatenate(List<Automaton> l) {
    return BasicOperations.concatenate(l);
  }

  /**
   * See {@link BasicOperations#optional(Automaton)}.
   */
  public Automaton optional() {
    return BasicOperations.optional(this);
  }

  /**
   * See {@link BasicOperations#repeat(Automaton)}.
   */
  public Automaton repeat() {
    return BasicOperations.repeat(this);
  }

  /**
   * See {@link BasicOperations#repeat(Automaton, int)}.
   */
  public Automaton repeat(int min) {
    return BasicOperations.repeat(this, min);
  }

  /**
   * See {@link BasicOperations#repeat(Automaton, int, int)}.
   */
  public Automaton repeat(int min, int max) {
    return BasicOperations.repeat(this, min, max);
  }

  /**
   * See {@link BasicOperations#complement(Automaton)}.
   */
  public Automaton complement() {
    return BasicOperations.complement(this);
  }

  /**
   * See {@link BasicOperations#minus(Automaton, Automaton)}.
   */
  public Automaton minus(Automaton a) {
    return BasicOperations.minus(this, a);
  }

  /**
   * See {@link BasicOperations#intersection(Automaton, Automaton)}.
   */
  public Automaton intersection(Automaton a) {
    return BasicOperations.intersection(this, a);
  }

  /**
   * See {@link BasicOperations#subsetOf(Automaton, Automaton)}.
   */
  public boolean subsetOf(Automaton a) {
    return BasicOperations.subsetOf(this, a);
  }

  /**
   * See {@link BasicOperations#union(Automaton, Automaton)}.
   */
  public Automaton union(Automaton a) {
    return BasicOperations.union(this, a);
  }

  /**
   * See {@link BasicOperations#union(Collection)}.
   */
  static public Automaton union(Collection<Automaton> l) {
    return BasicOperations.union(l);
  }

  /**
   * See {@link BasicOperations#determinize(Automaton)}.
   */
  public void determinize() {
    BasicOperations.determinize(this);
  }

  /**
   * See {@link BasicOperations#isEmptyString(Automaton)}.
   */
  public boolean isEmptyString() {
    return BasicOperations.isEmptyString(this);
  }

  /**
   * See {@link MinimizationOperations#minimize(Automaton)}. Returns the
   * automaton being given as argument.
   */
  public static Automaton minimize(Automaton a) {
    MinimizationOperations.minimize(a);
    return a;
  }
}
