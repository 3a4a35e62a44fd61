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
import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;

import org.termautomata.util.ArrayUtil;
import org.termautomata.util.BytesRef;
import org.termautomata.util.InfoStream;
import org.termautomata.util.IntsRef;
import org.termautomata.util.UnicodeUtil;

/**
 * Builds a minimal, deterministic {@link Automaton} that accepts a set of
 * strings. The algorithm requires sorted input data, but is very fast
 * (nearly linear with the input size).
 *
 * @see #build(Collection)
 * @see BasicAutomata#makeStringUnion(Collection)
 */
public final class DaciukMihovAutomatonBuilder {

  /**
   * DFSA state with <code>int</code> labels on transitions.
   */
  private final static class State {

    /** An empty set of labels. */
    private final static int[] NO_LABELS = new int[0];

    /** An empty set of states. */
    private final static State[] NO_STATES = new State[0];

    /**
     * Labels of outgoing transitions. Indexed identically to {@link #states}.
     * Labels must be sorted lexicographically.
     */
    int[] labels = NO_LABELS;

    /**
     * States reachable from outgoing transitions. Indexed identically to
     * {@link #labels}.
     */
    State[] states = NO_STATES;

    /**
     * <code>true</code> if this state corresponds to the end of at least one
     * input sequence.
     */
    boolean is_final;

    /**
     * Returns the target state of a transition leaving this state and labeled
     * with <code>label</code>. If no such transition exists, returns
     * <code>null</code>.
     */
    State getState(int label) {
      final int index = Arrays.binarySearch(labels, label);
      return index >= 0 ? states[index] : null;
    }

    /**
     * Two states are equal if:
     * <ul>
     * <li>they have an identical number of outgoing transitions, labeled with
     * the same labels</li>
     * <li>corresponding outgoing transitions lead to the same states (to states
     * with an identical right-language).
     * </ul>
     */
    @Override
    public boolean equals(Object obj) {
      final State other = (State) obj;
      return is_final == other.is_final
          && Arrays.equals(this.labels, other.labels)
          && referenceEquals(this.states, other.states);
    }

    /**
     * Compute the hash code of the <i>current</i> status of this state.
     */
    @Override
    public int hashCode() {
      int hash = is_final ? 1 : 0;

      hash ^= hash * 31 + this.labels.length;
      for (int c : this.labels)
        hash ^= hash * 31 + c;

      /*
       * Compare the right-language of this state using reference-identity of
       * outgoing states. This is possible because states are interned (stored
       * in registry) and traversed in post-order, so any outgoing transitions
       * are already interned.
       */
      for (State s : this.states) {
        hash ^= System.identityHashCode(s);
      }

      return hash;
    }

    /**
     * Return <code>true</code> if this state has any children (outgoing
     * transitions).
     */
    boolean hasChildren() {
      return labels.length > 0;
    }

    /**
     * Create a new outgoing transition labeled <code>label</code> and return
     * the newly created target state for this transition.
     */
    State newState(int label) {
      assert Arrays.binarySearch(labels, label) < 0 : "State already has transition labeled: "
          + label;

      labels = Arrays.copyOf(labels, labels.length + 1);
      states = Arrays.copyOf(states, states.length + 1);

      labels[labels.length - 1] = label;
      return states[states.length - 1] = new State();
    }

    /**
     * Return the most recent transitions's target state.
     */
    State lastChild() {
      assert hasChildren() : "No outgoing transitions.";
      return states[states.length - 1];
    }

    /**
     * Return the associated state if the most recent transition is labeled with
     * <code>label</code>.
     */
    State lastChild(int label) {
      final int index = labels.length - 1;
      State s = null;
      if (index >= 0 && labels[index] == label) {
        s = states[index];
      }
      assert s == getState(label);
      return s;
    }

    /**
     * Replace the last added outgoing transition's target state with the given
     * state.
     */
    void replaceLastChild(State state) {
      assert hasChildren() : "No outgoing transitions.";
      states[states.length - 1] = state;
    }

    /**
     * Compare two lists of objects for reference-equality.
     */
    private static boolean referenceEquals(Object[] a1, Object[] a2) {
      if (a1.length != a2.length) {
        return false;
      }

      for (int i = 0; i < a1.length; i++) {
        if (a1[i] != a2[i]) {
          return false;
        }
      }

      return true;
    }
  }

  /**
   * A "registry" for state interning.
   */
  private HashMap<State,State> stateRegistry = new HashMap<>();

  /**
   * Root automaton state.
   */
  private final State root = new State();

  /**
   * Previous sequence added to the automaton in {@link #add(IntsRef)}.
   */
  private IntsRef previous;

  /** Number of sequences accepted by {@link #add(IntsRef)}, duplicates included. */
  private int count;

  /**
   * Add another code point sequence to this automaton. The sequence must be
   * lexicographically larger or equal compared to any previous sequences added
   * to this automaton (the input must be sorted).
   *
   * @throws IllegalArgumentException if {@code current} sorts before the
   *         previous sequence
   * @throws IllegalStateException if the automaton was already completed
   */
  public void add(IntsRef current) {
    if (stateRegistry == null) {
      throw new IllegalStateException("Automaton already built.");
    }
    if (previous != null && previous.compareTo(current) > 0) {
      throw new IllegalArgumentException("Input must be in sorted order: "
          + previous + " > " + current);
    }
    previous = IntsRef.deepCopyOf(current);
    count++;

    // Descend in the automaton (find matching prefix).
    final int end = current.offset + current.length;
    int pos = current.offset;
    State next, state = root;
    while (pos < end && (next = state.lastChild(current.ints[pos])) != null) {
      state = next;
      pos++;
    }

    if (state.hasChildren()) replaceOrRegister(state);

    addSuffix(state, current.ints, pos, end);
  }

  /**
   * Finalize the automaton and return the root state. No more strings can be
   * added to the builder after this call.
   *
   * @return the minimal automaton accepting every added sequence
   * @throws IllegalStateException if called more than once
   */
  public Automaton complete() {
    return complete(AutomatonConfig.DEFAULT);
  }

  /**
   * As {@link #complete()}, reporting to {@code config}'s info stream.
   */
  public Automaton complete(AutomatonConfig config) {
    if (this.stateRegistry == null) throw new IllegalStateException("Automaton already built.");

    if (root.hasChildren()) replaceOrRegister(root);

    final int registered = stateRegistry.size();
    stateRegistry = null;

    final Automaton a = new Automaton(convert(root));
    a.setDeterministic(true);

    final InfoStream infoStream = config.getInfoStream();
    if (infoStream.isEnabled(AutomatonConfig.DM_COMPONENT)) {
      infoStream.message(AutomatonConfig.DM_COMPONENT, count + " sequences interned into "
          + (registered + 1) + " states");
    }
    return a;
  }

  /**
   * Internal conversion to the automaton graph, preserving the sharing of
   * interned states.
   */
  private static org.termautomata.util.automaton.State convert(State root) {
    final IdentityHashMap<State,org.termautomata.util.automaton.State> visited = new IdentityHashMap<>();
    final ArrayDeque<State> pending = new ArrayDeque<>();
    visited.put(root, new org.termautomata.util.automaton.State());
    pending.push(root);
    while (!pending.isEmpty()) {
      final State s = pending.pop();
      final org.termautomata.util.automaton.State converted = visited.get(s);
      converted.setAccept(s.is_final);
      final int[] labels = s.labels;
      for (int i = 0; i < s.states.length; i++) {
        final State target = s.states[i];
        org.termautomata.util.automaton.State convertedTarget = visited.get(target);
        if (convertedTarget == null) {
          convertedTarget = new org.termautomata.util.automaton.State();
          visited.put(target, convertedTarget);
          pending.push(target);
        }
        converted.addTransition(new Transition(labels[i], convertedTarget));
      }
    }
    return visited.get(root);
  }

  /**
   * Build a minimal, deterministic automaton from a sorted list of
   * {@link BytesRef} representing strings in UTF-8. These strings must be
   * binary-sorted.
   */
  public static Automaton build(Collection<BytesRef> input) {
    return build(input, AutomatonConfig.DEFAULT);
  }

  /**
   * As {@link #build(Collection)}, reporting to {@code config}'s info stream.
   */
  public static Automaton build(Collection<BytesRef> input, AutomatonConfig config) {
    final DaciukMihovAutomatonBuilder builder = new DaciukMihovAutomatonBuilder();

    int[] codePoints = new int[0];
    final IntsRef ref = new IntsRef();
    for (BytesRef b : input) {
      codePoints = ArrayUtil.grow(codePoints, b.length);
      ref.ints = codePoints;
      ref.length = UnicodeUtil.UTF8toUTF32(b, codePoints);
      builder.add(ref);
    }

    return builder.complete(config);
  }

  /**
   * Replace last child of <code>state</code> with an already registered state
   * or stateRegistry the last child state. Children are processed deepest
   * first, so every child's own children are already interned when it is
   * looked up.
   */
  private void replaceOrRegister(State state) {
    final List<State> chain = new ArrayList<>();
    for (State s = state; s.hasChildren(); s = s.lastChild()) {
      chain.add(s);
    }
    for (int i = chain.size() - 1; i >= 0; i--) {
      final State parent = chain.get(i);
      final State child = parent.lastChild();
      final State registered = stateRegistry.get(child);
      if (registered != null) {
        parent.replaceLastChild(registered);
      } else {
        stateRegistry.put(child, child);
      }
    }
  }

  /**
   * Add a suffix of <code>current</code> starting at <code>fromIndex</code>
   * (inclusive) to state <code>state</code>.
   */
  private void addSuffix(State state, int[] current, int fromIndex, int end) {
    for (int i = fromIndex; i < end; i++) {
      state = state.newState(current[i]);
    }
    state.is_final = true;
  }
}
