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

import org.termautomata.util.ArrayUtil;
import org.termautomata.util.IntsRef;
import org.termautomata.util.RamUsageEstimator;

/**
 * Iterates all accepted strings.
 *
 * <p>If the {@link Automaton} has cycles then this iterator may throw an {@code
 * IllegalArgumentException}, but this is not guaranteed!
 *
 * <p>Be aware that the iteration order is implementation dependent
 * and may change across releases.
 *
 * <p>If the automaton is not determinized then it's possible this iterator
 * will return duplicates.
 *
 * @termautomata.experimental
 */
public class FiniteStringsIterator {
  /**
   * Empty string.
   */
  private static final IntsRef EMPTY = new IntsRef();

  /**
   * Sorted transitions of every state, indexed by state number.
   */
  private final Transition[][] transitions;

  /**
   * Tracks which states are in the current path, for cycle detection.
   */
  private final BitSet pathStates;

  /**
   * Labels of the current path.
   */
  private final IntsRef string;

  /**
   * Stack to hold our current state in the
   * recursion/iteration.
   */
  private PathNode[] nodes;

  /**
   * Emit empty string?.
   */
  private boolean emitEmptyString;

  /**
   * Constructor.
   *
   * @param a Automaton to create finite string from.
   */
  public FiniteStringsIterator(Automaton a) {
    final Automaton expanded;
    if (a.isSingleton()) {
      expanded = a.cloneExpanded();
    } else {
      expanded = a;
    }
    this.transitions = expanded.getSortedTransitions();
    this.nodes = new PathNode[16];
    for (int i = 0, end = nodes.length; i < end; i++) {
      nodes[i] = new PathNode();
    }
    this.string = new IntsRef(16);
    this.pathStates = new BitSet(transitions.length);
    final State initial = expanded.initial;
    this.emitEmptyString = initial.accept;

    // Start iteration with the initial state.
    if (initial.numTransitions() > 0) {
      pathStates.set(initial.number);
      nodes[0].resetState(initial, transitions[initial.number]);
      string.length = 1;
    }
  }

  /**
   * Generate next finite string.
   * The return value is just valid until the next call of this method!
   *
   * @return Finite string or null, if no more finite strings are available.
   */
  public IntsRef next() {
    // Special case the empty string, as usual:
    if (emitEmptyString) {
      emitEmptyString = false;
      return EMPTY;
    }

    for (int depth = string.length; depth > 0;) {
      PathNode node = nodes[depth-1];

      // Get next label leaving the current node:
      int label = node.nextLabel();
      if (label != -1) {
        string.ints[depth - 1] = label;

        State to = node.to;
        if (to.numTransitions() != 0) {
          // Now recurse: the destination of this transition has outgoing transitions:
          if (pathStates.get(to.number)) {
            throw new IllegalArgumentException("automaton has cycles");
          }
          pathStates.set(to.number);

          // Push node onto stack:
          growStack(depth);
          nodes[depth].resetState(to, transitions[to.number]);
          depth++;
          string.ints = ArrayUtil.grow(string.ints, depth);
          string.length = depth;
        } else if (to.accept) {
          // This transition leads to an accept state, so we save the current string:
          return string;
        }
      } else {
        // No more transitions leaving this state, pop/return back to previous state:
        State state = node.state;
        assert pathStates.get(state.number);
        pathStates.clear(state.number);
        depth--;
        string.length = depth;

        // The empty string was already emitted up front.
        if (depth > 0 && state.accept) {
          // This transition leads to an accept state, so we save the current string:
          return string;
        }
      }
    }

    // Finished iteration.
    return null;
  }

  /**
   * Grow path stack, if required.
   */
  private void growStack(int depth) {
    if (nodes.length == depth) {
      PathNode[] newNodes = new PathNode[ArrayUtil.oversize(nodes.length + 1, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
      System.arraycopy(nodes, 0, newNodes, 0, nodes.length);
      for (int i = depth, end = newNodes.length; i < end; i++) {
        newNodes[i] = new PathNode();
      }
      nodes = newNodes;
    }
  }

  /**
   * Nodes for path stack.
   */
  private static class PathNode {

    /** Which state the path node ends on, whose
     *  transitions we are enumerating. */
    State state;

    /** The transitions leaving {@link #state}, sorted by label. */
    Transition[] transitions;

    /** The thing we are pointing to */
    State to;

    /** Which transition we are on. */
    int transition;

    /** Which label we are on, in the min-max range of the
     *  current Transition */
    int label;

    void resetState(State state, Transition[] transitions) {
      assert transitions.length != 0;
      this.state = state;
      this.transitions = transitions;
      transition = 0;
      label = transitions[0].min;
      to = transitions[0].to;
    }

    /** Returns next label of current transition, or
     *  advances to next transition and returns its first
     *  label, if current one is exhausted.  If there are
     *  no more transitions, returns -1. */
    int nextLabel() {
      if (label > transitions[transition].max) {
        // We've exhaused the current transition's labels;
        // move to next transitions:
        transition++;
        if (transition >= transitions.length) {
          // We're done iterating transitions leaving this state
          label = -1;
          return -1;
        }
        label = transitions[transition].min;
        to = transitions[transition].to;
      }
      return label++;
    }
  }
}
