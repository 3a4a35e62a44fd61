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


import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.termautomata.util.IntsRef;

/**
 * A ParametricDescription describes the structure of a Levenshtein DFA for some degree n.
 * <p>
 * There are four components of a parametric description, all parameterized on the length
 * of the word <code>w</code>:
 * <ol>
 * <li>The number of states: {@link #size()}
 * <li>The set of final states: {@link #isAccept(int)}
 * <li>The transition function: {@link #transition(int, int, int)}
 * <li>Minimal boundary function: {@link #getPosition(int)}
 * </ol>
 * <p>
 * A parametric state is a set of Levenshtein NFA positions, relative to a base
 * offset into the word. A regular position {@code (p, e)} has consumed
 * {@code p} characters of the word with {@code e} edits; a transposition
 * position {@code (p, e, t)} has additionally read {@code word[p+1]} and waits
 * for {@code word[p]}. The tables are independent of the word and are built
 * once per (distance, transpositions) pair.
 */
final class ParametricDescription {

  private static final Tables[] TABLES = new Tables[2 * (LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE + 1)];

  private final int w;
  private final int n;
  private final Tables tables;

  /**
   * Creates the description for a word of length {@code w}, {@code n} edits
   * and optionally transpositions.
   */
  ParametricDescription(int w, int n, boolean transpositions) {
    if (n < 1 || n > LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE) {
      throw new IllegalArgumentException("unsupported edit distance: " + n);
    }
    this.w = w;
    this.n = n;
    this.tables = tables(n, transpositions);
  }

  private static synchronized Tables tables(int n, boolean transpositions) {
    final int slot = 2 * n + (transpositions ? 1 : 0);
    Tables t = TABLES[slot];
    if (t == null) {
      t = TABLES[slot] = new Tables(n, transpositions);
    }
    return t;
  }

  /**
   * Return the number of states needed to compute a Levenshtein DFA
   */
  int size() {
    return tables.minErrors.length * (w+1);
  }

  /**
   * Returns true if the <code>state</code> in any Levenshtein DFA is an accept state (final state).
   */
  boolean isAccept(int absState) {
    // decode absState -> state, offset
    int state = absState/(w+1);
    int offset = absState%(w+1);
    assert offset >= 0;
    return w - offset + tables.minErrors[state] <= n;
  }

  /**
   * Returns the position in the input word for a given <code>state</code>.
   * This is the minimal boundary for the state.
   */
  int getPosition(int absState) {
    return absState % (w+1);
  }

  /**
   * Returns the state number for a transition from the given <code>state</code>,
   * assuming <code>position</code> and characteristic vector <code>vector</code>,
   * or -1 if the transition leads to the empty state.
   */
  int transition(int absState, int position, int vector) {
    int state = absState/(w+1);
    int offset = absState%(w+1);
    assert offset == position : "offset=" + offset + " position=" + position;
    final int k = Math.min(w - offset, 2*n+1);
    assert vector >>> k == 0;
    final int loc = (state << k) | vector;
    final int next = tables.toStates[k][loc];
    if (next == -1) {
      return -1;
    }
    return next*(w+1) + offset + tables.offsetIncrs[k][loc];
  }

  /** Number of parametric states, independent of the word. */
  int numParametricStates() {
    return tables.minErrors.length;
  }

  /**
   * Word independent transition tables, indexed by window length
   * {@code k} (the number of word characters the characteristic vector
   * covers, at most {@code 2n+1}) and {@code state << k | vector}.
   */
  private static final class Tables {
    private static final int NO_ACCEPT = Integer.MAX_VALUE / 2;

    final int n;
    final boolean transpositions;
    final int[][] toStates;
    final int[][] offsetIncrs;
    final int[] minErrors;

    // parametric state -> its sorted position codes
    private final List<int[]> states = new ArrayList<>();
    private final Map<IntsRef,Integer> ids = new HashMap<>();

    Tables(int n, boolean transpositions) {
      this.n = n;
      this.transpositions = transpositions;
      final int maxWindow = 2*n+1;

      // per state, per window: next state and offset increment for every vector
      final List<int[][]> nextRows = new ArrayList<>();
      final List<int[][]> incrRows = new ArrayList<>();

      id(new int[] {encode(0, 0, false)});
      for (int s = 0; s < states.size(); s++) {
        final int[] positions = states.get(s);
        final int[][] next = new int[maxWindow+1][];
        final int[][] incr = new int[maxWindow+1][];
        for (int k = 0; k <= maxWindow; k++) {
          next[k] = new int[1 << k];
          incr[k] = new int[1 << k];
          for (int vec = 0; vec < 1 << k; vec++) {
            step(positions, k, vec, next[k], incr[k]);
          }
        }
        nextRows.add(next);
        incrRows.add(incr);
      }

      final int numStates = states.size();
      toStates = new int[maxWindow+1][];
      offsetIncrs = new int[maxWindow+1][];
      for (int k = 0; k <= maxWindow; k++) {
        toStates[k] = new int[numStates << k];
        offsetIncrs[k] = new int[numStates << k];
        for (int s = 0; s < numStates; s++) {
          System.arraycopy(nextRows.get(s)[k], 0, toStates[k], s << k, 1 << k);
          System.arraycopy(incrRows.get(s)[k], 0, offsetIncrs[k], s << k, 1 << k);
        }
      }

      minErrors = new int[numStates];
      for (int s = 0; s < numStates; s++) {
        int min = NO_ACCEPT;
        for (int code : states.get(s)) {
          if (!isTransposition(code)) {
            min = Math.min(min, errors(code) - position(code));
          }
        }
        minErrors[s] = min;
      }
    }

    private int encode(int p, int e, boolean t) {
      return ((p * (n+1) + e) << 1) | (t ? 1 : 0);
    }

    private int position(int code) {
      return (code >> 1) / (n+1);
    }

    private int errors(int code) {
      return (code >> 1) % (n+1);
    }

    private static boolean isTransposition(int code) {
      return (code & 1) != 0;
    }

    // bit k-1 of the vector stands for the first character of the window
    private static boolean match(int r, int k, int vec) {
      return r < k && ((vec >>> (k-1-r)) & 1) != 0;
    }

    private int id(int[] positions) {
      final IntsRef key = new IntsRef(positions, 0, positions.length);
      Integer id = ids.get(key);
      if (id == null) {
        id = states.size();
        states.add(positions);
        ids.put(key, id);
      }
      return id;
    }

    private void step(int[] positions, int k, int vec, int[] next, int[] incr) {
      final List<Integer> out = new ArrayList<>();
      for (int code : positions) {
        final int p = position(code);
        final int e = errors(code);
        if (isTransposition(code)) {
          if (match(p, k, vec)) {
            out.add(encode(p+2, e, false));
          }
          continue;
        }
        if (match(p, k, vec)) {
          out.add(encode(p+1, e, false));
        }
        if (e < n) {
          // insertion
          out.add(encode(p, e+1, false));
          // substitution
          if (p < k) {
            out.add(encode(p+1, e+1, false));
          }
          // deletion of j characters, then a match
          for (int j = 1; j <= n-e; j++) {
            if (match(p+j, k, vec)) {
              out.add(encode(p+j+1, e+j, false));
            }
          }
          if (transpositions && match(p+1, k, vec)) {
            out.add(encode(p, e+1, true));
          }
        }
      }
      if (out.isEmpty()) {
        next[vec] = -1;
        incr[vec] = 0;
        return;
      }
      final int[] reduced = reduce(out);
      int base = Integer.MAX_VALUE;
      for (int code : reduced) {
        base = Math.min(base, position(code));
      }
      for (int i = 0; i < reduced.length; i++) {
        reduced[i] = encode(position(reduced[i]) - base, errors(reduced[i]), isTransposition(reduced[i]));
      }
      Arrays.sort(reduced);
      next[vec] = id(reduced);
      incr[vec] = base;
    }

    // drops duplicates and every regular position subsumed by another one
    private int[] reduce(List<Integer> codes) {
      final int[] sorted = new int[codes.size()];
      for (int i = 0; i < sorted.length; i++) {
        sorted[i] = codes.get(i);
      }
      Arrays.sort(sorted);
      final int[] kept = new int[sorted.length];
      int upto = 0;
      for (int i = 0; i < sorted.length; i++) {
        if (i > 0 && sorted[i] == sorted[i-1]) {
          continue;
        }
        if (!isTransposition(sorted[i]) && isSubsumed(sorted[i], sorted)) {
          continue;
        }
        kept[upto++] = sorted[i];
      }
      return Arrays.copyOf(kept, upto);
    }

    private boolean isSubsumed(int code, int[] others) {
      final int j = position(code);
      final int f = errors(code);
      for (int other : others) {
        if (isTransposition(other)) {
          continue;
        }
        final int i = position(other);
        final int e = errors(other);
        if (e < f && Math.abs(j - i) <= f - e) {
          return true;
        }
      }
      return false;
    }
  }
}
