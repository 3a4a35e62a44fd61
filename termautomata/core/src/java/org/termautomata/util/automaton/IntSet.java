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


import java.util.Arrays;

/**
 * A sorted set of NFA state numbers, used as the identity of one DFA state
 * during determinization. Equality and hash code are structural, and they are
 * the same for every subclass, so a mutable working set can be looked up in a
 * map keyed by frozen snapshots.
 */
abstract class IntSet {

  /**
   * Sorted ascending, only the first {@link #size()} entries are meaningful.
   */
  abstract int[] getArray();

  /** Number of distinct values in the set. */
  abstract int size();

  /** Hash over {@link #size()} and the sorted values; must agree across subclasses. */
  abstract int hash();

  @Override
  public final int hashCode() {
    return hash();
  }

  @Override
  public final boolean equals(Object _other) {
    if (_other == null) {
      return false;
    }
    if (!(_other instanceof IntSet)) {
      return false;
    }
    final IntSet other = (IntSet) _other;
    if (hash() != other.hash()) {
      return false;
    }
    final int size = size();
    return size == other.size() && Arrays.equals(getArray(), 0, size, other.getArray(), 0, size);
  }

  static int hashOf(int[] values, int size) {
    int hashCode = size;
    for (int i = 0; i < size; i++) {
      hashCode = 683*hashCode + values[i];
    }
    return hashCode;
  }
}
