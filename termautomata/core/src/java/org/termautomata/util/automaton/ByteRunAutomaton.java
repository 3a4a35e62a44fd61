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


/**
 * Automaton representation for matching UTF-8 byte[].
 */
public class ByteRunAutomaton extends RunAutomaton {

  /** Converts the code point automaton {@code a} to UTF-8 and compiles it. */
  public ByteRunAutomaton(Automaton a) {
    this(a, false, AutomatonConfig.DEFAULT);
  }

  /**
   * Expert: if isBinary is true, the input is already byte-based, its labels
   * in 0-255, and is compiled as is.
   */
  public ByteRunAutomaton(Automaton a, boolean isBinary) {
    this(a, isBinary, AutomatonConfig.DEFAULT);
  }

  /** Expert: as {@link #ByteRunAutomaton(Automaton, boolean)}, with an explicit configuration. */
  public ByteRunAutomaton(Automaton a, boolean isBinary, AutomatonConfig config) {
    // the converted automaton is private to this instance, so it may be determinized in place
    super(isBinary ? a : new UTF32ToUTF8().convert(a, config), 256, true,
        isBinary ? config : config.setAllowMutate(true));
  }

  /**
   * Returns true if the given byte array is accepted by this automaton
   */
  public boolean run(byte[] s, int offset, int length) {
    int p = initial;
    int l = offset + length;
    for (int i = offset; i < l; i++) {
      p = step(p, s[i] & 0xFF);
      if (p == -1) return false;
    }
    return accept[p];
  }
}
