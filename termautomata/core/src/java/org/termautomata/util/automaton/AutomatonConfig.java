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


import org.termautomata.util.InfoStream;

/**
 * Holds the options that automaton operations consult while they run.
 * <p>
 * Instances are immutable: every setter returns a modified copy, so a config
 * can be shared freely between threads and operations. Operations that are
 * called without a config use {@link #DEFAULT}.
 *
 * @termautomata.experimental
 */
public final class AutomatonConfig {

  /** Component name used for determinization messages. */
  public static final String DET_COMPONENT = "DET";
  /** Component name used for minimization messages. */
  public static final String MIN_COMPONENT = "MIN";
  /** Component name used for regular expression compilation messages. */
  public static final String RE_COMPONENT = "RE";
  /** Component name used for Levenshtein automaton construction messages. */
  public static final String LEV_COMPONENT = "LEV";
  /** Component name used for UTF-8 conversion messages. */
  public static final String UTF8_COMPONENT = "UTF8";
  /** Component name used for sorted-string builder messages. */
  public static final String DM_COMPONENT = "DM";

  /** Never mutates its inputs, never minimizes implicitly, logs to the default {@link InfoStream}. */
  public static final AutomatonConfig DEFAULT = new AutomatonConfig(false, false, null);

  private final boolean allowMutate;
  private final boolean minimizeAlways;
  // null means InfoStream.getDefault() at the time of the call
  private final InfoStream infoStream;

  private AutomatonConfig(boolean allowMutate, boolean minimizeAlways, InfoStream infoStream) {
    this.allowMutate = allowMutate;
    this.minimizeAlways = minimizeAlways;
    this.infoStream = infoStream;
  }

  /**
   * If true, operations may modify (and return) the automata passed to them
   * instead of working on clones. Default is false.
   */
  public boolean allowMutate() {
    return allowMutate;
  }

  /** Returns a copy of this config with {@link #allowMutate()} set to the given value. */
  public AutomatonConfig setAllowMutate(boolean allowMutate) {
    return new AutomatonConfig(allowMutate, minimizeAlways, infoStream);
  }

  /**
   * If true, composite operations minimize their result before returning it.
   * Default is false.
   */
  public boolean minimizeAlways() {
    return minimizeAlways;
  }

  /** Returns a copy of this config with {@link #minimizeAlways()} set to the given value. */
  public AutomatonConfig setMinimizeAlways(boolean minimizeAlways) {
    return new AutomatonConfig(allowMutate, minimizeAlways, infoStream);
  }

  /** Returns the {@link InfoStream} operations report to. */
  public InfoStream getInfoStream() {
    return infoStream == null ? InfoStream.getDefault() : infoStream;
  }

  /**
   * Returns a copy of this config that reports to the given {@link InfoStream}.
   * Use {@link InfoStream#NO_OUTPUT} to disable logging.
   */
  public AutomatonConfig setInfoStream(InfoStream infoStream) {
    if (infoStream == null) {
      throw new IllegalArgumentException("Cannot set InfoStream implementation to null. "+
        "To disable logging use InfoStream.NO_OUTPUT");
    }
    return new AutomatonConfig(allowMutate, minimizeAlways, infoStream);
  }

  @Override
  public String toString() {
    return "AutomatonConfig(allowMutate=" + allowMutate + " minimizeAlways=" + minimizeAlways + " infoStream=" + getInfoStream() + ")";
  }
}
