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
package org.termautomata.util;

import java.util.Random;

import com.carrotsearch.randomizedtesting.JUnit3MethodProvider;
import com.carrotsearch.randomizedtesting.JUnit4MethodProvider;
import com.carrotsearch.randomizedtesting.RandomizedContext;
import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.TestMethodProviders;
import org.junit.runner.RunWith;

/**
 * Base class for all tests. Tests run under {@link RandomizedRunner}, so every
 * failure reports the seed needed to reproduce it. Both JUnit3 style
 * {@code testXxx()} methods and {@code @Test} methods are picked up.
 */
@RunWith(RandomizedRunner.class)
@TestMethodProviders({
    JUnit3MethodProvider.class,
    JUnit4MethodProvider.class
})
public abstract class TermAutomataTestCase extends RandomizedTest {

  /** True if the tests should print what they do; set with {@code -Dtests.verbose=true}. */
  public static final boolean VERBOSE = Boolean.getBoolean("tests.verbose");

  /** Returns the random generator of the current test, seeded from the suite seed. */
  public static Random random() {
    return RandomizedContext.current().getRandom();
  }

  /** Returns an {@link InfoStream} that prints to stdout in verbose mode and is silent otherwise. */
  public static InfoStream newInfoStream() {
    return VERBOSE ? new PrintStreamInfoStream(System.out) : InfoStream.NO_OUTPUT;
  }
}
