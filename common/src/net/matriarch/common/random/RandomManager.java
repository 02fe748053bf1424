/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.matriarch.common.random;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Source of {@link RandomGenerator}s for sampling matrices and vectors. Once {@link #useTestSeed()}
 * has been called, every generator starts from the same fixed seed, so sampled data repeats from run
 * to run.
 */
public final class RandomManager {

  private static final long TEST_SEED = 1234567890L;

  private static volatile boolean useTestSeed = false;

  private RandomManager() {
  }

  /**
   * @return a new {@link MersenneTwister}; seeded with the test seed in test mode, else from the clock
   *  and identity hash as Commons Math does by default
   */
  public static RandomGenerator getRandom() {
    return useTestSeed ? new MersenneTwister(TEST_SEED) : new MersenneTwister();
  }

  /**
   * Seeds generators returned from now on with a fixed seed. Generators already handed out are left
   * as they are.
   */
  public static void useTestSeed() {
    useTestSeed = true;
  }

}
