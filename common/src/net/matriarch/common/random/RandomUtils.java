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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Helpful methods for producing random matrix and vector contents.
 */
public final class RandomUtils {

  private RandomUtils() {
  }

  /**
   * @param length number of values to produce
   * @param maxQuarters largest absolute value to produce, in units of 0.25
   * @param random random number generator to use
   * @return values chosen uniformly from the multiples of 0.25 in {@code [-maxQuarters/4, maxQuarters/4]}.
   *  Sums of products of a few such values are exact in {@code float} as long as they stay small, which
   *  lets differently ordered computations be compared bit for bit
   */
  public static float[] randomQuarters(int length, int maxQuarters, RandomGenerator random) {
    Preconditions.checkArgument(length >= 0, "length must be nonnegative: %s", length);
    Preconditions.checkArgument(maxQuarters > 0, "maxQuarters must be positive: %s", maxQuarters);
    float[] values = new float[length];
    for (int i = 0; i < length; i++) {
      values[i] = (random.nextInt(2 * maxQuarters + 1) - maxQuarters) / 4.0f;
    }
    return values;
  }

  /**
   * @param length number of values to produce
   * @param random random number generator to use
   * @return values drawn from a standard normal distribution
   */
  public static float[] randomGaussians(int length, RandomGenerator random) {
    Preconditions.checkArgument(length >= 0, "length must be nonnegative: %s", length);
    float[] values = new float[length];
    for (int i = 0; i < length; i++) {
      values[i] = (float) random.nextGaussian();
    }
    return values;
  }

}
