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

package net.factorix.common.random;

import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import net.factorix.common.math.Complex;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.NumericField;

/**
 * Manages random number generation, and makes random matrices from it. Allows resetting RNGs
 * to a known state for testing. Mostly adapted from Mahout's {@code RandomUtils}.
 *
 * @author Sean Owen
 * @author Mahout
 */
public final class RandomManager {

  private static final long TEST_SEED = 1234567890L;

  private static final Map<RandomGenerator,Boolean> INSTANCES = new WeakHashMap<RandomGenerator,Boolean>();
  private static boolean useTestSeed = false;

  private RandomManager() {
  }

  public static RandomGenerator getRandom() {
    if (useTestSeed) {
      // No need to track instances anymore
      return new MersenneTwister(TEST_SEED);
    }
    RandomGenerator random = new MersenneTwister();
    synchronized (INSTANCES) {
      INSTANCES.put(random, Boolean.TRUE);
    }
    return random;
  }

  public static void useTestSeed() {
    useTestSeed = true;
    synchronized (INSTANCES) {
      for (RandomGenerator random : INSTANCES.keySet()) {
        random.setSeed(TEST_SEED);
      }
      INSTANCES.clear();
    }
  }

  /**
   * @param random source of randomness
   * @param field converts each sampled value to the element type
   * @param width number of columns
   * @param height number of rows
   * @param scale elements are drawn uniformly from [-scale, scale)
   * @return new random matrix
   */
  public static <T extends Numeric<T>> Matrix<T> randomMatrix(RandomGenerator random,
                                                              NumericField<T> field,
                                                              int width,
                                                              int height,
                                                              double scale) {
    Preconditions.checkArgument(scale > 0.0, "Bad scale: %s", scale);
    List<T> values = Lists.newArrayListWithCapacity(width * height);
    for (int i = 0; i < width * height; i++) {
      values.add(field.fromReal(scale * (2.0 * random.nextDouble() - 1.0)));
    }
    return Matrix.of(field, width, height, values);
  }

  /**
   * Like {@link #randomMatrix(RandomGenerator, NumericField, int, int, double)}, with both the real
   * and imaginary part of each element random.
   */
  public static Matrix<Complex> randomComplexMatrix(RandomGenerator random, int width, int height, double scale) {
    Preconditions.checkArgument(scale > 0.0, "Bad scale: %s", scale);
    List<Complex> values = Lists.newArrayListWithCapacity(width * height);
    for (int i = 0; i < width * height; i++) {
      values.add(new Complex(scale * (2.0 * random.nextDouble() - 1.0), scale * (2.0 * random.nextDouble() - 1.0)));
    }
    return Matrix.of(Complex.FIELD, width, height, values);
  }

}
