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

import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;

import net.factorix.common.FactorixTest;
import net.factorix.common.math.Complex;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.Real;

public final class RandomManagerTest extends FactorixTest {

  @Test
  public void testTestSeedRepeats() {
    RandomGenerator first = RandomManager.getRandom();
    RandomGenerator second = RandomManager.getRandom();
    assertEquals(first.nextLong(), second.nextLong());
  }

  @Test
  public void testRandomMatrix() {
    Matrix<Real> m = RandomManager.randomMatrix(RandomManager.getRandom(), Real.FIELD, 4, 3, 2.0);
    assertEquals(4, m.getWidth());
    assertEquals(3, m.getHeight());
    for (Real value : m.toList()) {
      assertTrue(value.norm() <= 2.0);
    }
    assertEquals(m, RandomManager.randomMatrix(RandomManager.getRandom(), Real.FIELD, 4, 3, 2.0));
  }

  @Test
  public void testRandomComplexMatrix() {
    Matrix<Complex> m = RandomManager.randomComplexMatrix(RandomManager.getRandom(), 2, 2, 1.0);
    for (Complex value : m.toList()) {
      assertTrue(Math.abs(value.getReal()) <= 1.0);
      assertTrue(Math.abs(value.getImaginary()) <= 1.0);
      assertTrue(value.getImaginary() != 0.0);
    }
  }

}
