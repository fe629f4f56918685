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

package net.factorix.engine;

import java.util.List;

import net.factorix.common.math.Matrix;
import net.factorix.common.math.Numeric;

/**
 * Triangular solves shared by the LU and QR paths.
 *
 * @author Sean Owen
 */
final class Substitution {

  private Substitution() {
  }

  /**
   * @param u upper triangular n x n matrix
   * @param y right-hand side, n elements
   * @return n x 1 solution {@code x} of {@code U * x = y}
   */
  static <T extends Numeric<T>> Matrix<T> backSubstitute(Matrix<T> u, List<T> y) {
    int n = u.getWidth();
    List<T> x = Matrix.zero(u.getField(), 1, n).toList();
    for (int i = n - 1; i >= 0; i--) {
      T xi = y.get(i);
      for (int j = i + 1; j < n; j++) {
        xi = xi.subtract(u.get(i, j).multiply(x.get(j)));
      }
      x.set(i, xi.divide(u.get(i, i)));
    }
    return Matrix.of(u.getField(), 1, n, x);
  }

}
