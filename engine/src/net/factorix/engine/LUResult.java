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

import com.google.common.base.Preconditions;

import net.factorix.common.math.Matrix;
import net.factorix.common.math.Numeric;

/**
 * The factors of an LU decomposition: unit lower triangular {@code L} and upper triangular
 * {@code U} with {@code L * U = A}.
 *
 * @param <T> element type
 * @author Sean Owen
 */
public final class LUResult<T extends Numeric<T>> {

  private final Matrix<T> l;
  private final Matrix<T> u;

  public LUResult(Matrix<T> l, Matrix<T> u) {
    Preconditions.checkNotNull(l);
    Preconditions.checkNotNull(u);
    this.l = l;
    this.u = u;
  }

  public Matrix<T> getL() {
    return l;
  }

  public Matrix<T> getU() {
    return u;
  }

  /**
   * @see LUDecomposition#solve(Matrix, Matrix, Matrix)
   */
  public Matrix<T> solve(Matrix<T> b) {
    return LUDecomposition.solve(l, u, b);
  }

}
