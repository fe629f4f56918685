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
 * The factors of a QR decomposition.
 *
 * @param <T> element type
 * @author Sean Owen
 */
public final class QRResult<T extends Numeric<T>> {

  private final Matrix<T> q;
  private final Matrix<T> r;

  public QRResult(Matrix<T> q, Matrix<T> r) {
    Preconditions.checkNotNull(q);
    Preconditions.checkNotNull(r);
    this.q = q;
    this.r = r;
  }

  /**
   * @return unitary factor
   */
  public Matrix<T> getQ() {
    return q;
  }

  /**
   * @return upper triangular factor
   */
  public Matrix<T> getR() {
    return r;
  }

  /**
   * @see QRSolver#solve(Matrix, Matrix, Matrix)
   */
  public Matrix<T> solve(Matrix<T> b) {
    return QRSolver.solve(q, r, b);
  }

}
