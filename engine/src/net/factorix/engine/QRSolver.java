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

import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;

/**
 * Solves {@code Ax = b} given a QR decomposition of A.
 *
 * @author Sean Owen
 */
public final class QRSolver {

  private QRSolver() {
  }

  /**
   * Computes {@code Q^H * b}, then back-substitutes against {@code R}.
   *
   * @param q unitary n x n matrix
   * @param r upper triangular n x n matrix
   * @param b n x 1 column vector
   * @return n x 1 solution {@code x}
   * @throws MatrixException with {@link MatrixError#SIZE_MISMATCH} if the shapes don't agree
   */
  public static <T extends Numeric<T>> Matrix<T> solve(Matrix<T> q, Matrix<T> r, Matrix<T> b) {
    if (!q.isSquare() || !r.isSquare() || b.getWidth() != 1 ||
        b.getHeight() != q.getHeight() || r.getWidth() != q.getWidth()) {
      throw new MatrixException(MatrixError.SIZE_MISMATCH);
    }
    Matrix<T> projected = q.conjugateTranspose().multiply(b);
    return Substitution.backSubstitute(r, projected.toList());
  }

}
