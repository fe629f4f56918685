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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.NumericField;

/**
 * <p>LU decomposition without pivoting (Doolittle), and solution of {@code Ax = b} from its factors.</p>
 *
 * <p>No row exchange is ever attempted. A zero pivot fails with {@link MatrixError#NOT_REGULAR},
 * even when a permutation of the rows would factor.</p>
 *
 * @author Sean Owen
 */
public final class LUDecomposition {

  private static final Logger log = LoggerFactory.getLogger(LUDecomposition.class);

  private LUDecomposition() {
  }

  /**
   * @param a square matrix to factor
   * @return {@code L} and {@code U} such that {@code L * U = A}
   * @throws MatrixException with {@link MatrixError#NOT_SQUARE} or {@link MatrixError#NOT_REGULAR}
   */
  public static <T extends Numeric<T>> LUResult<T> decompose(Matrix<T> a) {
    if (!a.isSquare()) {
      throw new MatrixException(MatrixError.NOT_SQUARE);
    }
    int n = a.getWidth();
    log.debug("LU decomposition of {} x {} matrix", n, n);
    NumericField<T> field = a.getField();
    List<T> d = a.toList();
    List<T> l = Matrix.zero(field, n, n).toList();
    List<T> u = Matrix.zero(field, n, n).toList();

    for (int layer = 0; layer < n; layer++) {
      T pivot = d.get(layer * n + layer);
      if (pivot.isZero()) {
        log.debug("Zero pivot at {}", layer);
        throw new MatrixException(MatrixError.NOT_REGULAR, "Zero pivot at " + layer);
      }
      l.set(layer * n + layer, field.one());
      u.set(layer * n + layer, pivot);
      for (int i = layer + 1; i < n; i++) {
        T below = d.get(i * n + layer);
        l.set(i * n + layer, below.divide(pivot));
        u.set(layer * n + i, d.get(layer * n + i));
        for (int j = layer + 1; j < n; j++) {
          T update = d.get(layer * n + j).multiply(below).divide(pivot);
          d.set(i * n + j, d.get(i * n + j).subtract(update));
        }
      }
    }

    return new LUResult<T>(Matrix.of(field, n, n, l), Matrix.of(field, n, n, u));
  }

  /**
   * Solves {@code L * U * x = b} by forward substitution against {@code L}, which is taken to have
   * a unit diagonal, then back substitution against {@code U}.
   *
   * @param l unit lower triangular n x n matrix
   * @param u upper triangular n x n matrix
   * @param b n x 1 column vector
   * @return n x 1 solution {@code x}
   * @throws MatrixException with {@link MatrixError#SIZE_MISMATCH} if the shapes don't agree
   */
  public static <T extends Numeric<T>> Matrix<T> solve(Matrix<T> l, Matrix<T> u, Matrix<T> b) {
    if (!l.isSquare() || !u.isSquare() || b.getWidth() != 1 ||
        b.getHeight() != l.getHeight() || l.getWidth() != u.getWidth()) {
      throw new MatrixException(MatrixError.SIZE_MISMATCH);
    }
    int n = l.getWidth();
    NumericField<T> field = l.getField();

    List<T> y = Matrix.zero(field, 1, n).toList();
    for (int i = 0; i < n; i++) {
      T yi = b.get(i, 0);
      for (int j = 0; j < i; j++) {
        yi = yi.subtract(l.get(i, j).multiply(y.get(j)));
      }
      y.set(i, yi);
    }

    return Substitution.backSubstitute(u, y);
  }

}
