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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.factorix.common.LangUtils;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.NumericField;

/**
 * <p>QR decomposition by Gram-Schmidt orthogonalization with re-orthogonalization. Works over
 * real and complex elements.</p>
 *
 * <p>Each column of A is projected against every column of Q already finished. The projection
 * pass repeats until the total squared change it makes to the column falls below epsilon, then
 * the column is normalized into Q. R holds the inner products of Q's columns with A's.</p>
 *
 * @param <T> element type
 * @author Sean Owen
 */
public final class GramSchmidtQR<T extends Numeric<T>> implements QRDecomposer<T> {

  private static final Logger log = LoggerFactory.getLogger(GramSchmidtQR.class);

  public static final double DEFAULT_EPSILON =
      LangUtils.readPositiveDoubleProperty("engine.gramSchmidt.epsilon", 0.1);
  private static final int MAX_PASSES =
      LangUtils.readPositiveIntProperty("engine.gramSchmidt.maxPasses", 16);

  private final double epsilon;

  public GramSchmidtQR() {
    this(DEFAULT_EPSILON);
  }

  /**
   * @param epsilon re-orthogonalization stops once a pass changes the column by less than this,
   *  in squared norm
   */
  public GramSchmidtQR(double epsilon) {
    Preconditions.checkArgument(LangUtils.isFinite(epsilon) && epsilon > 0.0, "Bad epsilon: %s", epsilon);
    this.epsilon = epsilon;
  }

  public double getEpsilon() {
    return epsilon;
  }

  @Override
  public QRResult<T> decompose(Matrix<T> a) {
    if (!a.isSquare()) {
      throw new MatrixException(MatrixError.NOT_SQUARE);
    }
    int n = a.getWidth();
    log.debug("Gram-Schmidt QR of {} x {} matrix, epsilon {}", n, n, epsilon);
    NumericField<T> field = a.getField();
    List<T> q = Matrix.zero(field, n, n).toList();
    List<T> r = Matrix.zero(field, n, n).toList();

    for (int j = 0; j < n; j++) {
      List<T> p = a.column(j).toList();

      int passes = 0;
      double delta;
      do {
        delta = 0.0;
        for (int i = 0; i < j; i++) {
          T dot = field.zero();
          for (int k = 0; k < n; k++) {
            dot = dot.add(q.get(k * n + i).conjugate().multiply(p.get(k)));
          }
          for (int k = 0; k < n; k++) {
            T change = q.get(k * n + i).multiply(dot);
            delta += change.normSquared();
            p.set(k, p.get(k).subtract(change));
          }
        }
        passes++;
      } while (!(delta < epsilon) && passes < MAX_PASSES);
      if (!(delta < epsilon)) {
        log.warn("Column {} did not converge after {} passes; last change {}", j, passes, delta);
      }

      double pNormSquared = 0.0;
      for (T element : p) {
        pNormSquared += element.normSquared();
      }
      T pNorm = field.fromReal(FastMath.sqrt(pNormSquared));
      for (int k = 0; k < n; k++) {
        q.set(k * n + j, p.get(k).divide(pNorm));
      }

      for (int i = 0; i <= j; i++) {
        T dot = field.zero();
        for (int k = 0; k < n; k++) {
          dot = dot.add(q.get(k * n + i).conjugate().multiply(a.get(k, j)));
        }
        r.set(i * n + j, dot);
      }
    }

    return new QRResult<T>(Matrix.of(field, n, n, q), Matrix.of(field, n, n, r));
  }

}
