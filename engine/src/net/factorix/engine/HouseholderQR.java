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

import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.NumericField;

/**
 * <p>QR decomposition by Householder reflections. Works over real and complex elements.</p>
 *
 * <p>For each pivot column the reflection {@code H = I - 2 v v^H} maps the part of the column on
 * and below the pivot onto the pivot row. It is applied to the running R and to an accumulated
 * product that starts as the identity; at the end that product times A is R, so Q is its
 * conjugate transpose. A column that has only zeros below the pivot is left alone, which keeps
 * the identity matrix fixed.</p>
 *
 * <p>A zero pivot takes phase 1, so its reflector still carries the column norm on the pivot
 * entry; dropping that term would leave R with non-zero entries below the diagonal.</p>
 *
 * @param <T> element type
 * @author Sean Owen
 */
public final class HouseholderQR<T extends Numeric<T>> implements QRDecomposer<T> {

  private static final Logger log = LoggerFactory.getLogger(HouseholderQR.class);

  @Override
  public QRResult<T> decompose(Matrix<T> a) {
    if (!a.isSquare()) {
      throw new MatrixException(MatrixError.NOT_SQUARE);
    }
    int n = a.getWidth();
    log.debug("Householder QR of {} x {} matrix", n, n);
    NumericField<T> field = a.getField();
    List<T> r = a.toList();
    List<T> h = Matrix.identity(field, n).toList();

    for (int layer = 0; layer < n; layer++) {
      double belowNormSquared = 0.0;
      for (int i = layer + 1; i < n; i++) {
        belowNormSquared += r.get(i * n + layer).normSquared();
      }
      if (belowNormSquared == 0.0) {
        continue;
      }
      T pivot = r.get(layer * n + layer);
      double columnNorm = FastMath.sqrt(pivot.normSquared() + belowNormSquared);

      List<T> v = Matrix.zero(field, 1, n).toList();
      // Pivot plus its own phase times the column norm; a zero pivot takes phase 1
      T shift;
      if (pivot.norm() != 0.0) {
        shift = pivot.divide(field.fromReal(pivot.norm())).multiply(field.fromReal(columnNorm));
      } else {
        shift = field.fromReal(columnNorm);
      }
      v.set(layer, pivot.add(shift));
      double vNormSquared = v.get(layer).normSquared();
      for (int i = layer + 1; i < n; i++) {
        T entry = r.get(i * n + layer);
        v.set(i, entry);
        vNormSquared += entry.normSquared();
      }
      T vNorm = field.fromReal(FastMath.sqrt(vNormSquared));
      for (int i = layer; i < n; i++) {
        v.set(i, v.get(i).divide(vNorm));
      }

      reflect(r, v, layer, n, field);
      reflect(h, v, layer, n, field);
    }

    Matrix<T> accumulated = Matrix.of(field, n, n, h);
    return new QRResult<T>(accumulated.conjugateTranspose(), Matrix.of(field, n, n, r));
  }

  /**
   * Applies {@code I - 2 v v^H} to every column of the n x n row-major matrix {@code m}.
   * {@code v} is zero above {@code from}.
   */
  private static <T extends Numeric<T>> void reflect(List<T> m, List<T> v, int from, int n, NumericField<T> field) {
    T minusTwo = field.fromReal(-2.0);
    for (int column = 0; column < n; column++) {
      T dot = field.zero();
      for (int k = from; k < n; k++) {
        dot = dot.add(v.get(k).conjugate().multiply(m.get(k * n + column)));
      }
      if (dot.isZero()) {
        continue;
      }
      T scaled = dot.multiply(minusTwo);
      for (int j = from; j < n; j++) {
        m.set(j * n + column, m.get(j * n + column).add(v.get(j).multiply(scaled)));
      }
    }
  }

}
