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

import com.google.common.collect.Lists;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Real;

/**
 * <p>QR decomposition by Givens rotations. Real matrices only.</p>
 *
 * <p>Entries below the diagonal are zeroed row by row, left to right. Each rotation mixes the
 * row being cleared with the pivot row of that column, in R and in an accumulated rotation
 * matrix, and Q is the transpose of the accumulated product. A rotation whose target is already
 * zero is skipped.</p>
 *
 * @author Sean Owen
 */
public final class GivensQR implements QRDecomposer<Real> {

  private static final Logger log = LoggerFactory.getLogger(GivensQR.class);

  @Override
  public QRResult<Real> decompose(Matrix<Real> a) {
    if (!a.isSquare()) {
      throw new MatrixException(MatrixError.NOT_SQUARE);
    }
    int n = a.getWidth();
    log.debug("Givens QR of {} x {} matrix", n, n);
    double[][] r = toArray(a);
    double[][] g = toArray(Matrix.identity(Real.FIELD, n));

    for (int row = 1; row < n; row++) {
      for (int column = 0; column < row; column++) {
        double x = r[column][column];
        double y = r[row][column];
        if (y == 0.0) {
          continue;
        }
        double hypotenuse = FastMath.sqrt(x * x + y * y);
        double cos = x / hypotenuse;
        double sin = -y / hypotenuse;
        rotate(r, column, row, cos, sin);
        rotate(g, column, row, cos, sin);
      }
    }

    return new QRResult<Real>(toMatrix(g).transpose(), toMatrix(r));
  }

  private static void rotate(double[][] m, int pivotRow, int targetRow, double cos, double sin) {
    double[] pivot = m[pivotRow];
    double[] target = m[targetRow];
    for (int i = 0; i < pivot.length; i++) {
      double p = pivot[i];
      double t = target[i];
      pivot[i] = p * cos - t * sin;
      target[i] = p * sin + t * cos;
    }
  }

  private static double[][] toArray(Matrix<Real> m) {
    double[][] result = new double[m.getHeight()][m.getWidth()];
    for (int row = 0; row < result.length; row++) {
      for (int column = 0; column < result[row].length; column++) {
        result[row][column] = m.get(row, column).doubleValue();
      }
    }
    return result;
  }

  private static Matrix<Real> toMatrix(double[][] data) {
    int n = data.length;
    List<Real> values = Lists.newArrayListWithCapacity(n * n);
    for (double[] row : data) {
      for (double value : row) {
        values.add(Real.valueOf(value));
      }
    }
    return Matrix.of(Real.FIELD, n, n, values);
  }

}
