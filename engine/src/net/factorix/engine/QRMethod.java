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
import net.factorix.common.math.NumericField;
import net.factorix.common.math.Real;

/**
 * The available QR algorithms, each with the numeric code that selects it in matrix files
 * ({@code Method=1} and so on).
 *
 * @author Sean Owen
 */
public enum QRMethod {

  HOUSEHOLDER(1),
  GIVENS(2),
  GRAM_SCHMIDT(3);

  private final int code;

  QRMethod(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * @return the method with the given code, or {@code null} if there is none
   */
  public static QRMethod forCode(int code) {
    for (QRMethod method : values()) {
      if (method.code == code) {
        return method;
      }
    }
    return null;
  }

  /**
   * @param field element type the decomposer will work on
   * @param epsilon re-orthogonalization threshold; only used by {@link #GRAM_SCHMIDT}
   * @return a decomposer implementing this method over {@code field}
   * @throws MatrixException with {@link MatrixError#UNSUPPORTED_OPERATION} if this method is
   *  not defined over {@code field}, which is the case for {@link #GIVENS} on any field whose elements are not {@link Real}
   */
  @SuppressWarnings("unchecked")
  public <T extends Numeric<T>> QRDecomposer<T> newDecomposer(NumericField<T> field, double epsilon) {
    switch (this) {
      case HOUSEHOLDER:
        return new HouseholderQR<T>();
      case GIVENS:
        if (!(field.zero() instanceof Real)) {
          throw new MatrixException(MatrixError.UNSUPPORTED_OPERATION, "Givens rotations need real elements");
        }
        return (QRDecomposer<T>) (QRDecomposer<?>) new GivensQR();
      case GRAM_SCHMIDT:
        return new GramSchmidtQR<T>(epsilon);
      default:
        throw new IllegalStateException("Unknown method " + this);
    }
  }

  /**
   * Decomposes {@code a} by this method, using the default Gram-Schmidt epsilon.
   *
   * @see #newDecomposer(NumericField, double)
   */
  public <T extends Numeric<T>> QRResult<T> decompose(Matrix<T> a) {
    return decompose(a, GramSchmidtQR.DEFAULT_EPSILON);
  }

  public <T extends Numeric<T>> QRResult<T> decompose(Matrix<T> a, double epsilon) {
    return newDecomposer(a.getField(), epsilon).decompose(a);
  }

}
