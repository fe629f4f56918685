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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.factorix.common.LangUtils;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.NumericField;
import net.factorix.common.math.Polynome;

/**
 * <p>Computes {@code det(A - λI)} of a tridiagonal matrix A through the three-term recurrence</p>
 *
 * <p>{@code D_i(λ) = (a_ii - λ) D_{i-1}(λ) - a_{i,i-1} a_{i-1,i} D_{i-2}(λ)}</p>
 *
 * <p>Over {@link net.factorix.common.math.LongInt} or
 * {@link net.factorix.common.math.Fraction} elements the result is exact.</p>
 *
 * @author Sean Owen
 */
public final class CharacteristicPolynomial {

  private static final Logger log = LoggerFactory.getLogger(CharacteristicPolynomial.class);

  /**
   * Entries off the three central diagonals count as zero when their squared norm is below this.
   */
  static final double TRIDIAGONAL_THRESHOLD =
      LangUtils.readPositiveDoubleProperty("engine.tridiagonal.threshold", 1.0e-4);

  private CharacteristicPolynomial() {
  }

  /**
   * @param a square tridiagonal matrix
   * @return coefficients of {@code det(A - λI)}, constant term first
   * @throws MatrixException with {@link MatrixError#NOT_SQUARE} or {@link MatrixError#NOT_TRIDIAGONAL}
   */
  public static <T extends Numeric<T>> Polynome<T> compute(Matrix<T> a) {
    if (!a.isSquare()) {
      throw new MatrixException(MatrixError.NOT_SQUARE);
    }
    if (!isTridiagonal(a, TRIDIAGONAL_THRESHOLD)) {
      throw new MatrixException(MatrixError.NOT_TRIDIAGONAL);
    }
    int n = a.getWidth();
    log.debug("Characteristic polynomial of {} x {} matrix", n, n);
    NumericField<T> field = a.getField();
    T minusOne = field.one().negate();

    if (n == 0) {
      return Polynome.of(field, Arrays.asList(field.zero()));
    }
    Polynome<T> first = Polynome.of(field, Arrays.asList(a.get(0, 0), minusOne));
    if (n == 1) {
      return first;
    }
    Polynome<T> second = determinant2x2(a, field);

    Polynome<T> beforePrevious = first;
    Polynome<T> previous = second;
    for (int i = 2; i < n; i++) {
      Polynome<T> diagonalTerm = Polynome.of(field, Arrays.asList(a.get(i, i), minusOne));
      T offDiagonalProduct = a.get(i, i - 1).multiply(a.get(i - 1, i));
      Polynome<T> next = previous.multiply(diagonalTerm).subtract(beforePrevious.multiply(offDiagonalProduct));
      beforePrevious = previous;
      previous = next;
    }
    return previous;
  }

  /**
   * @return {@code ad - cb - (a + d)λ + λ^2} for the leading 2 x 2 block {@code [[a, b], [c, d]]}
   */
  private static <T extends Numeric<T>> Polynome<T> determinant2x2(Matrix<T> m, NumericField<T> field) {
    T a = m.get(0, 0);
    T b = m.get(0, 1);
    T c = m.get(1, 0);
    T d = m.get(1, 1);
    return Polynome.of(field, Arrays.asList(a.multiply(d).subtract(c.multiply(b)), a.add(d).negate(), field.one()));
  }

  /**
   * @return true if every entry off the main, sub- and super-diagonal has squared norm below
   *  {@code threshold}
   */
  public static <T extends Numeric<T>> boolean isTridiagonal(Matrix<T> a, double threshold) {
    for (int row = 0; row < a.getHeight(); row++) {
      for (int column = 0; column < a.getWidth(); column++) {
        if (Math.abs(row - column) > 1 && a.get(row, column).normSquared() >= threshold) {
          return false;
        }
      }
    }
    return true;
  }

}
