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

import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;

import net.factorix.common.FactorixTest;
import net.factorix.common.math.Complex;
import net.factorix.common.math.Fraction;
import net.factorix.common.math.LongInt;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.NumericField;
import net.factorix.common.math.Real;
import net.factorix.common.random.RandomManager;

/**
 * Tests {@link LUDecomposition}.
 *
 * @author Sean Owen
 */
public final class LUDecompositionTest extends FactorixTest {

  private static final NumericField<Fraction<LongInt>> RATIONAL = Fraction.field(LongInt.FIELD);

  @Test
  public void testTwoByTwo() {
    Matrix<Real> a = realMatrix(2, 4, 3, 6, 3);
    LUResult<Real> lu = LUDecomposition.decompose(a);
    assertEquals(realMatrix(2, 1, 0, 1.5, 1), lu.getL());
    assertEquals(realMatrix(2, 4, 3, 0, -1.5), lu.getU());
    assertEquals(a, lu.getL().multiply(lu.getU()));
  }

  @Test
  public void testRandomReal() {
    RandomGenerator random = RandomManager.getRandom();
    for (int n = 1; n <= 8; n++) {
      Matrix<Real> a = diagonallyDominant(RandomManager.randomMatrix(random, Real.FIELD, n, n, 1.0));
      LUResult<Real> lu = LUDecomposition.decompose(a);
      assertTriangular(lu.getL(), true);
      assertTriangular(lu.getU(), false);
      for (int i = 0; i < n; i++) {
        assertEquals(Real.ONE, lu.getL().get(i, i));
      }
      assertMatrixEquals(a, lu.getL().multiply(lu.getU()));

      Matrix<Real> b = RandomManager.randomMatrix(random, Real.FIELD, 1, n, 10.0);
      Matrix<Real> x = lu.solve(b);
      assertMatrixEquals(b, a.multiply(x));
    }
  }

  @Test
  public void testRandomComplex() {
    RandomGenerator random = RandomManager.getRandom();
    int n = 6;
    Matrix<Complex> a = diagonallyDominant(RandomManager.randomComplexMatrix(random, n, n, 1.0));
    LUResult<Complex> lu = LUDecomposition.decompose(a);
    assertMatrixEquals(a, lu.getL().multiply(lu.getU()));
    Matrix<Complex> b = RandomManager.randomComplexMatrix(random, 1, n, 1.0);
    assertMatrixEquals(b, a.multiply(LUDecomposition.solve(lu.getL(), lu.getU(), b)));
  }

  @Test
  public void testExactRational() {
    Matrix<Fraction<LongInt>> a = Matrix.of(RATIONAL, 3,
        rational(2), rational(1), rational(1),
        rational(4), rational(-6), rational(0),
        rational(-2), rational(7), rational(2));
    LUResult<Fraction<LongInt>> lu = LUDecomposition.decompose(a);
    assertEquals(a, lu.getL().multiply(lu.getU()));
    Matrix<Fraction<LongInt>> b = Matrix.of(RATIONAL, 1, rational(5), rational(-2), rational(9));
    Matrix<Fraction<LongInt>> x = lu.solve(b);
    assertEquals(b, a.multiply(x));
    assertEquals(Matrix.of(RATIONAL, 1, rational(1), rational(1), rational(2)), x);
  }

  @Test
  public void testZeroPivot() {
    try {
      LUDecomposition.decompose(realMatrix(2, 0, 1, 1, 0));
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.NOT_REGULAR, me.getError());
    }
  }

  @Test
  public void testLaterZeroPivot() {
    // Singular, so the second pivot is exactly zero
    try {
      LUDecomposition.decompose(realMatrix(2, 1, 2, 2, 4));
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.NOT_REGULAR, me.getError());
    }
  }

  @Test
  public void testNotSquare() {
    try {
      LUDecomposition.decompose(realMatrix(3, 1, 2, 3, 4, 5, 6));
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.NOT_SQUARE, me.getError());
    }
  }

  @Test
  public void testSolveSizeMismatch() {
    LUResult<Real> lu = LUDecomposition.decompose(realMatrix(2, 4, 3, 6, 3));
    try {
      lu.solve(realMatrix(1, 1, 2, 3));
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.SIZE_MISMATCH, me.getError());
    }
    try {
      lu.solve(realMatrix(2, 1, 2));
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.SIZE_MISMATCH, me.getError());
    }
  }

  @Test
  public void testEmpty() {
    LUResult<Real> lu = LUDecomposition.decompose(Matrix.zero(Real.FIELD, 0, 0));
    assertEquals(0, lu.getL().getWidth());
    assertEquals(0, lu.getU().getHeight());
  }

  private static Fraction<LongInt> rational(long value) {
    return RATIONAL.fromReal(value);
  }

  private static <T extends Numeric<T>> Matrix<T> diagonallyDominant(Matrix<T> m) {
    int n = m.getWidth();
    return m.add(Matrix.identity(m.getField(), n).multiply(m.getField().fromReal(n)));
  }

  private static <T extends Numeric<T>> void assertTriangular(Matrix<T> m, boolean lower) {
    for (int i = 0; i < m.getHeight(); i++) {
      for (int j = 0; j < m.getWidth(); j++) {
        if (lower ? j > i : j < i) {
          assertTrue(m.get(i, j).isZero());
        }
      }
    }
  }

}
