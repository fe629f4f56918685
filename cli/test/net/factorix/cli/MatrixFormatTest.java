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

package net.factorix.cli;

import java.io.File;
import java.util.Arrays;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.Test;

import net.factorix.common.FactorixTest;
import net.factorix.common.math.Complex;
import net.factorix.common.math.LongInt;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Polynome;
import net.factorix.common.math.Real;
import net.factorix.engine.QRMethod;

/**
 * Tests {@link MatrixFormat}.
 *
 * @author Sean Owen
 */
public final class MatrixFormatTest extends FactorixTest {

  @Test
  public void testParseReal() {
    ParsedMatrix parsed = MatrixFormat.parse("A = ...\n[4 3;\n6 3];");
    assertFalse(parsed.isComplex());
    assertNull(parsed.getMethod());
    assertEquals(realMatrix(2, 4, 3, 6, 3), parsed.getReal());
  }

  @Test
  public void testParseMethod() {
    ParsedMatrix parsed = MatrixFormat.parse("Method=2\nA = ...\n[1 2;\n3 4];");
    assertSame(QRMethod.GIVENS, parsed.getMethod());
    assertEquals(realMatrix(2, 1, 2, 3, 4), parsed.getReal());
    assertNull(MatrixFormat.parse("Method=7\nA = [1];").getMethod());
  }

  @Test
  public void testParseDecimals() {
    ParsedMatrix parsed = MatrixFormat.parse("A = [-1.5 2e3;\n0.25 -0];");
    assertEquals(realMatrix(2, -1.5, 2000, 0.25, 0), parsed.getReal());
  }

  @Test
  public void testPadding() {
    ParsedMatrix parsed = MatrixFormat.parse("A = [1 2 3;\n4;\n5 6];");
    assertEquals(realMatrix(3, 1, 2, 3, 4, 0, 0, 5, 6, 0), parsed.getReal());
  }

  @Test
  public void testContinuation() {
    ParsedMatrix parsed = MatrixFormat.parse("A = [1 ... \n 2;\n3 ...\n4];");
    assertEquals(realMatrix(2, 1, 2, 3, 4), parsed.getReal());
  }

  @Test
  public void testLenientEnd() {
    assertEquals(realMatrix(2, 1, 2, 3, 4), MatrixFormat.parse("A = [1 2;\n3 4;\n];").getReal());
    assertEquals(realMatrix(1, 7), MatrixFormat.parse("[7 ]").getReal());
    Matrix<Real> empty = MatrixFormat.parse("A = [];").getReal();
    assertEquals(0, empty.getWidth());
    assertEquals(0, empty.getHeight());
  }

  @Test
  public void testParseComplex() {
    ParsedMatrix parsed = MatrixFormat.parse("A = complex([1 2;\n3 4],[0 1;\n-1 0]);");
    assertTrue(parsed.isComplex());
    Matrix<Complex> expected = Matrix.of(Complex.FIELD, 2,
        new Complex(1, 0), new Complex(2, 1),
        new Complex(3, -1), new Complex(4, 0));
    assertEquals(expected, parsed.getComplex());
  }

  @Test
  public void testRealAsComplex() {
    ParsedMatrix parsed = MatrixFormat.parse("A = [1 2];");
    assertEquals(Matrix.of(Complex.FIELD, 2, new Complex(1, 0), new Complex(2, 0)), parsed.getComplex());
  }

  @Test(expected = IllegalStateException.class)
  public void testComplexIsNotReal() {
    MatrixFormat.parse("A = complex([1],[2]);").getReal();
  }

  @Test
  public void testInvalid() {
    for (String text : Arrays.asList("", "A = 3;", "A = [1 x];", "A = [1 2", "A = [1e 2];", "A = [1 2 Infx];")) {
      try {
        MatrixFormat.parse(text);
        fail(text);
      } catch (MatrixException me) {
        assertEquals(text, MatrixError.INVALID_FILE_FORMAT, me.getError());
      }
    }
  }

  @Test
  public void testNonFinite() throws Exception {
    Matrix<Real> parsed = MatrixFormat.parse("A = [NaN Inf;\n-Inf -Infinity];").getReal();
    assertTrue(Double.isNaN(parsed.get(0, 0).doubleValue()));
    assertEquals(Double.POSITIVE_INFINITY, parsed.get(0, 1).doubleValue(), 0.0);
    assertEquals(Double.NEGATIVE_INFINITY, parsed.get(1, 0).doubleValue(), 0.0);
    assertEquals(Double.NEGATIVE_INFINITY, parsed.get(1, 1).doubleValue(), 0.0);

    // Written non-finite values read back
    File file = new File(getTestTempDir(), "Qmat1.m");
    MatrixFormat.write(realMatrix(3, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY), file);
    Matrix<Real> read = MatrixFormat.read(file).getReal();
    assertTrue(Double.isNaN(read.get(0, 0).doubleValue()));
    assertEquals(Double.POSITIVE_INFINITY, read.get(0, 1).doubleValue(), 0.0);
    assertEquals(Double.NEGATIVE_INFINITY, read.get(0, 2).doubleValue(), 0.0);

    Matrix<Complex> complex = Matrix.of(Complex.FIELD, 1, new Complex(Double.NaN, 1.0));
    MatrixFormat.write(complex, file);
    Matrix<Complex> readComplex = MatrixFormat.read(file).getComplex();
    assertTrue(Double.isNaN(readComplex.get(0, 0).getReal()));
    assertEquals(1.0, readComplex.get(0, 0).getImaginary(), 0.0);
  }

  @Test
  public void testComplexShapeMismatch() {
    try {
      MatrixFormat.parse("A = complex([1 2],[1 2;\n3 4]);");
      fail();
    } catch (MatrixException me) {
      assertEquals(MatrixError.SIZE_MISMATCH, me.getError());
    }
  }

  @Test
  public void testFormat() {
    assertEquals("A = ...\n[4 3;\n6 -1.5];", MatrixFormat.format(realMatrix(2, 4, 3, 6, -1.5)));
    Matrix<Complex> complex = Matrix.of(Complex.FIELD, 2, new Complex(1, 2), new Complex(3, 0));
    assertEquals("A = complex([1 3],[2 0]);", MatrixFormat.format(complex));
    Matrix<LongInt> integral = Matrix.of(LongInt.FIELD, 1, LongInt.valueOf(-12), LongInt.valueOf(5));
    assertEquals("A = ...\n[-12;\n5];", MatrixFormat.format(integral));
  }

  @Test
  public void testReadWrite() throws Exception {
    File file = new File(getTestTempDir(), "Amat1.m");
    Matrix<Real> matrix = realMatrix(3, 1, -2, 0.5, 4, 1e-3, 6);
    MatrixFormat.write(matrix, file);
    assertEquals(matrix, MatrixFormat.read(file).getReal());

    Matrix<Complex> complex = Matrix.of(Complex.FIELD, 1, new Complex(1.5, -2), new Complex(0, 3));
    MatrixFormat.write(complex, file);
    assertEquals(complex, MatrixFormat.read(file).getComplex());
  }

  @Test
  public void testWritePolynome() throws Exception {
    File file = new File(getTestTempDir(), "cvec1.m");
    Polynome<LongInt> poly = Polynome.of(LongInt.FIELD,
        Arrays.asList(LongInt.valueOf(4), LongInt.valueOf(-10), LongInt.valueOf(6), LongInt.valueOf(-1)));
    MatrixFormat.write(poly, file);
    assertEquals("cvec = ...\n[-1; 6; -10; 4];", Files.asCharSource(file, Charsets.UTF_8).read());
  }

}
