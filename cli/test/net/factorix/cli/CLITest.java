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
import java.io.IOException;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.junit.Test;

import net.factorix.common.FactorixTest;
import net.factorix.common.math.Complex;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.Real;

/**
 * Runs {@link CLI} end to end against problem files in a temporary directory.
 *
 * @author Sean Owen
 */
public final class CLITest extends FactorixTest {

  @Test
  public void testMakeLU() throws Exception {
    ProblemFiles files = problem(1, "A = ...\n[4 3;\n6 3];");
    assertEquals(0, run("make_lu", 1));
    assertEquals("A = ...\n[1 0;\n1.5 1];", read(files.getL()));
    assertEquals("A = ...\n[4 3;\n0 -1.5];", read(files.getU()));
  }

  @Test
  public void testLUGauss() throws Exception {
    ProblemFiles files = problem(2, "A = ...\n[4 3;\n6 3];");
    write(files.getB(), "b = ...\n[10;\n12];");
    // No L and U yet, so A is factored first
    assertEquals(0, run("lu_gauss", 2));
    assertEquals(realMatrix(1, 1, 2), MatrixFormat.read(files.getX()).getReal());

    assertEquals(0, run("make_lu", 2));
    assertTrue(files.getX().delete());
    assertEquals(0, run("lu_gauss", 2));
    assertEquals(realMatrix(1, 1, 2), MatrixFormat.read(files.getX()).getReal());
  }

  @Test
  public void testComplexLU() throws Exception {
    ProblemFiles files = problem(3, "A = complex([2 1;\n1 3],[1 0;\n0 -1]);");
    write(files.getB(), "b = [1;\n2];");
    assertEquals(0, run("make_lu", 3));
    assertTrue(MatrixFormat.read(files.getL()).isComplex());
    assertEquals(0, run("lu_gauss", 3));
    Matrix<Complex> a = MatrixFormat.read(files.getA()).getComplex();
    Matrix<Complex> x = MatrixFormat.read(files.getX()).getComplex();
    assertMatrixEquals(MatrixFormat.read(files.getB()).getComplex(), a.multiply(x));
  }

  @Test
  public void testNotRegular() throws Exception {
    ProblemFiles files = problem(4, "A = [0 1;\n1 0];");
    assertEquals(1, run("make_lu", 4));
    assertFalse(files.getL().exists());
  }

  @Test
  public void testMakeQRWithMethod() throws Exception {
    ProblemFiles files = problem(5, "Method=1\nA = ...\n[1 0;\n0 1];");
    assertEquals(0, run("make_qr", 5));
    Matrix<Real> identity = Matrix.identity(Real.FIELD, 2);
    assertEquals(identity, MatrixFormat.read(files.getQ()).getReal());
    assertEquals(identity, MatrixFormat.read(files.getR()).getReal());
  }

  @Test
  public void testQRDefaultMethods() throws Exception {
    ProblemFiles files = problem(6, "A = [3 1 0;\n1 4 2;\n0 2 5];");
    write(files.getB(), "b = [1;\n2;\n3];");
    Matrix<Real> a = MatrixFormat.read(files.getA()).getReal();
    Matrix<Real> b = MatrixFormat.read(files.getB()).getReal();

    // Householder, with no Q and R on disk
    assertEquals(0, run("qr_gauss", 6));
    assertMatrixEquals(b, a.multiply(MatrixFormat.read(files.getX()).getReal()));

    // Gram-Schmidt, then solving from the written factors
    assertEquals(0, run("make_qr", 6));
    Matrix<Real> q = MatrixFormat.read(files.getQ()).getReal();
    Matrix<Real> r = MatrixFormat.read(files.getR()).getReal();
    assertMatrixEquals(a, q.multiply(r));
    assertEquals(0, run("qr_gauss", 6));
    assertMatrixEquals(b, a.multiply(MatrixFormat.read(files.getX()).getReal()));
  }

  @Test
  public void testGivensOnComplex() throws Exception {
    ProblemFiles files = problem(7, "Method=2\nA = complex([1 0;\n0 1],[0 1;\n1 0]);");
    assertEquals(1, run("make_qr", 7));
    assertFalse(files.getQ().exists());
  }

  @Test
  public void testEpsilon() throws Exception {
    ProblemFiles files = problem(8, "A = [2 1;\n1 2];");
    assertEquals(0, CLI.run("--epsilon", "0.001", "make_qr", getTestTempDir().getPath(), "8"));
    assertTrue(files.getQ().isFile());
    assertEquals(1, CLI.run("--epsilon", "0", "make_qr", getTestTempDir().getPath(), "8"));
  }

  @Test
  public void testFindPoly() throws Exception {
    ProblemFiles files = problem(9, "A = ...\n[2 1 0;\n1 2 1;\n0 1 2];");
    assertEquals(0, run("find_poly", 9));
    assertEquals("cvec = ...\n[-1; 6; -10; 4];", read(files.getC()));
  }

  @Test
  public void testFindPolyFailures() throws Exception {
    problem(10, "A = [1 2 3;\n4 5 6;\n7 8 9];");
    assertEquals(1, run("find_poly", 10));
    problem(11, "A = complex([1],[1]);");
    assertEquals(1, run("find_poly", 11));
  }

  @Test
  public void testMissingFile() {
    assertEquals(1, run("make_lu", 12));
  }

  @Test
  public void testBadArguments() {
    String dir = getTestTempDir().getPath();
    assertEquals(1, CLI.run());
    assertEquals(1, CLI.run("make_lu", dir));
    assertEquals(1, CLI.run("invert", dir, "1"));
    assertEquals(1, CLI.run("make_lu", new File(dir, "missing").getPath(), "1"));
    assertEquals(1, CLI.run("make_lu", dir, "one"));
  }

  private int run(String operation, int problem) {
    return CLI.run(operation, getTestTempDir().getPath(), Integer.toString(problem));
  }

  private ProblemFiles problem(int problem, String a) throws IOException {
    ProblemFiles files = new ProblemFiles(getTestTempDir(), problem);
    write(files.getA(), a);
    return files;
  }

  private static void write(File file, String content) throws IOException {
    Files.asCharSink(file, Charsets.UTF_8).write(content);
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, Charsets.UTF_8).read();
  }

}
