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
import java.util.List;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import net.factorix.common.LangUtils;
import net.factorix.common.math.Complex;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.Polynome;
import net.factorix.common.math.Real;
import net.factorix.engine.QRMethod;

/**
 * <p>Reads and writes matrices in a small subset of Matlab syntax, like:</p>
 *
 * <p><pre>
 * Method=2
 * A = ...
 * [4 3;
 * 6 3];
 * </pre></p>
 *
 * <p>The optional first line selects a {@link QRMethod} by code. Everything up to the first
 * {@code [} is ignored. Rows end with {@code ;} and values are separated by whitespace; stray
 * {@code .} characters between values, as in Matlab's {@code ...} line continuation, are skipped.
 * Short rows are padded with zeros. {@code NaN}, {@code Inf} and {@code -Inf} are read, and so
 * is the {@code Infinity} spelling that non-finite values are written with. A complex matrix is
 * written as {@code A = complex([re],[im]);}, that is, two matrices of the same shape separated by
 * a comma.</p>
 *
 * @author Sean Owen
 */
public final class MatrixFormat {

  private static final String METHOD_PREFIX = "Method=";

  /** Matlab spellings, and the ones {@link Double#toString(double)} writes. */
  private static final Map<String,Double> NON_FINITE = ImmutableMap.<String,Double>builder()
      .put("NaN", Double.NaN)
      .put("Inf", Double.POSITIVE_INFINITY)
      .put("-Inf", Double.NEGATIVE_INFINITY)
      .put("Infinity", Double.POSITIVE_INFINITY)
      .put("-Infinity", Double.NEGATIVE_INFINITY)
      .build();

  private MatrixFormat() {
  }

  /**
   * @throws IOException if the file can't be read
   * @throws MatrixException with {@link MatrixError#INVALID_FILE_FORMAT} if it can't be parsed
   */
  public static ParsedMatrix read(File file) throws IOException {
    return parse(Files.asCharSource(file, Charsets.UTF_8).read());
  }

  /**
   * @throws MatrixException with {@link MatrixError#INVALID_FILE_FORMAT} if {@code text} can't be
   *  parsed, or {@link MatrixError#SIZE_MISMATCH} if real and imaginary parts differ in shape
   */
  public static ParsedMatrix parse(String text) {
    Preconditions.checkNotNull(text);
    Cursor cursor = new Cursor(text);
    QRMethod method = readMethod(cursor);
    int start = text.indexOf('[', cursor.position);
    if (start < 0) {
      throw new MatrixException(MatrixError.INVALID_FILE_FORMAT, "No matrix found");
    }
    cursor.position = start;
    Matrix<Real> first = readSimple(cursor);
    if (!cursor.startsWith(",")) {
      return new ParsedMatrix(first, null, method);
    }
    cursor.position++;
    cursor.skipWhitespace();
    Matrix<Real> second = readSimple(cursor);
    if (first.getWidth() != second.getWidth() || first.getHeight() != second.getHeight()) {
      throw new MatrixException(MatrixError.SIZE_MISMATCH, "Real and imaginary parts differ in shape");
    }
    List<Complex> values = Lists.newArrayListWithCapacity(first.getWidth() * first.getHeight());
    for (int row = 0; row < first.getHeight(); row++) {
      for (int column = 0; column < first.getWidth(); column++) {
        values.add(new Complex(first.get(row, column).doubleValue(), second.get(row, column).doubleValue()));
      }
    }
    Matrix<Complex> complex = Matrix.of(Complex.FIELD, first.getWidth(), first.getHeight(), values);
    return new ParsedMatrix(null, complex, method);
  }

  private static QRMethod readMethod(Cursor cursor) {
    cursor.skipWhitespace();
    if (cursor.startsWith(METHOD_PREFIX)) {
      int codePosition = cursor.position + METHOD_PREFIX.length();
      if (codePosition < cursor.text.length()) {
        char code = cursor.text.charAt(codePosition);
        QRMethod method = code >= '0' && code <= '9' ? QRMethod.forCode(code - '0') : null;
        if (method != null) {
          cursor.position = codePosition + 1;
          return method;
        }
      }
    }
    cursor.position = 0;
    return null;
  }

  private static Matrix<Real> readSimple(Cursor cursor) {
    if (!cursor.startsWith("[")) {
      throw new MatrixException(MatrixError.INVALID_FILE_FORMAT, "Expected [ at " + cursor.position);
    }
    cursor.position++;
    List<List<Real>> rows = Lists.newArrayList();
    int maxWidth = 0;
    boolean finished = false;
    while (!finished) {
      cursor.skipSeparators();
      if (cursor.startsWith("]")) {
        // Empty matrix, or a trailing ; before ]
        cursor.position++;
        break;
      }
      List<Real> row = Lists.newArrayList();
      while (true) {
        cursor.skipSeparators();
        row.add(Real.valueOf(readValue(cursor)));
        cursor.skipWhitespace();
        if (cursor.startsWith(";")) {
          cursor.position++;
          break;
        }
        if (cursor.startsWith("]")) {
          cursor.position++;
          finished = true;
          break;
        }
      }
      maxWidth = Math.max(maxWidth, row.size());
      rows.add(row);
    }

    for (List<Real> row : rows) {
      while (row.size() < maxWidth) {
        row.add(Real.ZERO);
      }
    }
    return Matrix.fromRows(Real.FIELD, rows);
  }

  private static double readValue(Cursor cursor) {
    String text = cursor.text;
    int start = cursor.position;
    if (start >= text.length() || !isValueStart(text.charAt(start))) {
      throw new MatrixException(MatrixError.INVALID_FILE_FORMAT, "Expected a number at " + start);
    }
    int end = start;
    while (end < text.length()) {
      char c = text.charAt(end);
      if (Character.isWhitespace(c) || c == ';' || c == ']') {
        break;
      }
      end++;
    }
    String token = text.substring(start, end);
    cursor.position = end;
    Double nonFinite = NON_FINITE.get(token);
    if (nonFinite != null) {
      return nonFinite;
    }
    try {
      return LangUtils.parseDouble(token);
    } catch (IllegalArgumentException iae) {
      throw new MatrixException(MatrixError.INVALID_FILE_FORMAT, "Bad number: " + token);
    }
  }

  private static boolean isValueStart(char c) {
    return Character.isDigit(c) || c == '-' || c == 'N' || c == 'I';
  }

  /**
   * @return {@code A = ...\n[a b;\nc d];} for a real matrix, or {@code A = complex([..],[..]);}
   *  for a complex one
   */
  @SuppressWarnings("unchecked")
  public static <T extends Numeric<T>> String format(Matrix<T> matrix) {
    if (Complex.FIELD.equals(matrix.getField())) {
      Matrix<Complex> complex = (Matrix<Complex>) (Matrix<?>) matrix;
      return "A = complex(" + formatParts(complex, true) + ',' + formatParts(complex, false) + ");";
    }
    List<String> values = Lists.newArrayListWithCapacity(matrix.getWidth() * matrix.getHeight());
    for (T value : matrix.toList()) {
      values.add(value.toString());
    }
    return "A = ...\n" + formatSimple(values, matrix.getWidth(), matrix.getHeight()) + ';';
  }

  private static String formatParts(Matrix<Complex> matrix, boolean realPart) {
    List<String> values = Lists.newArrayListWithCapacity(matrix.getWidth() * matrix.getHeight());
    for (Complex value : matrix.toList()) {
      values.add(Real.valueOf(realPart ? value.getReal() : value.getImaginary()).toString());
    }
    return formatSimple(values, matrix.getWidth(), matrix.getHeight());
  }

  private static String formatSimple(List<String> values, int width, int height) {
    StringBuilder result = new StringBuilder("[");
    for (int row = 0; row < height; row++) {
      if (row > 0) {
        result.append(";\n");
      }
      for (int column = 0; column < width; column++) {
        if (column > 0) {
          result.append(' ');
        }
        result.append(values.get(row * width + column));
      }
    }
    return result.append(']').toString();
  }

  public static <T extends Numeric<T>> void write(Matrix<T> matrix, File file) throws IOException {
    Files.asCharSink(file, Charsets.UTF_8).write(format(matrix));
  }

  /**
   * Writes {@code polynome} in the form {@code cvec = ...\n[c_n; ...; c_0];}.
   */
  public static void write(Polynome<?> polynome, File file) throws IOException {
    Files.asCharSink(file, Charsets.UTF_8).write(polynome.toString());
  }

  private static final class Cursor {

    private final String text;
    private int position;

    private Cursor(String text) {
      this.text = text;
    }

    boolean startsWith(String prefix) {
      return text.startsWith(prefix, position);
    }

    void skipWhitespace() {
      while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
        position++;
      }
    }

    /**
     * Skips whitespace and {@code .} characters.
     */
    void skipSeparators() {
      while (position < text.length() &&
             (Character.isWhitespace(text.charAt(position)) || text.charAt(position) == '.')) {
        position++;
      }
    }

  }

}
