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

package net.factorix.common.math;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>A dense matrix of {@link Numeric} values, stored row-major in one flat array of
 * {@code width * height} elements.</p>
 *
 * <p>Instances are immutable. Every operation, including {@link #with(int, int, Numeric)}, returns a
 * new matrix. Shape-sensitive operations throw {@link MatrixException} with
 * {@link MatrixError#SIZE_MISMATCH} when dimensions disagree.</p>
 *
 * @param <T> element type
 * @author Sean Owen
 */
public final class Matrix<T extends Numeric<T>> {

  private final NumericField<T> field;
  private final int width;
  private final int height;
  private final Object[] elements;

  private Matrix(NumericField<T> field, int width, int height, Object[] elements) {
    this.field = field;
    this.width = width;
    this.height = height;
    this.elements = elements;
  }

  /**
   * @return {@code height} x {@code width} matrix of zeros
   */
  public static <T extends Numeric<T>> Matrix<T> zero(NumericField<T> field, int width, int height) {
    Preconditions.checkNotNull(field);
    Preconditions.checkArgument(width >= 0 && height >= 0, "Bad dimensions: %s x %s", height, width);
    Object[] elements = new Object[width * height];
    Arrays.fill(elements, field.zero());
    return new Matrix<T>(field, width, height, elements);
  }

  public static <T extends Numeric<T>> Matrix<T> identity(NumericField<T> field, int n) {
    Matrix<T> result = zero(field, n, n);
    T one = field.one();
    for (int i = 0; i < n; i++) {
      result.elements[i * n + i] = one;
    }
    return result;
  }

  /**
   * @return {@code n} x {@code n} matrix with <em>every</em> element set to {@code x}, not only
   *  the diagonal
   */
  public static <T extends Numeric<T>> Matrix<T> scalar(NumericField<T> field, T x, int n) {
    Preconditions.checkNotNull(x);
    Matrix<T> result = zero(field, n, n);
    Arrays.fill(result.elements, x);
    return result;
  }

  /**
   * @param values elements in row-major order; their count must be a multiple of {@code width}
   */
  @SafeVarargs
  public static <T extends Numeric<T>> Matrix<T> of(NumericField<T> field, int width, T... values) {
    return of(field, width, Arrays.asList(values));
  }

  /**
   * @param values elements in row-major order; their count must be a multiple of {@code width}
   */
  public static <T extends Numeric<T>> Matrix<T> of(NumericField<T> field, int width, List<T> values) {
    Preconditions.checkArgument(width > 0 || values.isEmpty(), "Bad width: %s", width);
    int height = values.isEmpty() ? 0 : values.size() / width;
    return of(field, width, height, values);
  }

  /**
   * @param values exactly {@code width * height} elements in row-major order
   */
  public static <T extends Numeric<T>> Matrix<T> of(NumericField<T> field, int width, int height, List<T> values) {
    Preconditions.checkNotNull(field);
    Preconditions.checkArgument(width >= 0 && height >= 0, "Bad dimensions: %s x %s", height, width);
    if (values.size() != width * height) {
      throw new MatrixException(MatrixError.SIZE_MISMATCH,
                                values.size() + " values don't fill " + height + " x " + width);
    }
    Object[] elements = values.toArray();
    for (Object element : elements) {
      Preconditions.checkNotNull(element);
    }
    return new Matrix<T>(field, width, height, elements);
  }

  /**
   * @param rows rows of the matrix, which must all have the same length
   */
  public static <T extends Numeric<T>> Matrix<T> fromRows(NumericField<T> field, List<? extends List<T>> rows) {
    int width = rows.isEmpty() ? 0 : rows.get(0).size();
    List<T> values = Lists.newArrayListWithCapacity(width * rows.size());
    for (List<T> row : rows) {
      if (row.size() != width) {
        throw new MatrixException(MatrixError.SIZE_MISMATCH, "Ragged rows: " + row.size() + " vs " + width);
      }
      values.addAll(row);
    }
    return of(field, width, rows.size(), values);
  }

  public NumericField<T> getField() {
    return field;
  }

  /**
   * @return number of columns
   */
  public int getWidth() {
    return width;
  }

  /**
   * @return number of rows
   */
  public int getHeight() {
    return height;
  }

  public boolean isSquare() {
    return width == height;
  }

  @SuppressWarnings("unchecked")
  public T get(int row, int column) {
    Preconditions.checkElementIndex(row, height);
    Preconditions.checkElementIndex(column, width);
    return (T) elements[row * width + column];
  }

  /**
   * @return copy of this matrix with one element replaced
   */
  public Matrix<T> with(int row, int column, T value) {
    Preconditions.checkElementIndex(row, height);
    Preconditions.checkElementIndex(column, width);
    Preconditions.checkNotNull(value);
    Object[] copy = elements.clone();
    copy[row * width + column] = value;
    return new Matrix<T>(field, width, height, copy);
  }

  /**
   * @return new, mutable list of the elements in row-major order
   */
  @SuppressWarnings("unchecked")
  public List<T> toList() {
    List<T> result = Lists.newArrayListWithCapacity(elements.length);
    for (Object element : elements) {
      result.add((T) element);
    }
    return result;
  }

  public Matrix<T> transpose() {
    Object[] transposed = new Object[elements.length];
    for (int row = 0; row < height; row++) {
      for (int column = 0; column < width; column++) {
        transposed[column * height + row] = elements[row * width + column];
      }
    }
    return new Matrix<T>(field, height, width, transposed);
  }

  /**
   * @return transpose with every element conjugated; the same as {@link #transpose()} for real types
   */
  public Matrix<T> conjugateTranspose() {
    Object[] transposed = new Object[elements.length];
    for (int row = 0; row < height; row++) {
      for (int column = 0; column < width; column++) {
        transposed[column * height + row] = get(row, column).conjugate();
      }
    }
    return new Matrix<T>(field, height, width, transposed);
  }

  /**
   * @return row {@code row} as a 1 x width matrix
   */
  public Matrix<T> row(int row) {
    Preconditions.checkElementIndex(row, height);
    return new Matrix<T>(field, width, 1, Arrays.copyOfRange(elements, row * width, (row + 1) * width));
  }

  /**
   * @return column {@code column} as a height x 1 matrix
   */
  public Matrix<T> column(int column) {
    Preconditions.checkElementIndex(column, width);
    Object[] values = new Object[height];
    for (int row = 0; row < height; row++) {
      values[row] = elements[row * width + column];
    }
    return new Matrix<T>(field, 1, height, values);
  }

  public Matrix<T> add(Matrix<T> other) {
    checkSameShape(other);
    Object[] sum = new Object[elements.length];
    for (int i = 0; i < sum.length; i++) {
      sum[i] = element(i).add(other.element(i));
    }
    return new Matrix<T>(field, width, height, sum);
  }

  public Matrix<T> subtract(Matrix<T> other) {
    checkSameShape(other);
    Object[] difference = new Object[elements.length];
    for (int i = 0; i < difference.length; i++) {
      difference[i] = element(i).subtract(other.element(i));
    }
    return new Matrix<T>(field, width, height, difference);
  }

  /**
   * @return this * other; this matrix's width must equal {@code other}'s height
   */
  public Matrix<T> multiply(Matrix<T> other) {
    if (width != other.height) {
      throw new MatrixException(MatrixError.SIZE_MISMATCH,
                                "Can't multiply " + describeShape() + " by " + other.describeShape());
    }
    Object[] product = new Object[height * other.width];
    for (int row = 0; row < height; row++) {
      for (int column = 0; column < other.width; column++) {
        T sum = field.zero();
        for (int k = 0; k < width; k++) {
          sum = sum.add(get(row, k).multiply(other.get(k, column)));
        }
        product[row * other.width + column] = sum;
      }
    }
    return new Matrix<T>(field, other.width, height, product);
  }

  public Matrix<T> multiply(T factor) {
    Object[] scaled = new Object[elements.length];
    for (int i = 0; i < scaled.length; i++) {
      scaled[i] = element(i).multiply(factor);
    }
    return new Matrix<T>(field, width, height, scaled);
  }

  public Matrix<T> divide(T divisor) {
    Object[] scaled = new Object[elements.length];
    for (int i = 0; i < scaled.length; i++) {
      scaled[i] = element(i).divide(divisor);
    }
    return new Matrix<T>(field, width, height, scaled);
  }

  /**
   * @return squared Frobenius norm: sum of {@link Numeric#normSquared()} over all elements
   */
  public double normSquared() {
    double total = 0.0;
    for (int i = 0; i < elements.length; i++) {
      total += element(i).normSquared();
    }
    return total;
  }

  public double norm() {
    return FastMath.sqrt(normSquared());
  }

  /**
   * @param targetField creates values of the target type
   * @param function converts one element
   * @return matrix of the same shape with every element converted
   */
  public <U extends Numeric<U>> Matrix<U> map(NumericField<U> targetField, Function<? super T, ? extends U> function) {
    Object[] mapped = new Object[elements.length];
    for (int i = 0; i < mapped.length; i++) {
      mapped[i] = Preconditions.checkNotNull(function.apply(element(i)));
    }
    return new Matrix<U>(targetField, width, height, mapped);
  }

  @SuppressWarnings("unchecked")
  private T element(int index) {
    return (T) elements[index];
  }

  private void checkSameShape(Matrix<T> other) {
    if (width != other.width || height != other.height) {
      throw new MatrixException(MatrixError.SIZE_MISMATCH, describeShape() + " vs " + other.describeShape());
    }
  }

  private String describeShape() {
    return height + " x " + width;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Matrix<?>)) {
      return false;
    }
    Matrix<?> other = (Matrix<?>) o;
    return width == other.width && height == other.height && Arrays.equals(elements, other.elements);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(elements);
  }

  /**
   * @return one line per row like {@code | 1 2 3 |}, or {@code [ ]} if the matrix is empty
   */
  @Override
  public String toString() {
    if (elements.length == 0) {
      return "[ ]";
    }
    StringBuilder result = new StringBuilder();
    for (int row = 0; row < height; row++) {
      result.append("| ");
      for (int column = 0; column < width; column++) {
        result.append(get(row, column)).append(' ');
      }
      result.append("|\n");
    }
    return result.toString();
  }

}
