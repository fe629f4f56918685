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

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

import net.factorix.common.math.Complex;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.Real;
import net.factorix.engine.QRMethod;

/**
 * A matrix read by {@link MatrixFormat}: either real or complex, plus the QR method named in
 * the file's header, if any.
 *
 * @author Sean Owen
 */
public final class ParsedMatrix {

  private static final Function<Real,Complex> TO_COMPLEX = new Function<Real,Complex>() {
    @Override
    public Complex apply(Real value) {
      return new Complex(value.doubleValue(), 0.0);
    }
  };

  private final Matrix<Real> real;
  private final Matrix<Complex> complex;
  private final QRMethod method;

  ParsedMatrix(Matrix<Real> real, Matrix<Complex> complex, QRMethod method) {
    Preconditions.checkArgument(real == null ^ complex == null);
    this.real = real;
    this.complex = complex;
    this.method = method;
  }

  public boolean isComplex() {
    return complex != null;
  }

  /**
   * @throws IllegalStateException if the matrix is complex
   */
  public Matrix<Real> getReal() {
    Preconditions.checkState(real != null, "Matrix is complex");
    return real;
  }

  /**
   * @return the matrix, converted to complex elements if it is real
   */
  public Matrix<Complex> getComplex() {
    return complex == null ? real.map(Complex.FIELD, TO_COMPLEX) : complex;
  }

  /**
   * @return QR method from the {@code Method=} header, or {@code null} if there was none
   */
  public QRMethod getMethod() {
    return method;
  }

}
