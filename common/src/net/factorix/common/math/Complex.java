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

import org.apache.commons.math3.util.FastMath;

/**
 * A complex number {@code re + im*i} over {@code double} components.
 *
 * @author Sean Owen
 */
public final class Complex implements Numeric<Complex> {

  public static final NumericField<Complex> FIELD = new NumericField<Complex>() {
    @Override
    public Complex zero() {
      return ZERO;
    }
    @Override
    public Complex one() {
      return ONE;
    }
    @Override
    public Complex fromReal(double value) {
      return new Complex(value, 0.0);
    }
  };

  public static final Complex ZERO = new Complex(0.0, 0.0);
  public static final Complex ONE = new Complex(1.0, 0.0);
  public static final Complex I = new Complex(0.0, 1.0);

  private final double re;
  private final double im;

  public Complex(double re, double im) {
    this.re = re;
    this.im = im;
  }

  public double getReal() {
    return re;
  }

  public double getImaginary() {
    return im;
  }

  @Override
  public Complex add(Complex other) {
    return new Complex(re + other.re, im + other.im);
  }

  @Override
  public Complex subtract(Complex other) {
    return new Complex(re - other.re, im - other.im);
  }

  @Override
  public Complex multiply(Complex other) {
    return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
  }

  /**
   * Multiplies by the conjugate of {@code other} and divides by its squared magnitude.
   */
  @Override
  public Complex divide(Complex other) {
    Complex product = multiply(other.conjugate());
    double denominator = other.normSquared();
    return new Complex(product.re / denominator, product.im / denominator);
  }

  public Complex multiply(double factor) {
    return new Complex(re * factor, im * factor);
  }

  public Complex divide(double divisor) {
    return new Complex(re / divisor, im / divisor);
  }

  @Override
  public Complex negate() {
    return new Complex(-re, -im);
  }

  @Override
  public double normSquared() {
    return re * re + im * im;
  }

  @Override
  public double norm() {
    return FastMath.sqrt(normSquared());
  }

  @Override
  public Complex conjugate() {
    return new Complex(re, -im);
  }

  /**
   * @return magnitude of this number, as a complex number with zero imaginary part
   */
  @Override
  public Complex absolute() {
    return new Complex(norm(), 0.0);
  }

  @Override
  public boolean isZero() {
    return re == 0.0 && im == 0.0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Complex)) {
      return false;
    }
    Complex other = (Complex) o;
    return re == other.re && im == other.im;
  }

  @Override
  public int hashCode() {
    return 31 * (re == 0.0 ? 0 : Double.valueOf(re).hashCode()) + (im == 0.0 ? 0 : Double.valueOf(im).hashCode());
  }

  /**
   * @return "2+3i", "2-3i", "3i", "2" or "0"
   */
  @Override
  public String toString() {
    if (re == 0.0) {
      return im == 0.0 ? "0" : Real.formatDouble(im) + 'i';
    }
    if (im == 0.0) {
      return Real.formatDouble(re);
    }
    if (im > 0.0) {
      return Real.formatDouble(re) + '+' + Real.formatDouble(im) + 'i';
    }
    return Real.formatDouble(re) + Real.formatDouble(im) + 'i';
  }

}
