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
 * A real scalar, backed by a {@code double}.
 *
 * @author Sean Owen
 */
public final class Real implements Numeric<Real>, Comparable<Real> {

  public static final NumericField<Real> FIELD = new NumericField<Real>() {
    @Override
    public Real zero() {
      return ZERO;
    }
    @Override
    public Real one() {
      return ONE;
    }
    @Override
    public Real fromReal(double value) {
      return Real.valueOf(value);
    }
  };

  public static final Real ZERO = new Real(0.0);
  public static final Real ONE = new Real(1.0);

  private final double value;

  private Real(double value) {
    this.value = value;
  }

  public static Real valueOf(double value) {
    return new Real(value);
  }

  public double doubleValue() {
    return value;
  }

  @Override
  public Real add(Real other) {
    return new Real(value + other.value);
  }

  @Override
  public Real subtract(Real other) {
    return new Real(value - other.value);
  }

  @Override
  public Real multiply(Real other) {
    return new Real(value * other.value);
  }

  @Override
  public Real divide(Real other) {
    return new Real(value / other.value);
  }

  @Override
  public Real negate() {
    return new Real(-value);
  }

  @Override
  public double normSquared() {
    return value * value;
  }

  @Override
  public double norm() {
    return FastMath.abs(value);
  }

  @Override
  public Real conjugate() {
    return this;
  }

  @Override
  public Real absolute() {
    return value < 0.0 ? new Real(-value) : this;
  }

  @Override
  public boolean isZero() {
    return value == 0.0;
  }

  @Override
  public int compareTo(Real other) {
    return Double.compare(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Real)) {
      return false;
    }
    // == rather than Double.compare so that 0.0 equals -0.0, as the algorithms expect
    return value == ((Real) o).value;
  }

  @Override
  public int hashCode() {
    return value == 0.0 ? 0 : Double.valueOf(value).hashCode();
  }

  @Override
  public String toString() {
    return formatDouble(value);
  }

  /**
   * @return shortest rendering of {@code d}, without a trailing ".0" on integral values
   */
  static String formatDouble(double d) {
    if (d == FastMath.rint(d) && !Double.isInfinite(d) && FastMath.abs(d) < 1.0e15) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

}
