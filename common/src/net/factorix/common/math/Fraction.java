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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>An exact rational number over an {@link IntegerLike} type. Values are always kept in lowest
 * terms with a positive denominator, so the sign lives in the numerator and two equal fractions
 * have equal numerators and denominators.</p>
 *
 * <p>Note that {@link #of(NumericField, IntegerLike, IntegerLike)} takes the denominator first.</p>
 *
 * @param <T> type of numerator and denominator
 * @author Sean Owen
 */
public final class Fraction<T extends IntegerLike<T>> implements Numeric<Fraction<T>> {

  private final NumericField<T> field;
  private final T numerator;
  private final T denominator;

  private Fraction(NumericField<T> field, T numerator, T denominator) {
    this.field = field;
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /**
   * @param field creates values of the underlying integer type
   * @param denominator denominator, which may be negative
   * @param numerator numerator, which may be negative
   * @return {@code numerator / denominator} reduced to lowest terms
   * @throws ArithmeticException if {@code denominator} is zero
   */
  public static <T extends IntegerLike<T>> Fraction<T> of(NumericField<T> field, T denominator, T numerator) {
    Preconditions.checkNotNull(field);
    Preconditions.checkNotNull(denominator);
    Preconditions.checkNotNull(numerator);
    if (denominator.isZero()) {
      throw new ArithmeticException("Zero denominator");
    }
    boolean negative = numerator.signum() < 0 != denominator.signum() < 0;
    T num = numerator.absolute();
    T den = denominator.absolute();
    T divisor = gcd(num, den);
    num = num.divide(divisor);
    den = den.divide(divisor);
    return new Fraction<T>(field, negative ? num.negate() : num, den);
  }

  /**
   * @return a {@link NumericField} producing fractions over {@code base}. Its
   *  {@code fromReal} is exact: a double is a dyadic rational, and is converted as one.
   */
  public static <T extends IntegerLike<T>> NumericField<Fraction<T>> field(final NumericField<T> base) {
    Preconditions.checkNotNull(base);
    return new NumericField<Fraction<T>>() {
      @Override
      public Fraction<T> zero() {
        return new Fraction<T>(base, base.zero(), base.one());
      }
      @Override
      public Fraction<T> one() {
        return new Fraction<T>(base, base.one(), base.one());
      }
      @Override
      public Fraction<T> fromReal(double value) {
        return fromDyadic(base, value);
      }
    };
  }

  private static <T extends IntegerLike<T>> Fraction<T> fromDyadic(NumericField<T> base, double value) {
    Preconditions.checkArgument(!Double.isNaN(value) && !Double.isInfinite(value), "Bad value: %s", value);
    if (value == FastMath.rint(value)) {
      return new Fraction<T>(base, base.fromReal(value), base.one());
    }
    long bits = Double.doubleToLongBits(value);
    int rawExponent = (int) ((bits >>> 52) & 0x7FFL);
    long mantissa = bits & 0xFFFFFFFFFFFFFL;
    int exponent;
    if (rawExponent == 0) {
      exponent = -1074;
    } else {
      mantissa |= 1L << 52;
      exponent = rawExponent - 1075;
    }
    // Not integral, so the exponent stays negative here
    while ((mantissa & 1L) == 0L) {
      mantissa >>= 1;
      exponent++;
    }
    T two = base.fromReal(2.0);
    T denominator = base.one();
    for (int i = exponent; i < 0; i++) {
      denominator = denominator.multiply(two);
    }
    T numerator = base.fromReal(value < 0.0 ? -mantissa : mantissa);
    return new Fraction<T>(base, numerator, denominator);
  }

  private static <T extends IntegerLike<T>> T gcd(T a, T b) {
    while (!b.isZero()) {
      T next = a.remainder(b);
      a = b;
      b = next;
    }
    return a;
  }

  public T getNumerator() {
    return numerator;
  }

  public T getDenominator() {
    return denominator;
  }

  @Override
  public Fraction<T> add(Fraction<T> other) {
    return of(field,
              denominator.multiply(other.denominator),
              numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)));
  }

  @Override
  public Fraction<T> subtract(Fraction<T> other) {
    return of(field,
              denominator.multiply(other.denominator),
              numerator.multiply(other.denominator).subtract(other.numerator.multiply(denominator)));
  }

  @Override
  public Fraction<T> multiply(Fraction<T> other) {
    return of(field, denominator.multiply(other.denominator), numerator.multiply(other.numerator));
  }

  /**
   * @throws ArithmeticException if {@code other} is zero
   */
  @Override
  public Fraction<T> divide(Fraction<T> other) {
    return of(field, denominator.multiply(other.numerator), numerator.multiply(other.denominator));
  }

  @Override
  public Fraction<T> negate() {
    return new Fraction<T>(field, numerator.negate(), denominator);
  }

  public double doubleValue() {
    return numerator.doubleValue() / denominator.doubleValue();
  }

  @Override
  public double normSquared() {
    double d = doubleValue();
    return d * d;
  }

  @Override
  public double norm() {
    return FastMath.abs(doubleValue());
  }

  @Override
  public Fraction<T> conjugate() {
    return this;
  }

  @Override
  public Fraction<T> absolute() {
    return numerator.signum() < 0 ? negate() : this;
  }

  @Override
  public boolean isZero() {
    return numerator.isZero();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fraction<?>)) {
      return false;
    }
    Fraction<?> other = (Fraction<?>) o;
    return numerator.equals(other.numerator) && denominator.equals(other.denominator);
  }

  @Override
  public int hashCode() {
    return 31 * numerator.hashCode() + denominator.hashCode();
  }

  @Override
  public String toString() {
    if (denominator.equals(field.one())) {
      return numerator.toString();
    }
    return numerator + "/" + denominator;
  }

}
