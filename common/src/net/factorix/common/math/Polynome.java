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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * <p>A dense polynomial in one variable, with coefficients stored in ascending order of power.</p>
 *
 * <p>The coefficient list grows only when a non-zero value is {@link #set(int, Numeric)} past its end,
 * and never shrinks when a leading coefficient cancels to zero. So {@link #degree()} is the length
 * of that list minus one, which can overstate the mathematical degree.</p>
 *
 * @param <T> coefficient type
 * @author Sean Owen
 */
public final class Polynome<T extends Numeric<T>> {

  private final NumericField<T> field;
  private final List<T> coefficients;

  public Polynome(NumericField<T> field) {
    Preconditions.checkNotNull(field);
    this.field = field;
    this.coefficients = Lists.newArrayList();
  }

  /**
   * @param field creates coefficient values
   * @param coefficients coefficients, constant term first; kept as given, including any zeros
   */
  public static <T extends Numeric<T>> Polynome<T> of(NumericField<T> field, List<T> coefficients) {
    Polynome<T> result = new Polynome<T>(field);
    result.coefficients.addAll(coefficients);
    return result;
  }

  /**
   * @return {@code -1} for the empty polynomial, otherwise the highest stored power
   */
  public int degree() {
    return coefficients.size() - 1;
  }

  /**
   * @return coefficient of {@code x^power}, or zero if no such coefficient is stored
   */
  public T get(int power) {
    return power >= 0 && power < coefficients.size() ? coefficients.get(power) : field.zero();
  }

  /**
   * Sets the coefficient of {@code x^power}. Assigning zero past the end is a no-op.
   */
  public void set(int power, T value) {
    Preconditions.checkArgument(power >= 0, "Negative power: %s", power);
    Preconditions.checkNotNull(value);
    if (power < coefficients.size()) {
      coefficients.set(power, value);
    } else if (!value.isZero()) {
      while (coefficients.size() < power) {
        coefficients.add(field.zero());
      }
      coefficients.add(value);
    }
  }

  /**
   * @return read-only view of the coefficients, constant term first
   */
  public List<T> getCoefficients() {
    return Collections.unmodifiableList(coefficients);
  }

  /**
   * @return coefficient of the highest stored power
   * @throws IllegalStateException if no coefficient is stored
   */
  public T leading() {
    Preconditions.checkState(!coefficients.isEmpty(), "Empty polynomial has no leading coefficient");
    return coefficients.get(coefficients.size() - 1);
  }

  public Polynome<T> add(Polynome<T> other) {
    int length = Math.max(coefficients.size(), other.coefficients.size());
    Polynome<T> result = new Polynome<T>(field);
    for (int i = 0; i < length; i++) {
      result.set(i, get(i).add(other.get(i)));
    }
    return result;
  }

  public Polynome<T> subtract(Polynome<T> other) {
    int length = Math.max(coefficients.size(), other.coefficients.size());
    Polynome<T> result = new Polynome<T>(field);
    for (int i = 0; i < length; i++) {
      result.set(i, get(i).subtract(other.get(i)));
    }
    return result;
  }

  public Polynome<T> multiply(Polynome<T> other) {
    Polynome<T> result = new Polynome<T>(field);
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      for (int j = other.coefficients.size() - 1; j >= 0; j--) {
        result.set(i + j, result.get(i + j).add(get(i).multiply(other.get(j))));
      }
    }
    return result;
  }

  public Polynome<T> multiply(T factor) {
    Polynome<T> result = new Polynome<T>(field);
    for (T coefficient : coefficients) {
      result.coefficients.add(coefficient.multiply(factor));
    }
    return result;
  }

  public Polynome<T> divide(T divisor) {
    Polynome<T> result = new Polynome<T>(field);
    for (T coefficient : coefficients) {
      result.coefficients.add(coefficient.divide(divisor));
    }
    return result;
  }

  /**
   * @return this polynomial divided by its {@link #leading()} coefficient
   * @throws IllegalStateException if no coefficient is stored
   */
  public Polynome<T> normalize() {
    return divide(leading());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Polynome<?>)) {
      return false;
    }
    return coefficients.equals(((Polynome<?>) o).coefficients);
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode();
  }

  /**
   * @return coefficients from highest power down, in the form {@code cvec = ...\n[1; -2; 3];},
   *  or an empty string when there are none
   */
  @Override
  public String toString() {
    if (coefficients.isEmpty()) {
      return "";
    }
    StringBuilder result = new StringBuilder("cvec = ...\n[");
    for (int i = coefficients.size() - 1; i > 0; i--) {
      result.append(coefficients.get(i)).append("; ");
    }
    result.append(coefficients.get(0)).append("];");
    return result.toString();
  }

}
