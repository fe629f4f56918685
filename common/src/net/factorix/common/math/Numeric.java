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

/**
 * <p>A scalar value that the matrix algorithms in this project are written against. Implementations
 * are immutable; every operation returns a new value and leaves both operands untouched, so
 * large values like {@link LongInt} can be passed around freely without copying.</p>
 *
 * <p>Values are created through a {@link NumericField}, which supplies zero, one and conversion
 * from a real literal for a given type.</p>
 *
 * @param <T> the implementing type itself
 * @author Sean Owen
 */
public interface Numeric<T extends Numeric<T>> {

  T add(T other);

  T subtract(T other);

  T multiply(T other);

  /**
   * @throws ArithmeticException if the implementation cannot divide by {@code other}, which
   *  is the case for exact types when {@code other} is zero
   */
  T divide(T other);

  T negate();

  /**
   * @return the squared magnitude of this value, as a floating-point approximation. This is only
   *  meant for stopping criteria and for reporting error norms, never for exact arithmetic.
   */
  double normSquared();

  /**
   * @return square root of {@link #normSquared()}
   */
  double norm();

  /**
   * @return complex conjugate of this value; the value itself for real-like types
   */
  T conjugate();

  /**
   * @return absolute value of this value, as the same type
   */
  T absolute();

  /**
   * @return true iff this value equals the additive identity of its type
   */
  boolean isZero();

}
