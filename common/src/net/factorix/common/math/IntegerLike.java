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
 * An ordered {@link Numeric} type with integer division, suitable as the numerator and
 * denominator type of a {@link Fraction}.
 *
 * @param <T> the implementing type itself
 * @author Sean Owen
 */
public interface IntegerLike<T extends IntegerLike<T>> extends Numeric<T>, Comparable<T> {

  /**
   * @return remainder of truncating division by {@code divisor}; carries the sign of this value
   * @throws ArithmeticException if {@code divisor} is zero
   */
  T remainder(T divisor);

  /**
   * @return -1, 0 or 1 as this value is negative, zero or positive
   */
  int signum();

  /**
   * @return closest {@code double} to this value
   */
  double doubleValue();

}
