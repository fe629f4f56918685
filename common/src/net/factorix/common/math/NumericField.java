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
 * Creates values of a {@link Numeric} type. Generic algorithms hold one of these to obtain
 * constants like zero and one, since they can't be had from the type parameter itself.
 *
 * @param <T> type of value created
 * @author Sean Owen
 */
public interface NumericField<T extends Numeric<T>> {

  T zero();

  T one();

  /**
   * @param value real scalar literal
   * @return the closest representable value of this type; integer types truncate toward zero
   */
  T fromReal(double value);

}
