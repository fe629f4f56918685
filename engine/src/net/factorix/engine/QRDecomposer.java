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

package net.factorix.engine;

import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;

/**
 * Encapsulates a strategy for factoring a square matrix A into unitary Q and upper triangular R.
 * This allows for swapping in other strategies later.
 *
 * @param <T> element type
 * @author Sean Owen
 * @see QRMethod
 */
public interface QRDecomposer<T extends Numeric<T>> {

  /**
   * @param a square matrix to factor
   * @return Q and R such that {@code Q * R = A}
   * @throws MatrixException with {@link MatrixError#NOT_SQUARE} if {@code a} is not square
   */
  QRResult<T> decompose(Matrix<T> a);

}
