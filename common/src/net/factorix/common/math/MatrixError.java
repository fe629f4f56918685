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
 * Kinds of failure reported by {@link MatrixException}.
 *
 * @author Sean Owen
 */
public enum MatrixError {

  /** An operation that needs a square matrix got a rectangular one. */
  NOT_SQUARE,
  /** LU met a zero pivot. No row exchange is attempted. */
  NOT_REGULAR,
  /** An entry off the three central diagonals is not negligible. */
  NOT_TRIDIAGONAL,
  /** Operand dimensions disagree. */
  SIZE_MISMATCH,
  /** The algorithm is not defined for this element type, like Givens rotations on complex input. */
  UNSUPPORTED_OPERATION,
  /** Matrix text could not be parsed. */
  INVALID_FILE_FORMAT

}
