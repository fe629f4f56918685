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

/**
 * Thrown when a matrix operation can't proceed on its input. The {@link MatrixError} says why.
 *
 * @author Sean Owen
 */
public final class MatrixException extends RuntimeException {

  private final MatrixError error;

  public MatrixException(MatrixError error) {
    this(error, error.name());
  }

  public MatrixException(MatrixError error, String message) {
    super(message);
    Preconditions.checkNotNull(error);
    this.error = error;
  }

  public MatrixError getError() {
    return error;
  }

}
