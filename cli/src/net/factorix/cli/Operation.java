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

package net.factorix.cli;

import java.util.Locale;

/**
 * Operations that {@link CLI} can run on a problem.
 *
 * @author Sean Owen
 */
public enum Operation {

  /** Factor {@code Amat} into {@code Lmat} and {@code Umat}. */
  MAKE_LU,
  /** Solve against {@code bvec} from the LU factors, writing {@code xvec}. */
  LU_GAUSS,
  /** Factor {@code Amat} into {@code Qmat} and {@code Rmat}. */
  MAKE_QR,
  /** Solve against {@code bvec} from the QR factors, writing {@code xvec}. */
  QR_GAUSS,
  /** Write the characteristic polynomial of tridiagonal {@code Amat} to {@code cvec}. */
  FIND_POLY;

  /**
   * @return the name used on the command line, like {@code make_lu}
   */
  public String getCommandName() {
    return name().toLowerCase(Locale.ENGLISH);
  }

  /**
   * @return operation whose {@link #getCommandName()} is {@code name}, or {@code null} if there is none
   */
  public static Operation forCommandName(String name) {
    for (Operation operation : values()) {
      if (operation.getCommandName().equals(name)) {
        return operation;
      }
    }
    return null;
  }

}
