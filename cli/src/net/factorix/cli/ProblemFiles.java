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

import java.io.File;

import com.google.common.base.Preconditions;

/**
 * Names the files that belong to one numbered problem in a directory: the input {@code Amat3.m},
 * the factors {@code Lmat3.m} and {@code Umat3.m} or {@code Qmat3.m} and {@code Rmat3.m}, the
 * right-hand side {@code bvec3.m}, the solution {@code xvec3.m} and the characteristic
 * polynomial {@code cvec3.m}.
 *
 * @author Sean Owen
 */
public final class ProblemFiles {

  private final File directory;
  private final int problem;

  public ProblemFiles(File directory, int problem) {
    Preconditions.checkNotNull(directory);
    Preconditions.checkArgument(problem >= 0, "Bad problem number: %s", problem);
    this.directory = directory;
    this.problem = problem;
  }

  public int getProblem() {
    return problem;
  }

  public File getA() {
    return file("Amat");
  }

  public File getL() {
    return file("Lmat");
  }

  public File getU() {
    return file("Umat");
  }

  public File getQ() {
    return file("Qmat");
  }

  public File getR() {
    return file("Rmat");
  }

  public File getB() {
    return file("bvec");
  }

  public File getX() {
    return file("xvec");
  }

  public File getC() {
    return file("cvec");
  }

  private File file(String prefix) {
    return new File(directory, prefix + problem + ".m");
  }

  @Override
  public String toString() {
    return "Problem " + problem + " in " + directory;
  }

}
