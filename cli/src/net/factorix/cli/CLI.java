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
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Function;
import com.google.common.base.Stopwatch;
import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.CliFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.factorix.common.LangUtils;
import net.factorix.common.log.LogUtils;
import net.factorix.common.math.Complex;
import net.factorix.common.math.LongInt;
import net.factorix.common.math.Matrix;
import net.factorix.common.math.MatrixError;
import net.factorix.common.math.MatrixException;
import net.factorix.common.math.Numeric;
import net.factorix.common.math.Polynome;
import net.factorix.common.math.Real;
import net.factorix.engine.CharacteristicPolynomial;
import net.factorix.engine.GivensQR;
import net.factorix.engine.GramSchmidtQR;
import net.factorix.engine.HouseholderQR;
import net.factorix.engine.LUDecomposition;
import net.factorix.engine.LUResult;
import net.factorix.engine.QRMethod;
import net.factorix.engine.QRResult;
import net.factorix.engine.QRSolver;

/**
 * <p>Command-line driver that runs one operation on one numbered problem. It is run like so:</p>
 *
 * <p>{@code java -jar factorix-cli-X.Y.jar [options] operation directory problem}</p>
 *
 * <p>"options" may be:</p>
 *
 * <ul>
 *   <li>{@code --verbose}: log debug messages from the decompositions</li>
 *   <li>{@code --epsilon}: re-orthogonalization threshold for Gram-Schmidt QR</li>
 * </ul>
 *
 * <p>"operation" is the lower-case name of an {@link Operation}, and reads and writes the files
 * that {@link ProblemFiles} names in "directory" for the given problem number:</p>
 *
 * <ul>
 *   <li>{@code make_lu}: factors {@code Amat} into {@code Lmat} and {@code Umat}</li>
 *   <li>{@code lu_gauss}: solves for {@code bvec} into {@code xvec}, using {@code Lmat} and
 *     {@code Umat} if both exist, or else factoring {@code Amat}</li>
 *   <li>{@code make_qr}: factors {@code Amat} into {@code Qmat} and {@code Rmat}, by the method in
 *     its {@code Method=} header or else by Gram-Schmidt</li>
 *   <li>{@code qr_gauss}: solves for {@code bvec} into {@code xvec}, using {@code Qmat} and
 *     {@code Rmat} if both exist, or else factoring {@code Amat}, by Householder reflections
 *     unless its header says otherwise</li>
 *   <li>{@code find_poly}: writes the characteristic polynomial of tridiagonal {@code Amat},
 *     computed exactly over integers, to {@code cvec}</li>
 * </ul>
 *
 * <p>For example, to factor {@code matrices/Amat3.m}:</p>
 *
 * <p>{@code java -jar factorix-cli-X.Y.jar make_lu matrices 3}</p>
 *
 * <p>The time taken and the residual norm, like {@code ‖LU - A‖}, are logged. The last line of
 * output is {@code Done!}, or {@code Error: } and the kind of failure.</p>
 *
 * @author Sean Owen
 */
public final class CLI {

  private static final Logger log = LoggerFactory.getLogger(CLI.class);

  private static final Function<Real,LongInt> TO_LONG_INT = new Function<Real,LongInt>() {
    @Override
    public LongInt apply(Real value) {
      return LongInt.fromReal(value.doubleValue());
    }
  };

  private CLI() {
  }

  public static void main(String[] args) {
    int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * @return process exit status: 0 on success, 1 on bad arguments or a failed operation
   */
  static int run(String... args) {

    LogUtils.setSensibleLogFormat();

    CLIArgs cliArgs;
    try {
      cliArgs = CliFactory.parseArguments(CLIArgs.class, args);
    } catch (ArgumentValidationException ave) {
      printHelp(ave.getMessage());
      return 1;
    }

    List<String> commands = cliArgs.getCommands();
    if (commands == null || commands.size() != 3) {
      printHelp("Expected: operation directory problem");
      return 1;
    }

    Operation operation = Operation.forCommandName(commands.get(0));
    if (operation == null) {
      printHelp(commands.get(0) + ": unknown operation");
      return 1;
    }
    File directory = new File(commands.get(1));
    if (!directory.isDirectory()) {
      printHelp(directory + ": not a directory");
      return 1;
    }
    int problem;
    try {
      problem = Integer.parseInt(commands.get(2));
    } catch (NumberFormatException nfe) {
      printHelp(commands.get(2) + ": not a problem number");
      return 1;
    }
    double epsilon = cliArgs.getEpsilon() == null ? GramSchmidtQR.DEFAULT_EPSILON : cliArgs.getEpsilon();
    if (!LangUtils.isFinite(epsilon) || epsilon <= 0.0) {
      printHelp(epsilon + ": epsilon must be positive");
      return 1;
    }

    if (cliArgs.isVerbose()) {
      LogUtils.enableDebugLoggingIn(CLI.class,
                                    LUDecomposition.class,
                                    HouseholderQR.class,
                                    GivensQR.class,
                                    GramSchmidtQR.class,
                                    CharacteristicPolynomial.class);
      log.debug("{}", cliArgs);
    }

    ProblemFiles files = new ProblemFiles(directory, problem);
    log.info("Problem {}", problem);
    try {
      switch (operation) {
        case MAKE_LU:
          doMakeLU(files);
          break;
        case LU_GAUSS:
          doLUGauss(files);
          break;
        case MAKE_QR:
          doMakeQR(files, epsilon);
          break;
        case QR_GAUSS:
          doQRGauss(files, epsilon);
          break;
        case FIND_POLY:
          doFindPoly(files);
          break;
      }
    } catch (MatrixException me) {
      log.debug("{} failed", operation, me);
      System.out.println("Error: " + me.getError());
      return 1;
    } catch (IOException ioe) {
      log.debug("{} failed", operation, ioe);
      System.out.println("Error: " + ioe);
      return 1;
    }
    System.out.println("Done!");
    return 0;
  }

  private static void doMakeLU(ProblemFiles files) throws IOException {
    ParsedMatrix a = MatrixFormat.read(files.getA());
    if (a.isComplex()) {
      makeLU(a.getComplex(), files);
    } else {
      makeLU(a.getReal(), files);
    }
  }

  private static <T extends Numeric<T>> void makeLU(Matrix<T> a, ProblemFiles files) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    LUResult<T> lu = LUDecomposition.decompose(a);
    stopwatch.stop();
    MatrixFormat.write(lu.getL(), files.getL());
    MatrixFormat.write(lu.getU(), files.getU());
    log.info("Took {}μs, ‖LU - A‖ = {}",
             stopwatch.elapsed(TimeUnit.MICROSECONDS),
             lu.getL().multiply(lu.getU()).subtract(a).norm());
  }

  private static void doLUGauss(ProblemFiles files) throws IOException {
    ParsedMatrix b = MatrixFormat.read(files.getB());
    if (files.getL().isFile() && files.getU().isFile()) {
      ParsedMatrix l = MatrixFormat.read(files.getL());
      ParsedMatrix u = MatrixFormat.read(files.getU());
      if (b.isComplex() || l.isComplex() || u.isComplex()) {
        luGauss(l.getComplex(), u.getComplex(), b.getComplex(), files);
      } else {
        luGauss(l.getReal(), u.getReal(), b.getReal(), files);
      }
    } else {
      log.info("No L and U for problem {}; factoring A", files.getProblem());
      ParsedMatrix a = MatrixFormat.read(files.getA());
      if (a.isComplex() || b.isComplex()) {
        luGauss(LUDecomposition.decompose(a.getComplex()), b.getComplex(), files);
      } else {
        luGauss(LUDecomposition.decompose(a.getReal()), b.getReal(), files);
      }
    }
  }

  private static <T extends Numeric<T>> void luGauss(LUResult<T> lu, Matrix<T> b, ProblemFiles files)
      throws IOException {
    luGauss(lu.getL(), lu.getU(), b, files);
  }

  private static <T extends Numeric<T>> void luGauss(Matrix<T> l, Matrix<T> u, Matrix<T> b, ProblemFiles files)
      throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Matrix<T> x = LUDecomposition.solve(l, u, b);
    stopwatch.stop();
    MatrixFormat.write(x, files.getX());
    log.info("Took {}μs, ‖LUx - b‖ = {}",
             stopwatch.elapsed(TimeUnit.MICROSECONDS),
             l.multiply(u.multiply(x)).subtract(b).norm());
  }

  private static void doMakeQR(ProblemFiles files, double epsilon) throws IOException {
    ParsedMatrix a = MatrixFormat.read(files.getA());
    QRMethod method = a.getMethod();
    if (method == null) {
      log.info("No method given! Assuming Gram-Schmidt");
      method = QRMethod.GRAM_SCHMIDT;
    }
    if (a.isComplex()) {
      makeQR(a.getComplex(), method, epsilon, files);
    } else {
      makeQR(a.getReal(), method, epsilon, files);
    }
  }

  private static <T extends Numeric<T>> void makeQR(Matrix<T> a,
                                                    QRMethod method,
                                                    double epsilon,
                                                    ProblemFiles files) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    QRResult<T> qr = method.decompose(a, epsilon);
    stopwatch.stop();
    MatrixFormat.write(qr.getQ(), files.getQ());
    MatrixFormat.write(qr.getR(), files.getR());
    log.info("{}: took {}μs, ‖QR - A‖ = {}",
             method,
             stopwatch.elapsed(TimeUnit.MICROSECONDS),
             qr.getQ().multiply(qr.getR()).subtract(a).norm());
  }

  private static void doQRGauss(ProblemFiles files, double epsilon) throws IOException {
    ParsedMatrix b = MatrixFormat.read(files.getB());
    if (files.getQ().isFile() && files.getR().isFile()) {
      ParsedMatrix q = MatrixFormat.read(files.getQ());
      ParsedMatrix r = MatrixFormat.read(files.getR());
      if (b.isComplex() || q.isComplex() || r.isComplex()) {
        qrGauss(q.getComplex(), r.getComplex(), b.getComplex(), files);
      } else {
        qrGauss(q.getReal(), r.getReal(), b.getReal(), files);
      }
    } else {
      ParsedMatrix a = MatrixFormat.read(files.getA());
      QRMethod method = a.getMethod() == null ? QRMethod.HOUSEHOLDER : a.getMethod();
      log.info("No Q and R for problem {}; factoring A by {}", files.getProblem(), method);
      if (a.isComplex() || b.isComplex()) {
        QRResult<Complex> qr = method.decompose(a.getComplex(), epsilon);
        qrGauss(qr.getQ(), qr.getR(), b.getComplex(), files);
      } else {
        QRResult<Real> qr = method.decompose(a.getReal(), epsilon);
        qrGauss(qr.getQ(), qr.getR(), b.getReal(), files);
      }
    }
  }

  private static <T extends Numeric<T>> void qrGauss(Matrix<T> q, Matrix<T> r, Matrix<T> b, ProblemFiles files)
      throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Matrix<T> x = QRSolver.solve(q, r, b);
    stopwatch.stop();
    MatrixFormat.write(x, files.getX());
    log.info("Took {}μs, ‖QRx - b‖ = {}",
             stopwatch.elapsed(TimeUnit.MICROSECONDS),
             q.multiply(r.multiply(x)).subtract(b).norm());
  }

  private static void doFindPoly(ProblemFiles files) throws IOException {
    ParsedMatrix a = MatrixFormat.read(files.getA());
    if (a.isComplex()) {
      throw new MatrixException(MatrixError.UNSUPPORTED_OPERATION, "Characteristic polynomial needs real input");
    }
    Matrix<LongInt> integral = a.getReal().map(LongInt.FIELD, TO_LONG_INT);
    Stopwatch stopwatch = Stopwatch.createStarted();
    Polynome<LongInt> polynome = CharacteristicPolynomial.compute(integral);
    stopwatch.stop();
    MatrixFormat.write(polynome, files.getC());
    log.info("Took {}μs", stopwatch.elapsed(TimeUnit.MICROSECONDS));
  }

  private static void printHelp(String message) {
    System.out.println();
    System.out.println("Factorix command line interface: LU and QR decomposition, linear solves, and characteristic");
    System.out.println("polynomials of tridiagonal matrices.");
    System.out.println();
    System.out.println("Usage: java -jar factorix-cli.jar [--verbose] [--epsilon e] operation directory problem");
    System.out.println("Operations: make_lu, lu_gauss, make_qr, qr_gauss, find_poly");
    System.out.println();
    if (message != null) {
      System.out.println(message);
      System.out.println();
    }
  }

}
