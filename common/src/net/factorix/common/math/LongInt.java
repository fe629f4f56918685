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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>An arbitrary-precision signed integer. The magnitude is stored as base-256 digits, least
 * significant first, with no trailing zero digit. Zero has no digits and is always positive, so
 * there is no negative zero.</p>
 *
 * <p>This exists so that recurrences like the tridiagonal characteristic polynomial can be
 * evaluated exactly, where {@code double} arithmetic would lose everything to cancellation.</p>
 *
 * @author Sean Owen
 */
public final class LongInt implements IntegerLike<LongInt> {

  public static final NumericField<LongInt> FIELD = new NumericField<LongInt>() {
    @Override
    public LongInt zero() {
      return ZERO;
    }
    @Override
    public LongInt one() {
      return ONE;
    }
    @Override
    public LongInt fromReal(double value) {
      return LongInt.fromReal(value);
    }
  };

  private static final byte[] NO_DIGITS = new byte[0];
  private static final byte[] TEN_DIGITS = {10};
  private static final char[] HEX_CHARS = "0123456789ABCDEF".toCharArray();
  // Anything below this converts through long without loss
  private static final double LONG_SAFE_LIMIT = 9.0e18;

  public static final LongInt ZERO = new LongInt(NO_DIGITS, true);
  public static final LongInt ONE = valueOf(1L);

  private final byte[] digits;
  private final boolean positive;

  private LongInt(byte[] digits, boolean positive) {
    this.digits = digits;
    this.positive = positive || digits.length == 0;
  }

  private static LongInt of(byte[] magnitude, boolean positive) {
    return new LongInt(trim(magnitude), positive);
  }

  public static LongInt valueOf(long value) {
    boolean positive = value >= 0L;
    // For Long.MIN_VALUE this stays negative, but its bits read unsigned are still 2^63
    long magnitude = positive ? value : -value;
    byte[] digits = new byte[8];
    for (int i = 0; i < digits.length; i++) {
      digits[i] = (byte) magnitude;
      magnitude >>>= 8;
    }
    return of(digits, positive);
  }

  /**
   * @param value finite real value
   * @return {@code value} truncated toward zero
   */
  public static LongInt fromReal(double value) {
    Preconditions.checkArgument(!Double.isNaN(value) && !Double.isInfinite(value), "Bad value: %s", value);
    if (FastMath.abs(value) < LONG_SAFE_LIMIT) {
      return valueOf((long) value);
    }
    // Large doubles are integral already; expand mantissa * 2^exponent exactly
    long bits = Double.doubleToLongBits(FastMath.abs(value));
    int exponent = (int) ((bits >>> 52) & 0x7FFL) - 1075;
    long mantissa = (bits & 0xFFFFFFFFFFFFFL) | (1L << 52);
    byte[] magnitude = shiftLeftMagnitude(valueOf(mantissa).digits, exponent);
    return of(magnitude, value > 0.0);
  }

  /**
   * @param s decimal integer, optionally preceded by a sign
   * @return parsed value
   * @throws NumberFormatException if {@code s} is not a decimal integer
   */
  public static LongInt parse(String s) {
    Preconditions.checkNotNull(s);
    String trimmed = s.trim();
    int start = 0;
    boolean positive = true;
    if (trimmed.startsWith("-")) {
      positive = false;
      start = 1;
    } else if (trimmed.startsWith("+")) {
      start = 1;
    }
    if (start >= trimmed.length()) {
      throw new NumberFormatException("No digits: " + s);
    }
    byte[] magnitude = NO_DIGITS;
    for (int i = start; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < '0' || c > '9') {
        throw new NumberFormatException("Bad digit '" + c + "' in " + s);
      }
      magnitude = addMagnitude(multiplyMagnitude(magnitude, TEN_DIGITS), new byte[] {(byte) (c - '0')});
    }
    return of(magnitude, positive);
  }

  /**
   * @return number of base-256 digits in the magnitude; 0 for zero
   */
  public int digitLength() {
    return digits.length;
  }

  /**
   * @param index digit position, least significant first
   * @return unsigned base-256 digit at {@code index}, or 0 past the last digit
   */
  public int getDigit(int index) {
    return digit(digits, index);
  }

  // Signed operations dispatch on the two signs to the magnitude-only helpers below

  @Override
  public LongInt add(LongInt other) {
    if (positive && other.positive) {
      return of(addMagnitude(digits, other.digits), true);
    }
    if (positive) {
      return subtractMagnitudes(this, other);
    }
    if (other.positive) {
      return subtractMagnitudes(this, other).negate();
    }
    return of(addMagnitude(digits, other.digits), false);
  }

  @Override
  public LongInt subtract(LongInt other) {
    if (positive && other.positive) {
      return subtractMagnitudes(this, other);
    }
    if (positive) {
      return of(addMagnitude(digits, other.digits), true);
    }
    if (other.positive) {
      return of(addMagnitude(digits, other.digits), false);
    }
    return subtractMagnitudes(this, other).negate();
  }

  @Override
  public LongInt multiply(LongInt other) {
    return of(multiplyMagnitude(digits, other.digits), positive == other.positive);
  }

  /**
   * @return quotient, truncated toward zero
   * @throws ArithmeticException if {@code other} is zero
   */
  @Override
  public LongInt divide(LongInt other) {
    byte[][] quotientAndRemainder = divideMagnitude(digits, other.digits);
    return of(quotientAndRemainder[0], positive == other.positive);
  }

  @Override
  public LongInt remainder(LongInt divisor) {
    byte[][] quotientAndRemainder = divideMagnitude(digits, divisor.digits);
    return of(quotientAndRemainder[1], positive);
  }

  @Override
  public LongInt negate() {
    return digits.length == 0 ? this : new LongInt(digits, !positive);
  }

  @Override
  public double normSquared() {
    double d = doubleValue();
    return d * d;
  }

  @Override
  public double norm() {
    return FastMath.abs(doubleValue());
  }

  @Override
  public LongInt conjugate() {
    return this;
  }

  @Override
  public LongInt absolute() {
    return positive ? this : new LongInt(digits, true);
  }

  @Override
  public boolean isZero() {
    return digits.length == 0;
  }

  @Override
  public int signum() {
    if (digits.length == 0) {
      return 0;
    }
    return positive ? 1 : -1;
  }

  @Override
  public double doubleValue() {
    double result = 0.0;
    for (int i = digits.length - 1; i >= 0; i--) {
      result = result * 256.0 + (digits[i] & 0xFF);
    }
    return positive ? result : -result;
  }

  @Override
  public int compareTo(LongInt other) {
    if (positive != other.positive) {
      return positive ? 1 : -1;
    }
    int magnitudeOrder = compareMagnitude(digits, other.digits);
    return positive ? magnitudeOrder : -magnitudeOrder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LongInt)) {
      return false;
    }
    LongInt other = (LongInt) o;
    return positive == other.positive && Arrays.equals(digits, other.digits);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(digits) + (positive ? 1 : 0);
  }

  /**
   * @return decimal representation, computed by repeated division by ten
   */
  public String toDecimalString() {
    if (digits.length == 0) {
      return "0";
    }
    StringBuilder reversed = new StringBuilder();
    byte[] remaining = digits;
    while (remaining.length > 0) {
      byte[][] quotientAndRemainder = divideMagnitude(remaining, TEN_DIGITS);
      reversed.append((char) ('0' + digit(quotientAndRemainder[1], 0)));
      remaining = quotientAndRemainder[0];
    }
    if (!positive) {
      reversed.append('-');
    }
    return reversed.reverse().toString();
  }

  /**
   * @return digits as pipe-delimited hexadecimal pairs, least significant first,
   *  like {@code |2C|01|} for 300 or {@code -|05|} for -5
   */
  public String toHexString() {
    if (digits.length == 0) {
      return "|00|";
    }
    StringBuilder result = new StringBuilder(positive ? "|" : "-|");
    for (byte d : digits) {
      result.append(HEX_CHARS[(d >>> 4) & 0x0F]).append(HEX_CHARS[d & 0x0F]).append('|');
    }
    return result.toString();
  }

  @Override
  public String toString() {
    return toDecimalString();
  }

  /**
   * @return {@code |a| - |b|}, which may be negative
   */
  private static LongInt subtractMagnitudes(LongInt a, LongInt b) {
    int order = compareMagnitude(a.digits, b.digits);
    if (order == 0) {
      return ZERO;
    }
    if (order < 0) {
      return of(subtractMagnitude(b.digits, a.digits), false);
    }
    return of(subtractMagnitude(a.digits, b.digits), true);
  }

  private static int digit(byte[] magnitude, int index) {
    return index < magnitude.length ? magnitude[index] & 0xFF : 0;
  }

  private static byte[] trim(byte[] magnitude) {
    int length = magnitude.length;
    while (length > 0 && magnitude[length - 1] == 0) {
      length--;
    }
    if (length == 0) {
      return NO_DIGITS;
    }
    return length == magnitude.length ? magnitude : Arrays.copyOf(magnitude, length);
  }

  private static int compareMagnitude(byte[] a, byte[] b) {
    for (int i = FastMath.max(a.length, b.length) - 1; i >= 0; i--) {
      int da = digit(a, i);
      int db = digit(b, i);
      if (da != db) {
        return da < db ? -1 : 1;
      }
    }
    return 0;
  }

  private static byte[] addMagnitude(byte[] a, byte[] b) {
    int length = FastMath.max(a.length, b.length);
    byte[] sum = new byte[length + 1];
    int carry = 0;
    for (int i = 0; i < length; i++) {
      int digitSum = digit(a, i) + digit(b, i) + carry;
      sum[i] = (byte) digitSum;
      carry = digitSum >>> 8;
    }
    sum[length] = (byte) carry;
    return sum;
  }

  /**
   * Requires {@code |a| >= |b|}.
   */
  private static byte[] subtractMagnitude(byte[] a, byte[] b) {
    byte[] difference = new byte[a.length];
    int borrow = 0;
    for (int i = 0; i < a.length; i++) {
      int digitDifference = digit(a, i) - digit(b, i) - borrow;
      if (digitDifference < 0) {
        digitDifference += 256;
        borrow = 1;
      } else {
        borrow = 0;
      }
      difference[i] = (byte) digitDifference;
    }
    return difference;
  }

  private static byte[] multiplyMagnitude(byte[] a, byte[] b) {
    if (a.length == 0 || b.length == 0) {
      return NO_DIGITS;
    }
    byte[] product = new byte[a.length + b.length];
    for (int i = 0; i < b.length; i++) {
      int multiplier = b[i] & 0xFF;
      int carry = 0;
      for (int j = 0; j < a.length; j++) {
        // At most 255*255 + 255 + 255, which fits in 16 bits
        int accumulated = (a[j] & 0xFF) * multiplier + (product[i + j] & 0xFF) + carry;
        product[i + j] = (byte) accumulated;
        carry = accumulated >>> 8;
      }
      product[i + a.length] = (byte) carry;
    }
    return product;
  }

  /**
   * Binary long division of magnitudes: walks the dividend's bits from the most significant,
   * shifting each into a running remainder and subtracting the divisor whenever it fits.
   *
   * @return quotient and remainder magnitudes, untrimmed
   * @throws ArithmeticException if {@code divisor} is zero
   */
  private static byte[][] divideMagnitude(byte[] dividend, byte[] divisor) {
    if (divisor.length == 0) {
      throw new ArithmeticException("Division by zero");
    }
    if (compareMagnitude(dividend, divisor) < 0) {
      return new byte[][] {NO_DIGITS, dividend};
    }
    byte[] quotient = new byte[dividend.length];
    // The remainder is below twice the divisor before each subtraction, so one extra digit suffices
    byte[] remainder = new byte[divisor.length + 1];
    for (int bit = dividend.length * 8 - 1; bit >= 0; bit--) {
      shiftLeftOneInPlace(remainder);
      remainder[0] |= (dividend[bit >>> 3] >>> (bit & 7)) & 1;
      if (compareMagnitude(remainder, divisor) >= 0) {
        subtractInPlace(remainder, divisor);
        quotient[bit >>> 3] |= (byte) (1 << (bit & 7));
      }
    }
    return new byte[][] {quotient, remainder};
  }

  private static void shiftLeftOneInPlace(byte[] magnitude) {
    int carry = 0;
    for (int i = 0; i < magnitude.length; i++) {
      int shifted = ((magnitude[i] & 0xFF) << 1) | carry;
      magnitude[i] = (byte) shifted;
      carry = shifted >>> 8;
    }
  }

  private static void subtractInPlace(byte[] minuend, byte[] subtrahend) {
    int borrow = 0;
    for (int i = 0; i < minuend.length; i++) {
      int difference = digit(minuend, i) - digit(subtrahend, i) - borrow;
      if (difference < 0) {
        difference += 256;
        borrow = 1;
      } else {
        borrow = 0;
      }
      minuend[i] = (byte) difference;
    }
  }

  private static byte[] shiftLeftMagnitude(byte[] magnitude, int bits) {
    int digitShift = bits >>> 3;
    int bitShift = bits & 7;
    byte[] shifted = new byte[magnitude.length + digitShift + 1];
    int carry = 0;
    for (int i = 0; i < magnitude.length; i++) {
      int value = ((magnitude[i] & 0xFF) << bitShift) | carry;
      shifted[i + digitShift] = (byte) value;
      carry = value >>> 8;
    }
    shifted[magnitude.length + digitShift] = (byte) carry;
    return shifted;
  }

}
