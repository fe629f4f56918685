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

package net.factorix.common;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * General utility methods related to the language, or primitives, and to reading configuration
 * from system properties.
 *
 * @author Sean Owen
 */
public final class LangUtils {

  private static final Logger log = LoggerFactory.getLogger(LangUtils.class);

  private LangUtils() {
  }

  /**
   * Parses a {@code double} from a {@link String} as if by {@link Double#valueOf(String)}, but disallows special
   * values like {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} and {@link Double#NEGATIVE_INFINITY}.
   *
   * @param s {@link String} to parse
   * @return floating-point value in the {@link String}
   * @throws NumberFormatException if input does not parse as a floating-point value
   * @throws IllegalArgumentException if input is infinite or {@link Double#NaN}
   */
  public static double parseDouble(String s) {
    double value = Double.parseDouble(s);
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * @param name system property name
   * @param defaultValue value to use when the property is not set
   * @return the property's value, which must be finite and positive
   */
  public static double readPositiveDoubleProperty(String name, double defaultValue) {
    String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    double result = parseDouble(value);
    Preconditions.checkArgument(result > 0.0, "%s must be positive: %s", name, result);
    log.info("{} = {} (default {})", name, result, defaultValue);
    return result;
  }

  /**
   * @see #readPositiveDoubleProperty(String, double)
   */
  public static int readPositiveIntProperty(String name, int defaultValue) {
    String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    int result = Integer.parseInt(value);
    Preconditions.checkArgument(result > 0, "%s must be positive: %s", name, result);
    log.info("{} = {} (default {})", name, result, defaultValue);
    return result;
  }

}
