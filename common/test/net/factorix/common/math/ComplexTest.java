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

import org.junit.Test;

import net.factorix.common.FactorixTest;

public final class ComplexTest extends FactorixTest {

  @Test
  public void testArithmetic() {
    Complex a = new Complex(2.0, 3.0);
    Complex b = new Complex(1.0, -1.0);
    assertEquals(new Complex(3.0, 2.0), a.add(b));
    assertEquals(new Complex(1.0, 4.0), a.subtract(b));
    assertEquals(new Complex(5.0, 1.0), a.multiply(b));
    assertEquals(new Complex(-0.5, 2.5), a.divide(b));
    assertEquals(a, a.divide(b).multiply(b));
    assertEquals(new Complex(-2.0, -3.0), a.negate());
    assertEquals(Complex.ONE.negate(), Complex.I.multiply(Complex.I));
  }

  @Test
  public void testNorms() {
    Complex z = new Complex(3.0, -4.0);
    assertEquals(25.0, z.normSquared());
    assertEquals(5.0, z.norm());
    assertEquals(new Complex(5.0, 0.0), z.absolute());
    assertEquals(new Complex(3.0, 4.0), z.conjugate());
  }

  @Test
  public void testZero() {
    assertTrue(Complex.ZERO.isZero());
    assertTrue(new Complex(-0.0, 0.0).isZero());
    assertEquals(Complex.ZERO, new Complex(-0.0, 0.0));
    assertEquals(Complex.ZERO.hashCode(), new Complex(-0.0, 0.0).hashCode());
    assertFalse(Complex.I.isZero());
  }

  @Test
  public void testToString() {
    assertEquals("0", Complex.ZERO.toString());
    assertEquals("3i", new Complex(0.0, 3.0).toString());
    assertEquals("2", new Complex(2.0, 0.0).toString());
    assertEquals("2+3i", new Complex(2.0, 3.0).toString());
    assertEquals("2-3i", new Complex(2.0, -3.0).toString());
    assertEquals("1.5-0.25i", new Complex(1.5, -0.25).toString());
  }

  @Test
  public void testField() {
    assertEquals(new Complex(2.5, 0.0), Complex.FIELD.fromReal(2.5));
    assertSame(Complex.ZERO, Complex.FIELD.zero());
    assertSame(Complex.ONE, Complex.FIELD.one());
  }

}
