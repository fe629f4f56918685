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

import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import com.google.common.collect.Lists;
import org.junit.Test;

public final class LangUtilsTest extends FactorixTest {

  @Test(expected = IllegalArgumentException.class)
  public void testDoubleNaN() {
    LangUtils.parseDouble("NaN");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDoubleInf() {
    LangUtils.parseDouble("Infinity");
  }

  @Test
  public void testDouble() {
    assertEquals(3.1, LangUtils.parseDouble("3.1"));
    assertEquals(-1.5e-3, LangUtils.parseDouble("-1.5e-3"));
  }

  @Test
  public void testPropertyDefaults() {
    assertEquals(0.25, LangUtils.readPositiveDoubleProperty("test.factorix.unset", 0.25));
    assertEquals(7, LangUtils.readPositiveIntProperty("test.factorix.unset", 7));
  }

  @Test
  public void testPropertySet() {
    System.setProperty("test.factorix.double", "0.5");
    System.setProperty("test.factorix.int", "3");
    try {
      assertEquals(0.5, LangUtils.readPositiveDoubleProperty("test.factorix.double", 0.25));
      assertEquals(3, LangUtils.readPositiveIntProperty("test.factorix.int", 7));
    } finally {
      System.clearProperty("test.factorix.double");
      System.clearProperty("test.factorix.int");
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveProperty() {
    System.setProperty("test.factorix.negative", "-1");
    try {
      LangUtils.readPositiveDoubleProperty("test.factorix.negative", 1.0);
    } finally {
      System.clearProperty("test.factorix.negative");
    }
  }

  @Test
  public void testOverrideIsLogged() {
    final List<String> messages = Lists.newArrayList();
    Handler handler = new Handler() {
      @Override
      public void publish(LogRecord record) {
        messages.add(record.getMessage());
      }
      @Override
      public void flush() {
      }
      @Override
      public void close() {
      }
    };
    Logger logger = Logger.getLogger(LangUtils.class.getName());
    logger.addHandler(handler);
    System.setProperty("test.factorix.logged", "2.0");
    try {
      assertEquals(1, LangUtils.readPositiveIntProperty("test.factorix.unset", 1));
      assertTrue(messages.isEmpty());
      assertEquals(2.0, LangUtils.readPositiveDoubleProperty("test.factorix.logged", 0.5));
      assertEquals(1, messages.size());
      assertEquals("test.factorix.logged = 2.0 (default 0.5)", messages.get(0));
    } finally {
      System.clearProperty("test.factorix.logged");
      logger.removeHandler(handler);
    }
  }

}
