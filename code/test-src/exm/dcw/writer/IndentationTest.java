/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dcw.writer;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.dcw.common.exceptions.DCWRuntimeError;

public class IndentationTest {

  @Test
  public void testPrefix() {
    assertEquals("", Indentation.prefix(0));
    assertEquals("  ", Indentation.prefix(1));
    assertEquals("      ", Indentation.prefix(3));
  }

  @Test
  public void testShiftCounting() {
    Indentation indentation = new Indentation();
    indentation.increase();
    indentation.increase();
    assertEquals(2, indentation.getLevel());
    assertEquals("    ", indentation.prefix());
    indentation.decrease();
    indentation.shift(0);
    assertEquals(1, indentation.getLevel());
    assertEquals(2, indentation.getIncreases());
    assertEquals(1, indentation.getDecreases());

    indentation.reset();
    assertEquals(0, indentation.getLevel());
    assertEquals(0, indentation.getIncreases());
    assertEquals(0, indentation.getDecreases());
  }

  @Test(expected=DCWRuntimeError.class)
  public void testNegativeLevel() {
    Indentation indentation = new Indentation();
    indentation.increase();
    indentation.shift(-2);
  }
}
