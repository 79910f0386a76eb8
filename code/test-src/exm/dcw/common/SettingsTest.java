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
package exm.dcw.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.dcw.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void restoreDefaults() {
    Settings.set(Settings.LOG_TRACE, "false");
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.TESTS_SKIP_FPC));
    assertFalse(Settings.getBoolean(Settings.TESTS_SKIP_FPC));
    assertFalse(Settings.getBoolean(Settings.TESTS_SKIP_DCC64));
  }

  @Test
  public void testBooleanIgnoresCase() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "TRUE");
    assertTrue(Settings.getBoolean(Settings.LOG_TRACE));
  }

  @Test(expected=InvalidOptionException.class)
  public void testInvalidBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "sometimes");
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test(expected=InvalidOptionException.class)
  public void testUnknownKey() throws InvalidOptionException {
    Settings.getBoolean("dcw.no.such.key");
  }
}
