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
import static org.junit.Assert.assertNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.dcw.common.Logging;
import exm.dcw.common.util.StringUtil;

/**
 * Writes known source models and compares with the expected files
 * */
public class KnownSourceCodeTest {

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging(null, false);
  }

  static String expectedSource(String folder, String name)
                                                      throws IOException {
    String resource = "/" + folder + "/" + name + "." +
                      DelphiSourceCodeWriter.UNIT_SOURCE_FILE_EXTENSION;
    InputStream in = KnownSourceCodeTest.class.getResourceAsStream(resource);
    assertNotNull("Missing test resource " + resource, in);
    try {
      // Resources may have been checked out with other line endings
      return StringUtil.convertLineSeparators(
                  IOUtils.toString(in, StandardCharsets.UTF_8), "\n");
    } finally {
      in.close();
    }
  }

  private static void checkUnit(String name) throws IOException {
    assertEquals(name, expectedSource("known-delphi-units", name),
                 DelphiSourceCodeWriter.toSourceCode(KnownUnits.unit(name)));
  }

  @Test
  public void testBinding() throws IOException {
    checkUnit("uBinding");
  }

  @Test
  public void testConditionalCompilation() throws IOException {
    checkUnit("uConditionalCompilation");
  }

  @Test
  public void testEnum() throws IOException {
    checkUnit("uEnum");
  }

  @Test
  public void testInterfaceMembers() throws IOException {
    checkUnit("uInterfaceMembers");
  }

  @Test
  public void testMethodDeclarations() throws IOException {
    checkUnit("uMethodDeclarations");
  }

  @Test
  public void testNestedConstants() throws IOException {
    checkUnit("uNestedConstants");
  }

  @Test
  public void testNestedTypes() throws IOException {
    checkUnit("uNestedTypes");
  }

  @Test
  public void testProperties() throws IOException {
    checkUnit("uProperties");
  }

  @Test
  public void testAllUnitsStayStable() throws IOException {
    // One writer, reused for every unit
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    for (String name: KnownUnits.UNIT_NAMES) {
      assertEquals(name, expectedSource("known-delphi-units", name),
                   writer.renderUnit(KnownUnits.unit(name)));
      assertEquals(name + " indentation", 0,
                   writer.getIndentation().getLevel());
    }
  }

  @Test
  public void testHelloWorldProgram() throws IOException {
    assertEquals(expectedSource("known-delphi-programs", "pHelloWorld"),
        DelphiSourceCodeWriter.toSourceCode(
                                    KnownUnits.program("pHelloWorld")));
  }
}
