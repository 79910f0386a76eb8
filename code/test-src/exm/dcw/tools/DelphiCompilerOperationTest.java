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
package exm.dcw.tools;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.dcw.common.Settings;

public class DelphiCompilerOperationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Before
  public void configureExecutables() {
    Settings.set(Settings.FPC_EXECUTABLE, "/opt/fpc/bin/fpc");
    Settings.set(Settings.DCC64_EXECUTABLE, "C:\\RAD\\bin\\dcc64.exe");
  }

  @After
  public void restoreExecutables() {
    Settings.set(Settings.FPC_EXECUTABLE, "");
    Settings.set(Settings.DCC64_EXECUTABLE, "");
  }

  private static void configure(DelphiCompilerOperation operation) {
    operation.getUnitPath().add("units");
    operation.getUnitPath().add("gen");
    operation.getIncludePath().add("include");
  }

  @Test
  public void testPlan() {
    assertTrue(DelphiCompilerOperation.plan(DelphiCompiler.FPC, "p.pas")
                 instanceof FpcOperation);
    DelphiCompilerOperation dcc64 =
        DelphiCompilerOperation.plan(DelphiCompiler.DCC64, "p.pas");
    assertTrue(dcc64 instanceof Dcc64Operation);
    assertEquals("p.pas", dcc64.getInputFile());
  }

  @Test
  public void testFpcCommandLine() {
    DelphiCompilerOperation operation = new FpcOperation("p.pas");
    configure(operation);
    assertEquals(Arrays.asList("/opt/fpc/bin/fpc", "-Fuunits", "-Fugen",
                               "-Fiinclude", "p.pas"),
                 operation.commandLine());

    operation.setGenerateDebugInfo(true);
    operation.setOutputPath("out");
    assertEquals(Arrays.asList("/opt/fpc/bin/fpc", "-g", "-Fuunits",
                               "-Fugen", "-Fiinclude", "-FEout", "p.pas"),
                 operation.commandLine());
  }

  @Test
  public void testDcc64CommandLine() {
    DelphiCompilerOperation operation = new Dcc64Operation("p.pas");
    configure(operation);
    operation.setGenerateDebugInfo(true);
    operation.setOutputPath("out");
    assertEquals(Arrays.asList("C:\\RAD\\bin\\dcc64.exe", "-V", "-Uunits",
                               "-Ugen", "-Iinclude", "-Eout", "p.pas"),
                 operation.commandLine());
  }

  @Test
  public void testDefaultExecutableName() {
    Settings.set(Settings.FPC_EXECUTABLE, "");
    String executable = new FpcOperation("p.pas").commandLine().get(0);
    assertTrue(executable, executable.startsWith("fpc"));
  }

  @Test
  public void testConfiguredExecutableMissing() {
    Settings.set(Settings.FPC_EXECUTABLE,
                 new File(folder.getRoot(), "no-fpc").getPath());
    assertFalse(new FpcOperation("p.pas").executableFound());
  }

  @Test
  public void testConfiguredExecutableFound() throws IOException {
    File fpc = folder.newFile("fpc");
    Settings.set(Settings.FPC_EXECUTABLE, fpc.getPath());
    assertTrue(new FpcOperation("p.pas").executableFound());
  }

  @Test
  public void testResult() {
    assertTrue(new CompilationResult(0, null).success);
    CompilationResult failed = new CompilationResult(1, "error");
    assertFalse(failed.success);
    assertEquals("exit code 1:\nerror", failed.toString());
  }
}
