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

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.apache.log4j.Logger;

import exm.dcw.common.Logging;
import exm.dcw.common.Settings;
import exm.dcw.common.exceptions.DCWRuntimeError;

/**
 * Planned invocation of a Delphi compiler.
 * Configure the search paths, then {@link #perform()}.
 * */
public abstract class DelphiCompilerOperation
{
  protected final Logger logger = Logging.getDCWLogger();

  /** Folders with units used by the compiled code */
  protected final List<String> unitPath = new ArrayList<String>();

  /** Folders with include files used by the compiled code */
  protected final List<String> includePath = new ArrayList<String>();

  /** Folder for compiler outputs, null for the compiler's default */
  protected String outputPath = null;

  protected boolean generateDebugInfo = false;

  protected final String inputFile;

  protected DelphiCompilerOperation(String inputFile)
  {
    this.inputFile = inputFile;
  }

  public static DelphiCompilerOperation plan(DelphiCompiler compiler,
                                             String inputFile)
  {
    switch (compiler) {
      case FPC:
        return new FpcOperation(inputFile);
      case DCC64:
        return new Dcc64Operation(inputFile);
      default:
        throw new DCWRuntimeError("Unknown compiler: " + compiler);
    }
  }

  public List<String> getUnitPath()
  {
    return unitPath;
  }

  public List<String> getIncludePath()
  {
    return includePath;
  }

  public String getOutputPath()
  {
    return outputPath;
  }

  public void setOutputPath(String outputPath)
  {
    this.outputPath = outputPath;
  }

  public void setGenerateDebugInfo(boolean generateDebugInfo)
  {
    this.generateDebugInfo = generateDebugInfo;
  }

  public String getInputFile()
  {
    return inputFile;
  }

  /**
   * @return complete command line for the planned invocation
   */
  public abstract List<String> commandLine();

  /**
   * Run the compiler and wait for it to finish
   */
  public CompilationResult perform() throws IOException
  {
    List<String> command = commandLine();
    logger.debug("Running: " + StringUtils.join(command, ' '));
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.redirectErrorStream(true);
    Process process = builder.start();
    String output = IOUtils.toString(process.getInputStream(),
                                     StandardCharsets.UTF_8);
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      process.destroy();
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for " +
                                       command.get(0));
    }
    logger.debug(command.get(0) + " exited with code " + exitCode);
    return new CompilationResult(exitCode,
                                 output.length() == 0 ? null : output);
  }

  /**
   * @return true if the compiler executable exists: the configured
   *         file, or a file of that name in one of the PATH folders
   */
  public boolean executableFound()
  {
    String executable = commandLine().get(0);
    if (executable.indexOf('/') >= 0 ||
        executable.indexOf(File.separatorChar) >= 0) {
      return new File(executable).isFile();
    }
    String path = System.getenv("PATH");
    if (path == null) {
      return false;
    }
    for (String folder: StringUtils.split(path, File.pathSeparatorChar)) {
      if (new File(folder, executable).isFile()) {
        logger.trace("Found " + executable + " in " + folder);
        return true;
      }
    }
    return false;
  }

  /**
   * @param settingKey setting with a configured executable location
   * @param name base name of the executable, without extension
   * @return configured location, or a name that is found on the PATH
   */
  protected static String executable(String settingKey, String name)
  {
    String configured = Settings.get(settingKey);
    if (StringUtils.isNotEmpty(configured)) {
      return configured;
    }
    if (SystemUtils.IS_OS_WINDOWS) {
      return name + ".exe";
    }
    return name;
  }
}
