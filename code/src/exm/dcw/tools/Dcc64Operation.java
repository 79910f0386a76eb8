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

import java.util.ArrayList;
import java.util.List;

import exm.dcw.common.Settings;

/**
 * Planned invocation of DCC64, the RAD Studio Delphi compiler
 * for 64-bit Windows
 * */
public class Dcc64Operation extends DelphiCompilerOperation
{
  public Dcc64Operation(String inputFile)
  {
    super(inputFile);
  }

  @Override
  public List<String> commandLine()
  {
    List<String> command = new ArrayList<String>();
    command.add(executable(Settings.DCC64_EXECUTABLE, "dcc64"));
    if (generateDebugInfo)
      command.add("-V");
    for (String folder: unitPath)
      command.add("-U" + folder);
    for (String folder: includePath)
      command.add("-I" + folder);
    if (outputPath != null)
      command.add("-E" + outputPath);
    command.add(inputFile);
    return command;
  }
}
