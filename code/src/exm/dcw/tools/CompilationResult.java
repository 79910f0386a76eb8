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

/**
 * Outcome of a compiler invocation
 * */
public class CompilationResult
{
  public final boolean success;
  public final int exitCode;
  /** Compiler output, null if there was none */
  public final String errorText;

  public CompilationResult(int exitCode, String errorText)
  {
    this.success = exitCode == 0;
    this.exitCode = exitCode;
    this.errorText = errorText;
  }

  @Override
  public String toString()
  {
    return "exit code " + exitCode + (errorText == null ? "" :
                                      ":\n" + errorText);
  }
}
