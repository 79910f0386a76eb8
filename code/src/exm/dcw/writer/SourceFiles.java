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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.dcw.common.Logging;
import exm.dcw.model.Program;
import exm.dcw.model.Unit;

/**
 * Recommended placement of written source files
 * */
public class SourceFiles
{
  private static final Logger logger = Logging.getDCWLogger();

  /**
   * A unit lives in a folder per namespace segment, in a file named
   * after its full dotted identifier
   * @return path components, relative to a source root
   */
  public static List<String> path(Unit unit)
  {
    return ImmutableList.<String>builder()
        .addAll(unit.getHeading().getNamespace())
        .add(unit.getHeading().toSourceCode() + "." +
             DelphiSourceCodeWriter.UNIT_SOURCE_FILE_EXTENSION)
        .build();
  }

  /**
   * @return path components, relative to a source root
   */
  public static List<String> path(Program program)
  {
    return ImmutableList.of(program.getHeading() + "." +
                      DelphiSourceCodeWriter.PROGRAM_SOURCE_FILE_EXTENSION);
  }

  /**
   * Write the source code of a unit below a source root,
   * creating folders as needed
   * @return the written file
   */
  public static File write(File root, Unit unit) throws IOException
  {
    return write(root, path(unit), DelphiSourceCodeWriter.toSourceCode(unit));
  }

  /**
   * Write the source code of a program below a source root,
   * creating folders as needed
   * @return the written file
   */
  public static File write(File root, Program program) throws IOException
  {
    return write(root, path(program),
                 DelphiSourceCodeWriter.toSourceCode(program));
  }

  private static File write(File root, List<String> path, String code)
                                                        throws IOException
  {
    File file = root;
    for (String component: path) {
      file = new File(file, component);
    }
    logger.debug("Writing source file " + file.getPath());
    FileUtils.writeStringToFile(file, code, StandardCharsets.UTF_8);
    return file;
  }
}
