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
package exm.dcw.model;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A Delphi program, the root of a source model tree.
 * Variables and statements of the program block are raw source code.
 * */
public class Program
{
  private final String heading;
  private final AnnotationComment comment;
  private final ImmutableList<String> includeFiles;
  private final ImmutableList<ConditionalUnitReference> usesClause;
  private final ImmutableList<String> variables;
  private final ImmutableList<String> statements;

  public Program(String heading, AnnotationComment comment,
                 List<String> includeFiles,
                 List<ConditionalUnitReference> usesClause,
                 List<String> variables, List<String> statements)
  {
    this.heading = Preconditions.checkNotNull(heading);
    this.comment = comment;
    this.includeFiles = ImmutableList.copyOf(includeFiles);
    this.usesClause = ImmutableList.copyOf(usesClause);
    this.variables = ImmutableList.copyOf(variables);
    this.statements = ImmutableList.copyOf(statements);
  }

  public Program(String heading, List<ConditionalUnitReference> usesClause)
  {
    this(heading, null, ImmutableList.<String>of(), usesClause,
         ImmutableList.<String>of(), ImmutableList.<String>of());
  }

  public String getHeading()
  {
    return heading;
  }

  public AnnotationComment getComment()
  {
    return comment;
  }

  public List<String> getIncludeFiles()
  {
    return includeFiles;
  }

  public List<ConditionalUnitReference> getUsesClause()
  {
    return usesClause;
  }

  public List<String> getVariables()
  {
    return variables;
  }

  public List<String> getStatements()
  {
    return statements;
  }
}
