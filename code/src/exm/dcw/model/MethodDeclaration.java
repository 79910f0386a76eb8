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
 * Defining declaration of a method in an implementation section.
 * Local declarations and statements are raw, already formatted source
 * code; each entry may span several lines.
 * */
public class MethodDeclaration
{
  private final String className;
  private final Prototype prototype;
  private final ImmutableList<String> localDeclarations;
  private final ImmutableList<String> statements;

  public MethodDeclaration(String className, Prototype prototype,
                           List<String> localDeclarations,
                           List<String> statements)
  {
    this.className = Preconditions.checkNotNull(className);
    this.prototype = Preconditions.checkNotNull(prototype);
    this.localDeclarations = ImmutableList.copyOf(localDeclarations);
    this.statements = ImmutableList.copyOf(statements);
  }

  public MethodDeclaration(String className, Prototype prototype)
  {
    this(className, prototype, ImmutableList.<String>of(),
         ImmutableList.<String>of());
  }

  public String getClassName()
  {
    return className;
  }

  public Prototype getPrototype()
  {
    return prototype;
  }

  public List<String> getLocalDeclarations()
  {
    return localDeclarations;
  }

  public List<String> getStatements()
  {
    return statements;
  }
}
