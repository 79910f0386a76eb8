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
 * Heading of a procedure, constructor, destructor or function,
 * shared by a method's interface declaration and its defining
 * declaration
 * */
public class Prototype
{
  public static enum Kind {
    PROCEDURE, CONSTRUCTOR, DESTRUCTOR, FUNCTION
  }

  private final Kind kind;
  private final String name;
  private final ImmutableList<Parameter> parameters;
  /** Only used by functions */
  private final String returnType;

  public Prototype(Kind kind, String name, List<Parameter> parameters,
                   String returnType)
  {
    this.kind = Preconditions.checkNotNull(kind);
    this.name = Preconditions.checkNotNull(name);
    this.parameters = ImmutableList.copyOf(parameters);
    this.returnType = returnType;
  }

  public static Prototype procedure(String name, Parameter... parameters)
  {
    return new Prototype(Kind.PROCEDURE, name,
                         ImmutableList.copyOf(parameters), null);
  }

  public static Prototype function(String name, String returnType,
                                   Parameter... parameters)
  {
    return new Prototype(Kind.FUNCTION, name,
                         ImmutableList.copyOf(parameters), returnType);
  }

  public Kind getKind()
  {
    return kind;
  }

  public String getName()
  {
    return name;
  }

  public List<Parameter> getParameters()
  {
    return parameters;
  }

  public String getReturnType()
  {
    return returnType;
  }
}
