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

/**
 * Value of an enumerated type, optionally with explicit ordinality
 * */
public class EnumValueDeclaration
{
  public final String name;
  /** Null if ordinality is implicit */
  public final Long ordinality;
  /** May be null */
  public final AnnotationComment comment;

  public EnumValueDeclaration(String name, Long ordinality,
                              AnnotationComment comment)
  {
    this.name = name;
    this.ordinality = ordinality;
    this.comment = comment;
  }

  public EnumValueDeclaration(String name)
  {
    this(name, null, null);
  }
}
