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
 * A Delphi unit, the root of a source model tree
 * */
public class Unit
{
  private final UnitIdentifier heading;
  private final AnnotationComment comment;
  private final ImmutableList<String> includeFiles;
  private final Interface interfaceSection;
  private final Implementation implementationSection;

  public Unit(UnitIdentifier heading, AnnotationComment comment,
              List<String> includeFiles, Interface interfaceSection,
              Implementation implementationSection)
  {
    this.heading = Preconditions.checkNotNull(heading);
    this.comment = comment;
    this.includeFiles = ImmutableList.copyOf(includeFiles);
    this.interfaceSection = Preconditions.checkNotNull(interfaceSection);
    this.implementationSection =
                            Preconditions.checkNotNull(implementationSection);
  }

  public Unit(UnitIdentifier heading, Interface interfaceSection,
              Implementation implementationSection)
  {
    this(heading, null, ImmutableList.<String>of(), interfaceSection,
         implementationSection);
  }

  public UnitIdentifier getHeading()
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

  public Interface getInterface()
  {
    return interfaceSection;
  }

  public Implementation getImplementation()
  {
    return implementationSection;
  }
}
