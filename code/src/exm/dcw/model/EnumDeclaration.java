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

public class EnumDeclaration
{
  private final String name;
  private final AnnotationComment comment;
  private final ImmutableList<ConditionalAttributeAnnotation> attributes;
  private final ImmutableList<EnumValueDeclaration> values;

  public EnumDeclaration(String name, AnnotationComment comment,
                         List<ConditionalAttributeAnnotation> attributes,
                         List<EnumValueDeclaration> values)
  {
    this.name = Preconditions.checkNotNull(name);
    this.comment = comment;
    this.attributes = ImmutableList.copyOf(attributes);
    this.values = ImmutableList.copyOf(values);
  }

  public EnumDeclaration(String name, List<EnumValueDeclaration> values)
  {
    this(name, null, ImmutableList.<ConditionalAttributeAnnotation>of(),
         values);
  }

  public String getName()
  {
    return name;
  }

  public AnnotationComment getComment()
  {
    return comment;
  }

  public List<ConditionalAttributeAnnotation> getAttributes()
  {
    return attributes;
  }

  public List<EnumValueDeclaration> getValues()
  {
    return values;
  }
}
