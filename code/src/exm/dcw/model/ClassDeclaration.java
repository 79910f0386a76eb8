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

public class ClassDeclaration
{
  private final String name;
  /** Null or empty for no explicit ancestor */
  private final String ancestor;
  private final ImmutableList<String> interfaces;
  private final AnnotationComment comment;
  private final ImmutableList<ConditionalAttributeAnnotation> attributes;
  private final ImmutableList<NestedDeclaration> nestedDeclarations;

  public ClassDeclaration(String name, String ancestor,
                  List<String> interfaces, AnnotationComment comment,
                  List<ConditionalAttributeAnnotation> attributes,
                  List<NestedDeclaration> nestedDeclarations)
  {
    this.name = Preconditions.checkNotNull(name);
    this.ancestor = ancestor;
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.comment = comment;
    this.attributes = ImmutableList.copyOf(attributes);
    this.nestedDeclarations = ImmutableList.copyOf(nestedDeclarations);
  }

  public ClassDeclaration(String name, String ancestor,
                          List<NestedDeclaration> nestedDeclarations)
  {
    this(name, ancestor, ImmutableList.<String>of(), null,
         ImmutableList.<ConditionalAttributeAnnotation>of(),
         nestedDeclarations);
  }

  public String getName()
  {
    return name;
  }

  public String getAncestor()
  {
    return ancestor;
  }

  public List<String> getInterfaces()
  {
    return interfaces;
  }

  public AnnotationComment getComment()
  {
    return comment;
  }

  public List<ConditionalAttributeAnnotation> getAttributes()
  {
    return attributes;
  }

  public List<NestedDeclaration> getNestedDeclarations()
  {
    return nestedDeclarations;
  }
}
