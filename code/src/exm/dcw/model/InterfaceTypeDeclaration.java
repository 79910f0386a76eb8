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
 * Declaration of an interface type with its GUID
 * */
public class InterfaceTypeDeclaration
{
  private final String name;
  /** Null or empty for no explicit ancestor */
  private final String ancestor;
  /** Without braces, e.g. 6D5D8C25-12EC-42F8-BAFC-3BFAC05837E5 */
  private final String guid;
  private final AnnotationComment comment;
  private final ImmutableList<ConditionalAttributeAnnotation> attributes;
  private final ImmutableList<InterfaceMemberDeclaration> members;

  public InterfaceTypeDeclaration(String name, String ancestor, String guid,
                      AnnotationComment comment,
                      List<ConditionalAttributeAnnotation> attributes,
                      List<InterfaceMemberDeclaration> members)
  {
    this.name = Preconditions.checkNotNull(name);
    this.ancestor = ancestor;
    this.guid = Preconditions.checkNotNull(guid);
    this.comment = comment;
    this.attributes = ImmutableList.copyOf(attributes);
    this.members = ImmutableList.copyOf(members);
  }

  public InterfaceTypeDeclaration(String name, String ancestor, String guid,
                                  List<InterfaceMemberDeclaration> members)
  {
    this(name, ancestor, guid, null,
         ImmutableList.<ConditionalAttributeAnnotation>of(), members);
  }

  public String getName()
  {
    return name;
  }

  public String getAncestor()
  {
    return ancestor;
  }

  public String getGuid()
  {
    return guid;
  }

  public AnnotationComment getComment()
  {
    return comment;
  }

  public List<ConditionalAttributeAnnotation> getAttributes()
  {
    return attributes;
  }

  public List<InterfaceMemberDeclaration> getMembers()
  {
    return members;
  }
}
