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

import exm.dcw.common.exceptions.DCWRuntimeError;

/**
 * Member of an interface type: a method or a property
 * */
public class InterfaceMemberDeclaration
{
  public static enum MemberKind {
    METHOD, PROPERTY
  }

  public final MemberKind kind;

  private final MethodInterfaceDeclaration method;
  private final PropertyDeclaration property;
  private final ImmutableList<ConditionalAttributeAnnotation> attributes;

  private InterfaceMemberDeclaration(MemberKind kind,
      MethodInterfaceDeclaration method, PropertyDeclaration property,
      List<ConditionalAttributeAnnotation> attributes)
  {
    this.kind = Preconditions.checkNotNull(kind);
    this.method = method;
    this.property = property;
    this.attributes = ImmutableList.copyOf(attributes);
  }

  public static InterfaceMemberDeclaration newMethod(
                  MethodInterfaceDeclaration method,
                  List<ConditionalAttributeAnnotation> attributes)
  {
    Preconditions.checkNotNull(method);
    return new InterfaceMemberDeclaration(MemberKind.METHOD, method, null,
                                          attributes);
  }

  public static InterfaceMemberDeclaration newMethod(
                                      MethodInterfaceDeclaration method)
  {
    return newMethod(method,
                     ImmutableList.<ConditionalAttributeAnnotation>of());
  }

  public static InterfaceMemberDeclaration newProperty(
                  PropertyDeclaration property,
                  List<ConditionalAttributeAnnotation> attributes)
  {
    Preconditions.checkNotNull(property);
    return new InterfaceMemberDeclaration(MemberKind.PROPERTY, null,
                                          property, attributes);
  }

  public static InterfaceMemberDeclaration newProperty(
                                      PropertyDeclaration property)
  {
    return newProperty(property,
                       ImmutableList.<ConditionalAttributeAnnotation>of());
  }

  public MemberKind getKind()
  {
    return kind;
  }

  private void checkKind(MemberKind expected)
  {
    if (this.kind != expected) {
      throw new DCWRuntimeError("interface member: " + this.kind +
                                " where " + expected + " was expected");
    }
  }

  public MethodInterfaceDeclaration getMethod()
  {
    checkKind(MemberKind.METHOD);
    return method;
  }

  public PropertyDeclaration getProperty()
  {
    checkKind(MemberKind.PROPERTY);
    return property;
  }

  public List<ConditionalAttributeAnnotation> getAttributes()
  {
    return attributes;
  }
}
