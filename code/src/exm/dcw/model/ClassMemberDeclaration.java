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
 * Member of a class: a method, a field or a property,
 * with its attribute annotations
 * */
public class ClassMemberDeclaration
{
  public static enum MemberKind {
    METHOD, FIELD, PROPERTY
  }

  public final MemberKind kind;

  private final MethodInterfaceDeclaration method;
  private final FieldDeclaration field;
  private final PropertyDeclaration property;
  private final ImmutableList<ConditionalAttributeAnnotation> attributes;

  /**
   * Private constructor: use the static builder methods (below)
   */
  private ClassMemberDeclaration(MemberKind kind,
      MethodInterfaceDeclaration method, FieldDeclaration field,
      PropertyDeclaration property,
      List<ConditionalAttributeAnnotation> attributes)
  {
    this.kind = Preconditions.checkNotNull(kind);
    this.method = method;
    this.field = field;
    this.property = property;
    this.attributes = ImmutableList.copyOf(attributes);
  }

  public static ClassMemberDeclaration newMethod(
                  MethodInterfaceDeclaration method,
                  List<ConditionalAttributeAnnotation> attributes)
  {
    Preconditions.checkNotNull(method);
    return new ClassMemberDeclaration(MemberKind.METHOD, method, null, null,
                                      attributes);
  }

  public static ClassMemberDeclaration newMethod(
                                      MethodInterfaceDeclaration method)
  {
    return newMethod(method,
                     ImmutableList.<ConditionalAttributeAnnotation>of());
  }

  public static ClassMemberDeclaration newField(FieldDeclaration field,
                  List<ConditionalAttributeAnnotation> attributes)
  {
    Preconditions.checkNotNull(field);
    return new ClassMemberDeclaration(MemberKind.FIELD, null, field, null,
                                      attributes);
  }

  public static ClassMemberDeclaration newField(FieldDeclaration field)
  {
    return newField(field,
                    ImmutableList.<ConditionalAttributeAnnotation>of());
  }

  public static ClassMemberDeclaration newProperty(
                  PropertyDeclaration property,
                  List<ConditionalAttributeAnnotation> attributes)
  {
    Preconditions.checkNotNull(property);
    return new ClassMemberDeclaration(MemberKind.PROPERTY, null, null,
                                      property, attributes);
  }

  public static ClassMemberDeclaration newProperty(
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
      throw new DCWRuntimeError("class member: " + this.kind + " where " +
                                expected + " was expected");
    }
  }

  public MethodInterfaceDeclaration getMethod()
  {
    checkKind(MemberKind.METHOD);
    return method;
  }

  public FieldDeclaration getField()
  {
    checkKind(MemberKind.FIELD);
    return field;
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
