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

import com.google.common.base.Preconditions;

import exm.dcw.common.exceptions.DCWRuntimeError;

/**
 * Declaration nested in a class: a nested type, a nested constant
 * or a member.  The visibility applies to the nested declaration,
 * {@link Visibility#UNSPECIFIED} writes no keyword.
 * */
public class NestedDeclaration
{
  public static enum NestedKind {
    TYPE, CONST, MEMBER
  }

  public final NestedKind kind;

  private final Visibility visibility;
  private final TypeDeclaration nestedType;
  private final ConstDeclaration nestedConst;
  private final ClassMemberDeclaration member;

  private NestedDeclaration(NestedKind kind, Visibility visibility,
                            TypeDeclaration nestedType,
                            ConstDeclaration nestedConst,
                            ClassMemberDeclaration member)
  {
    this.kind = kind;
    this.visibility = Preconditions.checkNotNull(visibility);
    this.nestedType = nestedType;
    this.nestedConst = nestedConst;
    this.member = member;
  }

  public static NestedDeclaration newType(Visibility visibility,
                                          TypeDeclaration nestedType)
  {
    Preconditions.checkNotNull(nestedType);
    return new NestedDeclaration(NestedKind.TYPE, visibility, nestedType,
                                 null, null);
  }

  public static NestedDeclaration newConst(Visibility visibility,
                                           ConstDeclaration nestedConst)
  {
    Preconditions.checkNotNull(nestedConst);
    return new NestedDeclaration(NestedKind.CONST, visibility, null,
                                 nestedConst, null);
  }

  public static NestedDeclaration newMember(Visibility visibility,
                                            ClassMemberDeclaration member)
  {
    Preconditions.checkNotNull(member);
    return new NestedDeclaration(NestedKind.MEMBER, visibility, null, null,
                                 member);
  }

  public static NestedDeclaration newMember(ClassMemberDeclaration member)
  {
    return newMember(Visibility.UNSPECIFIED, member);
  }

  public NestedKind getKind()
  {
    return kind;
  }

  public Visibility getVisibility()
  {
    return visibility;
  }

  private void checkKind(NestedKind expected)
  {
    if (this.kind != expected) {
      throw new DCWRuntimeError("nested declaration: " + this.kind +
                                " where " + expected + " was expected");
    }
  }

  public TypeDeclaration getNestedType()
  {
    checkKind(NestedKind.TYPE);
    return nestedType;
  }

  public ConstDeclaration getNestedConst()
  {
    checkKind(NestedKind.CONST);
    return nestedConst;
  }

  public ClassMemberDeclaration getMember()
  {
    checkKind(NestedKind.MEMBER);
    return member;
  }
}
