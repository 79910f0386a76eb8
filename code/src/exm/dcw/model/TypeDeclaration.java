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
 * Type declared in an interface section, or nested in a class:
 * a class, an enumerated type or an interface type
 * */
public class TypeDeclaration
{
  public static enum TypeKind {
    CLASS, ENUM, INTERFACE
  }

  public final TypeKind kind;

  private final ClassDeclaration classDeclaration;
  private final EnumDeclaration enumDeclaration;
  private final InterfaceTypeDeclaration interfaceDeclaration;

  private TypeDeclaration(TypeKind kind, ClassDeclaration classDeclaration,
                          EnumDeclaration enumDeclaration,
                          InterfaceTypeDeclaration interfaceDeclaration)
  {
    this.kind = kind;
    this.classDeclaration = classDeclaration;
    this.enumDeclaration = enumDeclaration;
    this.interfaceDeclaration = interfaceDeclaration;
  }

  public static TypeDeclaration newClass(ClassDeclaration declaration)
  {
    Preconditions.checkNotNull(declaration);
    return new TypeDeclaration(TypeKind.CLASS, declaration, null, null);
  }

  public static TypeDeclaration newEnum(EnumDeclaration declaration)
  {
    Preconditions.checkNotNull(declaration);
    return new TypeDeclaration(TypeKind.ENUM, null, declaration, null);
  }

  public static TypeDeclaration newInterface(
                                    InterfaceTypeDeclaration declaration)
  {
    Preconditions.checkNotNull(declaration);
    return new TypeDeclaration(TypeKind.INTERFACE, null, null, declaration);
  }

  public TypeKind getKind()
  {
    return kind;
  }

  private void checkKind(TypeKind expected)
  {
    if (this.kind != expected) {
      throw new DCWRuntimeError("type declaration: " + this.kind +
                                " where " + expected + " was expected");
    }
  }

  public ClassDeclaration getClassDeclaration()
  {
    checkKind(TypeKind.CLASS);
    return classDeclaration;
  }

  public EnumDeclaration getEnumDeclaration()
  {
    checkKind(TypeKind.ENUM);
    return enumDeclaration;
  }

  public InterfaceTypeDeclaration getInterfaceDeclaration()
  {
    checkKind(TypeKind.INTERFACE);
    return interfaceDeclaration;
  }
}
