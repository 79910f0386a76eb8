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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import exm.dcw.common.exceptions.DCWRuntimeError;

/**
 * Tagged declaration variants only hand out their own kind
 */
public class DeclarationKindTest {

  private static ClassDeclaration emptyClass() {
    return new ClassDeclaration("TFoo", null,
                                ImmutableList.<NestedDeclaration>of());
  }

  @Test
  public void testTypeDeclaration() {
    ClassDeclaration declaration = emptyClass();
    TypeDeclaration type = TypeDeclaration.newClass(declaration);
    assertEquals(TypeDeclaration.TypeKind.CLASS, type.getKind());
    assertSame(declaration, type.getClassDeclaration());
  }

  @Test(expected=DCWRuntimeError.class)
  public void testTypeDeclarationWrongKind() {
    TypeDeclaration.newClass(emptyClass()).getEnumDeclaration();
  }

  @Test
  public void testNestedDeclarationVisibility() {
    NestedDeclaration nested = NestedDeclaration.newMember(
        ClassMemberDeclaration.newField(new FieldDeclaration("F", "Byte")));
    assertEquals(Visibility.UNSPECIFIED, nested.getVisibility());
    assertEquals(NestedDeclaration.NestedKind.MEMBER, nested.getKind());
    assertEquals("F", nested.getMember().getField().name);
  }

  @Test(expected=DCWRuntimeError.class)
  public void testNestedDeclarationWrongKind() {
    NestedDeclaration.newConst(Visibility.PRIVATE,
        new ConstDeclaration("C", "1")).getNestedType();
  }

  @Test(expected=DCWRuntimeError.class)
  public void testClassMemberWrongKind() {
    ClassMemberDeclaration.newProperty(
        new PropertyDeclaration("P", "Integer", "FP", null)).getMethod();
  }

  @Test(expected=DCWRuntimeError.class)
  public void testInterfaceMemberWrongKind() {
    InterfaceMemberDeclaration.newMethod(
        new MethodInterfaceDeclaration(Prototype.procedure("Run")))
          .getProperty();
  }

  @Test
  public void testPropertySpecifiersDefaultToEmpty() {
    PropertyDeclaration property =
                    new PropertyDeclaration("P", "Integer", null, null);
    assertEquals("", property.readSpecifier);
    assertEquals("", property.writeSpecifier);
  }
}
