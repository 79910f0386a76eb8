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
package exm.dcw.writer;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.dcw.model.AnnotationComment;
import exm.dcw.model.ClassDeclaration;
import exm.dcw.model.ClassMemberDeclaration;
import exm.dcw.model.ConditionalAttributeAnnotation;
import exm.dcw.model.ConditionalUnitReference;
import exm.dcw.model.ConstDeclaration;
import exm.dcw.model.EnumDeclaration;
import exm.dcw.model.EnumValueDeclaration;
import exm.dcw.model.FieldDeclaration;
import exm.dcw.model.Implementation;
import exm.dcw.model.Interface;
import exm.dcw.model.InterfaceMemberDeclaration;
import exm.dcw.model.InterfaceTypeDeclaration;
import exm.dcw.model.MethodDeclaration;
import exm.dcw.model.MethodInterfaceDeclaration;
import exm.dcw.model.MethodInterfaceDeclaration.Binding;
import exm.dcw.model.NestedDeclaration;
import exm.dcw.model.Parameter;
import exm.dcw.model.Program;
import exm.dcw.model.PropertyDeclaration;
import exm.dcw.model.Prototype;
import exm.dcw.model.TypeDeclaration;
import exm.dcw.model.Unit;
import exm.dcw.model.UnitIdentifier;
import exm.dcw.model.UnitReference;
import exm.dcw.model.Visibility;

/**
 * Source models matching the expected source files in
 * known-delphi-units/ and known-delphi-programs/
 * */
public class KnownUnits
{
  public static final List<String> UNIT_NAMES = ImmutableList.of(
      "uBinding", "uConditionalCompilation", "uEnum", "uInterfaceMembers",
      "uMethodDeclarations", "uNestedConstants", "uNestedTypes",
      "uProperties");

  public static final List<String> PROGRAM_NAMES =
                                            ImmutableList.of("pHelloWorld");

  private static final List<ConditionalAttributeAnnotation> NO_ATTRIBUTES =
                        ImmutableList.<ConditionalAttributeAnnotation>of();

  public static Unit unit(String name)
  {
    if (name.equals("uBinding"))
      return binding();
    else if (name.equals("uConditionalCompilation"))
      return conditionalCompilation();
    else if (name.equals("uEnum"))
      return enumUnit();
    else if (name.equals("uInterfaceMembers"))
      return interfaceMembers();
    else if (name.equals("uMethodDeclarations"))
      return methodDeclarations();
    else if (name.equals("uNestedConstants"))
      return nestedConstants();
    else if (name.equals("uNestedTypes"))
      return nestedTypes();
    else if (name.equals("uProperties"))
      return properties();
    throw new IllegalArgumentException("No known unit " + name);
  }

  public static Program program(String name)
  {
    if (name.equals("pHelloWorld"))
      return helloWorld();
    throw new IllegalArgumentException("No known program " + name);
  }

  static AnnotationComment summary(String text)
  {
    return new AnnotationComment("<summary>", text, "</summary>");
  }

  private static Unit interfaceOnly(String name,
                                    List<ConditionalUnitReference> uses,
                                    TypeDeclaration... declarations)
  {
    return new Unit(new UnitIdentifier(name),
                    new Interface(uses, ImmutableList.copyOf(declarations)),
                    Implementation.empty());
  }

  private static Unit interfaceOnly(String name,
                                    TypeDeclaration... declarations)
  {
    return interfaceOnly(name, ImmutableList.<ConditionalUnitReference>of(),
                         declarations);
  }

  private static NestedDeclaration method(Prototype prototype,
                                Binding binding, AnnotationComment comment)
  {
    return NestedDeclaration.newMember(ClassMemberDeclaration.newMethod(
                new MethodInterfaceDeclaration(prototype, binding, comment)));
  }

  private static Unit binding()
  {
    ClassDeclaration classX = new ClassDeclaration("ClassX",
        "TAbstractBaseClass", ImmutableList.of(
          method(Prototype.procedure("ProcedureX"), Binding.VIRTUAL, null),
          method(Prototype.procedure("VirtualProcedure"), Binding.OVERRIDE,
                 null)));
    Interface interfaceSection = new Interface(
        ImmutableList.of(ConditionalUnitReference.of("uAbstractBaseClass")),
        ImmutableList.of(TypeDeclaration.newClass(classX)));
    Implementation implementation = new Implementation(
        ImmutableList.<ConditionalUnitReference>of(), ImmutableList.of(
          new MethodDeclaration("ClassX", Prototype.procedure("ProcedureX")),
          new MethodDeclaration("ClassX",
                                Prototype.procedure("VirtualProcedure"))));
    return new Unit(new UnitIdentifier("uBinding"), interfaceSection,
                    implementation);
  }

  private static Unit conditionalCompilation()
  {
    String symbol = "TEST_FILE_INCLUDED";
    List<ConditionalUnitReference> uses = ImmutableList.of(
        ConditionalUnitReference.ifDefined(symbol,
            UnitReference.parse("uReferenced"), null),
        ConditionalUnitReference.ifDefined(symbol, null,
            UnitReference.parse("uReferenced2")),
        ConditionalUnitReference.ifDefined(symbol,
            UnitReference.parse("uReferenced2"),
            UnitReference.parse("uReferenced")));
    List<ConditionalAttributeAnnotation> attributes = ImmutableList.of(
        ConditionalAttributeAnnotation.ifDefined(symbol, "volatile", null),
        ConditionalAttributeAnnotation.ifDefined(symbol, null, "Example"),
        ConditionalAttributeAnnotation.ifDefined(symbol, "Example",
                                                 "volatile"));
    ClassDeclaration classX = new ClassDeclaration("ClassX", null,
        ImmutableList.<String>of(), null, attributes,
        ImmutableList.<NestedDeclaration>of());
    return new Unit(new UnitIdentifier("uConditionalCompilation"), null,
        ImmutableList.of("testIncludeFile.inc"),
        new Interface(uses, ImmutableList.of(TypeDeclaration.newClass(classX))),
        Implementation.empty());
  }

  private static Unit enumUnit()
  {
    EnumDeclaration enumX = new EnumDeclaration("EnumX",
        summary("This is an enumerated type used for testing."),
        NO_ATTRIBUTES, ImmutableList.of(
          new EnumValueDeclaration("exValueX", null,
              summary("This is an enumerated value used for testing, " +
                      "without explicitly assigned ordinality.")),
          new EnumValueDeclaration("exValueY", 3L,
              summary("This is an enumerated value used for testing, " +
                      "with explicitly assigned ordinality."))));
    return interfaceOnly("uEnum", TypeDeclaration.newEnum(enumX));
  }

  private static Unit interfaceMembers()
  {
    InterfaceTypeDeclaration interfaceX = new InterfaceTypeDeclaration(
        "InterfaceX", "IInterface", "6D5D8C25-12EC-42F8-BAFC-3BFAC05837E5",
        ImmutableList.of(
          InterfaceMemberDeclaration.newMethod(new MethodInterfaceDeclaration(
              Prototype.function("GetX", "Integer"))),
          InterfaceMemberDeclaration.newMethod(new MethodInterfaceDeclaration(
              Prototype.procedure("SetX",
                                  new Parameter("ParamX", "Integer")))),
          InterfaceMemberDeclaration.newProperty(new PropertyDeclaration(
              "PropertyX", "Integer", "GetX", "SetX",
              summary("This is a property used for testing.")))));
    return interfaceOnly("uInterfaceMembers",
                         TypeDeclaration.newInterface(interfaceX));
  }

  private static Unit methodDeclarations()
  {
    Prototype procedureX = Prototype.procedure("ProcedureX");
    Prototype constructorX = new Prototype(Prototype.Kind.CONSTRUCTOR,
        "ConstructorX", ImmutableList.<Parameter>of(), null);
    Prototype destructorX = new Prototype(Prototype.Kind.DESTRUCTOR,
        "DestructorX", ImmutableList.<Parameter>of(), null);
    Prototype functionX = Prototype.function("FunctionX", "Integer");
    ClassDeclaration classX = new ClassDeclaration("ClassX", null,
        ImmutableList.of(
          method(procedureX, Binding.STATIC, null),
          method(constructorX, Binding.STATIC,
                 summary("This is a method used for testing.")),
          method(destructorX, Binding.STATIC, null),
          method(functionX, Binding.STATIC, null)));
    Implementation implementation = new Implementation(
        ImmutableList.<ConditionalUnitReference>of(), ImmutableList.of(
          new MethodDeclaration("ClassX", procedureX),
          new MethodDeclaration("ClassX", constructorX),
          new MethodDeclaration("ClassX", destructorX),
          new MethodDeclaration("ClassX", functionX)));
    return new Unit(new UnitIdentifier("uMethodDeclarations"),
        new Interface(ImmutableList.<ConditionalUnitReference>of(),
                      ImmutableList.of(TypeDeclaration.newClass(classX))),
        implementation);
  }

  private static Unit nestedConstants()
  {
    ClassDeclaration classX = new ClassDeclaration("ClassX", null,
        ImmutableList.of(
          NestedDeclaration.newConst(Visibility.UNSPECIFIED,
              new ConstDeclaration("ConstX", "1")),
          NestedDeclaration.newConst(Visibility.PRIVATE,
              new ConstDeclaration("ConstY", "'2'",
                  summary("This is a true constant used for testing.")))));
    return interfaceOnly("uNestedConstants",
                         TypeDeclaration.newClass(classX));
  }

  private static Unit nestedTypes()
  {
    ClassDeclaration classY = new ClassDeclaration("ClassY", null,
        ImmutableList.<String>of(),
        summary("This is an empty nested class used for testing."),
        NO_ATTRIBUTES, ImmutableList.<NestedDeclaration>of());
    EnumDeclaration enumX = new EnumDeclaration("EnumX",
        summary("This is a nested enumerated type used for testing."),
        NO_ATTRIBUTES,
        ImmutableList.of(new EnumValueDeclaration("exValueX")));
    ClassDeclaration classX = new ClassDeclaration("ClassX", null,
        ImmutableList.of(
          NestedDeclaration.newType(Visibility.UNSPECIFIED,
                                    TypeDeclaration.newClass(classY)),
          NestedDeclaration.newType(Visibility.PRIVATE,
                                    TypeDeclaration.newEnum(enumX))));
    return interfaceOnly("uNestedTypes", TypeDeclaration.newClass(classX));
  }

  private static Unit properties()
  {
    ClassDeclaration classX = new ClassDeclaration("ClassX", null,
        ImmutableList.of(
          NestedDeclaration.newMember(ClassMemberDeclaration.newField(
              new FieldDeclaration("FieldX", "Integer"))),
          NestedDeclaration.newMember(ClassMemberDeclaration.newField(
              new FieldDeclaration("FieldY", "Integer"))),
          NestedDeclaration.newMember(ClassMemberDeclaration.newProperty(
              new PropertyDeclaration("PropertyX", "Integer", "FieldX", "",
                  summary("This is a property used for testing.")))),
          NestedDeclaration.newMember(ClassMemberDeclaration.newProperty(
              new PropertyDeclaration("PropertyY", "Integer", "",
                                      "FieldY"))),
          NestedDeclaration.newMember(ClassMemberDeclaration.newProperty(
              new PropertyDeclaration("PropertyXY", "Integer", "FieldY",
                                      "FieldX")))));
    return interfaceOnly("uProperties", TypeDeclaration.newClass(classX));
  }

  private static Program helloWorld()
  {
    return new Program("pHelloWorld",
        summary("This is a program used for testing."),
        ImmutableList.<String>of(),
        ImmutableList.of(ConditionalUnitReference.of("SysUtils")),
        ImmutableList.of("Greeting: string;"),
        ImmutableList.of("Greeting := 'Hello';",
                         "if Greeting <> '' then\n" +
                         "begin\n" +
                         "  WriteLn(Greeting);\n" +
                         "end;"));
  }
}
