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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.base.Joiner;

import exm.dcw.common.Logging;
import exm.dcw.common.exceptions.DCWRuntimeError;
import exm.dcw.common.util.StringUtil;
import exm.dcw.model.AnnotationComment;
import exm.dcw.model.AttributeAnnotation;
import exm.dcw.model.ClassDeclaration;
import exm.dcw.model.ClassMemberDeclaration;
import exm.dcw.model.CompilationCondition;
import exm.dcw.model.Conditional;
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
import exm.dcw.model.UnitReference;
import exm.dcw.model.Visibility;

/**
 * Writes Delphi source code for a unit or program model.
 *
 * Walks the model tree and appends to a single buffer, tracking the
 * nesting depth in an {@link Indentation}.  Every non-empty line is
 * prefixed with the indentation of the level it is written at;
 * blank lines and compiler directives are never indented.
 *
 * An instance may render several trees one after the other, but must
 * not be shared between threads.
 * */
public class DelphiSourceCodeWriter
{
  /** File name extension (without leading dot) for unit source files */
  public static final String UNIT_SOURCE_FILE_EXTENSION = "pas";
  /** File name extension (without leading dot) for program source files */
  public static final String PROGRAM_SOURCE_FILE_EXTENSION = "pas";

  private static final String LINE_SEPARATOR = "\n";
  private static final String COMMENT_PREFIX = "/// ";

  private final Logger logger = Logging.getDCWLogger();

  private final StringBuilder sb = new StringBuilder(2048);
  private final Indentation indentation = new Indentation();

  public static String toSourceCode(Unit unit)
  {
    return new DelphiSourceCodeWriter().renderUnit(unit);
  }

  public static String toSourceCode(Program program)
  {
    return new DelphiSourceCodeWriter().renderProgram(program);
  }

  /**
   * @return complete source code of the unit
   */
  public String renderUnit(Unit unit)
  {
    reset();
    logger.debug("Writing unit " + unit.getHeading().toSourceCode());
    appendComment(unit.getComment());
    line("unit " + unit.getHeading().toSourceCode() + ";");
    blankLine();
    appendIncludeFiles(unit.getIncludeFiles());
    appendCompatibilityMode();
    appendInterface(unit.getInterface());
    appendImplementation(unit.getImplementation());
    line("end.");
    return sb.toString();
  }

  /**
   * @return complete source code of the program
   */
  public String renderProgram(Program program)
  {
    reset();
    logger.debug("Writing program " + program.getHeading());
    appendComment(program.getComment());
    line("program " + program.getHeading() + ";");
    blankLine();
    appendIncludeFiles(program.getIncludeFiles());
    appendCompatibilityMode();
    appendUsesClause(program.getUsesClause());
    if (!program.getVariables().isEmpty()) {
      line("var");
      indentation.increase();
      for (String variable: program.getVariables()) {
        code(variable);
      }
      indentation.decrease();
      blankLine();
    }
    line("begin");
    indentation.increase();
    for (String statement: program.getStatements()) {
      code(statement);
    }
    indentation.decrease();
    line("end.");
    return sb.toString();
  }

  /**
   * @return code written by the last render
   */
  @Override
  public String toString()
  {
    return sb.toString();
  }

  Indentation getIndentation()
  {
    return indentation;
  }

  private void reset()
  {
    sb.setLength(0);
    indentation.reset();
  }

  /**
   * Append one line at the current indentation
   */
  void line(String text)
  {
    if (text.length() != 0) {
      sb.append(indentation.prefix());
      sb.append(text);
    }
    sb.append(LINE_SEPARATOR);
  }

  private void blankLine()
  {
    sb.append(LINE_SEPARATOR);
  }

  /**
   * Compiler directives always start at the first column
   */
  private void directive(String text)
  {
    sb.append(text);
    sb.append(LINE_SEPARATOR);
  }

  /**
   * Append raw, possibly multi-line source code, shifting every
   * non-empty line to the current indentation
   */
  void code(String lines)
  {
    String normalized = StringUtil.convertLineSeparators(lines,
                                                         LINE_SEPARATOR);
    sb.append(StringUtil.prefixLines(normalized, indentation.prefix()));
    if (!normalized.endsWith(LINE_SEPARATOR)) {
      sb.append(LINE_SEPARATOR);
    }
  }

  private void appendComment(AnnotationComment comment)
  {
    if (comment == null) {
      return;
    }
    for (String commentLine: comment.getLines()) {
      line(COMMENT_PREFIX + commentLine);
    }
  }

  private void appendIncludeFiles(List<String> includeFiles)
  {
    if (includeFiles.isEmpty()) {
      return;
    }
    for (String includeFile: includeFiles) {
      directive("{$INCLUDE " + quoteFileName(includeFile) + "}");
    }
    blankLine();
  }

  private static String quoteFileName(String fileName)
  {
    if (fileName.contains(" ")) {
      return "'" + fileName + "'";
    }
    return fileName;
  }

  /**
   * FPC only accepts Delphi syntax in Delphi mode
   */
  private void appendCompatibilityMode()
  {
    directive("{$IFDEF FPC}");
    indentation.increase();
    line("{$MODE DELPHI}");
    indentation.decrease();
    directive("{$ENDIF}");
    blankLine();
  }

  private void appendInterface(Interface section)
  {
    logger.trace("interface section...");
    line("interface");
    blankLine();
    appendUsesClause(section.getUsesClause());
    List<TypeDeclaration> declarations = section.getDeclarations();
    if (declarations.isEmpty()) {
      return;
    }
    line("type");
    indentation.increase();
    for (TypeDeclaration declaration: declarations) {
      appendTypeDeclaration(declaration);
      blankLine();
    }
    indentation.decrease();
  }

  private void appendImplementation(Implementation section)
  {
    logger.trace("implementation section...");
    line("implementation");
    blankLine();
    appendUsesClause(section.getUsesClause());
    for (MethodDeclaration method: section.getDeclarations()) {
      appendMethodDeclaration(method);
      blankLine();
    }
  }

  /**
   * Entries are separated by commas, the last one ends the clause.
   * An empty clause writes nothing.
   */
  private void appendUsesClause(List<ConditionalUnitReference> usesClause)
  {
    if (usesClause.isEmpty()) {
      return;
    }
    line("uses");
    indentation.increase();
    for (int i = 0; i < usesClause.size(); i++) {
      final String terminator = (i == usesClause.size() - 1) ? ";" : ",";
      appendConditional(usesClause.get(i),
                        new ElementAppender<UnitReference>() {
        @Override
        public void append(UnitReference reference) {
          line(reference.getUnit().toSourceCode() + terminator);
        }
      });
    }
    indentation.decrease();
    blankLine();
  }

  private void appendAttributes(
                      List<ConditionalAttributeAnnotation> attributes)
  {
    for (ConditionalAttributeAnnotation attribute: attributes) {
      appendConditional(attribute,
                        new ElementAppender<AttributeAnnotation>() {
        @Override
        public void append(AttributeAnnotation annotation) {
          line("[" + annotation.attribute + "]");
        }
      });
    }
  }

  /**
   * Writes one element of a conditional wrapper.
   * @see #appendConditionally(CompilationCondition, CodeFragment,
   *                           CodeFragment)
   */
  private <T> void appendConditional(Conditional<T> conditional,
                                     ElementAppender<T> appender)
  {
    appendConditionally(conditional.getCondition(),
                        fragment(appender, conditional.getElement()),
                        fragment(appender, conditional.getAlternative()));
  }

  private static <T> CodeFragment fragment(final ElementAppender<T> appender,
                                           final T element)
  {
    if (element == null) {
      return null;
    }
    return new CodeFragment() {
      @Override
      public void append() {
        appender.append(element);
      }
    };
  }

  /**
   * Write code that is present unconditionally, only if a symbol is
   * defined, or in two forms switched by the symbol.
   * @param condition null for unconditional code
   * @param primary written if the symbol is defined (or unconditionally),
   *                may be null if there is a condition
   * @param alternative written if the symbol is not defined, may be null
   * @throws DCWRuntimeError if nothing would be written
   */
  void appendConditionally(CompilationCondition condition,
                           CodeFragment primary, CodeFragment alternative)
  {
    if (condition == null) {
      if (primary == null) {
        throw new DCWRuntimeError("conditional element: " +
                                  "unconditional element is missing");
      }
      primary.append();
    } else if (primary != null) {
      directive("{$IFDEF " + condition.symbol + "}");
      primary.append();
      if (alternative != null) {
        directive("{$ELSE}");
        alternative.append();
      }
      directive("{$ENDIF}");
    } else if (alternative != null) {
      directive("{$IFNDEF " + condition.symbol + "}");
      alternative.append();
      directive("{$ENDIF}");
    } else {
      throw new DCWRuntimeError("conditional element: " +
                  "neither element nor alternative for " + condition.symbol);
    }
  }

  private void appendTypeDeclaration(TypeDeclaration declaration)
  {
    switch (declaration.getKind()) {
      case CLASS:
        appendClass(declaration.getClassDeclaration());
        break;
      case ENUM:
        appendEnum(declaration.getEnumDeclaration());
        break;
      case INTERFACE:
        appendInterfaceType(declaration.getInterfaceDeclaration());
        break;
      default:
        throw new DCWRuntimeError("Unknown type declaration kind: " +
                                  declaration.getKind());
    }
  }

  private void appendClass(ClassDeclaration declaration)
  {
    appendComment(declaration.getComment());
    appendAttributes(declaration.getAttributes());
    List<String> heritage = new ArrayList<String>();
    if (StringUtils.isNotEmpty(declaration.getAncestor())) {
      heritage.add(declaration.getAncestor());
    }
    heritage.addAll(declaration.getInterfaces());
    String header = declaration.getName() + " = class";
    if (!heritage.isEmpty()) {
      header += "(" + Joiner.on(", ").join(heritage) + ")";
    }
    line(header);
    indentation.increase();
    boolean first = true;
    for (NestedDeclaration nested: declaration.getNestedDeclarations()) {
      if (!first) {
        blankLine();
      }
      first = false;
      appendNestedDeclaration(nested);
    }
    indentation.decrease();
    line("end;");
  }

  private void appendNestedDeclaration(NestedDeclaration nested)
  {
    String prefix = declarationPrefix(nested.getVisibility());
    switch (nested.getKind()) {
      case TYPE:
        line(prefix + "type");
        indentation.increase();
        appendTypeDeclaration(nested.getNestedType());
        indentation.decrease();
        break;
      case CONST: {
        ConstDeclaration constant = nested.getNestedConst();
        appendComment(constant.comment);
        line(prefix + "const " + constant.name + " = " + constant.value +
             ";");
        break;
      }
      case MEMBER:
        appendClassMember(prefix, nested.getMember());
        break;
      default:
        throw new DCWRuntimeError("Unknown nested declaration kind: " +
                                  nested.getKind());
    }
  }

  private void appendClassMember(String prefix,
                                 ClassMemberDeclaration member)
  {
    switch (member.getKind()) {
      case METHOD: {
        // Class methods line up with the class header
        MethodInterfaceDeclaration method = member.getMethod();
        indentation.decrease();
        appendComment(method.getComment());
        appendAttributes(member.getAttributes());
        line(prefix + methodInterface(method));
        indentation.increase();
        break;
      }
      case FIELD: {
        FieldDeclaration field = member.getField();
        appendComment(field.comment);
        appendAttributes(member.getAttributes());
        line(prefix + "var " + field.name + ": " + field.type + ";");
        break;
      }
      case PROPERTY: {
        PropertyDeclaration property = member.getProperty();
        appendComment(property.comment);
        appendAttributes(member.getAttributes());
        line(prefix + property(property));
        break;
      }
      default:
        throw new DCWRuntimeError("Unknown class member kind: " +
                                  member.getKind());
    }
  }

  private void appendEnum(EnumDeclaration declaration)
  {
    appendComment(declaration.getComment());
    appendAttributes(declaration.getAttributes());
    line(declaration.getName() + " = (");
    indentation.increase();
    List<EnumValueDeclaration> values = declaration.getValues();
    for (int i = 0; i < values.size(); i++) {
      EnumValueDeclaration value = values.get(i);
      if (i > 0) {
        blankLine();
      }
      appendComment(value.comment);
      String ordinality = value.ordinality == null ? ""
                                              : " = " + value.ordinality;
      String separator = (i == values.size() - 1) ? "" : ",";
      line(value.name + ordinality + separator);
    }
    indentation.decrease();
    line(");");
  }

  private void appendInterfaceType(InterfaceTypeDeclaration declaration)
  {
    appendComment(declaration.getComment());
    appendAttributes(declaration.getAttributes());
    String header = declaration.getName() + " = interface";
    if (StringUtils.isNotEmpty(declaration.getAncestor())) {
      header += "(" + declaration.getAncestor() + ")";
    }
    line(header);
    indentation.increase();
    line("['{" + declaration.getGuid() + "}']");
    boolean first = true;
    for (InterfaceMemberDeclaration member: declaration.getMembers()) {
      if (!first) {
        blankLine();
      }
      first = false;
      appendInterfaceMember(member);
    }
    indentation.decrease();
    line("end;");
  }

  private void appendInterfaceMember(InterfaceMemberDeclaration member)
  {
    switch (member.getKind()) {
      case METHOD: {
        MethodInterfaceDeclaration method = member.getMethod();
        appendComment(method.getComment());
        appendAttributes(member.getAttributes());
        line(methodInterface(method));
        break;
      }
      case PROPERTY: {
        PropertyDeclaration property = member.getProperty();
        appendComment(property.comment);
        appendAttributes(member.getAttributes());
        line(property(property));
        break;
      }
      default:
        throw new DCWRuntimeError("Unknown interface member kind: " +
                                  member.getKind());
    }
  }

  private void appendMethodDeclaration(MethodDeclaration method)
  {
    line(prototype(method.getPrototype(), method.getClassName()) + ";");
    if (!method.getLocalDeclarations().isEmpty()) {
      line("var");
      indentation.increase();
      for (String declaration: method.getLocalDeclarations()) {
        code(declaration);
      }
      indentation.decrease();
    }
    line("begin");
    indentation.increase();
    for (String statement: method.getStatements()) {
      code(statement);
    }
    indentation.decrease();
    line("end;");
  }

  private static String methodInterface(MethodInterfaceDeclaration method)
  {
    return prototype(method.getPrototype(), null) + ";" +
           bindingSuffix(method.getBinding());
  }

  private static String property(PropertyDeclaration property)
  {
    StringBuilder result = new StringBuilder();
    result.append("property " + property.name + ": " + property.type);
    if (property.readSpecifier.length() != 0) {
      result.append(" read " + property.readSpecifier);
    }
    if (property.writeSpecifier.length() != 0) {
      result.append(" write " + property.writeSpecifier);
    }
    result.append(";");
    return result.toString();
  }

  /**
   * @param className owning class for a defining declaration,
   *                  null for an interface declaration
   * @return prototype without trailing semicolon
   */
  static String prototype(Prototype prototype, String className)
  {
    StringBuilder result = new StringBuilder();
    result.append(prototypeKeyword(prototype.getKind()));
    result.append(' ');
    if (className != null) {
      result.append(className);
      result.append('.');
    }
    result.append(prototype.getName());
    List<Parameter> parameters = prototype.getParameters();
    if (!parameters.isEmpty()) {
      List<String> declarations = new ArrayList<String>(parameters.size());
      for (Parameter parameter: parameters) {
        declarations.add(parameter.name + ": " + parameter.type);
      }
      result.append("(");
      result.append(Joiner.on("; ").join(declarations));
      result.append(")");
    }
    if (prototype.getKind() == Prototype.Kind.FUNCTION) {
      if (prototype.getReturnType() == null) {
        throw new DCWRuntimeError("function " + prototype.getName() +
                                  " has no return type");
      }
      result.append(": ");
      result.append(prototype.getReturnType());
    }
    return result.toString();
  }

  private static String prototypeKeyword(Prototype.Kind kind)
  {
    switch (kind) {
      case PROCEDURE:
        return "procedure";
      case CONSTRUCTOR:
        return "constructor";
      case DESTRUCTOR:
        return "destructor";
      case FUNCTION:
        return "function";
      default:
        throw new DCWRuntimeError("Unknown prototype kind: " + kind);
    }
  }

  /**
   * @return directive written after the declaration, possibly empty
   */
  private static String bindingSuffix(Binding binding)
  {
    switch (binding) {
      case STATIC:
        return "";
      case VIRTUAL:
        return " virtual;";
      case OVERRIDE:
        return " override;";
      default:
        throw new DCWRuntimeError("Unknown method binding: " + binding);
    }
  }

  /**
   * @return visibility keyword and a space, or nothing if unspecified
   */
  static String declarationPrefix(Visibility visibility)
  {
    switch (visibility) {
      case UNSPECIFIED:
        return "";
      case PRIVATE:
        return "private ";
      case PROTECTED:
        return "protected ";
      case PUBLIC:
        return "public ";
      default:
        throw new DCWRuntimeError("Unknown visibility: " + visibility);
    }
  }

  /**
   * Writes a single element of a conditional wrapper
   */
  private static interface ElementAppender<T>
  {
    public void append(T element);
  }
}
