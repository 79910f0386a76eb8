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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableList;

import exm.dcw.common.exceptions.DCWRuntimeError;
import exm.dcw.model.CompilationCondition;
import exm.dcw.model.ConditionalUnitReference;
import exm.dcw.model.Implementation;
import exm.dcw.model.Interface;
import exm.dcw.model.TypeDeclaration;
import exm.dcw.model.Unit;
import exm.dcw.model.UnitIdentifier;
import exm.dcw.model.UnitReference;

/**
 * Directive protocol for code that depends on a preprocessor symbol
 */
public class ConditionalEmissionTest {

  private static final CompilationCondition FOO =
                                    new CompilationCondition("FOO");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static CodeFragment lineFragment(final DelphiSourceCodeWriter writer,
                                           final String text) {
    return new CodeFragment() {
      @Override
      public void append() {
        writer.line(text);
      }
    };
  }

  @Test
  public void testUnconditional() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    writer.appendConditionally(null, lineFragment(writer, "A;"), null);
    assertEquals("A;\n", writer.toString());
  }

  @Test
  public void testUnconditionalIgnoresAlternative() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    writer.appendConditionally(null, lineFragment(writer, "A;"),
                               lineFragment(writer, "B;"));
    assertEquals("A;\n", writer.toString());
  }

  @Test
  public void testIfDefinedOnly() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    writer.appendConditionally(FOO, lineFragment(writer, "A;"), null);
    assertEquals("{$IFDEF FOO}\nA;\n{$ENDIF}\n", writer.toString());
  }

  @Test
  public void testIfDefinedWithAlternative() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    writer.appendConditionally(FOO, lineFragment(writer, "A;"),
                               lineFragment(writer, "B;"));
    assertEquals("{$IFDEF FOO}\nA;\n{$ELSE}\nB;\n{$ENDIF}\n",
                 writer.toString());
  }

  @Test
  public void testIfNotDefinedOnly() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    writer.appendConditionally(FOO, null, lineFragment(writer, "B;"));
    assertEquals("{$IFNDEF FOO}\nB;\n{$ENDIF}\n", writer.toString());
  }

  @Test
  public void testDirectivesStayInFirstColumn() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    writer.getIndentation().increase();
    writer.getIndentation().increase();
    writer.appendConditionally(FOO, lineFragment(writer, "A;"),
                               lineFragment(writer, "B;"));
    assertEquals("{$IFDEF FOO}\n    A;\n{$ELSE}\n    B;\n{$ENDIF}\n",
                 writer.toString());
  }

  @Test
  public void testConditionalUsesEntries() {
    Unit unit = new Unit(new UnitIdentifier("uTest"),
        new Interface(ImmutableList.of(
            ConditionalUnitReference.ifDefined("FOO",
                UnitReference.parse("uReferenced"),
                UnitReference.parse("uReferenced2")),
            ConditionalUnitReference.of("System.SysUtils")),
            ImmutableList.<TypeDeclaration>of()),
        Implementation.empty());
    String code = DelphiSourceCodeWriter.toSourceCode(unit);
    assertTrue(code, code.contains("uses\n" +
                                   "{$IFDEF FOO}\n" +
                                   "  uReferenced,\n" +
                                   "{$ELSE}\n" +
                                   "  uReferenced2,\n" +
                                   "{$ENDIF}\n" +
                                   "  System.SysUtils;\n"));
  }

  @Test
  public void testLastConditionalUsesEntryEndsClause() {
    Unit unit = new Unit(new UnitIdentifier("uTest"),
        new Interface(ImmutableList.of(
            ConditionalUnitReference.ifDefined("FOO", null,
                UnitReference.parse("uReferenced2"))),
            ImmutableList.<TypeDeclaration>of()),
        Implementation.empty());
    String code = DelphiSourceCodeWriter.toSourceCode(unit);
    assertTrue(code, code.contains("uses\n" +
                                   "{$IFNDEF FOO}\n" +
                                   "  uReferenced2;\n" +
                                   "{$ENDIF}\n"));
  }

  @Test
  public void testConditionWithoutElementsFails() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    exception.expect(DCWRuntimeError.class);
    exception.expectMessage("FOO");
    writer.appendConditionally(FOO, null, null);
  }

  @Test
  public void testUnconditionalWithoutElementFails() {
    DelphiSourceCodeWriter writer = new DelphiSourceCodeWriter();
    exception.expect(DCWRuntimeError.class);
    writer.appendConditionally(null, null, lineFragment(writer, "B;"));
  }
}
