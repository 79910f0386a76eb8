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
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class UsesClausesTest {

  private static List<UnitReference> references(String... dottedNames) {
    List<UnitReference> result = new ArrayList<UnitReference>();
    for (String dottedName: dottedNames) {
      result.add(UnitReference.parse(dottedName));
    }
    return result;
  }

  @Test
  public void testNamespaceSegmentsCompareFirst() {
    List<UnitReference> uses = references("System.SysUtils", "System",
                                          "System.Generics.Collections");
    UsesClauses.sort(uses);
    assertEquals(references("System", "System.Generics.Collections",
                            "System.SysUtils"), uses);
  }

  @Test
  public void testSortIsIdempotent() {
    List<UnitReference> uses = references("b", "Vcl.Forms", "a.b.c", "a");
    UsesClauses.sort(uses);
    List<UnitReference> once = new ArrayList<UnitReference>(uses);
    UsesClauses.sort(uses);
    assertEquals(once, uses);
  }

  @Test
  public void testCompare() {
    assertTrue(UsesClauses.compare(UnitReference.parse("A"),
                                   UnitReference.parse("A.B")) < 0);
    assertTrue(UsesClauses.compare(UnitReference.parse("A.Z"),
                                   UnitReference.parse("B")) < 0);
    assertEquals(0, UsesClauses.compare(UnitReference.parse("A.B"),
                                        UnitReference.parse("A.B")));
  }

  @Test
  public void testParse() {
    UnitIdentifier id = UnitIdentifier.parse("System.Generics.Collections");
    assertEquals(Arrays.asList("System", "Generics"), id.getNamespace());
    assertEquals("Collections", id.getUnit());
    assertEquals("System.Generics.Collections", id.toSourceCode());

    UnitIdentifier plain = UnitIdentifier.parse("uEnum");
    assertTrue(plain.getNamespace().isEmpty());
    assertEquals(new UnitIdentifier("uEnum"), plain);
  }

  @Test
  public void testConditionalSortUsesElementOrAlternative() {
    ConditionalUnitReference c = ConditionalUnitReference.of("c");
    ConditionalUnitReference b = ConditionalUnitReference.ifDefined("FOO",
                                      null, UnitReference.parse("b"));
    ConditionalUnitReference a = ConditionalUnitReference.ifDefined("BAR",
                  UnitReference.parse("a"), UnitReference.parse("z"));
    List<ConditionalUnitReference> uses =
              new ArrayList<ConditionalUnitReference>(Arrays.asList(c, b, a));
    UsesClauses.sortConditional(uses);
    assertEquals(Arrays.asList(a, b, c), uses);
  }

  @Test
  public void testConditionalSortIsStable() {
    ConditionalUnitReference first = ConditionalUnitReference.ifDefined(
                            "FOO", UnitReference.parse("x"), null);
    ConditionalUnitReference second = ConditionalUnitReference.of("x");
    List<ConditionalUnitReference> uses =
          new ArrayList<ConditionalUnitReference>(
                                      Arrays.asList(first, second));
    UsesClauses.sortConditional(uses);
    assertEquals(Arrays.asList(first, second), uses);
  }
}
