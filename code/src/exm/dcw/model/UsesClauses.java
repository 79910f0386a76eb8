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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.Ordering;

/**
 * Ordering of uses clause entries.
 * Unit references are ordered lexicographically by their dotted path
 * (namespace segments, then unit name), so a reference sorts before
 * any reference that extends its path: "System" before
 * "System.Generics.Collections" before "System.SysUtils".
 *
 * The writer never sorts; callers sort before building the tree.
 * */
public class UsesClauses
{
  private static final Ordering<Iterable<String>> PATH_ORDER =
                          Ordering.<String>natural().lexicographical();

  private static final Ordering<UnitReference> KEY_ORDER =
                          Ordering.<UnitReference>natural().nullsFirst();

  public static final Comparator<ConditionalUnitReference>
      CONDITIONAL_ORDER = new Comparator<ConditionalUnitReference>() {
    @Override
    public int compare(ConditionalUnitReference a,
                       ConditionalUnitReference b) {
      return KEY_ORDER.compare(sortKey(a), sortKey(b));
    }
  };

  /**
   * @return negative, zero or positive as a sorts before, together with
   *         or after b
   */
  public static int compare(UnitReference a, UnitReference b)
  {
    return PATH_ORDER.compare(a.getUnit().path(), b.getUnit().path());
  }

  /**
   * Sort a uses clause in place.  The sort is stable, so references
   * with equal paths keep their relative order.
   */
  public static void sort(List<UnitReference> usesClause)
  {
    Collections.sort(usesClause);
  }

  /**
   * Sort a uses clause of conditional entries in place, keyed by the
   * entry's element, or its alternative if it has no element.
   * The condition does not take part in the order.
   */
  public static void sortConditional(
                              List<ConditionalUnitReference> usesClause)
  {
    Collections.sort(usesClause, CONDITIONAL_ORDER);
  }

  private static UnitReference sortKey(ConditionalUnitReference reference)
  {
    if (reference.getElement() != null) {
      return reference.getElement();
    }
    return reference.getAlternative();
  }
}
