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

import java.util.ArrayList;
import java.util.List;

public class ConditionalUnitReference extends Conditional<UnitReference>
{
  public ConditionalUnitReference(UnitReference element,
              UnitReference alternative, CompilationCondition condition)
  {
    super(element, alternative, condition);
  }

  public static ConditionalUnitReference of(UnitReference element)
  {
    return new ConditionalUnitReference(element, null, null);
  }

  public static ConditionalUnitReference of(String dottedName)
  {
    return of(UnitReference.parse(dottedName));
  }

  /**
   * @param symbol preprocessor symbol
   * @param element used if symbol is defined, may be null
   * @param alternative used if symbol is not defined, may be null
   */
  public static ConditionalUnitReference ifDefined(String symbol,
                  UnitReference element, UnitReference alternative)
  {
    return new ConditionalUnitReference(element, alternative,
                                        new CompilationCondition(symbol));
  }

  public static List<ConditionalUnitReference> wrap(
                                          List<UnitReference> references)
  {
    List<ConditionalUnitReference> result =
            new ArrayList<ConditionalUnitReference>(references.size());
    for (UnitReference reference: references) {
      result.add(of(reference));
    }
    return result;
  }
}
