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

public class ConditionalAttributeAnnotation
                                    extends Conditional<AttributeAnnotation>
{
  public ConditionalAttributeAnnotation(AttributeAnnotation element,
        AttributeAnnotation alternative, CompilationCondition condition)
  {
    super(element, alternative, condition);
  }

  public static ConditionalAttributeAnnotation of(String attribute)
  {
    return new ConditionalAttributeAnnotation(
                      new AttributeAnnotation(attribute), null, null);
  }

  /**
   * @param symbol preprocessor symbol
   * @param attribute used if symbol is defined, may be null
   * @param alternative used if symbol is not defined, may be null
   */
  public static ConditionalAttributeAnnotation ifDefined(String symbol,
                                    String attribute, String alternative)
  {
    return new ConditionalAttributeAnnotation(
        attribute == null ? null : new AttributeAnnotation(attribute),
        alternative == null ? null : new AttributeAnnotation(alternative),
        new CompilationCondition(symbol));
  }

  public static List<ConditionalAttributeAnnotation> wrap(
                                    List<AttributeAnnotation> annotations)
  {
    List<ConditionalAttributeAnnotation> result =
      new ArrayList<ConditionalAttributeAnnotation>(annotations.size());
    for (AttributeAnnotation annotation: annotations) {
      result.add(new ConditionalAttributeAnnotation(annotation, null, null));
    }
    return result;
  }
}
