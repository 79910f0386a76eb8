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

/**
 * Source code element that is compiled unconditionally, only if a
 * preprocessor symbol is defined, or in one of two forms switched by
 * that symbol.
 *
 * Without a condition only the element is used.  With a condition the
 * element is compiled if the symbol is defined and the alternative
 * otherwise; either may be absent, but not both.
 * Invalid combinations are representable and are rejected when written.
 * @param <T> type of the wrapped element
 * */
public abstract class Conditional<T>
{
  private final T element;
  private final T alternative;
  private final CompilationCondition condition;

  protected Conditional(T element, T alternative,
                        CompilationCondition condition)
  {
    this.element = element;
    this.alternative = alternative;
    this.condition = condition;
  }

  /**
   * @return element compiled if the condition holds,
   *         or unconditionally.  May be null
   */
  public T getElement()
  {
    return element;
  }

  /**
   * @return element compiled if the condition does not hold. May be null
   */
  public T getAlternative()
  {
    return alternative;
  }

  /**
   * @return null if unconditional
   */
  public CompilationCondition getCondition()
  {
    return condition;
  }

  public boolean isConditional()
  {
    return condition != null;
  }
}
