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

/**
 * Preprocessor symbol that switches conditionally compiled code
 * */
public class CompilationCondition
{
  public final String symbol;

  public CompilationCondition(String symbol)
  {
    this.symbol = Preconditions.checkNotNull(symbol);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (!(obj instanceof CompilationCondition))
      return false;
    return symbol.equals(((CompilationCondition) obj).symbol);
  }

  @Override
  public int hashCode()
  {
    return symbol.hashCode();
  }

  @Override
  public String toString()
  {
    return symbol;
  }
}
