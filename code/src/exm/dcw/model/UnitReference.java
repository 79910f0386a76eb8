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
 * Entry of a uses clause
 * */
public class UnitReference implements Comparable<UnitReference>
{
  private final UnitIdentifier unit;

  public UnitReference(UnitIdentifier unit)
  {
    this.unit = Preconditions.checkNotNull(unit);
  }

  public static UnitReference parse(String dottedName)
  {
    return new UnitReference(UnitIdentifier.parse(dottedName));
  }

  public UnitIdentifier getUnit()
  {
    return unit;
  }

  /**
   * Lexicographic order of the dotted path
   * @see UsesClauses#compare(UnitReference, UnitReference)
   */
  @Override
  public int compareTo(UnitReference other)
  {
    return UsesClauses.compare(this, other);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    if (!(obj instanceof UnitReference))
      return false;
    return unit.equals(((UnitReference) obj).unit);
  }

  @Override
  public int hashCode()
  {
    return unit.hashCode();
  }

  @Override
  public String toString()
  {
    return unit.toString();
  }
}
