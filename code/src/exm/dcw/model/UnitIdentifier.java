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

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Name of a unit, either generic ("SysUtils") or
 * fully qualified with namespace segments ("System.SysUtils")
 * */
public class UnitIdentifier
{
  private final ImmutableList<String> namespace;
  private final String unit;

  public UnitIdentifier(List<String> namespace, String unit)
  {
    this.namespace = ImmutableList.copyOf(namespace);
    this.unit = Preconditions.checkNotNull(unit);
  }

  public UnitIdentifier(String unit)
  {
    this(ImmutableList.<String>of(), unit);
  }

  /**
   * @param dottedName e.g. "System.Generics.Collections"
   * @return identifier with all but the last segment as namespace
   */
  public static UnitIdentifier parse(String dottedName)
  {
    List<String> segments = Splitter.on('.').splitToList(dottedName);
    int last = segments.size() - 1;
    return new UnitIdentifier(segments.subList(0, last), segments.get(last));
  }

  public List<String> getNamespace()
  {
    return namespace;
  }

  public String getUnit()
  {
    return unit;
  }

  /**
   * @return namespace segments followed by the unit name
   */
  public List<String> path()
  {
    return ImmutableList.<String>builder().addAll(namespace).add(unit).build();
  }

  /**
   * @return dotted identifier as written in Delphi source code
   */
  public String toSourceCode()
  {
    return Joiner.on('.').join(path());
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    if (!(obj instanceof UnitIdentifier))
      return false;
    UnitIdentifier other = (UnitIdentifier) obj;
    return namespace.equals(other.namespace) && unit.equals(other.unit);
  }

  @Override
  public int hashCode()
  {
    return Objects.hashCode(namespace, unit);
  }

  @Override
  public String toString()
  {
    return toSourceCode();
  }
}
