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

import org.apache.commons.lang3.StringUtils;

import exm.dcw.common.exceptions.DCWRuntimeError;

/**
 * Current nesting depth of written source code.
 * Every increase on a code path is matched by an equal decrease
 * before that path returns, so the level is back at zero when a
 * top-level render finishes.
 * */
public class Indentation
{
  /** Spaces per indentation level */
  public static final int INDENT_WIDTH = 2;

  private static final String SINGLE_INDENT =
                                StringUtils.repeat(' ', INDENT_WIDTH);

  private int level = 0;

  /** Number of shifts towards deeper / shallower levels */
  private int increases = 0;
  private int decreases = 0;

  /**
   * @return prefix for lines at the given level
   */
  public static String prefix(int level)
  {
    return StringUtils.repeat(SINGLE_INDENT, level);
  }

  /**
   * @return prefix for lines at the current level
   */
  public String prefix()
  {
    return prefix(level);
  }

  public int getLevel()
  {
    return level;
  }

  /**
   * Change the level by a signed amount
   */
  public void shift(int delta)
  {
    if (level + delta < 0) {
      throw new DCWRuntimeError("indentation: unbalanced decrease from " +
                                level + " by " + (-delta));
    }
    level += delta;
    if (delta > 0) {
      increases++;
    } else if (delta < 0) {
      decreases++;
    }
  }

  public void increase()
  {
    shift(1);
  }

  public void decrease()
  {
    shift(-1);
  }

  public int getIncreases()
  {
    return increases;
  }

  public int getDecreases()
  {
    return decreases;
  }

  public void reset()
  {
    level = 0;
    increases = 0;
    decreases = 0;
  }
}
