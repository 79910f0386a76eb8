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
package exm.dcw.common.util;

/**
 * Letter case style used for identifiers in Delphi source code
 * @see StringUtil#toCase(String, IdentifierCase)
 * */
public enum IdentifierCase
{
  /** Any valid identifier string, left as it is */
  NONE,
  /**
   * Capitalizes the first letter of each syllable.
   * Usual for Delphi identifiers that do not refer to constants.
   */
  PASCAL,
  /**
   * Capitalizes all letters and joins syllables with an underscore.
   * Usual for Delphi identifiers that refer to constants.
   */
  SCREAMING_SNAKE;
}
