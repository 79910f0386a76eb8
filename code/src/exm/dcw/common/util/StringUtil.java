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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Joiner;

import exm.dcw.common.exceptions.DCWRuntimeError;

public class StringUtil {

  /**
   * Separators between syllables of a human-readable identifier:
   * an underscore ("my_name"), a dash ("my-name"),
   * a lowercase letter followed by an uppercase letter ("MyName"),
   * a digit followed by a letter ("MyTop5Names")
   */
  private static final Pattern SYLLABLE_SEPARATOR = Pattern.compile(
        "_"
      + "|-"
      + "|(?<=[a-z])(?=[A-Z])"
      + "|(?<=[0-9])(?=[a-zA-Z])");

  private static final Pattern LINE_SEPARATOR =
                                    Pattern.compile("\\r\\n?|\\n");

  /** Any non-empty line; only \n ends a line */
  private static final Pattern NON_EMPTY_LINE =
                                    Pattern.compile("^.+$",
                                    Pattern.MULTILINE | Pattern.UNIX_LINES);

  /**
   * Split a human-readable identifier into syllables.
   * Empty segments (e.g. from doubled separators) are dropped.
   * @param identifier
   * @return syllables in order of appearance
   */
  public static List<String> splitSyllables(String identifier) {
    List<String> syllables = new ArrayList<String>();
    for (String syllable: SYLLABLE_SEPARATOR.split(identifier)) {
      if (syllable.length() != 0) {
        syllables.add(syllable);
      }
    }
    return syllables;
  }

  /**
   * Convert a human-readable identifier to a specific case
   * by splitting it into syllables and recombining them
   * @param identifier
   * @param identifierCase
   * @return equivalent identifier in the requested case
   */
  public static String toCase(String identifier,
                              IdentifierCase identifierCase) {
    switch (identifierCase) {
      case NONE:
        return identifier;
      case PASCAL: {
        StringBuilder sb = new StringBuilder(identifier.length());
        for (String syllable: splitSyllables(identifier)) {
          sb.append(StringUtils.capitalize(syllable.substring(0, 1)));
          sb.append(StringUtils.lowerCase(syllable.substring(1)));
        }
        return sb.toString();
      }
      case SCREAMING_SNAKE: {
        List<String> upper = new ArrayList<String>();
        for (String syllable: splitSyllables(identifier)) {
          upper.add(StringUtils.upperCase(syllable));
        }
        return Joiner.on('_').join(upper);
      }
      default:
        throw new DCWRuntimeError("Unknown identifier case: "
                                  + identifierCase);
    }
  }

  /**
   * Convert all line separators (\r\n, \r or \n) to the same form
   */
  public static String convertLineSeparators(String text,
                                             String lineSeparator) {
    return LINE_SEPARATOR.matcher(text).replaceAll(
                              Matcher.quoteReplacement(lineSeparator));
  }

  /**
   * Prefix every non-empty line with a string.
   * Empty lines are left alone.
   */
  public static String prefixLines(String lines, String prefix) {
    if (prefix.length() == 0) {
      return lines;
    }
    return NON_EMPTY_LINE.matcher(lines).replaceAll(
                              Matcher.quoteReplacement(prefix) + "$0");
  }
}
