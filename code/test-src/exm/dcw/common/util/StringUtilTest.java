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

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class StringUtilTest {

  @Test
  public void testSplitSyllables() {
    assertEquals(Arrays.asList("My", "Top5", "Names"),
                 StringUtil.splitSyllables("MyTop5Names"));
    assertEquals(Arrays.asList("my", "example", "Name5", "Tag"),
                 StringUtil.splitSyllables("my-example_Name5Tag"));
    assertEquals(Arrays.asList("a", "b"),
                 StringUtil.splitSyllables("__a--b_"));
  }

  @Test
  public void testPascalCase() {
    assertEquals("MyExampleName5Tag",
        StringUtil.toCase("my-example_Name5Tag", IdentifierCase.PASCAL));
    assertEquals("HttpServer",
        StringUtil.toCase("HTTP_SERVER", IdentifierCase.PASCAL));
  }

  @Test
  public void testScreamingSnakeCase() {
    assertEquals("MY_EXAMPLE_NAME5_TAG",
        StringUtil.toCase("my-example_Name5Tag",
                          IdentifierCase.SCREAMING_SNAKE));
    assertEquals("MY_TOP5_NAMES",
        StringUtil.toCase("MyTop5Names", IdentifierCase.SCREAMING_SNAKE));
  }

  @Test
  public void testNoCase() {
    assertEquals("my-example_Name5Tag",
        StringUtil.toCase("my-example_Name5Tag", IdentifierCase.NONE));
  }

  @Test
  public void testConvertLineSeparators() {
    assertEquals("a\nb\nc\n\nd",
        StringUtil.convertLineSeparators("a\r\nb\rc\n\r\nd", "\n"));
    assertEquals("a\r\nb",
        StringUtil.convertLineSeparators("a\nb", "\r\n"));
  }

  @Test
  public void testPrefixLines() {
    assertEquals("  a\n\n  b\n",
                 StringUtil.prefixLines("a\n\nb\n", "  "));
    assertEquals("$x", StringUtil.prefixLines("x", "$"));
    assertEquals("a\nb", StringUtil.prefixLines("a\nb", ""));
  }
}
