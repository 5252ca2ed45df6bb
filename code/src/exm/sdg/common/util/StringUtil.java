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

package exm.sdg.common.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

public class StringUtil {

  public static String spaces(int c) {
    return StringUtils.repeat(' ', c);
  }

  /**
   * @return length of the text after the last newline in sb
   */
  public static int lastLineLength(CharSequence sb) {
    for (int i = sb.length() - 1; i >= 0; i--) {
      if (sb.charAt(i) == '\n') {
        return sb.length() - i - 1;
      }
    }
    return sb.length();
  }

  /**
   * Split at newlines.  Unlike String.split(), empty trailing
   * lines are kept, so "a\n" gives ["a", ""].
   */
  public static List<String> splitLines(String s) {
    List<String> result = new ArrayList<String>();
    int start = 0;
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == '\n') {
        result.add(s.substring(start, i));
        start = i + 1;
      }
    }
    result.add(s.substring(start));
    return result;
  }

  /**
   * Split text into whitespace-separated words, dropping empty words
   */
  public static List<String> words(String s) {
    List<String> result = new ArrayList<String>();
    for (String word: StringUtils.split(s)) {
      result.add(word);
    }
    return result;
  }
}
