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

package exm.sdg.render;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.sdg.common.util.StringUtil;

/**
 * Greedy packing of tokens into lines of limited width
 */
public class TokenWrapper {

  /**
   * Pack tokens into lines, joined by a single space.  A token longer
   * than width is put on a line of its own.
   * @param width maximum line width
   */
  public static List<String> wrap(Iterable<String> tokens, int width) {
    List<String> lines = new ArrayList<String>();
    List<String> pieces = new ArrayList<String>();
    int lineWidth = 0;
    for (String token: tokens) {
      int added = pieces.isEmpty() ? token.length() : token.length() + 1;
      if (!pieces.isEmpty() && lineWidth + added > width) {
        lines.add(StringUtils.join(pieces, ' '));
        pieces.clear();
        lineWidth = 0;
        added = token.length();
      }
      pieces.add(token);
      lineWidth += added;
    }
    if (!pieces.isEmpty()) {
      lines.add(StringUtils.join(pieces, ' '));
    }
    return lines;
  }

  /**
   * Wrap running text at word boundaries
   */
  public static List<String> wrapText(String text, int width) {
    return wrap(StringUtil.words(text), width);
  }
}
