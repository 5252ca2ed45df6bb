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

package exm.sdg.template;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One compiled template line
 */
public class TemplateLine {
  private final int lineNumber;
  private final int indentLevel;
  private final ImmutableList<Fragment> fragments;
  private final boolean hasExpansion;

  public TemplateLine(int lineNumber, List<Fragment> fragments) {
    this.lineNumber = lineNumber;
    this.fragments = ImmutableList.copyOf(fragments);
    int level = 0;
    boolean expansion = false;
    for (Fragment f: fragments) {
      if (f.kind() == Fragment.Kind.INDENT_MARKER) {
        level = ((IndentMarker)f).getLevel();
      } else if (f.kind() == Fragment.Kind.GROUP_EXPANSION) {
        expansion = true;
      }
    }
    this.indentLevel = level;
    this.hasExpansion = expansion;
  }

  /**
   * @return 1-based line number within the template
   */
  public int getLineNumber() {
    return lineNumber;
  }

  public int getIndentLevel() {
    return indentLevel;
  }

  public List<Fragment> getFragments() {
    return fragments;
  }

  /**
   * @return true if the line contains a group expansion; such a line
   *         disappears when it renders to nothing
   */
  public boolean hasExpansion() {
    return hasExpansion;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Fragment f: fragments) {
      sb.append(f.source());
    }
    return sb.toString();
  }
}
