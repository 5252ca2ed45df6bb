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

/**
 * Piece of a compiled template line
 */
public abstract class Fragment {

  public static enum Kind {
    INDENT_MARKER,
    LITERAL,
    ATTRIBUTE,
    GROUP_EXPANSION
  }

  /** 1-based column of fragment in trimmed template line */
  private final int column;

  protected Fragment(int column) {
    this.column = column;
  }

  public abstract Kind kind();

  public int getColumn() {
    return column;
  }

  /**
   * @return template text this fragment was compiled from
   */
  public abstract String source();

  @Override
  public String toString() {
    return source();
  }
}
