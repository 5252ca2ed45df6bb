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

package exm.sdg.common.exceptions;

/**
 * Malformed template declaration.  Raised when the template
 * of a (type, format) pair is compiled, never at render time.
 */
public class TemplateCompileException extends RuntimeException {

  private final String typeName;
  private final String format;
  private final int line;
  private final int column;

  /**
   * @param line 1-based template line, 0 if not applicable
   * @param column 1-based column within the trimmed template line,
   *               0 if not applicable
   */
  public TemplateCompileException(String typeName, String format,
                                  int line, int column, String message) {
    super(typeName + "." + format +
          (line > 0 ? ":" + line + ":" + (column > 0 ? column + ":" : "")
                    : ":") +
          " " + message);
    this.typeName = typeName;
    this.format = format;
    this.line = line;
    this.column = column;
  }

  public String getTypeName() {
    return typeName;
  }

  public String getFormat() {
    return format;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  private static final long serialVersionUID = 1L;
}
