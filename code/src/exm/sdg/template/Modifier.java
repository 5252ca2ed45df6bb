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
 * Decorations of a group expansion
 */
public enum Modifier {
  /** Before the whole expansion */
  HEAD("head"),
  /** Replaces head if the expansion is a single line */
  FRONT0("front0"),
  /** After the whole expansion */
  REAR("rear"),
  /** Replaces rear if the expansion is a single line */
  REAR0("rear0"),
  /** Between items */
  SEP("sep"),
  /** At the end of the last line of every item but the last */
  SEP_EOL("sep_eol"),
  /** Used if there are no items */
  EMPTY("empty"),
  /** Before every line of every item */
  LEAD("lead"),
  /** After every line of every item */
  TAIL("tail");

  private final String templateName;

  private Modifier(String templateName) {
    this.templateName = templateName;
  }

  public String templateName() {
    return templateName;
  }

  public static Modifier forTemplateName(String name) {
    for (Modifier m: values()) {
      if (m.templateName.equals(name)) {
        return m;
      }
    }
    return null;
  }
}
