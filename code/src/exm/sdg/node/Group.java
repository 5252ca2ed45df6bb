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

package exm.sdg.node;

/**
 * Names of children groups.  Each node type declares the ordered
 * subset of groups it supports.
 */
public enum Group {
  BODY,
  DECL,
  HEAD,
  TAIL,
  THEN,
  ELSEIF,
  ELSE,
  CASE,
  DEFAULT;

  /**
   * @return name used to refer to this group in templates
   */
  public String templateName() {
    return name().toLowerCase();
  }

  /**
   * @return group for template name, or null if no such group
   */
  public static Group forTemplateName(String name) {
    for (Group g: values()) {
      if (g.templateName().equals(name)) {
        return g;
      }
    }
    return null;
  }
}
