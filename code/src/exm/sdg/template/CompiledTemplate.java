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
 * Template of a (node type, format) pair, compiled once and shared by
 * all nodes of the type
 */
public class CompiledTemplate {
  private final String typeName;
  private final String format;
  private final String text;
  private final ImmutableList<TemplateLine> lines;

  public CompiledTemplate(String typeName, String format, String text,
                          List<TemplateLine> lines) {
    this.typeName = typeName;
    this.format = format;
    this.text = text;
    this.lines = ImmutableList.copyOf(lines);
  }

  public String getTypeName() {
    return typeName;
  }

  public String getFormat() {
    return format;
  }

  /**
   * @return template text as declared
   */
  public String getText() {
    return text;
  }

  public List<TemplateLine> getLines() {
    return lines;
  }

  @Override
  public String toString() {
    return typeName + "." + format + lines;
  }
}
