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

import exm.sdg.common.Settings;
import exm.sdg.node.Node;
import exm.sdg.node.Scope;

/**
 * Position and parameters of one step of a render.  Immutable,
 * a fresh context is derived for every nested expansion.
 */
public class RenderContext {
  /** Smallest width handed to wrapping line sources */
  public static final int MIN_WRAP_WIDTH = 4;

  private final String format;
  private final Scope pass;
  private final int outputWidth;
  private final String indentUnit;
  private final int column;
  private final int decorationWidth;

  /**
   * @param indentUnit unit for the whole tree, or null to use the unit
   *                   of each node's type
   */
  public RenderContext(String format, int outputWidth, String indentUnit) {
    this(format, Formats.passFor(format), outputWidth, indentUnit, 0, 0);
  }

  private RenderContext(String format, Scope pass, int outputWidth,
                        String indentUnit, int column, int decorationWidth) {
    this.format = format;
    this.pass = pass;
    this.outputWidth = outputWidth;
    this.indentUnit = indentUnit;
    this.column = column;
    this.decorationWidth = decorationWidth;
  }

  public String getFormat() {
    return format;
  }

  public Scope getPass() {
    return pass;
  }

  public int getOutputWidth() {
    return outputWidth;
  }

  /**
   * @return absolute column where the current content starts
   */
  public int getColumn() {
    return column;
  }

  /**
   * @return width of decorations added to each produced line
   */
  public int getDecorationWidth() {
    return decorationWidth;
  }

  public String indentUnitFor(Node node) {
    if (indentUnit != null) {
      return indentUnit;
    }
    String unit = node.getType().getIndentUnit();
    return unit != null ? unit : Settings.indentUnit();
  }

  /**
   * @return width available to wrapped content at this position
   */
  public int wrapWidth() {
    return Math.max(outputWidth - column - decorationWidth -
                    Settings.wrapDecoration(), MIN_WRAP_WIDTH);
  }

  public boolean isVisible(Node node) {
    return node.getScope().visibleIn(pass);
  }

  public RenderContext at(int newColumn, int newDecorationWidth) {
    return new RenderContext(format, pass, outputWidth, indentUnit,
                             newColumn, newDecorationWidth);
  }

  public RenderContext withFormat(String newFormat) {
    if (newFormat == null || newFormat.equals(format)) {
      return this;
    }
    return new RenderContext(newFormat, Formats.passFor(newFormat),
                   outputWidth, indentUnit, column, decorationWidth);
  }
}
