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
 * Output stream a node belongs to
 */
public enum Scope {
  /** Only rendered in header passes */
  HEADER,
  /** Only rendered in body passes */
  BODY,
  /** Rendered in every pass */
  BOTH;

  /**
   * @param pass scope of the rendering pass, BOTH for unfiltered passes
   * @return true if a node with this scope takes part in the pass
   */
  public boolean visibleIn(Scope pass) {
    return pass == BOTH || this == BOTH || this == pass;
  }
}
