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
 * Rendering of a node failed.  Lines already handed to the caller
 * are not retracted.
 */
public class RenderException extends RuntimeException {

  private final long nodeId;
  private final String typeName;
  private final String format;
  private final String fragment;

  public RenderException(long nodeId, String typeName, String format,
                         String fragment, Throwable cause) {
    super("Error rendering " + typeName + "#" + nodeId + " as " + format +
          (fragment != null ? " at " + fragment : "") + ": " +
          cause.getMessage(), cause);
    this.nodeId = nodeId;
    this.typeName = typeName;
    this.format = format;
    this.fragment = fragment;
  }

  public RenderException(long nodeId, String typeName, String format,
                         String message) {
    super("Error rendering " + typeName + "#" + nodeId + " as " + format +
          ": " + message);
    this.nodeId = nodeId;
    this.typeName = typeName;
    this.format = format;
    this.fragment = null;
  }

  public long getNodeId() {
    return nodeId;
  }

  public String getTypeName() {
    return typeName;
  }

  public String getFormat() {
    return format;
  }

  /**
   * @return description of the failing fragment, or null
   */
  public String getFragment() {
    return fragment;
  }

  private static final long serialVersionUID = 1L;
}
