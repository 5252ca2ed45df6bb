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
 * No value for an attribute path anywhere in the prototype chain
 */
public class AttributeNotFoundException extends RuntimeException {

  private final String path;
  private final String typeName;
  private final long nodeId;

  public AttributeNotFoundException(String path, String typeName,
                                    long nodeId) {
    super("Attribute not found: " + path + " in " + typeName + "#" + nodeId);
    this.path = path;
    this.typeName = typeName;
    this.nodeId = nodeId;
  }

  public String getPath() {
    return path;
  }

  public String getTypeName() {
    return typeName;
  }

  public long getNodeId() {
    return nodeId;
  }

  private static final long serialVersionUID = 1L;
}
