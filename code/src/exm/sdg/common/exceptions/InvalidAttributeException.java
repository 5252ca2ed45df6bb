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
 * Attribute values passed to a node constructor do not match the
 * attribute table of its type
 */
public class InvalidAttributeException extends RuntimeException {

  private final String typeName;
  private final String attribute;

  public InvalidAttributeException(String typeName, String attribute,
                                   String message) {
    super(typeName + ": " + message + ": " + attribute);
    this.typeName = typeName;
    this.attribute = attribute;
  }

  public String getTypeName() {
    return typeName;
  }

  public String getAttribute() {
    return attribute;
  }

  private static final long serialVersionUID = 1L;
}
