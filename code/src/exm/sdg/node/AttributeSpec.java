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
 * Declaration of a single attribute of a node type
 */
public class AttributeSpec {
  private final String name;
  private final boolean hasDefault;
  private final Object defaultValue;
  private final AttributeConverter converter;

  private AttributeSpec(String name, boolean hasDefault, Object defaultValue,
                        AttributeConverter converter) {
    this.name = name;
    this.hasDefault = hasDefault;
    this.defaultValue = defaultValue;
    this.converter = converter;
  }

  public static AttributeSpec withDefault(String name, Object defaultValue,
                                          AttributeConverter converter) {
    return new AttributeSpec(name, true, defaultValue, converter);
  }

  /**
   * Attribute without default: resolution falls back to the prototype
   */
  public static AttributeSpec withoutDefault(String name,
                                             AttributeConverter converter) {
    return new AttributeSpec(name, false, null, converter);
  }

  public String getName() {
    return name;
  }

  public boolean hasDefault() {
    return hasDefault;
  }

  public Object getDefault() {
    return defaultValue;
  }

  public AttributeConverter getConverter() {
    return converter;
  }

  public Object convert(Node node, Object value) {
    if (converter == null) {
      return value;
    }
    return converter.convert(node, name, value);
  }

  @Override
  public String toString() {
    return name + (hasDefault ? "=" + defaultValue : "");
  }
}
