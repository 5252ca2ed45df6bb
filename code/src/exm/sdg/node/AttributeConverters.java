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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Conversions shared by node catalogs
 */
public class AttributeConverters {

  /**
   * Stringify non-null values
   */
  public static final AttributeConverter TO_STRING = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      return value == null ? null : value.toString();
    }
  };

  /**
   * Stringify and strip leading/trailing whitespace
   */
  public static final AttributeConverter TRIMMED = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      return value == null ? null : value.toString().trim();
    }
  };

  /**
   * Turn single values into a one-element list, copy collections
   */
  public static final AttributeConverter LIST = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      List<Object> result = new ArrayList<Object>();
      if (value instanceof Collection) {
        result.addAll((Collection<?>)value);
      } else if (value instanceof Object[]) {
        for (Object o: (Object[])value) {
          result.add(o);
        }
      } else if (value != null) {
        result.add(value);
      }
      return result;
    }
  };

  /**
   * Map a truthy value to the given keyword text, everything else
   * to null.  Used for modifiers like "static ".
   */
  public static AttributeConverter flag(final String text) {
    return new AttributeConverter() {
      @Override
      public Object convert(Node node, String name, Object value) {
        if (value == null || Boolean.FALSE.equals(value) ||
            "".equals(value)) {
          return null;
        }
        return text;
      }
    };
  }
}
