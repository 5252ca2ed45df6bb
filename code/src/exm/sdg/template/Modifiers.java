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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Modifier values of one group expansion.  Values are sequences of
 * literals and simple attribute references, evaluated per render.
 */
public class Modifiers {
  private final Map<Modifier, ImmutableList<Fragment>> values;

  Modifiers(Map<Modifier, List<Fragment>> values) {
    this.values = new EnumMap<Modifier, ImmutableList<Fragment>>(
                                                        Modifier.class);
    for (Map.Entry<Modifier, List<Fragment>> e: values.entrySet()) {
      this.values.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
    }
  }

  public boolean isSet(Modifier m) {
    return values.containsKey(m);
  }

  /**
   * @return fragments of modifier, empty if not set
   */
  public List<Fragment> get(Modifier m) {
    List<Fragment> v = values.get(m);
    if (v == null) {
      return Collections.emptyList();
    }
    return v;
  }

  public String source() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Modifier, ImmutableList<Fragment>> e: values.entrySet()) {
      if (sb.length() > 0) {
        sb.append(TemplateParser.MODIFIER_SEPARATOR);
      }
      sb.append(e.getKey().templateName()).append('=');
      for (Fragment f: e.getValue()) {
        sb.append(f.source());
      }
    }
    return sb.toString();
  }
}
