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
 * Expansion of children or attribute values into a (possibly
 * multi-line) block: <code>%(:modifiers:keys:)</code>
 */
public class GroupExpansion extends Fragment {
  private final Modifiers modifiers;
  private final ImmutableList<KeySpec> keys;

  public GroupExpansion(int column, Modifiers modifiers,
                        List<KeySpec> keys) {
    super(column);
    this.modifiers = modifiers;
    this.keys = ImmutableList.copyOf(keys);
  }

  public Modifiers getModifiers() {
    return modifiers;
  }

  public List<KeySpec> getKeys() {
    return keys;
  }

  @Override
  public Kind kind() {
    return Kind.GROUP_EXPANSION;
  }

  @Override
  public String source() {
    StringBuilder sb = new StringBuilder("%(:");
    sb.append(modifiers.source()).append(':');
    for (int i = 0; i < keys.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(keys.get(i).source());
    }
    sb.append(":)");
    return sb.toString();
  }
}
