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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Trailer assignment over a union of groups: the last child in the
 * union gets the trailer text, all earlier children get an empty
 * trailer.  Reapplied after every insertion into one of the groups.
 */
public class TrailerRule {
  private final String trailer;
  private final ImmutableList<Group> groups;

  public TrailerRule(String trailer, Group... groups) {
    this.trailer = trailer;
    this.groups = ImmutableList.copyOf(groups);
  }

  public String getTrailer() {
    return trailer;
  }

  public List<Group> getGroups() {
    return groups;
  }

  public boolean covers(Group group) {
    return groups.contains(group);
  }

  public void apply(Node node) {
    Node last = null;
    for (Group g: groups) {
      for (Node child: node.getChildren(g)) {
        child.setTrailer("");
        last = child;
      }
    }
    if (last != null) {
      last.setTrailer(trailer);
    }
  }
}
