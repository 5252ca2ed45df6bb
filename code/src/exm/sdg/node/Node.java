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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.sdg.common.exceptions.InvalidAttributeException;
import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.common.exceptions.SDGRuntimeError;
import exm.sdg.render.Formats;
import exm.sdg.render.Renderer;

/**
 * A node of a document tree.  What a node stores and how it renders
 * is described by its {@link NodeType}; subclasses only add
 * convenience constructors and accessors.
 */
public class Node {

  public static final String NAME = "name";

  /** Root of the type hierarchy */
  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Node", null)
        .attribute(NAME, "")
        .groups(Group.BODY)
        .template(Formats.STR_FORMAT,
                  "%(type) %(name)\n" +
                  ">%(::*children:)")
        .template(Formats.REPR_FORMAT,
                  "%(type) (%(name)" +
                  "%(:head=%(NL)¡lead=%(indent)¡sep_eol=,¡rear=%(NL)" +
                  ":*children:))")
        .build());

  private final NodeType type;
  private final long id;

  /** Attribute values stored on this node, after conversion */
  private final Map<String, Object> attributes =
      new LinkedHashMap<String, Object>();

  private final ListMultimap<Group, Node> children =
      ArrayListMultimap.create();

  private Node parent = null;
  private Node prototype = null;

  private Scope scope;
  private boolean scopePinned = false;
  private String trailer;

  public Node(NodeType type) {
    this(type, new Object[0], null);
  }

  /**
   * @param type node type
   * @param positional values for the type's positional attributes,
   *          surplus values go to its rest attribute
   * @param keywords named attribute values, may be null
   * @throws InvalidAttributeException if the values do not match
   *          the attribute table of the type
   */
  public Node(NodeType type, Object[] positional, Map<String, ?> keywords) {
    if (type == null) {
      throw new SDGRuntimeError("Node created without type");
    }
    this.type = type;
    this.id = NodeIds.next();
    this.scope = type.getDefaultScope();
    this.trailer = type.getDefaultTrailer();
    initAttributes(positional, keywords);
    if (getName().isEmpty()) {
      attributes.put(NAME, "__" + type.getName() + "_" + id);
    }
  }

  private void initAttributes(Object[] positional, Map<String, ?> keywords) {
    Map<String, Object> values = new LinkedHashMap<String, Object>();
    List<String> front = type.getFrontArgs();
    int i = 0;
    for (; i < positional.length && i < front.size(); i++) {
      values.put(front.get(i), positional[i]);
    }
    if (i < positional.length) {
      String rest = type.getRestArg();
      if (rest == null) {
        throw new InvalidAttributeException(type.getName(),
            String.valueOf(positional.length),
            "too many positional arguments, expected at most " +
            front.size());
      }
      values.put(rest, new ArrayList<Object>(
          Arrays.asList(positional).subList(i, positional.length)));
    }

    if (keywords != null) {
      for (Map.Entry<String, ?> e: keywords.entrySet()) {
        if (values.containsKey(e.getKey())) {
          throw new InvalidAttributeException(type.getName(), e.getKey(),
              "multiple values for attribute");
        }
        values.put(e.getKey(), e.getValue());
      }
    }

    for (String a: front) {
      if (!values.containsKey(a) && !type.getAttribute(a).hasDefault()) {
        throw new InvalidAttributeException(type.getName(), a,
                                            "missing positional argument");
      }
    }

    for (Map.Entry<String, Object> e: values.entrySet()) {
      setAttribute(e.getKey(), e.getValue());
    }
  }

  public NodeType getType() {
    return type;
  }

  public long getId() {
    return id;
  }

  public String getName() {
    Object name = attributes.get(NAME);
    if (name == null) {
      AttributeSpec spec = type.getAttribute(NAME);
      name = spec == null ? null : spec.getDefault();
    }
    return name == null ? "" : name.toString();
  }

  /**
   * Store an attribute value, running the type's conversion
   * @throws InvalidAttributeException if attribute is not declared
   */
  public void setAttribute(String attrName, Object value) {
    AttributeSpec spec = type.getAttribute(attrName);
    if (spec == null) {
      throw new InvalidAttributeException(type.getName(), attrName,
                                          "unknown attribute");
    }
    attributes.put(attrName, spec.convert(this, value));
  }

  public boolean hasOwnAttribute(String attrName) {
    return attributes.containsKey(attrName);
  }

  public Object getOwnAttribute(String attrName) {
    return attributes.get(attrName);
  }

  /**
   * Resolve through own values, type defaults and prototype chain
   */
  public Object getAttribute(String path) {
    return AttributeResolver.resolve(this, path);
  }

  public Node getPrototype() {
    return prototype;
  }

  public void setPrototype(Node prototype) {
    for (Node p = prototype; p != null; p = p.prototype) {
      if (p == this) {
        throw new SDGRuntimeError("Prototype cycle through " + getName());
      }
    }
    this.prototype = prototype;
  }

  public Node getParent() {
    return parent;
  }

  public String getTrailer() {
    return trailer;
  }

  public void setTrailer(String trailer) {
    this.trailer = trailer;
  }

  public Scope getScope() {
    return scope;
  }

  void setScope(Scope scope) {
    this.scope = scope;
  }

  public boolean isScopePinned() {
    return scopePinned;
  }

  void setScopePinned(boolean pinned) {
    this.scopePinned = pinned;
  }

  /**
   * Set scope of this node and pass it down to its descendants
   */
  public void updateScope(Scope newScope) {
    ScopePropagator.updateScope(this, newScope);
  }

  /**
   * Set scope of this node and shield it from later ancestor updates
   */
  public void pinScope(Scope newScope) {
    ScopePropagator.pinScope(this, newScope);
  }

  /**
   * Insert child into the group preferred by its type, or the default
   * group of this node
   */
  public Node insert(Node child) throws InvalidChildException {
    return insert(child, null, -1);
  }

  public Node insert(Node child, Group group) throws InvalidChildException {
    return insert(child, group, -1);
  }

  /**
   * @param child node to insert; null is ignored
   * @param group target group, null to select automatically
   * @param index position within the group, negative to append
   * @return this, for chaining
   */
  public Node insert(Node child, Group group, int index)
      throws InvalidChildException {
    if (child == null) {
      return this;
    }
    Group target = group != null ? group : selectGroup(child);
    if (target == null) {
      throw new InvalidChildException(this, child, null,
                        type.getName() + " does not take children");
    }
    if (!type.hasGroup(target)) {
      throw new InvalidChildException(this, child, target,
                        "group not declared by " + type.getName());
    }
    if (child.parent != null) {
      throw new InvalidChildException(this, child, target,
                        "already a child of " + child.parent.getName());
    }
    for (Node n = this; n != null; n = n.parent) {
      if (n == child) {
        throw new InvalidChildException(this, child, target,
                                        "insertion would create a cycle");
      }
    }
    type.getChildConstraint().check(this, child, target);

    List<Node> list = children.get(target);
    if (index < 0) {
      list.add(child);
    } else if (index <= list.size()) {
      list.add(index, child);
    } else {
      throw new InvalidChildException(this, child, target,
          "index " + index + " out of range, group has " + list.size());
    }
    child.parent = this;
    ScopePropagator.inherit(this, child);

    TrailerRule rule = type.getTrailerRule();
    if (rule != null && rule.covers(target)) {
      rule.apply(this);
    }
    return this;
  }

  /**
   * Insert each child in order, see {@link #insert(Node)}
   */
  public Node add(Node... nodes) throws InvalidChildException {
    for (Node child: nodes) {
      insert(child);
    }
    return this;
  }

  private Group selectGroup(Node child) {
    Group preferred = child.getType().getPreferredGroup();
    if (preferred != null && type.hasGroup(preferred)) {
      return preferred;
    }
    return type.getDefaultGroup();
  }

  /**
   * @return read-only view of the children in group
   */
  public List<Node> getChildren(Group group) {
    if (!type.hasGroup(group)) {
      return NodeType.NO_CHILDREN;
    }
    return Collections.unmodifiableList(children.get(group));
  }

  /**
   * @return all children in declared group order
   */
  public List<Node> allChildren() {
    List<Node> result = new ArrayList<Node>();
    for (Group g: type.getGroups()) {
      result.addAll(children.get(g));
    }
    return result;
  }

  /**
   * Find a child by name
   * @param transitive if true, search all descendants depth first
   * @return the child, or null if none has that name
   */
  public Node findChild(String childName, boolean transitive) {
    for (Node c: allChildren()) {
      if (c.getName().equals(childName)) {
        return c;
      }
    }
    if (transitive) {
      for (Node c: allChildren()) {
        Node found = c.findChild(childName, true);
        if (found != null) {
          return found;
        }
      }
    }
    return null;
  }

  /**
   * @return rendering in repr_format, children nested in parentheses
   */
  public String repr() {
    return StringUtils.join(Renderer.render(this, Formats.REPR_FORMAT)
                                    .iterator(), "\n");
  }

  /**
   * Render in str_format
   */
  @Override
  public String toString() {
    return StringUtils.join(Renderer.render(this, Formats.STR_FORMAT)
                                    .iterator(), "\n");
  }
}
