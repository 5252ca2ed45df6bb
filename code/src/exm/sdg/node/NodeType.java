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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.sdg.common.exceptions.SDGRuntimeError;
import exm.sdg.render.LineSource;

/**
 * Immutable description of a kind of node: declared attributes,
 * children groups, templates per output format and scope policy.
 *
 * Types form a single-inheritance hierarchy.  A type built with a
 * parent starts from a copy of everything the parent declares and
 * overrides from there.
 */
public class NodeType {
  private final String name;
  private final NodeType parent;

  private final ImmutableMap<String, AttributeSpec> attributes;
  private final ImmutableList<String> frontArgs;
  private final String restArg;

  private final ImmutableList<Group> groups;
  private final Group defaultGroup;
  private final Group preferredGroup;
  private final ChildConstraint childConstraint;
  private final TrailerRule trailerRule;
  private final String defaultTrailer;

  private final Scope defaultScope;
  private final boolean inheritsScope;
  private final Scope childScope;
  private final boolean passesScope;

  private final String indentUnit;
  private final ImmutableMap<String, String> templates;
  private final ImmutableMap<String, LineSource> lineSources;

  private NodeType(Builder b) {
    this.name = b.name;
    this.parent = b.parent;
    this.attributes = ImmutableMap.copyOf(b.attributes);
    this.frontArgs = ImmutableList.copyOf(b.frontArgs);
    this.restArg = b.restArg;
    this.groups = ImmutableList.copyOf(b.groups);
    this.defaultGroup = b.defaultGroup;
    this.preferredGroup = b.preferredGroup;
    this.childConstraint = b.childConstraint;
    this.trailerRule = b.trailerRule;
    this.defaultTrailer = b.defaultTrailer;
    this.defaultScope = b.defaultScope;
    this.inheritsScope = b.inheritsScope;
    this.childScope = b.childScope;
    this.passesScope = b.passesScope;
    this.indentUnit = b.indentUnit;
    this.templates = ImmutableMap.copyOf(b.templates);
    this.lineSources = ImmutableMap.copyOf(b.lineSources);
  }

  public String getName() {
    return name;
  }

  public NodeType getParent() {
    return parent;
  }

  public boolean isSubtypeOf(NodeType other) {
    for (NodeType t = this; t != null; t = t.parent) {
      if (t == other) {
        return true;
      }
    }
    return false;
  }

  public AttributeSpec getAttribute(String attrName) {
    return attributes.get(attrName);
  }

  public boolean hasAttribute(String attrName) {
    return attributes.containsKey(attrName);
  }

  /**
   * @return declared attributes in declaration order
   */
  public Map<String, AttributeSpec> getAttributes() {
    return attributes;
  }

  public List<String> getFrontArgs() {
    return frontArgs;
  }

  /**
   * @return attribute receiving surplus positional arguments, or null
   */
  public String getRestArg() {
    return restArg;
  }

  public List<Group> getGroups() {
    return groups;
  }

  public boolean hasGroup(Group group) {
    return groups.contains(group);
  }

  public Group getDefaultGroup() {
    return defaultGroup;
  }

  /**
   * @return group a parent should put nodes of this type into when
   *         the caller names none, or null to use the parent's default
   */
  public Group getPreferredGroup() {
    return preferredGroup;
  }

  public ChildConstraint getChildConstraint() {
    return childConstraint;
  }

  public TrailerRule getTrailerRule() {
    return trailerRule;
  }

  public String getDefaultTrailer() {
    return defaultTrailer;
  }

  public Scope getDefaultScope() {
    return defaultScope;
  }

  /**
   * @return false if nodes of this type manage their own scope and
   *         ignore scope passed down from ancestors
   */
  public boolean inheritsScope() {
    return inheritsScope;
  }

  /**
   * @return scope forced onto children, or null to pass down the
   *         node's own scope
   */
  public Scope getChildScope() {
    return childScope;
  }

  /**
   * @return false if inserted children keep their own scope
   */
  public boolean passesScope() {
    return passesScope;
  }

  /**
   * @return indentation unit, or null to use the configured default
   */
  public String getIndentUnit() {
    return indentUnit;
  }

  public Map<String, String> getTemplates() {
    return templates;
  }

  public String getTemplate(String format) {
    return templates.get(format);
  }

  public LineSource getLineSource(String sourceName) {
    return lineSources.get(sourceName);
  }

  @Override
  public String toString() {
    return name;
  }

  public static class Builder {
    private final String name;
    private final NodeType parent;

    private final Map<String, AttributeSpec> attributes =
        new LinkedHashMap<String, AttributeSpec>();
    private List<String> frontArgs = new ArrayList<String>();
    private String restArg = null;

    private List<Group> groups = new ArrayList<Group>();
    private Group defaultGroup = null;
    private Group preferredGroup = null;
    private ChildConstraint childConstraint = ChildConstraints.ANY;
    private TrailerRule trailerRule = null;
    private String defaultTrailer = "";

    private Scope defaultScope = Scope.BOTH;
    private boolean inheritsScope = true;
    private Scope childScope = null;
    private boolean passesScope = true;

    private String indentUnit = null;
    private final Map<String, String> templates =
        new LinkedHashMap<String, String>();
    private final Map<String, LineSource> lineSources =
        new LinkedHashMap<String, LineSource>();

    /**
     * @param name unique type name
     * @param parent type to inherit from, null for a root type
     */
    public Builder(String name, NodeType parent) {
      if (name == null || name.isEmpty()) {
        throw new SDGRuntimeError("Node type needs a name");
      }
      this.name = name;
      this.parent = parent;
      if (parent != null) {
        attributes.putAll(parent.attributes);
        frontArgs.addAll(parent.frontArgs);
        restArg = parent.restArg;
        groups.addAll(parent.groups);
        defaultGroup = parent.defaultGroup;
        preferredGroup = parent.preferredGroup;
        childConstraint = parent.childConstraint;
        trailerRule = parent.trailerRule;
        defaultTrailer = parent.defaultTrailer;
        defaultScope = parent.defaultScope;
        inheritsScope = parent.inheritsScope;
        childScope = parent.childScope;
        passesScope = parent.passesScope;
        indentUnit = parent.indentUnit;
        templates.putAll(parent.templates);
        lineSources.putAll(parent.lineSources);
      }
    }

    public Builder attribute(String attrName, Object defaultValue) {
      return attribute(attrName, defaultValue, null);
    }

    public Builder attribute(String attrName, Object defaultValue,
                             AttributeConverter converter) {
      attributes.put(attrName,
          AttributeSpec.withDefault(attrName, defaultValue, converter));
      return this;
    }

    /**
     * Declare an attribute without default value
     */
    public Builder attributeNoDefault(String attrName,
                                      AttributeConverter converter) {
      attributes.put(attrName,
                     AttributeSpec.withoutDefault(attrName, converter));
      return this;
    }

    /**
     * Replace the list of attributes filled from positional arguments
     */
    public Builder frontArgs(String... attrNames) {
      this.frontArgs = new ArrayList<String>(Arrays.asList(attrNames));
      return this;
    }

    public Builder restArg(String attrName) {
      this.restArg = attrName;
      return this;
    }

    /**
     * Replace declared groups.  The first group becomes the default
     * group unless one is set explicitly afterwards.
     */
    public Builder groups(Group... declared) {
      this.groups = new ArrayList<Group>(Arrays.asList(declared));
      this.defaultGroup = declared.length > 0 ? declared[0] : null;
      return this;
    }

    public Builder defaultGroup(Group group) {
      this.defaultGroup = group;
      return this;
    }

    public Builder preferredGroup(Group group) {
      this.preferredGroup = group;
      return this;
    }

    public Builder childConstraint(ChildConstraint constraint) {
      this.childConstraint = constraint;
      return this;
    }

    public Builder trailerRule(TrailerRule rule) {
      this.trailerRule = rule;
      return this;
    }

    public Builder trailer(String trailer) {
      this.defaultTrailer = trailer;
      return this;
    }

    public Builder scope(Scope scope) {
      this.defaultScope = scope;
      return this;
    }

    public Builder inheritsScope(boolean inherits) {
      this.inheritsScope = inherits;
      return this;
    }

    public Builder childScope(Scope scope) {
      this.childScope = scope;
      return this;
    }

    public Builder passesScope(boolean passes) {
      this.passesScope = passes;
      return this;
    }

    public Builder indentUnit(String unit) {
      this.indentUnit = unit;
      return this;
    }

    public Builder template(String format, String text) {
      templates.put(format, text);
      return this;
    }

    public Builder lineSource(String sourceName, LineSource source) {
      lineSources.put(sourceName, source);
      return this;
    }

    public NodeType build() {
      if (defaultGroup != null && !groups.contains(defaultGroup)) {
        throw new SDGRuntimeError("Default group " + defaultGroup +
                      " of " + name + " is not declared");
      }
      for (String a: frontArgs) {
        if (!attributes.containsKey(a)) {
          throw new SDGRuntimeError("Positional argument " + a + " of " +
                      name + " is not a declared attribute");
        }
      }
      if (restArg != null && !attributes.containsKey(restArg)) {
        throw new SDGRuntimeError("Rest argument " + restArg + " of " +
                    name + " is not a declared attribute");
      }
      if (trailerRule != null &&
          !groups.containsAll(trailerRule.getGroups())) {
        throw new SDGRuntimeError("Trailer rule of " + name +
                    " names undeclared groups " + trailerRule.getGroups());
      }
      return new NodeType(this);
    }
  }

  /** Empty list for types without children */
  static final List<Node> NO_CHILDREN = Collections.emptyList();
}
