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

package exm.sdg.render;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Lists;

import exm.sdg.common.Logging;
import exm.sdg.common.Settings;
import exm.sdg.common.exceptions.RenderException;
import exm.sdg.common.util.StringUtil;
import exm.sdg.node.AttributeResolver;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.template.AttributeRef;
import exm.sdg.template.CompiledTemplate;
import exm.sdg.template.Fragment;
import exm.sdg.template.GroupExpansion;
import exm.sdg.template.KeySpec;
import exm.sdg.template.Literal;
import exm.sdg.template.Modifier;
import exm.sdg.template.Modifiers;
import exm.sdg.template.TemplateCache;
import exm.sdg.template.TemplateLine;
import exm.sdg.template.TemplateParser;

/**
 * Render node trees to lines of text.
 *
 * Rendering is lazy at the granularity of template lines: the
 * template lines of a node are expanded one at a time as the caller
 * pulls output lines.  Children referenced by an expansion are
 * rendered completely when their line is expanded.
 */
public class Renderer {
  private static final Logger logger = Logging.getSDGLogger();

  /**
   * Render with configured output width and per-type indentation
   */
  public static Iterable<String> render(Node node, String format) {
    return render(node, format, Settings.outputWidth(), null);
  }

  /**
   * @param indentUnit indentation unit for the whole tree, null to
   *                   use the unit declared by each node type
   * @return lines without line terminators.  Every call to
   *         iterator() renders the tree again.
   */
  public static Iterable<String> render(final Node node, final String format,
                          final int outputWidth, final String indentUnit) {
    return new Iterable<String>() {
      @Override
      public Iterator<String> iterator() {
        return lines(node,
                     new RenderContext(format, outputWidth, indentUnit));
      }
    };
  }

  static Iterator<String> lines(Node node, RenderContext context) {
    if (!context.isVisible(node)) {
      return Collections.<String>emptyIterator();
    }
    CompiledTemplate template = TemplateCache.lookup(node.getType(),
                                                     context.getFormat());
    if (template == null) {
      throw new RenderException(node.getId(), node.getType().getName(),
              context.getFormat(), "no template declared for format");
    }
    if (logger.isTraceEnabled()) {
      logger.trace("render " + node.getType().getName() + "#" +
                   node.getId() + " as " + context.getFormat() +
                   " at column " + context.getColumn());
    }
    return new NodeLines(node, template, context);
  }

  /**
   * Output lines of one node, expanded a template line at a time
   */
  private static class NodeLines extends AbstractIterator<String> {
    private final Node node;
    private final RenderContext context;
    private final Iterator<TemplateLine> templateLines;
    private final Deque<String> pending = new ArrayDeque<String>();

    NodeLines(Node node, CompiledTemplate template, RenderContext context) {
      this.node = node;
      this.context = context;
      this.templateLines = template.getLines().iterator();
    }

    @Override
    protected String computeNext() {
      while (pending.isEmpty()) {
        if (!templateLines.hasNext()) {
          return endOfData();
        }
        pending.addAll(expandLine(node, templateLines.next(), context));
      }
      return pending.removeFirst();
    }
  }

  private static List<String> expandLine(Node node, TemplateLine line,
                                         RenderContext context) {
    String indent = StringUtils.repeat(context.indentUnitFor(node),
                                       line.getIndentLevel());
    int lineColumn = context.getColumn() + indent.length();
    StringBuilder sb = new StringBuilder();
    for (Fragment f: line.getFragments()) {
      try {
        switch (f.kind()) {
          case INDENT_MARKER:
            break;
          case LITERAL:
            sb.append(((Literal)f).getText());
            break;
          case ATTRIBUTE:
            Object value = attributeValue(node, ((AttributeRef)f).getPath(),
                                          context);
            sb.append(stringify(value, context));
            break;
          case GROUP_EXPANSION:
            sb.append(expand(node, (GroupExpansion)f, context, lineColumn,
                             StringUtil.lastLineLength(sb)));
            break;
          default:
            throw new RenderException(node.getId(), node.getType().getName(),
                context.getFormat(), "unexpected fragment " + f.kind());
        }
      } catch (RenderException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new RenderException(node.getId(), node.getType().getName(),
            context.getFormat(),
            "line " + line.getLineNumber() + ": " + f.source(), e);
      }
    }

    String text = sb.toString();
    if (text.isEmpty() && line.hasExpansion()) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<String>();
    for (String piece: StringUtil.splitLines(text)) {
      result.add(piece.isEmpty() ? "" : indent + piece);
    }
    return result;
  }

  /**
   * One item of a group expansion
   */
  private static class Item {
    final List<String> lines;
    final boolean anchored;

    Item(List<String> lines, boolean anchored) {
      this.lines = lines;
      this.anchored = anchored;
    }
  }

  /**
   * @param lineColumn absolute column where the template line starts
   * @param offset length of the current output line before the expansion
   */
  private static String expand(Node node, GroupExpansion expansion,
        RenderContext context, int lineColumn, int offset) {
    Modifiers m = expansion.getModifiers();
    String head = evaluate(node, m.get(Modifier.HEAD), context);
    String rear = evaluate(node, m.get(Modifier.REAR), context);
    String sep = evaluate(node, m.get(Modifier.SEP), context);
    String sepEol = evaluate(node, m.get(Modifier.SEP_EOL), context);
    String lead = evaluate(node, m.get(Modifier.LEAD), context);
    String tail = evaluate(node, m.get(Modifier.TAIL), context);

    String front0 = null;
    String rear0 = null;
    if (m.isSet(Modifier.FRONT0) || m.isSet(Modifier.REAR0)) {
      front0 = m.isSet(Modifier.FRONT0) ?
                evaluate(node, m.get(Modifier.FRONT0), context) :
                head.replace("\n", "");
      rear0 = m.isSet(Modifier.REAR0) ?
                evaluate(node, m.get(Modifier.REAR0), context) :
                rear.replace("\n", "");
    }

    int contentColumn = lineColumn + StringUtil.lastLineLength(head) +
                        (head.indexOf('\n') >= 0 ? 0 : offset);
    RenderContext inner = context.at(contentColumn,
                      lead.length() + tail.length() + sep.length());

    List<Item> items = new ArrayList<Item>();
    for (KeySpec key: expansion.getKeys()) {
      collect(node, key, inner, items);
    }

    List<String> out = new ArrayList<String>();
    String pad = StringUtil.spaces(offset);
    for (int i = 0; i < items.size(); i++) {
      Item item = items.get(i);
      for (int j = 0; j < item.lines.size(); j++) {
        StringBuilder sb = new StringBuilder();
        if (j == 0 && i > 0) {
          sb.append(sep);
        }
        sb.append(lead).append(item.lines.get(j)).append(tail);
        if (j == item.lines.size() - 1 && i < items.size() - 1) {
          sb.append(sepEol);
        }
        if (item.anchored && !out.isEmpty() && sb.length() > 0) {
          sb.insert(0, pad);
        }
        out.add(sb.toString());
      }
    }

    if (out.isEmpty()) {
      return evaluate(node, m.get(Modifier.EMPTY), context);
    } else if (out.size() == 1 && front0 != null) {
      return front0 + out.get(0) + rear0;
    } else {
      return head + StringUtils.join(out, "\n") + rear;
    }
  }

  private static void collect(Node node, KeySpec key, RenderContext context,
                              List<Item> items) {
    switch (key.getKind()) {
      case NODES: {
        RenderContext childContext = context.withFormat(key.getFormat());
        if (key.isAllChildren()) {
          for (Group g: node.getType().getGroups()) {
            addNodes(node.getChildren(g), key, childContext, items);
          }
        } else if (key.getGroup() != null) {
          addNodes(node.getChildren(key.getGroup()), key, childContext,
                   items);
        } else {
          addValue(AttributeResolver.resolve(node, key.getName()), key,
                   childContext, items);
        }
        break;
      }
      case VALUES:
        addValue(attributeValue(node, key.getName(), context), key, context,
                 items);
        break;
      case SOURCE:
        LineSource source = node.getType().getLineSource(key.getName());
        for (String line: source.lines(node, context)) {
          items.add(new Item(StringUtil.splitLines(line), key.isAnchored()));
        }
        break;
      default:
        throw new RenderException(node.getId(), node.getType().getName(),
            context.getFormat(), "unexpected key kind " + key.getKind());
    }
  }

  private static void addNodes(List<Node> nodes, KeySpec key,
                               RenderContext context, List<Item> items) {
    for (Node child: nodes) {
      addNode(child, key, context, items);
    }
  }

  private static void addNode(Node child, KeySpec key,
                              RenderContext context, List<Item> items) {
    List<String> lines = Lists.newArrayList(lines(child, context));
    if (!lines.isEmpty()) {
      items.add(new Item(lines, key.isAnchored()));
    }
  }

  /**
   * Attribute values: null gives no item, collections one item per
   * non-null element, anything else a single item
   */
  private static void addValue(Object value, KeySpec key,
                               RenderContext context, List<Item> items) {
    if (value == null) {
      return;
    } else if (value instanceof Node) {
      addNode((Node)value, key, context, items);
    } else if (value instanceof Collection) {
      for (Object elem: (Collection<?>)value) {
        if (elem instanceof Node) {
          addNode((Node)elem, key, context, items);
        } else if (elem != null) {
          items.add(new Item(StringUtil.splitLines(
                    stringify(elem, context)), key.isAnchored()));
        }
      }
    } else {
      items.add(new Item(StringUtil.splitLines(stringify(value, context)),
                         key.isAnchored()));
    }
  }

  private static Object attributeValue(Node node, String path,
                                       RenderContext context) {
    if (TemplateParser.NL.equals(path)) {
      return "\n";
    } else if (TemplateParser.INDENT.equals(path)) {
      return context.indentUnitFor(node);
    }
    return AttributeResolver.resolve(node, path);
  }

  private static String evaluate(Node node, List<Fragment> fragments,
                                 RenderContext context) {
    StringBuilder sb = new StringBuilder();
    for (Fragment f: fragments) {
      if (f.kind() == Fragment.Kind.LITERAL) {
        sb.append(((Literal)f).getText());
      } else {
        assert(f.kind() == Fragment.Kind.ATTRIBUTE) : f;
        sb.append(stringify(attributeValue(node,
                      ((AttributeRef)f).getPath(), context), context));
      }
    }
    return sb.toString();
  }

  /**
   * Null gives empty text, nodes their rendering joined by newlines,
   * collections their elements joined by a space
   */
  private static String stringify(Object value, RenderContext context) {
    if (value == null) {
      return "";
    } else if (value instanceof Node) {
      return StringUtils.join(lines((Node)value, context), "\n");
    } else if (value instanceof Collection) {
      List<String> parts = new ArrayList<String>();
      for (Object elem: (Collection<?>)value) {
        parts.add(stringify(elem, context));
      }
      return StringUtils.join(parts, ' ');
    }
    return value.toString();
  }
}
