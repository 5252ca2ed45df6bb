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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import exm.sdg.common.Settings;
import exm.sdg.common.exceptions.TemplateCompileException;
import exm.sdg.node.AttributeResolver;
import exm.sdg.node.Group;
import exm.sdg.node.NodeType;

/**
 * Recursive descent parser for node templates.
 *
 * <pre>
 * line       := marker* content
 * content    := (literal | '%%' | '\n' | directive)*
 * directive  := '%(' path ')' | '%(:' modifiers ':' keys ':)'
 * modifiers  := [ name '=' value ( '¡' name '=' value )* ]
 * value      := (literal | '%%' | '\n' | '%(' path ')')*
 * keys       := key ( ',' key )*
 * key        := ['>'] ('*' | '.' | '@') path
 * path       := name ( '.' name )*
 * </pre>
 *
 * Every name used is checked against the node type, so that a
 * template that compiles can only fail at render time because of
 * attribute values.
 */
public class TemplateParser {

  public static final char MODIFIER_SEPARATOR = '¡';

  /** Built-ins provided by the renderer rather than the node */
  public static final String NL = "NL";
  public static final String INDENT = "indent";

  private final NodeType type;
  private final String format;
  private final char marker;

  /** State for current line */
  private String text;
  private int pos;
  private int lineNumber;

  public TemplateParser(NodeType type, String format) {
    this.type = type;
    this.format = format;
    this.marker = Settings.indentMarker();
  }

  public CompiledTemplate parse(String template) {
    if (template == null) {
      throw new TemplateCompileException(type.getName(), format, 0, 0,
                                         "no template text");
    }
    List<TemplateLine> lines = new ArrayList<TemplateLine>();
    String rawLines[] = template.trim().split("\n", -1);
    for (int i = 0; i < rawLines.length; i++) {
      lines.add(parseLine(i + 1, rawLines[i].trim()));
    }
    return new CompiledTemplate(type.getName(), format, template, lines);
  }

  private TemplateLine parseLine(int number, String line) {
    this.text = line;
    this.pos = 0;
    this.lineNumber = number;

    List<Fragment> fragments = new ArrayList<Fragment>();
    int level = 0;
    while (pos < text.length() && text.charAt(pos) == marker) {
      level++;
      pos++;
    }
    if (level > 0) {
      fragments.add(new IndentMarker(level));
    }
    fragments.addAll(parseContent(false));
    return new TemplateLine(number, fragments);
  }

  /**
   * @param inModifier if true, stop at end of modifier value and
   *                   reject group expansions
   */
  private List<Fragment> parseContent(boolean inModifier) {
    List<Fragment> result = new ArrayList<Fragment>();
    StringBuilder literal = new StringBuilder();
    int literalStart = pos;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (inModifier && (c == ':' || c == MODIFIER_SEPARATOR)) {
        break;
      } else if (c == '%') {
        char next = peek(1);
        if (next == '%') {
          literal.append('%');
          pos += 2;
        } else if (next == '(') {
          flushLiteral(result, literal, literalStart);
          result.add(parseDirective(inModifier));
          literalStart = pos;
        } else {
          throw error(pos, "expected '(' or '%' after '%'");
        }
      } else if (c == '\\' && peek(1) == 'n') {
        literal.append('\n');
        pos += 2;
      } else {
        literal.append(c);
        pos++;
      }
    }
    flushLiteral(result, literal, literalStart);
    return result;
  }

  private void flushLiteral(List<Fragment> result, StringBuilder literal,
                            int start) {
    if (literal.length() > 0) {
      result.add(new Literal(start + 1, literal.toString()));
      literal.setLength(0);
    }
  }

  private Fragment parseDirective(boolean inModifier) {
    int start = pos;
    assert(text.startsWith("%(", pos));
    pos += 2;
    if (peek(0) == ':') {
      if (inModifier) {
        throw error(start, "group expansion not allowed in modifier value");
      }
      return parseExpansion(start);
    }
    int pathStart = pos;
    String path = parsePath();
    expect(')');
    checkAttribute(pathStart, path, true);
    return new AttributeRef(start + 1, path);
  }

  private GroupExpansion parseExpansion(int start) {
    expect(':');
    Modifiers modifiers = parseModifiers();
    expect(':');
    List<KeySpec> keys = parseKeys();
    expect(':');
    expect(')');
    return new GroupExpansion(start + 1, modifiers, keys);
  }

  private Modifiers parseModifiers() {
    Map<Modifier, List<Fragment>> values =
        new EnumMap<Modifier, List<Fragment>>(Modifier.class);
    if (peek(0) == ':') {
      return new Modifiers(values);
    }
    while (true) {
      int nameStart = pos;
      String name = parseName();
      Modifier m = Modifier.forTemplateName(name);
      if (m == null) {
        throw error(nameStart, "unknown modifier '" + name + "'");
      }
      if (values.containsKey(m)) {
        throw error(nameStart, "modifier '" + name + "' given twice");
      }
      expect('=');
      values.put(m, parseContent(true));
      if (peek(0) == MODIFIER_SEPARATOR) {
        pos++;
      } else {
        break;
      }
    }
    return new Modifiers(values);
  }

  private List<KeySpec> parseKeys() {
    List<KeySpec> keys = new ArrayList<KeySpec>();
    while (true) {
      skipSpaces();
      int keyStart = pos;
      boolean anchored = false;
      if (peek(0) == '>') {
        anchored = true;
        pos++;
      }
      KeySpec.Kind kind = KeySpec.Kind.forPrefix(peek(0));
      if (kind == null) {
        throw error(pos, "expected key kind '*', '.' or '@'");
      }
      pos++;
      int nameStart = pos;
      keys.add(checkKey(keyStart, nameStart, kind, anchored, parsePath()));
      skipSpaces();
      if (peek(0) == ',') {
        pos++;
      } else {
        break;
      }
    }
    return keys;
  }

  private KeySpec checkKey(int keyStart, int nameStart, KeySpec.Kind kind,
                           boolean anchored, String path) {
    switch (kind) {
      case NODES: {
        String name = path;
        String childFormat = null;
        int dot = path.indexOf('.');
        if (dot >= 0) {
          name = path.substring(0, dot);
          childFormat = path.substring(dot + 1);
          if (childFormat.indexOf('.') >= 0) {
            throw error(nameStart, "bad format name '" + childFormat + "'");
          }
        }
        if (name.equals(KeySpec.ALL_CHILDREN)) {
          return new KeySpec(kind, name, anchored, childFormat, null);
        }
        Group g = Group.forTemplateName(name);
        if (g != null && type.hasGroup(g)) {
          return new KeySpec(kind, name, anchored, childFormat, g);
        } else if (type.hasAttribute(name)) {
          return new KeySpec(kind, name, anchored, childFormat, null);
        }
        throw error(nameStart, "undeclared group or attribute '" +
                               name + "'");
      }
      case VALUES:
        checkAttribute(nameStart, path, false);
        return new KeySpec(kind, path, anchored, null, null);
      case SOURCE:
        if (type.getLineSource(path) == null) {
          throw error(nameStart, "undeclared line source '" + path + "'");
        }
        return new KeySpec(kind, path, anchored, null, null);
      default:
        throw error(keyStart, "unknown key kind " + kind);
    }
  }

  /**
   * Check first segment of attribute path against node type
   */
  private void checkAttribute(int at, String path,
                              boolean allowRenderBuiltins) {
    int dot = path.indexOf('.');
    String first = dot < 0 ? path : path.substring(0, dot);
    if (allowRenderBuiltins && (first.equals(NL) || first.equals(INDENT))) {
      if (dot >= 0) {
        throw error(at, "'" + first + "' has no attributes");
      }
      return;
    }
    if (!type.hasAttribute(first) && !AttributeResolver.isBuiltin(first)) {
      throw error(at, "undeclared attribute '" + first + "'");
    }
  }

  private String parsePath() {
    StringBuilder sb = new StringBuilder(parseName());
    while (peek(0) == '.') {
      pos++;
      sb.append('.').append(parseName());
    }
    return sb.toString();
  }

  private String parseName() {
    int start = pos;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      boolean ok = (c == '_' || Character.isLetter(c)) ||
                   (pos > start && Character.isDigit(c));
      if (!ok) {
        break;
      }
      pos++;
    }
    if (pos == start) {
      throw error(start, "expected name");
    }
    return text.substring(start, pos);
  }

  private void skipSpaces() {
    while (peek(0) == ' ') {
      pos++;
    }
  }

  private void expect(char c) {
    if (peek(0) != c) {
      throw error(pos, "expected '" + c + "'" +
          (pos < text.length() ? " but found '" + text.charAt(pos) + "'"
                               : " but found end of line"));
    }
    pos++;
  }

  /**
   * @return character at offset from current position, 0 past end
   */
  private char peek(int offset) {
    int i = pos + offset;
    return i < text.length() ? text.charAt(i) : 0;
  }

  private TemplateCompileException error(int at, String message) {
    return new TemplateCompileException(type.getName(), format, lineNumber,
                                        at + 1, message + ": " + text);
  }
}
