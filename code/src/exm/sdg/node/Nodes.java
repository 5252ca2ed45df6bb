package exm.sdg.node;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic construction of nodes from a type
 */
public class Nodes {

  public static Node create(NodeType type, Object... positional) {
    return new Node(type, positional, null);
  }

  public static Node create(NodeType type, Object[] positional,
                            Map<String, ?> keywords) {
    return new Node(type, positional, keywords);
  }

  /**
   * Build a keyword map from alternating names and values
   */
  public static Map<String, Object> kw(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Odd number of arguments: " +
                                         namesAndValues.length);
    }
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      result.put((String)namesAndValues[i], namesAndValues[i + 1]);
    }
    return result;
  }
}
