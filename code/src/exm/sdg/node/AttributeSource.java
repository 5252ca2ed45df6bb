package exm.sdg.node;

/**
 * Where the value of a resolved attribute came from
 */
public enum AttributeSource {
  /** Stored on the node itself */
  OWN,
  /** Default declared by the node type */
  DEFAULT,
  /** Found through the prototype chain */
  PROTOTYPE,
  /** Derived from node state (id, type, trailer, scope) */
  BUILTIN
}
