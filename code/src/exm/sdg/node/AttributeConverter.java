package exm.sdg.node;

/**
 * Conversion applied once when an attribute value is stored
 */
public interface AttributeConverter {
  /**
   * @param node node the value is stored on; its attributes may be
   *             only partly initialized
   * @param name attribute name
   * @param value value passed by the caller, may be null
   * @return value to store
   */
  Object convert(Node node, String name, Object value);
}
