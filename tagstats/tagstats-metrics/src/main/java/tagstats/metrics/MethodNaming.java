package tagstats.metrics;

/**
 * How {@link CallMeasurer} identifies a call-site that belongs to a type.
 */
public enum MethodNaming {
  /**
   * {@code def=<method>,class=<Type>}: the type goes in its own tag, after any extra tags. {@code <Type>} keeps
   * enclosing types, as in {@code Outer.Inner}.
   */
  SeparateClassTag,
  /**
   * {@code def=<Type>.<method>}: a single qualified tag.
   */
  QualifiedDef
}
