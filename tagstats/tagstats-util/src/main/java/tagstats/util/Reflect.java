package tagstats.util;

public class Reflect {
  /**
   * Guice AOP (and other bytecode-generating proxies) subclass the intercepted type with a name containing "$$";
   * this walks up to the first class that was written by a human.
   */
  @SuppressWarnings("unchecked")
  public static <T> Class<T> getUnenhancedClass(Class<? extends T> possiblyEnhancedClass) {
    Class<?> c = possiblyEnhancedClass;
    while (c.getName().contains("$$")) {
      c = c.getSuperclass();
    }
    return (Class<T>) c;
  }

  /**
   * The class name without its package: member classes are prefixed by their enclosing types ({@code Outer.Inner}),
   * local classes use their simple name, and anonymous classes yield an empty string.
   */
  public static String nestedName(Class<?> cls) {
    Class<?> enclosing = cls.getEnclosingClass();
    if (enclosing == null || !cls.isMemberClass()) return cls.getSimpleName();
    return nestedName(enclosing) + "." + cls.getSimpleName();
  }

  /**
   * The fully-qualified class name, with nested classes separated by '.' rather than '$'.
   */
  public static String dottedName(Class<?> cls) {
    return cls.getName().replaceAll("\\$+", ".");
  }
}
