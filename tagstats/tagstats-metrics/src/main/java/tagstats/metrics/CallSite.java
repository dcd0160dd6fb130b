package tagstats.metrics;

import tagstats.util.Reflect;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The identity of a measured call: a function name and, for methods, the type that defines it.
 */
public final class CallSite {
  private final Optional<Class<?>> owner;
  private final String functionName;

  private CallSite(Optional<Class<?>> owner, String functionName) {
    checkArgument(!checkNotNull(functionName, "functionName").isEmpty(), "functionName must not be empty");
    this.owner = owner;
    this.functionName = functionName;
  }

  public static CallSite function(String functionName) {
    return new CallSite(Optional.empty(), functionName);
  }

  /**
   * A method of {@code owner}. Proxy subclasses generated for interception are resolved to the class they enhance.
   */
  public static CallSite method(Class<?> owner, String methodName) {
    return new CallSite(Optional.of(Reflect.getUnenhancedClass(owner)), methodName);
  }

  public static CallSite of(Method method) {
    return method(method.getDeclaringClass(), method.getName());
  }

  public String functionName() {
    return functionName;
  }

  /**
   * The owner's name without its package, keeping enclosing types: {@code Outer.Inner}. Empty for anonymous classes.
   */
  public Optional<String> ownerName() {
    return owner.map(Reflect::nestedName).filter(name -> !name.isEmpty());
  }

  public String qualifiedName() {
    return ownerName().map(name -> name + "." + functionName).orElse(functionName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CallSite that = (CallSite) o;
    return owner.equals(that.owner) && functionName.equals(that.functionName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, functionName);
  }

  @Override
  public String toString() {
    return qualifiedName();
  }
}
