package tagstats.util;

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

class ReflectTest {

  @Test
  void unenhancedClassSkipsGeneratedSubclasses() {
    assertThat(Reflect.getUnenhancedClass(Outer.Inner.class)).isEqualTo(Outer.Inner.class);
    assertThat(Reflect.<Object>getUnenhancedClass(Outer.Inner$$Generated.class)).isEqualTo(Outer.Inner.class);
  }

  @Test
  void dottedNameReplacesNestingSeparators() {
    assertThat(Reflect.dottedName(Outer.Inner.class)).isEqualTo("tagstats.util.ReflectTest.Outer.Inner");
  }

  @Test
  void nestedNameKeepsEnclosingTypes() {
    assertThat(Reflect.nestedName(ReflectTest.class)).isEqualTo("ReflectTest");
    assertThat(Reflect.nestedName(Outer.Inner.class)).isEqualTo("ReflectTest.Outer.Inner");

    class Local {
    }
    assertThat(Reflect.nestedName(Local.class)).isEqualTo("Local");
    assertThat(Reflect.nestedName(new Object() { }.getClass())).isEmpty();
  }

  static class Outer {
    static class Inner {
    }

    static class Inner$$Generated extends Inner {
    }
  }
}
