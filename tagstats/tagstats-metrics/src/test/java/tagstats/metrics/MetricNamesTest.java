package tagstats.metrics;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetricNamesTest {
  @Test
  void tagsFollowInsertionOrder() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("zeta", "1");
    tags.put("alpha", "2");

    assertThat(MetricNames.encodedName(StatsOperation.Gauge, tags, "depth"))
            .isEqualTo("gauge,zeta=1,alpha=2,name=depth");
  }

  @Test
  void emptyTags() {
    assertThat(MetricNames.encodedName(StatsOperation.Incr, ImmutableMap.of(), "fool")).isEqualTo("incr,name=fool");
  }

  @Test
  void mergeKeepsPositionOfOverriddenKeys() {
    ImmutableMap<String, String> merged = MetricTags.merge(
            ImmutableMap.of("a", "1", "b", "2"),
            ImmutableMap.of("c", "3", "a", "override")
    );

    assertThat(merged).containsExactly("a", "override", "b", "2", "c", "3").inOrder();
  }

  @Test
  void renderingIsTotal() {
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("missing", null);
    tags.put("number", 1.25);

    assertThat(MetricTags.render(tags)).containsExactly("missing", "null", "number", "1.25").inOrder();
  }

  @Test
  void nullKeysAreRejected() {
    assertThrows(NullPointerException.class, () -> MetricTags.render(Collections.singletonMap(null, "v")));
  }
}
