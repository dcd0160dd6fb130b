package tagstats.metrics;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

public class MetricTags {
  /**
   * Renders tag values with {@link String#valueOf(Object)}, keeping the given order.
   */
  public static ImmutableMap<String, String> render(Map<String, ?> tags) {
    return merge(ImmutableMap.of(), tags);
  }

  /**
   * Keys already present in {@code base} keep their position and take the value from {@code extra}; new keys are
   * appended in {@code extra}'s order.
   */
  public static ImmutableMap<String, String> merge(Map<String, String> base, Map<String, ?> extra) {
    if (extra.isEmpty()) return ImmutableMap.copyOf(base);
    Map<String, String> merged = new LinkedHashMap<>(base);
    extra.forEach((key, value) -> merged.put(checkNotNull(key, "tag key"), String.valueOf(value)));
    return ImmutableMap.copyOf(merged);
  }
}
