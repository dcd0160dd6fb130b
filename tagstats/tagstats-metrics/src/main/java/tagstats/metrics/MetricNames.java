package tagstats.metrics;

import com.google.common.base.Joiner;

import java.util.Iterator;
import java.util.Map;

/**
 * Composes influx-style tagged statsd names:
 * <pre>{@code <operation>,<k1>=<v1>,...,<kN>=<vN>,name=<call-site-name>}</pre>
 * Tags keep their given order; the {@code name} tag always comes last.
 */
public class MetricNames {
  public static final String NAME_TAG = "name";
  private static final char TAG_DELIMITER = ',';
  private static final char TAG_VALUE_SEPARATOR = '=';
  private static final Joiner.MapJoiner TAG_JOINER = Joiner.on(TAG_DELIMITER).withKeyValueSeparator(TAG_VALUE_SEPARATOR);

  public static String encodedName(StatsOperation operation, Map<String, String> tags, String name) {
    return encodedName(operation.metricPrefix(), tags, name);
  }

  public static String encodedName(String metric, Map<String, String> tags, String name) {
    StringBuilder builder = new StringBuilder(metric).append(TAG_DELIMITER);
    Iterator<Map.Entry<String, String>> entries = tags.entrySet().stream()
            .filter(entry -> !entry.getKey().equals(NAME_TAG))
            .iterator();
    if (entries.hasNext()) {
      TAG_JOINER.appendTo(builder, entries).append(TAG_DELIMITER);
    }
    return builder.append(NAME_TAG).append(TAG_VALUE_SEPARATOR).append(name).toString();
  }
}
