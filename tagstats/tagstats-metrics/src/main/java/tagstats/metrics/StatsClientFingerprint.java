package tagstats.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * A SHA-256 hex digest over a canonical JSON encoding of {@code [service, module, options]}. Option fields are
 * written in a fixed order and tags in their insertion order, so equal inputs always produce equal fingerprints.
 */
public class StatsClientFingerprint {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static String of(String service, String module, StatsClientOptions options) {
    return Hashing.sha256()
            .hashString(canonicalJson(service, module, options), StandardCharsets.UTF_8)
            .toString();
  }

  static String canonicalJson(String service, String module, StatsClientOptions options) {
    ArrayNode root = MAPPER.createArrayNode()
            .add(service)
            .add(module);
    ObjectNode optionsNode = root.addObject()
            .put("host", options.host())
            .put("port", options.port())
            .put("prefix", options.prefix().orElse(null))
            .put("maxPacketSizeBytes", options.maxPacketSizeBytes());
    ArrayNode tagsNode = optionsNode.putArray("tags");
    options.tags().forEach((key, value) -> tagsNode.addArray().add(key).add(value));
    return root.toString();
  }
}
