// Copyright 2026 The Nomulus Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package libdns.rfc2136.util;

import com.google.common.flogger.FluentLogger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;

/**
 * Utility methods for loading layered YAML configuration.
 *
 * <p>Configuration always starts from a bundled default document that names every supported
 * setting. An optional operator-supplied document is then laid over it, and only the settings it
 * mentions change.
 */
public final class YamlUtils {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Loads a POJO of type {@code T} from the default YAML document merged with an override.
   *
   * @param defaultYaml content of the bundled default YAML document
   * @param overrideYaml content of the operator's YAML document; may be empty
   * @param clazz type of the POJO the merged document is bound to
   * @throws IllegalStateException if either document is invalid or doesn't fit {@code clazz}
   */
  public static <T> T getConfigSettings(String defaultYaml, String overrideYaml, Class<T> clazz) {
    try {
      return new Yaml().loadAs(mergeYaml(defaultYaml, overrideYaml), clazz);
    } catch (RuntimeException e) {
      throw new IllegalStateException("Invalid YAML configuration for " + clazz.getName(), e);
    }
  }

  /**
   * Merges the override document into the default document and returns the result as YAML.
   *
   * <p>Keys of the override that the default document doesn't define are dropped with a warning,
   * so a typo in an operator's file is visible instead of silently ignored. Nested maps are merged
   * key by key; every other value, lists included, replaces the default wholesale.
   */
  static String mergeYaml(String defaultYaml, String overrideYaml) {
    Yaml yaml = new Yaml();
    Map<String, Object> merged =
        loadAsMap(yaml, defaultYaml)
            .orElseThrow(() -> new IllegalStateException("Default YAML configuration is empty"));
    Optional<Map<String, Object>> overrides = loadAsMap(yaml, overrideYaml);
    if (overrides.isPresent()) {
      merged = mergeMaps("", merged, overrides.get());
    } else {
      logger.atFine().log("No configuration overrides supplied; using defaults.");
    }
    return yaml.dump(merged);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mergeMaps(
      String path, Map<String, Object> defaults, Map<String, Object> overrides) {
    Map<String, Object> result = new LinkedHashMap<>(defaults);
    for (Map.Entry<String, Object> override : overrides.entrySet()) {
      String key = override.getKey();
      if (!defaults.containsKey(key)) {
        logger.atWarning().log("Ignoring unknown configuration key '%s%s'.", path, key);
        continue;
      }
      Object defaultValue = defaults.get(key);
      if (defaultValue instanceof Map && override.getValue() instanceof Map) {
        result.put(
            key,
            mergeMaps(
                path + key + ".",
                (Map<String, Object>) defaultValue,
                (Map<String, Object>) override.getValue()));
      } else {
        result.put(key, override.getValue());
      }
    }
    return result;
  }

  /** Returns the document as a map, or empty if it holds no data (e.g. only comments). */
  @SuppressWarnings("unchecked")
  private static Optional<Map<String, Object>> loadAsMap(Yaml yaml, String yamlString) {
    return Optional.ofNullable((Map<String, Object>) yaml.load(yamlString));
  }

  private YamlUtils() {}
}
