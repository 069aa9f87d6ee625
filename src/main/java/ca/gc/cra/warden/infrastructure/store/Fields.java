package ca.gc.cra.warden.infrastructure.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over parsed JSON objects with path-qualified error messages.
 */
final class Fields {
  private Fields() {}

  static Map<String, Object> object(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be an object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return map;
  }

  static String requiredString(Map<String, Object> node, String key, String context) {
    String value = optionalString(node, key, context);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(context + "." + key + " is required");
    }
    return value;
  }

  static String optionalString(Map<String, Object> node, String key, String context) {
    Object value = node.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException(context + "." + key + " must be a string");
    }
    return text;
  }

  static boolean optionalBoolean(Map<String, Object> node, String key, String context, boolean fallback) {
    Object value = node.get(key);
    if (value == null) {
      return fallback;
    }
    if (!(value instanceof Boolean flag)) {
      throw new IllegalArgumentException(context + "." + key + " must be a boolean");
    }
    return flag;
  }

  static List<String> stringList(Map<String, Object> node, String key, String context) {
    Object value = node.get(key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + "." + key + " must be an array");
    }
    List<String> result = new ArrayList<>(raw.size());
    for (Object item : raw) {
      if (!(item instanceof String text)) {
        throw new IllegalArgumentException(context + "." + key + " must only contain strings");
      }
      result.add(text);
    }
    return result;
  }
}
