package com.gentoro.labasset.record;

import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/** Renders extracted attributes as the HTML body of a record. */
public final class RecordBody {
  private RecordBody() {}

  public static String render(Map<String, Object> attributes) {
    StringBuilder html = new StringBuilder();
    for (Map.Entry<String, Object> e : attributes.entrySet()) {
      if (e.getValue() instanceof Map<?, ?> section) {
        html.append("<h3>").append(escape(label(e.getKey()))).append("</h3>\n");
        for (Map.Entry<?, ?> field : section.entrySet()) {
          line(html, String.valueOf(field.getKey()), field.getValue());
        }
      } else {
        line(html, e.getKey(), e.getValue());
      }
    }
    return html.toString();
  }

  private static void line(StringBuilder html, String key, Object value) {
    String text =
        value instanceof List<?> list
            ? String.join(", ", list.stream().map(String::valueOf).toList())
            : String.valueOf(value);
    html.append("<p><strong>")
        .append(escape(label(key)))
        .append(":</strong> ")
        .append(escape(text))
        .append("</p>\n");
  }

  /** {@code serial_number} becomes {@code Serial number}. */
  static String label(String key) {
    return StringUtils.capitalize(key.replace('_', ' ').trim());
  }

  static String escape(String s) {
    return s.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;");
  }
}
