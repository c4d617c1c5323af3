package com.gentoro.labasset.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Turns provider text into an attribute map according to an {@link ExtractionRule}. */
public final class ResponseExtractor {
  private static final Pattern FENCE =
      Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private ResponseExtractor() {}

  /**
   * @throws AnalysisException {@link ErrorKind#INVALID_RESPONSE} when no JSON object can be found
   */
  public static Map<String, Object> extract(String raw, ExtractionRule rule) {
    if (raw == null || raw.isBlank()) {
      throw new AnalysisException(
          ErrorKind.INVALID_RESPONSE, "Provider returned an empty response");
    }
    String text = stripFences(raw.trim());
    String candidate =
        switch (rule) {
          case STRICT_JSON -> text;
          case EMBEDDED_JSON -> outermostObject(text);
        };
    if (candidate == null) {
      throw new AnalysisException(
          ErrorKind.INVALID_RESPONSE, "No JSON object found in provider response");
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(candidate);
    } catch (JsonProcessingException e) {
      throw new AnalysisException(
          ErrorKind.INVALID_RESPONSE,
          "Provider response is not valid JSON: " + e.getOriginalMessage(),
          e);
    }
    if (node == null || !node.isObject()) {
      throw new AnalysisException(
          ErrorKind.INVALID_RESPONSE, "Provider response is not a JSON object");
    }
    return JacksonUtility.getJsonMapper().convertValue(node, MAP_TYPE);
  }

  static String stripFences(String text) {
    Matcher m = FENCE.matcher(text);
    return m.matches() ? m.group(1) : text;
  }

  static String outermostObject(String text) {
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) {
      return null;
    }
    return text.substring(start, end + 1);
  }
}
