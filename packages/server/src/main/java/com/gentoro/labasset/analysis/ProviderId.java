package com.gentoro.labasset.analysis;

import com.gentoro.labasset.exception.ValidationException;
import java.util.Locale;

/** Closed set of inference backends selectable through {@code inference.providerId}. */
public enum ProviderId {
  OPENAI("openai", ExtractionRule.STRICT_JSON, "gpt-4o", true),
  ANTHROPIC("anthropic", ExtractionRule.EMBEDDED_JSON, "claude-sonnet-4-20250514", true),
  GEMINI("gemini", ExtractionRule.EMBEDDED_JSON, "gemini-2.5-flash", true),
  OLLAMA("ollama", ExtractionRule.EMBEDDED_JSON, "llava", false);

  private final String id;
  private final ExtractionRule extractionRule;
  private final String defaultModel;
  private final boolean hosted;

  ProviderId(String id, ExtractionRule extractionRule, String defaultModel, boolean hosted) {
    this.id = id;
    this.extractionRule = extractionRule;
    this.defaultModel = defaultModel;
    this.hosted = hosted;
  }

  public String id() {
    return id;
  }

  public ExtractionRule extractionRule() {
    return extractionRule;
  }

  public String defaultModel() {
    return defaultModel;
  }

  /** Hosted providers require a credential; local ones an endpoint. */
  public boolean isHosted() {
    return hosted;
  }

  public static ProviderId fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      for (ProviderId p : values()) {
        if (p.id.equals(normalized)) return p;
      }
    }
    throw new ValidationException("inference.providerId", "unknown provider '" + id + "'");
  }
}
