package com.gentoro.labasset.analysis;

/** How a provider's text output is turned into an attribute map. */
public enum ExtractionRule {
  /** The whole output (after removing markdown fences) must be one JSON object. */
  STRICT_JSON,
  /** The outermost {@code {...}} slice of free text is parsed as a JSON object. */
  EMBEDDED_JSON
}
