package com.gentoro.labasset.analysis;

import com.gentoro.labasset.capture.CaptureArtifact;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the system and user prompts for asset analysis. The configurable part is the additional
 * user instruction, in which {@code ${artifactId}}, {@code ${deviceId}}, {@code ${capturedAt}},
 * {@code ${resolution}} and {@code ${template}} are substituted. Unknown variables are left as is.
 */
public final class PromptTemplate {
  private static final Pattern VARIABLE = Pattern.compile("\\$\\{([A-Za-z][A-Za-z0-9_]*)}");

  static final String DEFAULT_TEMPLATE_FIELDS =
      """
      {
        "name": "",
        "manufacturer": "",
        "model": "",
        "serial_number": "",
        "category": "",
        "location": "",
        "description": ""
      }""";

  private static final String SYSTEM =
      """
      You are a professional laboratory asset analysis assistant. Your task is to analyze \
      laboratory equipment or items in the image and provide detailed structured information for \
      the asset management system.

      IMPORTANT: The most critical field is the asset name. Carefully identify the exact name of \
      the chemical, equipment, or item from the image. Look for labels, markings, or text on the \
      item itself. The name should be specific (e.g. "Hydrofluoric Acid" rather than just "Acid").

      Your response MUST follow this two-part structure:
      1. FIRST, a summary section with ONLY the asset name and type at the very beginning of your \
      JSON response:
         "summary": {
           "asset_name": "[Exact name of the asset]",
           "asset_type": "[Type of asset: chemical/equipment/tool/etc.]"
         },
      2. THEN, the complete detailed information according to the following template format:

      %s

      Answer with a single JSON object that includes both the summary section and all detailed \
      fields. If some information cannot be obtained from the image, mark it as "unknown" or give \
      the most reasonable guess. The asset name in the summary and in the detailed section must \
      match.""";

  private static final String USER =
      """
      Please analyze the laboratory equipment or item in this image and provide detailed \
      information according to the template in the system prompt.
      Remember to FIRST provide the summary section with the asset name and type, THEN the \
      complete detailed information.
      %s""";

  private PromptTemplate() {}

  public static String systemPrompt(String templateFields) {
    return SYSTEM.formatted(fieldsOrDefault(templateFields));
  }

  public static String userPrompt(
      String additional, CaptureArtifact artifact, String templateFields) {
    String rendered =
        render(additional == null ? "" : additional, variables(artifact, templateFields));
    return USER.formatted(rendered).strip();
  }

  static Map<String, String> variables(CaptureArtifact artifact, String templateFields) {
    Map<String, String> vars = new HashMap<>();
    vars.put("artifactId", artifact.id());
    vars.put("deviceId", artifact.deviceId());
    vars.put("capturedAt", String.valueOf(artifact.capturedAt()));
    vars.put("resolution", artifact.resolution() == null ? "" : artifact.resolution().toString());
    vars.put("template", fieldsOrDefault(templateFields));
    return vars;
  }

  private static String fieldsOrDefault(String templateFields) {
    return templateFields == null || templateFields.isBlank()
        ? DEFAULT_TEMPLATE_FIELDS
        : templateFields;
  }

  static String render(String template, Map<String, String> vars) {
    Matcher m = VARIABLE.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String value = vars.get(m.group(1));
      m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? m.group(0) : value));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
