package com.gentoro.labasset.analysis;

import com.gentoro.labasset.config.ConfigSnapshot;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Inference settings resolved from one configuration snapshot. */
public record ProviderSettings(
    ProviderId providerId,
    String credential,
    String model,
    double temperature,
    int maxOutputTokens,
    String localEndpoint,
    Duration timeout,
    int maxConcurrent,
    String promptTemplate) {

  public static ProviderSettings from(ConfigSnapshot config) {
    ProviderId provider = ProviderId.fromId(config.getString("inference.providerId", "openai"));
    return new ProviderSettings(
        provider,
        config.getString("inference.credential", ""),
        config.getString("inference.model", provider.defaultModel()),
        config.getDouble("inference.temperature", 0.7),
        config.getInt("inference.maxOutputTokens", 4000),
        config.getString("inference.localEndpoint", "http://localhost:11434"),
        Duration.ofSeconds(config.getInt("inference.timeoutSeconds", 120)),
        config.getInt("inference.maxConcurrent", 2),
        config.getString("inference.promptTemplate", ""));
  }

  public String effectiveModel() {
    return model == null || model.isBlank() ? providerId.defaultModel() : model;
  }

  public boolean credentialConfigured() {
    return credential != null && !credential.isBlank();
  }

  /** Settings as reported to API callers. The credential itself is never included. */
  public Map<String, Object> describe() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("providerId", providerId.id());
    out.put("model", effectiveModel());
    out.put("temperature", temperature);
    out.put("maxOutputTokens", maxOutputTokens);
    out.put("localEndpoint", localEndpoint);
    out.put("timeoutSeconds", timeout.toSeconds());
    out.put("maxConcurrent", maxConcurrent);
    out.put("promptTemplate", promptTemplate);
    out.put("credentialConfigured", credentialConfigured());
    return out;
  }

  @Override
  public String toString() {
    return "ProviderSettings[" + providerId.id() + ", model=" + effectiveModel() + "]";
  }
}
