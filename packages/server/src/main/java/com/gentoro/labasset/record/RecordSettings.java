package com.gentoro.labasset.record;

import com.gentoro.labasset.config.ConfigSnapshot;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Record-system settings resolved from one configuration snapshot. */
public record RecordSettings(
    RecordSystemProvider provider,
    String baseUrl,
    String credential,
    int defaultCategory,
    int teamId,
    boolean verifyTls,
    Duration timeout) {

  public static RecordSettings from(ConfigSnapshot config) {
    return new RecordSettings(
        RecordSystemProvider.fromId(config.getString("recordSystem.provider", "elabftw")),
        config.getString("recordSystem.baseUrl", "https://localhost:3148/api/v2"),
        config.getString("recordSystem.credential", ""),
        config.getInt("recordSystem.defaultCategory", 1),
        config.getInt("recordSystem.teamId", 1),
        config.getBoolean("recordSystem.verifyTls", true),
        Duration.ofSeconds(config.getInt("recordSystem.timeoutSeconds", 20)));
  }

  /** Base URL of the web interface: {@link #baseUrl()} without its {@code /api/...} suffix. */
  public String webBaseUrl() {
    String url = baseUrl;
    int api = url.indexOf("/api/");
    if (api >= 0) {
      url = url.substring(0, api);
    } else if (url.endsWith("/api")) {
      url = url.substring(0, url.length() - 4);
    }
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  public boolean credentialConfigured() {
    return credential != null && !credential.isBlank();
  }

  /** Settings as reported to API callers. The credential itself is never included. */
  public Map<String, Object> describe() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("provider", provider.id());
    out.put("baseUrl", baseUrl);
    out.put("defaultCategory", defaultCategory);
    out.put("teamId", teamId);
    out.put("verifyTls", verifyTls);
    out.put("timeoutSeconds", timeout.toSeconds());
    out.put("credentialConfigured", credentialConfigured());
    return out;
  }

  @Override
  public String toString() {
    return "RecordSettings[" + provider.id() + ", " + baseUrl + "]";
  }
}
