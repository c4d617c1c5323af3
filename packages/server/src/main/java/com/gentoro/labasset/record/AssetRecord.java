package com.gentoro.labasset.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A record in the record-management system. {@code externalId} is {@code null} until the record
 * has been created remotely; {@code recordVersion} is the optimistic-concurrency version.
 */
public record AssetRecord(
    String externalId,
    String title,
    String body,
    int categoryId,
    Map<String, Object> attributes,
    List<String> tags,
    String status,
    long recordVersion) {

  public AssetRecord {
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static AssetRecord draft(
      String title,
      String body,
      int categoryId,
      Map<String, Object> attributes,
      List<String> tags) {
    return new AssetRecord(null, title, body, categoryId, attributes, tags, "draft", 0);
  }

  public AssetRecord withExternalId(String id, long version) {
    return new AssetRecord(id, title, body, categoryId, attributes, tags, status, version);
  }
}
