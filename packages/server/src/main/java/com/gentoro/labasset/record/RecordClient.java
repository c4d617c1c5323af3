package com.gentoro.labasset.record;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Client of the external record-management system.
 *
 * <p>Failures are reported as {@link com.gentoro.labasset.exception.RecordClientException}: {@code
 * AUTH_ERROR} and {@code NOT_FOUND} are final, {@code CONFLICT} means the caller must re-fetch the
 * record before trying again, and {@code TRANSIENT_NETWORK_ERROR} has already been retried by the
 * client when it surfaces.
 */
public interface RecordClient extends AutoCloseable {

  /**
   * Create a record. Idempotent per {@code idempotencyKey}: when a create with the same key already
   * succeeded, the existing external id is returned and nothing new is created.
   */
  String create(AssetRecord record, String idempotencyKey);

  /**
   * Apply {@code fields} if the record is still at {@code expectedVersion}.
   *
   * <p>Recognized fields: {@code title}, {@code body}, {@code categoryId}, {@code status}, {@code
   * tags} (list) and {@code attributes} (map, replaces the stored attributes).
   *
   * @return the new version
   */
  long update(String externalId, Map<String, Object> fields, long expectedVersion);

  AssetRecord get(String externalId);

  List<RecordSummary> list(RecordFilter filter);

  /**
   * Attach an image file to a record. Idempotent per {@code fileName}: an attachment with that name
   * already on the record is left as it is.
   */
  void attachImage(String externalId, Path image, String fileName, String mediaType);

  /** Item templates offered by the record system. */
  List<RecordTemplate> templates();

  @Override
  default void close() {}
}
