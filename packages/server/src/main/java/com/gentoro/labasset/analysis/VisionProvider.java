package com.gentoro.labasset.analysis;

/**
 * A vision-capable inference backend. Implementations encapsulate one provider SDK or HTTP API and
 * report failures as {@link com.gentoro.labasset.exception.AnalysisException} with the matching
 * {@link com.gentoro.labasset.exception.ErrorKind}.
 */
public interface VisionProvider extends AutoCloseable {
  ProviderId id();

  /** Run one inference call and return the provider's raw text output. */
  String complete(VisionRequest request);

  @Override
  default void close() {}
}
