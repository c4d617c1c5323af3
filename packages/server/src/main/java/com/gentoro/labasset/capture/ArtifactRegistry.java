package com.gentoro.labasset.capture;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Index of artifacts that exist on disk and may be referenced by jobs. */
public class ArtifactRegistry {
  private final Map<String, CaptureArtifact> artifacts = new ConcurrentHashMap<>();

  public void register(CaptureArtifact artifact) {
    CaptureArtifact previous = artifacts.putIfAbsent(artifact.id(), artifact);
    if (previous != null) {
      throw new IllegalStateException("Artifact " + artifact.id() + " is already registered");
    }
  }

  public Optional<CaptureArtifact> find(String id) {
    return Optional.ofNullable(artifacts.get(id));
  }

  public Optional<CaptureArtifact> remove(String id) {
    return Optional.ofNullable(artifacts.remove(id));
  }

  public Collection<CaptureArtifact> list() {
    return List.copyOf(artifacts.values());
  }
}
