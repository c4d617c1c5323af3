package com.gentoro.labasset.label;

import java.time.Instant;

public record LabelFile(String fileName, long sizeBytes, Instant modifiedAt) {}
