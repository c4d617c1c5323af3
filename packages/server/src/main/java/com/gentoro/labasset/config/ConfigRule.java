package com.gentoro.labasset.config;

import com.gentoro.labasset.exception.ValidationException;

/** Validates a raw configuration value and returns its normalized form. */
@FunctionalInterface
public interface ConfigRule {
  Object normalize(String path, Object value) throws ValidationException;
}
