package com.gentoro.labasset.record;

import com.gentoro.labasset.exception.InvalidInputException;

/**
 * Listing criteria.
 *
 * @param query free text matched against titles, {@code null} for all records
 * @param categoryId restrict to one category, {@code null} for all
 */
public record RecordFilter(String query, Integer categoryId, int limit, int offset) {
  public static final int MAX_LIMIT = 100;

  public RecordFilter {
    if (limit <= 0 || limit > MAX_LIMIT) {
      throw new InvalidInputException("limit must be between 1 and " + MAX_LIMIT);
    }
    if (offset < 0) {
      throw new InvalidInputException("offset must not be negative");
    }
  }

  public static RecordFilter all() {
    return new RecordFilter(null, null, MAX_LIMIT, 0);
  }
}
