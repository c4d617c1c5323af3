package com.gentoro.labasset.capture;

import com.gentoro.labasset.exception.InvalidInputException;
import java.util.Locale;

/** Requested frame size, written as {@code WIDTHxHEIGHT}. */
public record Resolution(int width, int height) {

  public Resolution {
    if (width <= 0 || height <= 0) {
      throw new InvalidInputException("Resolution must be positive, got " + width + "x" + height);
    }
  }

  public static Resolution parse(String value) {
    if (value == null) {
      throw new InvalidInputException("Resolution is required");
    }
    String[] parts = value.trim().toLowerCase(Locale.ROOT).split("x");
    if (parts.length != 2) {
      throw new InvalidInputException("Resolution must be formatted as WIDTHxHEIGHT: " + value);
    }
    try {
      return new Resolution(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    } catch (NumberFormatException e) {
      throw new InvalidInputException("Resolution must be formatted as WIDTHxHEIGHT: " + value, e);
    }
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
