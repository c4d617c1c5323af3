package com.gentoro.labasset.service;

/** Health of one external dependency, as reported by the system status. */
public record ComponentHealth(boolean healthy, String detail) {

  static ComponentHealth up(String detail) {
    return new ComponentHealth(true, detail);
  }

  static ComponentHealth down(String detail) {
    return new ComponentHealth(false, detail);
  }
}
