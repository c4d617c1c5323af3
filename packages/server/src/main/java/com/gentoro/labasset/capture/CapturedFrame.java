package com.gentoro.labasset.capture;

/** Raw image bytes as returned by a device. */
public record CapturedFrame(byte[] data, String mediaType, String extension) {}
