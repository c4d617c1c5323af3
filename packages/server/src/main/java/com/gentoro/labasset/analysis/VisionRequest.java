package com.gentoro.labasset.analysis;

import java.util.Base64;

/** One image-plus-prompt inference call. */
public record VisionRequest(
    String systemPrompt, String userPrompt, byte[] image, String mediaType) {

  public String imageBase64() {
    return Base64.getEncoder().encodeToString(image);
  }

  public String dataUrl() {
    return "data:" + mediaType + ";base64," + imageBase64();
  }
}
