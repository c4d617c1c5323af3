package com.gentoro.labasset.analysis;

import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import java.util.List;

/** Google Gemini through the google-genai client with inline image bytes. */
public class GeminiVisionProvider extends AbstractVisionProvider {
  private final Client client;

  public GeminiVisionProvider(ProviderSettings settings) {
    this(
        settings,
        Client.builder()
            .apiKey(apiKey(settings))
            .build());
  }

  public GeminiVisionProvider(ProviderSettings settings, Client client) {
    super(settings);
    this.client = client;
  }

  @Override
  protected String run(VisionRequest request) {
    GenerateContentConfig config =
        GenerateContentConfig.builder()
            .temperature((float) settings.temperature())
            .maxOutputTokens(settings.maxOutputTokens())
            .candidateCount(1)
            .systemInstruction(
                Content.builder().parts(List.of(Part.fromText(request.systemPrompt()))).build())
            .build();
    Content user =
        Content.builder()
            .role("user")
            .parts(
                List.of(
                    Part.fromBytes(request.image(), request.mediaType()),
                    Part.fromText(request.userPrompt())))
            .build();

    GenerateContentResponse response =
        client.models.generateContent(settings.effectiveModel(), List.of(user), config);
    String text = response.text();
    if (text == null || text.isBlank()) {
      throw new AnalysisException(
          ErrorKind.INVALID_RESPONSE, "No text content returned from Gemini inference");
    }
    return text;
  }

  @Override
  protected AnalysisException classify(RuntimeException e) {
    if (e instanceof ApiException api) {
      return new AnalysisException(
          kindForStatus(api.code()),
          "Gemini returned HTTP " + api.code() + ": " + api.getMessage(),
          e);
    }
    return super.classify(e);
  }
}
