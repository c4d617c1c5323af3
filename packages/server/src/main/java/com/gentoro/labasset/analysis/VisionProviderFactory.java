package com.gentoro.labasset.analysis;

/** Creates the {@link VisionProvider} variant named by {@link ProviderSettings#providerId()}. */
@FunctionalInterface
public interface VisionProviderFactory {
  VisionProvider create(ProviderSettings settings);

  static VisionProviderFactory standard() {
    return settings ->
        switch (settings.providerId()) {
          case OPENAI -> new OpenAiVisionProvider(settings);
          case ANTHROPIC -> new AnthropicVisionProvider(settings);
          case GEMINI -> new GeminiVisionProvider(settings);
          case OLLAMA -> new OllamaVisionProvider(settings);
        };
  }
}
