package com.gentoro.labasset.analysis;

import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.util.List;

/** OpenAI Chat Completions with image input and JSON object response format. */
public class OpenAiVisionProvider extends AbstractVisionProvider {
  private final OpenAIClient client;

  public OpenAiVisionProvider(ProviderSettings settings) {
    this(
        settings,
        OpenAIOkHttpClient.builder()
            .apiKey(apiKey(settings))
            .timeout(settings.timeout())
            .maxRetries(0)
            .build());
  }

  public OpenAiVisionProvider(ProviderSettings settings, OpenAIClient client) {
    super(settings);
    this.client = client;
  }

  @Override
  protected String run(VisionRequest request) {
    ChatCompletionCreateParams params =
        ChatCompletionCreateParams.builder()
            .model(settings.effectiveModel())
            .temperature(settings.temperature())
            .maxCompletionTokens(settings.maxOutputTokens())
            .responseFormat(ResponseFormatJsonObject.builder().build())
            .addSystemMessage(request.systemPrompt())
            .addUserMessageOfArrayOfContentParts(
                List.of(
                    ChatCompletionContentPart.ofText(
                        ChatCompletionContentPartText.builder().text(request.userPrompt()).build()),
                    ChatCompletionContentPart.ofImageUrl(
                        ChatCompletionContentPartImage.builder()
                            .imageUrl(
                                ChatCompletionContentPartImage.ImageUrl.builder()
                                    .url(request.dataUrl())
                                    .build())
                            .build())))
            .build();

    ChatCompletion completion = client.chat().completions().create(params);
    return completion.choices().stream()
        .filter(c -> c.message().content().isPresent())
        .map(c -> c.message().content().get())
        .findFirst()
        .orElseThrow(
            () ->
                new AnalysisException(
                    ErrorKind.INVALID_RESPONSE, "No content returned from OpenAI inference"));
  }

  @Override
  protected AnalysisException classify(RuntimeException e) {
    if (e instanceof OpenAIServiceException se) {
      return new AnalysisException(
          kindForStatus(se.statusCode()), "OpenAI returned HTTP " + se.statusCode(), e);
    }
    if (e instanceof OpenAIIoException) {
      return new AnalysisException(
          ErrorKind.TRANSIENT_NETWORK_ERROR, "OpenAI connection failed: " + e.getMessage(), e);
    }
    return super.classify(e);
  }

  @Override
  public void close() {
    client.close();
  }
}
