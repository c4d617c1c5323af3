package com.gentoro.labasset.analysis;

import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.anthropic.errors.AnthropicIoException;
import com.anthropic.errors.AnthropicServiceException;
import com.anthropic.models.messages.Base64ImageSource;
import com.anthropic.models.messages.ContentBlock;
import com.anthropic.models.messages.ContentBlockParam;
import com.anthropic.models.messages.ImageBlockParam;
import com.anthropic.models.messages.Message;
import com.anthropic.models.messages.MessageCreateParams;
import com.anthropic.models.messages.TextBlockParam;
import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import java.util.List;

/** Anthropic Messages API with a base64 image block. */
public class AnthropicVisionProvider extends AbstractVisionProvider {
  private final AnthropicClient client;

  public AnthropicVisionProvider(ProviderSettings settings) {
    this(
        settings,
        AnthropicOkHttpClient.builder()
            .apiKey(apiKey(settings))
            .timeout(settings.timeout())
            .maxRetries(0)
            .build());
  }

  public AnthropicVisionProvider(ProviderSettings settings, AnthropicClient client) {
    super(settings);
    this.client = client;
  }

  @Override
  protected String run(VisionRequest request) {
    MessageCreateParams params =
        MessageCreateParams.builder()
            .model(settings.effectiveModel())
            .maxTokens(settings.maxOutputTokens())
            .temperature(settings.temperature())
            .system(request.systemPrompt())
            .addUserMessageOfBlockParams(
                List.of(
                    ContentBlockParam.ofImage(
                        ImageBlockParam.builder()
                            .source(
                                Base64ImageSource.builder()
                                    .data(request.imageBase64())
                                    .mediaType(mediaType(request.mediaType()))
                                    .build())
                            .build()),
                    ContentBlockParam.ofText(
                        TextBlockParam.builder().text(request.userPrompt()).build())))
            .build();

    Message message = client.messages().create(params);
    StringBuilder text = new StringBuilder();
    for (ContentBlock block : message.content()) {
      block.text().ifPresent(t -> text.append(t.text()));
    }
    if (text.length() == 0) {
      throw new AnalysisException(
          ErrorKind.INVALID_RESPONSE, "No text content returned from Anthropic inference");
    }
    return text.toString();
  }

  static Base64ImageSource.MediaType mediaType(String mediaType) {
    if (mediaType == null) return Base64ImageSource.MediaType.IMAGE_JPEG;
    return switch (mediaType) {
      case "image/png" -> Base64ImageSource.MediaType.IMAGE_PNG;
      case "image/gif" -> Base64ImageSource.MediaType.IMAGE_GIF;
      case "image/webp" -> Base64ImageSource.MediaType.IMAGE_WEBP;
      default -> Base64ImageSource.MediaType.IMAGE_JPEG;
    };
  }

  @Override
  protected AnalysisException classify(RuntimeException e) {
    if (e instanceof AnthropicServiceException se) {
      return new AnalysisException(
          kindForStatus(se.statusCode()), "Anthropic returned HTTP " + se.statusCode(), e);
    }
    if (e instanceof AnthropicIoException) {
      return new AnalysisException(
          ErrorKind.TRANSIENT_NETWORK_ERROR, "Anthropic connection failed: " + e.getMessage(), e);
    }
    return super.classify(e);
  }

  @Override
  public void close() {
    client.close();
  }
}
