package com.gentoro.labasset.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.labasset.exception.AnalysisException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.http.OkHttpFactory;
import com.gentoro.labasset.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** Locally hosted model served by Ollama ({@code POST /api/chat}, non-streaming). */
public class OllamaVisionProvider extends AbstractVisionProvider {
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient http;

  public OllamaVisionProvider(ProviderSettings settings) {
    this(settings, OkHttpFactory.create(settings.timeout(), true));
  }

  public OllamaVisionProvider(ProviderSettings settings, OkHttpClient http) {
    super(settings);
    this.http = http;
  }

  @Override
  protected String run(VisionRequest request) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("model", settings.effectiveModel());
    body.put("stream", false);
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", request.systemPrompt());
    ObjectNode user = messages.addObject().put("role", "user").put("content", request.userPrompt());
    user.putArray("images").add(request.imageBase64());
    ObjectNode options = body.putObject("options");
    options.put("temperature", settings.temperature());
    options.put("num_predict", settings.maxOutputTokens());

    Request httpRequest =
        new Request.Builder()
            .url(settings.localEndpoint() + "/api/chat")
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();

    try (Response response = http.newCall(httpRequest).execute()) {
      ResponseBody responseBody = response.body();
      String payload = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new AnalysisException(
            kindForStatus(response.code()),
            "Ollama returned HTTP " + response.code() + ": " + abbreviate(payload));
      }
      JsonNode node = JacksonUtility.getJsonMapper().readTree(payload);
      JsonNode content = node.path("message").path("content");
      if (!content.isTextual()) {
        throw new AnalysisException(
            ErrorKind.INVALID_RESPONSE, "Ollama response has no message content");
      }
      return content.asText();
    } catch (SocketTimeoutException e) {
      throw new AnalysisException(ErrorKind.PROVIDER_TIMEOUT, "Ollama call timed out", e);
    } catch (InterruptedIOException e) {
      throw new AnalysisException(ErrorKind.PROVIDER_TIMEOUT, "Ollama call abandoned", e);
    } catch (IOException e) {
      throw new AnalysisException(
          ErrorKind.TRANSIENT_NETWORK_ERROR, "Ollama connection failed: " + e.getMessage(), e);
    }
  }

  private static String abbreviate(String s) {
    return s.length() <= 300 ? s : s.substring(0, 300) + "...";
  }
}
