package com.gentoro.labasset.http;

import com.gentoro.labasset.logging.LoggingService;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/** Debug logging of outbound calls. Credentials are redacted and large bodies truncated. */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);
  private static final int MAX_BODY_CHARS = 2000;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending {} {}\nHeaders:\n{}Body: {}",
          request.method(),
          request.url(),
          redact(request.headers()),
          bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsed(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage());
      throw e;
    }

    log.debug(
        "Received {} for {} {} in {} ms",
        response.code(),
        request.method(),
        response.request().url(),
        elapsed(startTime));
    if (log.isTraceEnabled()) {
      try {
        log.trace("Response body: {}", truncate(response.peekBody(MAX_BODY_CHARS * 4L).string()));
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
    }
    return response;
  }

  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      boolean secret =
          name.equalsIgnoreCase("Authorization")
              || name.equalsIgnoreCase("x-api-key")
              || name.equalsIgnoreCase("x-goog-api-key");
      sb.append(name).append(": ").append(secret ? "***" : headers.value(i)).append('\n');
    }
    return sb.toString();
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    if (request.body() == null) return "(none)";
    MediaType type = request.body().contentType();
    if (type != null && !"json".equals(type.subtype()) && !"text".equals(type.type())) {
      return "(" + type + ")";
    }
    try {
      Buffer buffer = new Buffer();
      request.newBuilder().build().body().writeTo(buffer);
      return truncate(buffer.readUtf8());
    } catch (IOException e) {
      return "(error reading body)";
    }
  }

  private static String truncate(String body) {
    if (body == null) return "";
    return body.length() <= MAX_BODY_CHARS
        ? body
        : body.substring(0, MAX_BODY_CHARS) + "... (" + body.length() + " chars)";
  }
}
