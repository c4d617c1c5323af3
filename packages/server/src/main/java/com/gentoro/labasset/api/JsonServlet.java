package com.gentoro.labasset.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.labasset.exception.ErrorDetails;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.ExceptionUtil;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.utility.JacksonUtility;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Base of the API servlets: JSON in, JSON out. Failures are answered with {@code {errorKind,
 * message}} and the HTTP status of the error kind.
 */
abstract class JsonServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(JsonServlet.class);
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  protected final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  @Override
  protected void service(HttpServletRequest req, HttpServletResponse resp)
      throws ServletException, IOException {
    try {
      super.service(req, resp);
    } catch (LabAssetException e) {
      if (e.getKind().httpStatus() >= 500) {
        log.warn("{} {} failed: [{}] {}", req.getMethod(), req.getRequestURI(), e.getKind(), e);
      } else {
        log.debug("{} {} rejected: [{}] {}", req.getMethod(), req.getRequestURI(), e.getKind(), e);
      }
      writeError(resp, e.getKind().httpStatus(), ExceptionUtil.toErrorDetails(e));
    } catch (RuntimeException e) {
      log.error("{} {} failed", req.getMethod(), req.getRequestURI(), e);
      writeError(resp, 500, ExceptionUtil.toErrorDetails(e));
    }
  }

  /** Path below the servlet mapping, split on {@code /}; empty for the collection itself. */
  protected static List<String> segments(HttpServletRequest req) {
    String info = req.getPathInfo();
    if (info == null || info.equals("/") || info.isEmpty()) return List.of();
    String trimmed = info.startsWith("/") ? info.substring(1) : info;
    if (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return List.of(trimmed.split("/"));
  }

  protected Map<String, Object> readBody(HttpServletRequest req) throws IOException {
    try (InputStream in = req.getInputStream()) {
      String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      if (text.isBlank()) return new LinkedHashMap<>();
      return mapper.readValue(text, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new InvalidInputException("Request body is not a JSON object", e);
    }
  }

  protected void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(body));
  }

  private void writeError(HttpServletResponse resp, int status, ErrorDetails details)
      throws IOException {
    if (resp.isCommitted()) return;
    resp.reset();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("errorKind", details.errorKind());
    body.put("message", details.message());
    if (!details.context().isEmpty()) body.put("context", details.context());
    writeJson(resp, status, body);
  }

  protected static LabAssetException notFound(HttpServletRequest req) {
    return new LabAssetException(
        ErrorKind.NOT_FOUND, "No route for " + req.getMethod() + " " + req.getRequestURI());
  }

  protected static String string(Map<String, Object> body, String key) {
    Object value = body.get(key);
    if (value == null) return null;
    if (value instanceof Map || value instanceof List) {
      throw new InvalidInputException("'" + key + "' must be a string");
    }
    return String.valueOf(value);
  }

  protected static Integer integer(Map<String, Object> body, String key) {
    Object value = body.get(key);
    if (value == null) return null;
    if (value instanceof Number n) return n.intValue();
    try {
      return Integer.valueOf(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new InvalidInputException("'" + key + "' must be an integer", e);
    }
  }

  protected static int intParam(HttpServletRequest req, String name, int defaultValue) {
    String value = req.getParameter(name);
    if (value == null || value.isBlank()) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidInputException("Query parameter '" + name + "' must be an integer", e);
    }
  }

  @SuppressWarnings("unchecked")
  protected static Map<String, Object> object(Map<String, Object> body, String key) {
    Object value = body.get(key);
    if (value == null) return null;
    if (!(value instanceof Map)) {
      throw new InvalidInputException("'" + key + "' must be an object");
    }
    return (Map<String, Object>) value;
  }

  protected static List<String> strings(Map<String, Object> body, String key) {
    Object value = body.get(key);
    if (value == null) return null;
    if (!(value instanceof List<?> list)) {
      throw new InvalidInputException("'" + key + "' must be a list");
    }
    return list.stream().map(String::valueOf).toList();
  }
}
