package com.gentoro.labasset.api;

import com.gentoro.labasset.service.AssetService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * GET/POST /api/analysis/settings, POST /api/analysis with {@code {artifactId | imagePath,
 * prompt}}.
 */
final class AnalysisServlet extends JsonServlet {
  private final AssetService service;

  AnalysisServlet(AssetService service) {
    this.service = service;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!segments(req).equals(List.of("settings"))) throw notFound(req);
    writeJson(resp, 200, service.analysisSettings());
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    Map<String, Object> body = readBody(req);
    if (path.equals(List.of("settings"))) {
      writeJson(resp, 200, service.updateAnalysisSettings(body));
    } else if (path.isEmpty()) {
      writeJson(
          resp,
          200,
          service.analyze(
              string(body, "artifactId"), string(body, "imagePath"), string(body, "prompt")));
    } else {
      throw notFound(req);
    }
  }
}
