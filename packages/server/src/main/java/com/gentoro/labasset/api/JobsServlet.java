package com.gentoro.labasset.api;

import com.gentoro.labasset.service.AssetService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * GET /api/jobs, GET /api/jobs/{id}, DELETE /api/jobs/{id} (cancel), POST /api/jobs {@code
 * {captureArtifactId}}.
 */
final class JobsServlet extends JsonServlet {
  private final AssetService service;

  JobsServlet(AssetService service) {
    this.service = service;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.isEmpty()) {
      writeJson(resp, 200, service.jobs());
    } else if (path.size() == 1) {
      writeJson(resp, 200, service.job(path.get(0)));
    } else {
      throw notFound(req);
    }
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!segments(req).isEmpty()) throw notFound(req);
    writeJson(resp, 202, service.submit(string(readBody(req), "captureArtifactId")));
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.size() != 1) throw notFound(req);
    writeJson(resp, 202, service.cancelJob(path.get(0)));
  }
}
