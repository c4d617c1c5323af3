package com.gentoro.labasset.api;

import com.gentoro.labasset.service.AssetService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * GET /api/labels (list), GET /api/labels/{file} (PNG), POST /api/labels {@code {externalId,
 * title?, profile?}}, DELETE /api/labels/{file}.
 */
final class LabelsServlet extends JsonServlet {
  private final AssetService service;

  LabelsServlet(AssetService service) {
    this.service = service;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.isEmpty()) {
      writeJson(resp, 200, service.listLabels());
      return;
    }
    if (path.size() != 1) throw notFound(req);
    Path file = service.labelFile(path.get(0));
    resp.setStatus(200);
    resp.setContentType("image/png");
    resp.setContentLengthLong(Files.size(file));
    Files.copy(file, resp.getOutputStream());
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    if (!segments(req).isEmpty()) throw notFound(req);
    Map<String, Object> body = readBody(req);
    writeJson(
        resp,
        201,
        service.generateLabel(
            string(body, "externalId"), string(body, "title"), string(body, "profile")));
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.size() != 1) throw notFound(req);
    service.deleteLabel(path.get(0));
    resp.setStatus(204);
  }
}
