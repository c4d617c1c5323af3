package com.gentoro.labasset.api;

import com.gentoro.labasset.service.AssetService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/** GET /api/system/status, GET /api/system/logs?lines=n. */
final class SystemServlet extends JsonServlet {
  static final int DEFAULT_LOG_LINES = 100;

  private final AssetService service;

  SystemServlet(AssetService service) {
    this.service = service;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.equals(List.of("status"))) {
      writeJson(resp, 200, service.systemStatus());
    } else if (path.equals(List.of("logs"))) {
      int lines = intParam(req, "lines", DEFAULT_LOG_LINES);
      writeJson(resp, 200, Map.of("lines", service.systemLogs(lines)));
    } else {
      throw notFound(req);
    }
  }
}
