package com.gentoro.labasset.api;

import com.gentoro.labasset.service.AssetService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * GET /api/capture/status, GET/POST /api/capture/settings, POST /api/capture (capture and start a
 * job).
 */
final class CaptureServlet extends JsonServlet {
  private final AssetService service;

  CaptureServlet(AssetService service) {
    this.service = service;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.equals(List.of("status"))) {
      writeJson(resp, 200, service.captureStatus());
    } else if (path.equals(List.of("settings"))) {
      writeJson(resp, 200, service.captureSettings());
    } else {
      throw notFound(req);
    }
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.equals(List.of("settings"))) {
      writeJson(resp, 200, service.updateCaptureSettings(readBody(req)));
    } else if (path.isEmpty()) {
      writeJson(resp, 202, service.triggerCapture());
    } else {
      throw notFound(req);
    }
  }
}
