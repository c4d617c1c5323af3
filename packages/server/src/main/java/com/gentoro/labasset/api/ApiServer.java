package com.gentoro.labasset.api;

import com.gentoro.labasset.http.EmbeddedJettyServer;
import com.gentoro.labasset.service.AssetService;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the JSON API servlets under {@code /api} on the embedded Jetty context. */
public final class ApiServer {
  static final String CONTEXT_PATH = "/api";

  private final AssetService service;

  public ApiServer(AssetService service) {
    this.service = service;
  }

  public void register(EmbeddedJettyServer server) {
    register(server.getContextHandler());
  }

  public void register(ServletContextHandler ctx) {
    ctx.addServlet(new ServletHolder(new CaptureServlet(service)), path("capture"));
    ctx.addServlet(new ServletHolder(new AnalysisServlet(service)), path("analysis"));
    ctx.addServlet(new ServletHolder(new RecordsServlet(service)), path("records"));
    ctx.addServlet(new ServletHolder(new LabelsServlet(service)), path("labels"));
    ctx.addServlet(new ServletHolder(new JobsServlet(service)), path("jobs"));
    ctx.addServlet(new ServletHolder(new SystemServlet(service)), path("system"));
  }

  private static String path(String resource) {
    return "%s/%s/*".formatted(CONTEXT_PATH, resource);
  }
}
