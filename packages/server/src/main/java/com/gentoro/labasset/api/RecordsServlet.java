package com.gentoro.labasset.api;

import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.record.RecordFilter;
import com.gentoro.labasset.service.AssetService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record operations under /api/records: list and create on the collection, read and update on
 * {@code /{id}}, plus {@code /settings} and {@code /templates}.
 */
final class RecordsServlet extends JsonServlet {
  private final AssetService service;

  RecordsServlet(AssetService service) {
    this.service = service;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.isEmpty()) {
      String category = req.getParameter("category");
      RecordFilter filter =
          new RecordFilter(
              req.getParameter("q"),
              category == null || category.isBlank() ? null : intParam(req, "category", 0),
              intParam(req, "limit", RecordFilter.MAX_LIMIT),
              intParam(req, "offset", 0));
      writeJson(resp, 200, service.listRecords(filter));
    } else if (path.size() != 1) {
      throw notFound(req);
    } else if (path.get(0).equals("settings")) {
      writeJson(resp, 200, service.recordSettings());
    } else if (path.get(0).equals("templates")) {
      writeJson(resp, 200, service.recordTemplates());
    } else {
      writeJson(resp, 200, service.getRecord(path.get(0)));
    }
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    Map<String, Object> body = readBody(req);
    if (path.equals(List.of("settings"))) {
      writeJson(resp, 200, service.updateRecordSettings(body));
    } else if (path.isEmpty()) {
      writeJson(
          resp,
          201,
          service.createRecord(
              string(body, "title"),
              string(body, "body"),
              integer(body, "categoryId"),
              object(body, "attributes"),
              strings(body, "tags"),
              string(body, "idempotencyKey")));
    } else {
      throw notFound(req);
    }
  }

  /** Body: {@code expectedVersion} plus the fields to change. */
  @Override
  protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<String> path = segments(req);
    if (path.size() != 1 || path.get(0).equals("settings") || path.get(0).equals("templates")) {
      throw notFound(req);
    }
    Map<String, Object> fields = new LinkedHashMap<>(readBody(req));
    Object version = fields.remove("expectedVersion");
    if (!(version instanceof Number n)) {
      throw new InvalidInputException("expectedVersion must be a number");
    }
    writeJson(resp, 200, service.updateRecord(path.get(0), fields, n.longValue()));
  }
}
