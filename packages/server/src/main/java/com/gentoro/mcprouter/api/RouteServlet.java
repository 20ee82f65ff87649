package com.gentoro.mcprouter.api;

import com.gentoro.mcprouter.engine.RoutingEngine;
import com.gentoro.mcprouter.exception.MalformedInputException;
import com.gentoro.mcprouter.model.RoutingRequest;
import com.gentoro.mcprouter.model.RoutingResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /api/route with a {@link RoutingRequest} body, or GET /api/route?q=... */
public final class RouteServlet extends JsonServlet {
  private final RoutingEngine engine;

  public RouteServlet(RoutingEngine engine) {
    this.engine = engine;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    RoutingRequest request;
    try {
      request = RoutingRequest.valueOf(readBody(req));
    } catch (MalformedInputException e) {
      writeError(resp, e);
      return;
    }
    respond(resp, engine.route(request));
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String query = queryParameter(req);
    if (query == null || query.isBlank()) {
      writeError(resp, new MalformedInputException("Query parameter 'q' or 'query' is required"));
      return;
    }
    respond(resp, engine.route(RoutingRequest.ofQuery(query)));
  }

  private void respond(HttpServletResponse resp, RoutingResponse response) throws IOException {
    writeJson(resp, response.httpStatus(), response);
  }
}
