package com.gentoro.mcprouter.api;

import com.gentoro.mcprouter.exception.RouterException;
import com.gentoro.mcprouter.model.RoutingRequest;
import com.gentoro.mcprouter.parse.RequestParser;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** Parse-only endpoint: POST /api/parse or GET /api/parse?q=... */
public final class ParseServlet extends JsonServlet {
  private final RequestParser parser;

  public ParseServlet(RequestParser parser) {
    this.parser = parser;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      writeJson(resp, 200, parser.parse(RoutingRequest.valueOf(readBody(req))));
    } catch (RouterException e) {
      writeError(resp, e);
    }
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    try {
      writeJson(resp, 200, parser.parse(RoutingRequest.ofQuery(queryParameter(req))));
    } catch (RouterException e) {
      writeError(resp, e);
    }
  }
}
