package com.gentoro.mcprouter.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mcprouter.exception.ErrorDetails;
import com.gentoro.mcprouter.exception.ExceptionUtil;
import com.gentoro.mcprouter.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Base for the JSON endpoints: body reading, JSON writing and error payloads. */
abstract class JsonServlet extends HttpServlet {
  protected final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  protected String readBody(HttpServletRequest req) throws IOException {
    return new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
  }

  /** {@code q} or {@code query} request parameter, or null when absent. */
  protected String queryParameter(HttpServletRequest req) {
    String q = req.getParameter("q");
    return q != null ? q : req.getParameter("query");
  }

  protected void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(body));
  }

  protected void writeError(HttpServletResponse resp, Throwable error) throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    writeJson(
        resp, details.code().httpStatus(), Map.of("success", false, "error", details));
  }
}
