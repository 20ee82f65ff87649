package com.gentoro.mcprouter.invoke;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.exception.UpstreamFailureException;
import com.gentoro.mcprouter.exception.UpstreamTimeoutException;
import com.gentoro.mcprouter.http.EmbeddedJettyServer;
import com.gentoro.mcprouter.http.OkHttpFactory;
import com.gentoro.mcprouter.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class HttpMcpInvokerTest {

  private static EmbeddedJettyServer server;
  private static String baseUrl;

  /** Minimal MCP endpoint: echoes the call back, fails or stalls depending on the path. */
  static class FakeMcpServlet extends HttpServlet {
    private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      JsonNode call = mapper.readTree(req.getInputStream());
      ObjectNode reply = mapper.createObjectNode();
      reply.put("jsonrpc", "2.0");
      reply.set("id", call.get("id"));
      String path = req.getRequestURI();
      if (path.endsWith("/error")) {
        reply.putObject("error").put("code", -32601).put("message", "Unknown tool");
      } else if (path.endsWith("/broken")) {
        resp.setStatus(500);
        return;
      } else if (path.endsWith("/slow")) {
        try {
          Thread.sleep(2_000);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        reply.putObject("result");
      } else {
        ObjectNode result = reply.putObject("result");
        result.put("method", call.path("method").asText());
        result.put("tool", call.path("params").path("name").asText());
        result.set("arguments", call.path("params").path("arguments"));
        String auth = req.getHeader("Authorization");
        if (auth != null) {
          result.put("authorization", auth);
        }
      }
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.getWriter().write(mapper.writeValueAsString(reply));
    }
  }

  @BeforeAll
  static void startServer() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("http.hostname", "127.0.0.1");
    config.setProperty("http.port", 0);
    server = new EmbeddedJettyServer(config);
    server.prepare();
    server.addServlet(new FakeMcpServlet(), "/mcp/*");
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getPort() + "/mcp";
  }

  @AfterAll
  static void stopServer() {
    server.close();
  }

  private static ProviderRecord provider(String path, String apiKey) {
    return new ProviderRecord(
        "@test/mcp", "Test MCP", "", "", List.of(), List.of(), true, 0, null, baseUrl + path,
        apiKey);
  }

  private static final ToolDescriptor TOOL = ToolDescriptor.of("get_current_weather", "");
  private static final InvocationParams PARAMS =
      new InvocationParams("weather_query", "weather in Seoul", Map.of("location", "Seoul"), null);

  @Test
  void sendsToolsCallAndReturnsResult() {
    HttpMcpInvoker invoker = new HttpMcpInvoker(OkHttpFactory.create(2_000));

    JsonNode result = invoker.invoke(provider("/ok", "secret"), TOOL, PARAMS);

    assertEquals("tools/call", result.path("method").asText());
    assertEquals("get_current_weather", result.path("tool").asText());
    assertEquals("Seoul", result.path("arguments").path("location").asText());
    assertEquals("weather in Seoul", result.path("arguments").path("query").asText());
    assertEquals("Bearer secret", result.path("authorization").asText());
  }

  @Test
  void omitsAuthorizationWithoutApiKey() {
    HttpMcpInvoker invoker = new HttpMcpInvoker(OkHttpFactory.create(2_000));

    JsonNode result = invoker.invoke(provider("/ok", null), TOOL, PARAMS);

    assertTrue(result.path("authorization").isMissingNode());
  }

  @Test
  void jsonRpcErrorIsAnUpstreamFailure() {
    HttpMcpInvoker invoker = new HttpMcpInvoker(OkHttpFactory.create(2_000));

    UpstreamFailureException e =
        assertThrows(
            UpstreamFailureException.class,
            () -> invoker.invoke(provider("/error", null), TOOL, PARAMS));
    assertTrue(e.getMessage().contains("Unknown tool"));
  }

  @Test
  void httpErrorIsAnUpstreamFailure() {
    HttpMcpInvoker invoker = new HttpMcpInvoker(OkHttpFactory.create(2_000));

    UpstreamFailureException e =
        assertThrows(
            UpstreamFailureException.class,
            () -> invoker.invoke(provider("/broken", null), TOOL, PARAMS));
    assertTrue(e.getMessage().contains("500"));
  }

  @Test
  void readTimeoutIsAnUpstreamTimeout() {
    HttpMcpInvoker invoker = new HttpMcpInvoker(OkHttpFactory.create(200));

    assertThrows(
        UpstreamTimeoutException.class,
        () -> invoker.invoke(provider("/slow", null), TOOL, PARAMS));
  }

  @Test
  void providerWithoutUrlCannotBeCalled() {
    HttpMcpInvoker invoker = new HttpMcpInvoker(OkHttpFactory.create(2_000));
    ProviderRecord noUrl =
        new ProviderRecord(
            "@test/none", "None", "", "", List.of(), List.of(), true, 0, null, null, null);

    assertThrows(UpstreamFailureException.class, () -> invoker.invoke(noUrl, TOOL, PARAMS));
  }
}
