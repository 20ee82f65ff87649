package com.gentoro.mcprouter.api;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.mcprouter.McpRouter;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class RouterApiServiceTest {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private static McpRouter router;
  private static OkHttpClient client;
  private static String baseUrl;

  @BeforeAll
  static void start() {
    router =
        new McpRouter(
            new String[] {"--mode", "server", "--config", "classpath:test-application.yaml"});
    router.initialize();
    client = new OkHttpClient();
    baseUrl = "http://127.0.0.1:" + router.httpServer().getPort();
  }

  @AfterAll
  static void stop() {
    router.shutdown();
  }

  private record Reply(int status, JsonNode body) {}

  private static Reply call(Request request) throws IOException {
    try (Response response = client.newCall(request).execute()) {
      String text = response.body() == null ? "" : response.body().string();
      return new Reply(response.code(), JacksonUtility.getJsonMapper().readTree(text));
    }
  }

  private static Reply get(String path, String q) throws IOException {
    HttpUrl.Builder url = HttpUrl.get(baseUrl + path).newBuilder();
    if (q != null) {
      url.addQueryParameter("q", q);
    }
    return call(new Request.Builder().url(url.build()).get().build());
  }

  private static Reply post(String path, String body) throws IOException {
    return call(
        new Request.Builder().url(baseUrl + path).post(RequestBody.create(body, JSON)).build());
  }

  @Test
  void healthReportsCatalogAndInvoker() throws Exception {
    Reply reply = get(RouterApiService.HEALTH_PATH, null);

    assertEquals(200, reply.status());
    assertEquals("UP", reply.body().path("status").asText());
    assertEquals("in-memory", reply.body().path("catalogDriver").asText());
    assertEquals(5, reply.body().path("catalogSize").asInt());
    assertEquals("mock", reply.body().path("invoker").asText());
  }

  @Test
  void routesFreeTextQueryOverGet() throws Exception {
    Reply reply = get(RouterApiService.ROUTE_PATH, "what's the weather in Seoul");

    assertEquals(200, reply.status());
    assertTrue(reply.body().path("success").asBoolean());
    assertEquals("Seoul", reply.body().path("result").path("location").asText());
    assertEquals(
        "@openweather/current", reply.body().path("metadata").path("chosenProviderId").asText());
    assertEquals("weather_query", reply.body().path("parsed").path("intent").asText());
    assertEquals("direct_execution", reply.body().path("parsed").path("strategy").asText());
  }

  @Test
  void routesStructuredRequestOverPost() throws Exception {
    Reply reply =
        post(
            RouterApiService.ROUTE_PATH,
            """
            {"intent": "cryptocurrency_price_query",
             "capabilities": ["crypto_price", "market_data"],
             "entities": {"cryptocurrency": "ethereum"}}
            """);

    assertEquals(200, reply.status());
    assertEquals("ETH", reply.body().path("result").path("symbol").asText());
    assertEquals(1.0, reply.body().path("metadata").path("confidence").asDouble(), 1e-9);
    assertEquals("get_price", reply.body().path("metadata").path("chosenTool").asText());
  }

  @Test
  void malformedBodyIs400() throws Exception {
    Reply reply = post(RouterApiService.ROUTE_PATH, "{not json");

    assertEquals(400, reply.status());
    assertFalse(reply.body().path("success").asBoolean(true));
    assertEquals("MALFORMED_INPUT", reply.body().path("error").path("code").asText());
  }

  @Test
  void missingQueryParameterIs400() throws Exception {
    assertEquals(400, get(RouterApiService.ROUTE_PATH, null).status());
    assertEquals(400, get(RouterApiService.PARSE_PATH, null).status());
  }

  @Test
  void unmatchedQueryIs404() throws Exception {
    Reply reply = post(RouterApiService.ROUTE_PATH, "{\"query\": \"hello there\"}");

    assertEquals(404, reply.status());
    assertEquals("NO_CANDIDATE_FOUND", reply.body().path("error").path("code").asText());
  }

  @Test
  void parseEndpointReturnsParsedRequest() throws Exception {
    Reply reply = get(RouterApiService.PARSE_PATH, "bitcoin price");

    assertEquals(200, reply.status());
    assertEquals("cryptocurrency_price_query", reply.body().path("intent").asText());
    assertEquals("Finance", reply.body().path("category").asText());
    assertEquals("crypto_price", reply.body().path("capabilities").get(0).asText());
  }

  @Test
  void cacheEndpointReportsAndClears() throws Exception {
    get(RouterApiService.ROUTE_PATH, "bitcoin price");
    get(RouterApiService.ROUTE_PATH, "bitcoin price");

    Reply stats = get(RouterApiService.CACHE_PATH, null);
    assertEquals(200, stats.status());
    assertTrue(stats.body().path("enabled").asBoolean());
    assertTrue(stats.body().path("entries").asInt() >= 1);
    assertTrue(stats.body().path("hits").asLong() >= 1);

    Reply cleared =
        call(new Request.Builder().url(baseUrl + RouterApiService.CACHE_PATH).delete().build());
    assertEquals(200, cleared.status());
    assertTrue(cleared.body().path("cleared").asInt() >= 1);
    assertEquals(0, get(RouterApiService.CACHE_PATH, null).body().path("entries").asInt());
  }
}
