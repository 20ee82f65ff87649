package com.gentoro.mcprouter.invoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;
import com.gentoro.mcprouter.exception.UpstreamFailureException;
import com.gentoro.mcprouter.exception.UpstreamTimeoutException;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls provider tools over MCP JSON-RPC 2.0: one {@code tools/call} POST to the provider's
 * deployment URL, authenticated with its API key as a bearer token when one is configured.
 */
public class HttpMcpInvoker implements Invoker {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(HttpMcpInvoker.class);

  public static final String MODE = "http";
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final AtomicLong requestIds = new AtomicLong();

  public HttpMcpInvoker(OkHttpClient client) {
    this.client = client;
  }

  @Override
  public JsonNode invoke(ProviderRecord provider, ToolDescriptor tool, InvocationParams params) {
    String url = provider.deploymentUrl();
    if (url == null || url.isBlank()) {
      throw new UpstreamFailureException("Provider " + provider.id() + " has no deployment URL");
    }

    ObjectNode payload = mapper.createObjectNode();
    payload.put("jsonrpc", "2.0");
    payload.put("id", requestIds.incrementAndGet());
    payload.put("method", "tools/call");
    ObjectNode rpcParams = payload.putObject("params");
    rpcParams.put("name", tool.name());
    rpcParams.set("arguments", mapper.valueToTree(params.toArguments()));

    Request.Builder builder =
        new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .post(RequestBody.create(payload.toString(), JSON));
    if (provider.apiKey() != null && !provider.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + provider.apiKey());
    }

    log.debug("Calling tool {} on {}", tool.name(), provider.id());
    try (Response response = client.newCall(builder.build()).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new UpstreamFailureException(
            "Provider %s answered HTTP %d".formatted(provider.id(), response.code()));
      }
      JsonNode reply = mapper.readTree(text);
      if (reply == null || !reply.isObject()) {
        throw new UpstreamFailureException(
            "Provider " + provider.id() + " returned a non JSON-RPC payload");
      }
      JsonNode error = reply.get("error");
      if (error != null && !error.isNull()) {
        throw new UpstreamFailureException(
            "Provider %s returned error: %s"
                .formatted(provider.id(), error.path("message").asText(error.toString())));
      }
      JsonNode result = reply.get("result");
      return result == null ? mapper.nullNode() : result;
    } catch (InterruptedIOException e) {
      throw new UpstreamTimeoutException(
          "Provider " + provider.id() + " did not answer in time", e);
    } catch (IOException e) {
      throw new UpstreamFailureException(
          "Provider %s call failed: %s".formatted(provider.id(), e.getMessage()), e);
    }
  }

  @Override
  public String mode() {
    return MODE;
  }
}
