package com.gentoro.mcprouter.api;

import com.gentoro.mcprouter.cache.ResponseCache;
import com.gentoro.mcprouter.catalog.ProviderCatalog;
import com.gentoro.mcprouter.invoke.Invoker;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** GET /health */
public final class HealthServlet extends JsonServlet {
  private final ProviderCatalog catalog;
  private final ResponseCache<?> cache;
  private final Invoker invoker;

  public HealthServlet(ProviderCatalog catalog, ResponseCache<?> cache, Invoker invoker) {
    this.catalog = catalog;
    this.cache = cache;
    this.invoker = invoker;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("catalogDriver", catalog.driverId());
    body.put("catalogSize", catalog.size());
    body.put("cacheEntries", cache.size());
    body.put("invoker", invoker.mode());
    writeJson(resp, 200, body);
  }
}
