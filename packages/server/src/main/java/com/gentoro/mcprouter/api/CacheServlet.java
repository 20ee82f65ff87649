package com.gentoro.mcprouter.api;

import com.gentoro.mcprouter.cache.ResponseCache;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;

/** GET /api/cache returns counters; DELETE /api/cache drops every entry. */
public final class CacheServlet extends JsonServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.mcprouter.logging.LoggingService.getLogger(CacheServlet.class);

  private final ResponseCache<?> cache;

  public CacheServlet(ResponseCache<?> cache) {
    this.cache = cache;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    writeJson(resp, 200, cache.stats());
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    int removed = cache.size();
    cache.clear();
    log.info("Response cache cleared ({} entries)", removed);
    writeJson(resp, 200, Map.of("cleared", removed));
  }
}
