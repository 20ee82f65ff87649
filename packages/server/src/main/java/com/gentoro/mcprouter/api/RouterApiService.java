package com.gentoro.mcprouter.api;

import com.gentoro.mcprouter.McpRouter;
import com.gentoro.mcprouter.http.EmbeddedJettyServer;

/** Registers the routing endpoints on the shared Jetty server. */
public class RouterApiService {
  public static final String ROUTE_PATH = "/api/route";
  public static final String PARSE_PATH = "/api/parse";
  public static final String CACHE_PATH = "/api/cache";
  public static final String HEALTH_PATH = "/health";

  private final McpRouter router;

  public RouterApiService(McpRouter router) {
    this.router = router;
  }

  public void register() {
    EmbeddedJettyServer http = router.httpServer();
    http.addServlet(new RouteServlet(router.engine()), ROUTE_PATH);
    http.addServlet(new ParseServlet(router.engine().parser()), PARSE_PATH);
    http.addServlet(new CacheServlet(router.engine().cache()), CACHE_PATH);
    http.addServlet(
        new HealthServlet(router.catalog(), router.engine().cache(), router.invoker()),
        HEALTH_PATH);
  }
}
