package com.gentoro.mcprouter.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void routerExceptionsKeepCodeAndContext() {
    NoMatchingToolException e =
        new NoMatchingToolException("no tool", List.of("OpenWeather", "Weather Lite"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(e);

    assertEquals("NoMatchingToolException", details.type());
    assertEquals(RouterErrorCode.NO_MATCHING_TOOL, details.code());
    assertEquals(404, details.code().httpStatus());
    assertEquals(
        List.of("OpenWeather", "Weather Lite"), details.context().get("evaluatedProviders"));
    assertNotNull(details.timestamp());
  }

  @Test
  void foreignExceptionsAreInternalErrors() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(RouterErrorCode.INTERNAL_ERROR, details.code());
    assertEquals("", details.message());
    assertNull(details.context());
  }

  @Test
  void extractErrorMessageWalksTheCauseChain() {
    Exception wrapped = new RuntimeException(null, new IOException("connection reset"));
    assertEquals("IOException: connection reset", ExceptionUtil.extractErrorMessage(wrapped));
    assertEquals(
        "catalog down",
        ExceptionUtil.extractErrorMessage(new UpstreamFailureException("catalog down")));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void rethrowIfUncheckedKeepsRouterExceptions() {
    ConfigException config = new ConfigException("bad");
    assertSame(config, ExceptionUtil.rethrowIfUnchecked(config, t -> new NetworkException("x", t)));

    RouterException wrapped =
        ExceptionUtil.rethrowIfUnchecked(
            new IOException("port in use"), t -> new NetworkException("start failed", t));
    assertEquals(RouterErrorCode.NETWORK_ERROR, wrapped.getCode());
  }
}
