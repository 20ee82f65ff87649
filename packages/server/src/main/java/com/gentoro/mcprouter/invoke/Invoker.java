package com.gentoro.mcprouter.invoke;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.mcprouter.catalog.ProviderRecord;
import com.gentoro.mcprouter.catalog.ToolDescriptor;

/**
 * Calls a tool on a provider. Implementations throw {@link
 * com.gentoro.mcprouter.exception.UpstreamFailureException} or {@link
 * com.gentoro.mcprouter.exception.UpstreamTimeoutException} when the provider misbehaves.
 */
public interface Invoker {
  JsonNode invoke(ProviderRecord provider, ToolDescriptor tool, InvocationParams params);

  /** Short name reported in response metadata. */
  String mode();
}
