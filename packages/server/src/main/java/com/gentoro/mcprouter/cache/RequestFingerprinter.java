package com.gentoro.mcprouter.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.mcprouter.exception.MalformedInputException;
import com.gentoro.mcprouter.parse.ParsedRequest;
import com.gentoro.mcprouter.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache key for a parsed request.
 *
 * <p>The key covers the intent, the normalized text (free text only), the sorted entities, the
 * sorted capability set, the category, the request context and the effective
 * verification requirement. Nothing time- or request-specific goes in, so identical requests
 * always collide.
 */
public class RequestFingerprinter {

  public Fingerprint fingerprint(
      ParsedRequest parsed, Map<String, Object> context, boolean requireVerified) {
    Map<String, Object> key = new LinkedHashMap<>();
    key.put("intent", parsed.intent());
    if (!parsed.structured()) {
      key.put("text", parsed.normalizedText());
    }
    // entities are extracted from case-preserved text, so "AAPL" and "aapl" must not collide
    key.put("entities", new TreeMap<>(parsed.entities()));
    List<String> capabilities = new ArrayList<>(parsed.capabilities());
    Collections.sort(capabilities);
    key.put("capabilities", capabilities);
    key.put("category", parsed.category());
    key.put("context", context == null ? Map.of() : context);
    key.put("requireVerified", requireVerified);

    String canonical;
    try {
      canonical = JacksonUtility.getCanonicalMapper().writeValueAsString(key);
    } catch (JsonProcessingException e) {
      throw new MalformedInputException("Request context cannot be serialized", e);
    }
    return new Fingerprint(sha256(canonical), canonical);
  }

  static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
