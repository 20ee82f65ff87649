package com.gentoro.mcprouter.cache;

/**
 * Cache key of a routing request.
 *
 * @param hash SHA-256 hex digest of {@code canonical}
 * @param canonical canonical JSON the digest was computed from
 */
public record Fingerprint(String hash, String canonical) {
  @Override
  public boolean equals(Object o) {
    return o instanceof Fingerprint other && hash.equals(other.hash);
  }

  @Override
  public int hashCode() {
    return hash.hashCode();
  }

  @Override
  public String toString() {
    return hash;
  }
}
