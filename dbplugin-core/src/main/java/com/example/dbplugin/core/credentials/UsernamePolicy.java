package com.example.dbplugin.core.credentials;

/**
 * Identifier length class of a backend.
 *
 * @param maxLength longest username the backend accepts
 * @param metadataLength characters reserved for the role name
 */
public record UsernamePolicy(int maxLength, int metadataLength) {

  /** Older backends with 16 character identifiers. */
  public static final UsernamePolicy LEGACY = new UsernamePolicy(16, 4);

  /** Current backends with 32 character identifiers. */
  public static final UsernamePolicy CURRENT = new UsernamePolicy(32, 10);

  public UsernamePolicy {
    if (maxLength < 1) throw new IllegalArgumentException("maxLength must be >= 1");
    if (metadataLength < 0) throw new IllegalArgumentException("metadataLength must be >= 0");
  }

  public static UsernamePolicy of(final boolean legacyMode) {
    return legacyMode ? LEGACY : CURRENT;
  }

  /**
   * Narrows this policy to {@code limit} characters. Non-positive limits leave it unchanged.
   *
   * @param limit caller-supplied maximum length
   * @return policy whose max length is the smaller of the two
   */
  public UsernamePolicy capTo(final int limit) {
    if (limit <= 0 || limit >= maxLength) return this;
    return new UsernamePolicy(limit, Math.min(metadataLength, limit));
  }
}
