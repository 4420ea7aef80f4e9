package com.example.dbplugin.core.credentials;

import com.example.dbplugin.core.errors.UsernameGenerationException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Random;

/**
 * Generates backend-compliant usernames of the form {@code v-<display>-<role>-<suffix>}.
 *
 * <p>The random suffix is never shortened. When the result would be too long the display name is
 * trimmed first, then the role name; a part trimmed to nothing is dropped along with its separator.
 */
public final class UsernameGenerator {

  static final String PREFIX = "v";
  static final String SEPARATOR = "-";
  static final int SUFFIX_LENGTH = 8;

  private static final char[] SUFFIX_ALPHABET =
      "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

  private final Random random;

  public UsernameGenerator() {
    this(new SecureRandom());
  }

  UsernameGenerator(final Random random) {
    this.random = random;
  }

  /**
   * Generates a username for the legacy or current length class.
   *
   * @param displayName display name of the requester
   * @param roleName role the credential is issued for
   * @param maxLength additional cap on the length, ignored when not positive
   * @param legacyMode whether to use the legacy (16 character) class
   * @return generated username
   * @throws UsernameGenerationException if not even the prefix and suffix fit
   */
  public String generate(
      final String displayName,
      final String roleName,
      final int maxLength,
      final boolean legacyMode) {
    return generate(displayName, roleName, UsernamePolicy.of(legacyMode).capTo(maxLength));
  }

  /**
   * Generates a username within {@code policy}.
   *
   * @param displayName display name of the requester
   * @param roleName role the credential is issued for
   * @param policy length limits
   * @return generated username
   * @throws UsernameGenerationException if not even the prefix and suffix fit
   */
  public String generate(
      final String displayName, final String roleName, final UsernamePolicy policy) {
    final var minimum = PREFIX.length() + SEPARATOR.length() + SUFFIX_LENGTH;
    if (policy.maxLength() < minimum) {
      throw new UsernameGenerationException(
          "error generating username: max length %d cannot hold a %d character suffix"
              .formatted(policy.maxLength(), SUFFIX_LENGTH));
    }

    final var suffix = randomSuffix();
    var display = truncate(sanitize(displayName), policy.maxLength());
    var role = truncate(sanitize(roleName), policy.metadataLength());

    var overflow = join(display, role, suffix).length() - policy.maxLength();
    if (overflow > 0) {
      final var cut = Math.min(overflow, display.length());
      display = display.substring(0, display.length() - cut);
      overflow = join(display, role, suffix).length() - policy.maxLength();
    }
    if (overflow > 0) {
      final var cut = Math.min(overflow, role.length());
      role = role.substring(0, role.length() - cut);
    }

    return join(display, role, suffix);
  }

  static String sanitize(final String value) {
    if (value == null) return "";
    final var sb = new StringBuilder(value.length());
    for (final var c : value.toCharArray()) {
      final var allowed =
          (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
      sb.append(allowed ? c : '_');
    }
    return sb.toString();
  }

  private static String truncate(final String value, final int length) {
    return value.length() <= length ? value : value.substring(0, length);
  }

  private static String join(final String display, final String role, final String suffix) {
    final var parts = new ArrayList<String>(4);
    parts.add(PREFIX);
    if (!display.isEmpty()) parts.add(display);
    if (!role.isEmpty()) parts.add(role);
    parts.add(suffix);
    return String.join(SEPARATOR, parts);
  }

  private String randomSuffix() {
    final var chars = new char[SUFFIX_LENGTH];
    for (int i = 0; i < chars.length; i++)
      chars[i] = SUFFIX_ALPHABET[random.nextInt(SUFFIX_ALPHABET.length)];
    return new String(chars);
  }
}
