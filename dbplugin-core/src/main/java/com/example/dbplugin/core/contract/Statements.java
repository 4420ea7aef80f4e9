package com.example.dbplugin.core.contract;

import java.util.List;

/**
 * Ordered statement templates supplied by the host for one lifecycle operation. A single command
 * may hold several {@code ;}-separated statements.
 *
 * @param commands statement templates, never null
 */
public record Statements(List<String> commands) {

  public Statements {
    commands = commands == null ? List.of() : List.copyOf(commands);
  }

  public static Statements of(final String... commands) {
    return new Statements(List.of(commands));
  }

  public static Statements empty() {
    return new Statements(List.of());
  }

  /**
   * True when there is no command with any non-blank text.
   *
   * @return whether the set is effectively empty
   */
  public boolean isEmpty() {
    return commands.stream().allMatch(c -> c == null || c.isBlank());
  }
}
