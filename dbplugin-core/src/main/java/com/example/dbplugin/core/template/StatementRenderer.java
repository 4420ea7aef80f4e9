package com.example.dbplugin.core.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns operator-supplied statement templates into the ordered list of statements a lifecycle
 * operation executes.
 *
 * <p>A template is either a JSON array of statements or a script of statements separated by
 * {@code ;}. Separators inside single, double or back-tick quotes do not split. Placeholders take
 * the form {@code {{key}}}; tokens without a value in the substitution map are left untouched.
 *
 * <pre>{@code
 * StatementRenderer.render(
 *     List.of("ALTER USER '{{username}}'@'%' IDENTIFIED BY '{{password}}';"),
 *     Map.of("username", "u1", "password", "p1"));
 * // -> ["ALTER USER 'u1'@'%' IDENTIFIED BY 'p1'"]
 * }</pre>
 */
public final class StatementRenderer {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private StatementRenderer() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used to read JSON array templates.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Splits every template, substitutes placeholders and flattens the result in order.
   *
   * @param templates statement templates
   * @param values substitution values keyed by placeholder name
   * @return non-empty statements ready to execute
   */
  public static List<String> render(
      final List<String> templates, final Map<String, String> values) {
    final var statements = new ArrayList<String>();
    for (final var template : templates)
      for (final var statement : split(template)) statements.add(substitute(statement, values));
    return List.copyOf(statements);
  }

  /**
   * Splits a template into trimmed, non-empty statements.
   *
   * @param template a JSON array of statements or a {@code ;}-separated script
   * @return statements in template order
   */
  public static List<String> split(final String template) {
    if (template == null) return List.of();
    final var trimmed = template.trim();
    if (trimmed.isEmpty()) return List.of();

    final List<String> parts =
        trimmed.startsWith("[") ? parseJsonArray(trimmed) : splitOnSeparators(trimmed);

    final var statements = new ArrayList<String>(parts.size());
    for (final var part : parts) {
      if (part == null) continue;
      final var statement = part.trim();
      if (!statement.isEmpty()) statements.add(statement);
    }
    return statements;
  }

  /**
   * Replaces each {@code {{key}}} in {@code statement} with its value.
   *
   * @param statement a single statement
   * @param values substitution values
   * @return statement with known placeholders replaced
   */
  public static String substitute(final String statement, final Map<String, String> values) {
    var result = statement;
    for (final var entry : values.entrySet()) {
      final var value = entry.getValue() == null ? "" : entry.getValue();
      result = result.replace("{{" + entry.getKey() + "}}", value);
    }
    return result;
  }

  private static List<String> parseJsonArray(final String template) {
    try {
      return mapperSupplier.get().readValue(template, STRING_LIST);
    } catch (final Exception e) {
      // Not JSON after all, e.g. a statement that starts with a bracketed identifier.
      return splitOnSeparators(template);
    }
  }

  private static List<String> splitOnSeparators(final String script) {
    final var parts = new ArrayList<String>();
    final var current = new StringBuilder();
    char quote = 0;
    for (int i = 0; i < script.length(); i++) {
      final var c = script.charAt(i);
      if (quote != 0) {
        current.append(c);
        if (c == '\\' && quote != '`' && i + 1 < script.length()) {
          current.append(script.charAt(++i));
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"' || c == '`') {
        quote = c;
        current.append(c);
      } else if (c == ';') {
        parts.add(current.toString());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    parts.add(current.toString());
    return parts;
  }
}
