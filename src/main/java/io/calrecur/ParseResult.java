package io.calrecur;

import io.calrecur.ast.Component;
import java.util.List;

/**
 * The outcome of parsing: a best-effort component tree plus the problems met on the way.
 *
 * @param roots the top-level components in document order, never empty
 * @param diagnostics the structural problems, in input order
 */
public record ParseResult(List<Component> roots, List<Diagnostic> diagnostics) {
  /** Creates a new ParseResult with defensive copies of lists. */
  public ParseResult {
    roots = List.copyOf(roots);
    diagnostics = List.copyOf(diagnostics);
  }

  /**
   * Returns the first top-level component, normally the VCALENDAR.
   *
   * @return the root component
   */
  public Component root() {
    return roots.get(0);
  }

  /**
   * Checks whether the input parsed without any diagnostic.
   *
   * @return true if clean
   */
  public boolean isClean() {
    return diagnostics.isEmpty();
  }
}
