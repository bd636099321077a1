package io.calrecur.parser;

import io.calrecur.CalendarException;
import io.calrecur.Diagnostic;
import io.calrecur.ParseResult;
import io.calrecur.ast.Component;
import io.calrecur.ast.ComponentType;
import io.calrecur.ast.Property;
import io.calrecur.lexer.ContentLine;
import io.calrecur.lexer.ContentLineLexer;
import io.calrecur.lexer.FoldedLine;
import io.calrecur.lexer.LineUnfolder;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the component tree from content lines in a single pass.
 *
 * <p>Parsing is permissive: malformed lines, stray properties and mismatched END lines become
 * diagnostics and the build continues. An END naming a component further down the stack closes
 * every component above it. Components still open at end of input are closed implicitly.
 */
public final class TreeBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);

  private final Deque<Component> stack = new ArrayDeque<>();
  private final List<Component> roots = new ArrayList<>();
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private TreeBuilder() {}

  /**
   * Parses an in-memory document.
   *
   * @param text the raw document
   * @return the tree and its diagnostics
   */
  public static ParseResult parse(String text) {
    return build(LineUnfolder.of(text));
  }

  /**
   * Parses a character stream. The caller owns and closes the reader.
   *
   * @param in the reader
   * @return the tree and its diagnostics
   */
  public static ParseResult parse(Reader in) {
    return build(LineUnfolder.of(in));
  }

  /**
   * Builds a tree from already unfolded lines.
   *
   * @param lines the logical lines
   * @return the tree and its diagnostics
   */
  public static ParseResult build(Iterator<FoldedLine> lines) {
    return new TreeBuilder().doBuild(lines);
  }

  private ParseResult doBuild(Iterator<FoldedLine> lines) {
    while (lines.hasNext()) {
      FoldedLine folded = lines.next();
      ContentLine line;
      try {
        line = ContentLineLexer.tokenize(folded);
      } catch (CalendarException e) {
        report(Diagnostic.of(e));
        continue;
      }

      switch (line.kind()) {
        case BEGIN -> begin(line);
        case END -> end(line);
        case PROPERTY -> property(line);
      }
    }

    while (!stack.isEmpty()) {
      Component open = stack.pop();
      report(
          Diagnostic.structure(
              "unterminated " + open.type() + " at end of input", open.span(), null));
    }

    if (roots.isEmpty()) {
      report(Diagnostic.structure("no components found", null, null));
      roots.add(Component.root(ComponentType.CALENDAR));
    }
    return new ParseResult(roots, diagnostics);
  }

  private void begin(ContentLine line) {
    String name = line.componentName();
    if (name.isEmpty()) {
      report(Diagnostic.structure("BEGIN without component name", line.span(), "BEGIN:"));
      return;
    }
    ComponentType type = ComponentType.of(name);
    if (stack.isEmpty()) {
      if (!roots.isEmpty()) {
        report(
            Diagnostic.structure(
                "additional top-level " + type + " after " + roots.get(0).type(),
                line.span(),
                null));
      }
      Component root = Component.root(type, line.span());
      roots.add(root);
      stack.push(root);
    } else {
      stack.push(stack.peek().addChild(type, line.span()));
    }
  }

  private void end(ContentLine line) {
    ComponentType type = ComponentType.of(line.componentName());
    if (stack.isEmpty()) {
      report(Diagnostic.structure("END:" + type + " without matching BEGIN", line.span(), null));
      return;
    }
    if (stack.peek().type().equals(type)) {
      stack.pop();
      return;
    }
    if (stack.stream().noneMatch(c -> c.type().equals(type))) {
      report(
          Diagnostic.structure(
              "END:" + type + " does not match open " + stack.peek().type(), line.span(), null));
      return;
    }
    while (!stack.peek().type().equals(type)) {
      Component open = stack.pop();
      report(
          Diagnostic.structure(
              "unterminated " + open.type() + " closed by END:" + type, line.span(), null));
    }
    stack.pop();
  }

  private void property(ContentLine line) {
    if (stack.isEmpty()) {
      report(
          Diagnostic.structure(
              "property " + line.name() + " outside any component", line.span(), null));
      return;
    }
    stack
        .peek()
        .addProperty(new Property(line.name(), line.parameters(), line.value(), line.span()));
  }

  private void report(Diagnostic diagnostic) {
    LOGGER.debug("Parse diagnostic: {}", diagnostic);
    diagnostics.add(diagnostic);
  }
}
