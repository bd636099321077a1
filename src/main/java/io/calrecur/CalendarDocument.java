package io.calrecur;

import io.calrecur.ast.Component;
import io.calrecur.ast.ComponentType;
import io.calrecur.parser.TreeBuilder;
import io.calrecur.timeline.Timeline;
import io.calrecur.timeline.TimelineOptions;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * The main entry point for parsing calendar documents and querying their occurrences.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CalendarDocument doc = CalendarDocument.parse(text);
 * doc.diagnostics().forEach(d -> System.err.println(d));
 * doc.timeline()
 *     .query(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"))
 *     .forEach(o -> System.out.println(o.start() + " " + o.component().summary().orElse("")));
 * }</pre>
 *
 * <p>Parsing never fails on malformed input: the best-effort tree is returned together with the
 * problems found.
 */
public final class CalendarDocument {
  private final ParseResult result;

  private CalendarDocument(ParseResult result) {
    this.result = result;
  }

  /**
   * Parses calendar text.
   *
   * @param text the document
   * @return the parsed document
   */
  public static CalendarDocument parse(String text) {
    return new CalendarDocument(TreeBuilder.parse(text));
  }

  /**
   * Parses calendar text from a reader. The reader is consumed but not closed.
   *
   * @param in the document source
   * @return the parsed document
   */
  public static CalendarDocument parse(Reader in) {
    return new CalendarDocument(TreeBuilder.parse(in));
  }

  /**
   * Returns the first top-level component, normally the VCALENDAR.
   *
   * @return the root component
   */
  public Component root() {
    return result.root();
  }

  /**
   * Returns every top-level component.
   *
   * @return the roots in document order
   */
  public List<Component> roots() {
    return result.roots();
  }

  /**
   * Returns the structural problems found while parsing.
   *
   * @return the diagnostics in document order
   */
  public List<Diagnostic> diagnostics() {
    return result.diagnostics();
  }

  public List<Component> events() {
    return components(ComponentType.Kind.EVENT);
  }

  public List<Component> todos() {
    return components(ComponentType.Kind.TODO);
  }

  public List<Component> journals() {
    return components(ComponentType.Kind.JOURNAL);
  }

  public List<Component> freeBusy() {
    return components(ComponentType.Kind.FREE_BUSY);
  }

  public List<Component> timezones() {
    return components(ComponentType.Kind.TIMEZONE);
  }

  /**
   * Returns the events, to-dos and journals with the given UID: the series master and its
   * overrides.
   *
   * @param uid the unique identifier
   * @return the matching components in document order
   */
  public List<Component> findByUid(String uid) {
    List<Component> out = new ArrayList<>();
    for (Component root : result.roots()) {
      List<Component> candidates =
          root.type().kind() == ComponentType.Kind.CALENDAR ? root.children() : List.of(root);
      for (Component c : candidates) {
        if (c.type().isSchedulable() && c.uid().filter(uid::equals).isPresent()) {
          out.add(c);
        }
      }
    }
    return out;
  }

  /**
   * Returns a timeline over all components of the document with default options.
   *
   * @return the timeline
   */
  public Timeline timeline() {
    return timeline(TimelineOptions.defaults());
  }

  /**
   * Returns a timeline over all components of the document.
   *
   * @param options zone and window settings
   * @return the timeline
   */
  public Timeline timeline(TimelineOptions options) {
    return Timeline.of(result.roots(), options);
  }

  private List<Component> components(ComponentType.Kind kind) {
    List<Component> out = new ArrayList<>();
    for (Component root : result.roots()) {
      if (root.type().kind() == kind) {
        out.add(root);
      } else {
        out.addAll(root.childrenOfType(kind));
      }
    }
    return out;
  }

  @Override
  public String toString() {
    return "CalendarDocument"
        + result.roots()
        + " ("
        + result.diagnostics().size()
        + " diagnostics)";
  }
}
