package io.calrecur.eval;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ZoneResolver} backed by the JDK's time-zone rules.
 *
 * <p>TZIDs that the JDK does not know (vendor names, or a leading {@code /} as some producers
 * write) fall back to a configured zone. Each unknown TZID is reported once.
 */
public final class SystemZoneResolver implements ZoneResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(SystemZoneResolver.class);

  private final ZoneId fallback;
  private final Map<String, ZoneId> zones = new ConcurrentHashMap<>();

  /** Creates a resolver that falls back to UTC. */
  public SystemZoneResolver() {
    this(ZoneOffset.UTC);
  }

  /**
   * Creates a resolver with the given fallback zone.
   *
   * @param fallback the zone used for unknown TZIDs
   */
  public SystemZoneResolver(ZoneId fallback) {
    this.fallback = fallback;
  }

  @Override
  public ZoneOffset offsetAt(String zoneId, Instant instant) {
    if (zoneId == null) {
      return fallback.getRules().getOffset(instant);
    }
    return zones.computeIfAbsent(zoneId, this::lookup).getRules().getOffset(instant);
  }

  private ZoneId lookup(String tzid) {
    String id = tzid.startsWith("/") ? tzid.substring(1) : tzid;
    try {
      return ZoneId.of(id);
    } catch (DateTimeException e) {
      LOGGER.warn("Unknown TZID '{}', using {}: {}", tzid, fallback, e.getMessage());
      return fallback;
    }
  }
}
