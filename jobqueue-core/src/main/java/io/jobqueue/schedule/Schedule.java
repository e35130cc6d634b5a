package io.jobqueue.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * When a periodic job is due.
 *
 * <p>Both kinds are pure functions of wall-clock time so that every instance in
 * a cluster computes the same due instants for the same registration. Fixed
 * intervals are aligned to the Unix epoch: an {@code every(30s)} schedule is due
 * at :00 and :30 of each minute regardless of when an instance started.
 *
 * <p>Schedules have a text form ({@link #asText()}, {@link #parse(String)}) used
 * when they travel inside serialized envelopes.
 */
public sealed interface Schedule permits Schedule.FixedInterval, Schedule.Cron {

  /**
   * Returns the first due instant at or after {@code now}.
   *
   * @param now the current time
   * @return the first due instant
   */
  Instant firstDue(Instant now);

  /**
   * Returns the due instant following {@code previousDue}, skipping any that are
   * not strictly after {@code now}. Missed occurrences after downtime are not
   * replayed.
   *
   * @param previousDue the due instant just handled
   * @param now the current time
   * @return the next due instant, strictly after both arguments
   */
  Instant nextDue(Instant previousDue, Instant now);

  /**
   * Returns the text form accepted by {@link #parse(String)}.
   *
   * @return the text form
   */
  String asText();

  static Schedule every(Duration interval) {
    return new FixedInterval(interval);
  }

  static Schedule everySeconds(long seconds) {
    return new FixedInterval(Duration.ofSeconds(seconds));
  }

  static Schedule cron(String expression) {
    return new Cron(CronExpression.parse(expression), ZoneOffset.UTC);
  }

  static Schedule cron(String expression, ZoneId zone) {
    return new Cron(CronExpression.parse(expression), zone);
  }

  /**
   * Parses the text form: {@code @every <ISO-8601 duration>} for fixed
   * intervals, otherwise a cron expression optionally prefixed with
   * {@code CRON_TZ=<zone> }.
   *
   * @param text the schedule text
   * @return the schedule
   * @throws IllegalArgumentException if the text is malformed
   */
  static Schedule parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    if (trimmed.startsWith(FixedInterval.PREFIX)) {
      try {
        return new FixedInterval(Duration.parse(trimmed.substring(FixedInterval.PREFIX.length()).trim()));
      } catch (RuntimeException e) {
        throw new IllegalArgumentException("Invalid interval schedule '" + text + "'", e);
      }
    }
    if (trimmed.startsWith(Cron.ZONE_PREFIX)) {
      int space = trimmed.indexOf(' ');
      if (space < 0) {
        throw new IllegalArgumentException("Missing cron fields after zone in '" + text + "'");
      }
      ZoneId zone;
      try {
        zone = ZoneId.of(trimmed.substring(Cron.ZONE_PREFIX.length(), space));
      } catch (RuntimeException e) {
        throw new IllegalArgumentException("Invalid zone in schedule '" + text + "'", e);
      }
      return cron(trimmed.substring(space + 1), zone);
    }
    return cron(trimmed);
  }

  /**
   * Fixed-interval schedule aligned to the epoch.
   *
   * @param interval time between due instants, at least one millisecond
   */
  record FixedInterval(Duration interval) implements Schedule {
    static final String PREFIX = "@every ";

    public FixedInterval {
      Objects.requireNonNull(interval, "interval");
      if (interval.toMillis() <= 0) {
        throw new IllegalArgumentException("interval must be at least 1 ms");
      }
    }

    @Override
    public Instant firstDue(Instant now) {
      long step = interval.toMillis();
      long nowMs = now.toEpochMilli();
      long due = Math.floorDiv(nowMs, step) * step;
      if (due < nowMs || now.getNano() % 1_000_000 != 0) {
        due += step;
      }
      return Instant.ofEpochMilli(due);
    }

    @Override
    public Instant nextDue(Instant previousDue, Instant now) {
      long step = interval.toMillis();
      Instant candidate = previousDue.plusMillis(step);
      if (candidate.isAfter(now)) {
        return candidate;
      }
      long behind = now.toEpochMilli() - candidate.toEpochMilli();
      return candidate.plusMillis((behind / step + 1) * step);
    }

    @Override
    public String asText() {
      return PREFIX + interval;
    }
  }

  /**
   * Cron schedule evaluated in a time zone (UTC unless given).
   *
   * @param expression the parsed cron expression
   * @param zone the zone the fields are interpreted in
   */
  record Cron(CronExpression expression, ZoneId zone) implements Schedule {
    static final String ZONE_PREFIX = "CRON_TZ=";

    public Cron {
      Objects.requireNonNull(expression, "expression");
      Objects.requireNonNull(zone, "zone");
    }

    @Override
    public Instant firstDue(Instant now) {
      return expression.next(now.minusNanos(1).atZone(zone)).toInstant();
    }

    @Override
    public Instant nextDue(Instant previousDue, Instant now) {
      Instant after = previousDue.isAfter(now) ? previousDue : now;
      return expression.next(after.atZone(zone)).toInstant();
    }

    @Override
    public String asText() {
      if (ZoneOffset.UTC.equals(zone)) {
        return expression.expression();
      }
      return ZONE_PREFIX + zone.getId() + " " + expression.expression();
    }
  }
}
