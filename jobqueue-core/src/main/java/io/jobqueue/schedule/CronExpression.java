package io.jobqueue.schedule;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed cron expression.
 *
 * <p>Accepts five fields ({@code minute hour day-of-month month day-of-week})
 * or six fields with a leading {@code second}. Each field supports {@code *},
 * {@code ?}, single values, ranges {@code a-b}, lists {@code a,b} and steps
 * {@code * / n}, {@code a/n}, {@code a-b/n}. Months accept {@code JAN..DEC} and
 * days of week {@code SUN..SAT}; both {@code 0} and {@code 7} mean Sunday.
 *
 * <p>When both day-of-month and day-of-week are restricted (neither starts with
 * {@code *} or {@code ?}) a day matches if either field matches.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class CronExpression {

  private static final String[] MONTH_NAMES = {
      "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"};
  private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

  private static final int SEARCH_YEARS = 10;

  private final String expression;
  private final BitSet seconds;
  private final BitSet minutes;
  private final BitSet hours;
  private final BitSet daysOfMonth;
  private final BitSet months;
  private final BitSet daysOfWeek;
  private final boolean dayOfMonthRestricted;
  private final boolean dayOfWeekRestricted;

  private CronExpression(String expression, String[] fields) {
    this.expression = expression;
    int offset = fields.length == 6 ? 1 : 0;
    this.seconds = offset == 1 ? parseField(fields[0], "second", 0, 59, null) : single(0);
    this.minutes = parseField(fields[offset], "minute", 0, 59, null);
    this.hours = parseField(fields[offset + 1], "hour", 0, 23, null);
    this.daysOfMonth = parseField(fields[offset + 2], "day-of-month", 1, 31, null);
    this.months = parseField(fields[offset + 3], "month", 1, 12, MONTH_NAMES);
    BitSet dow = parseField(fields[offset + 4], "day-of-week", 0, 7, DAY_NAMES);
    if (dow.get(7)) {
      dow.clear(7);
      dow.set(0);
    }
    this.daysOfWeek = dow;
    this.dayOfMonthRestricted = isRestricted(fields[offset + 2]);
    this.dayOfWeekRestricted = isRestricted(fields[offset + 4]);
  }

  /**
   * Parses a cron expression.
   *
   * @param expression five- or six-field cron text
   * @return the parsed expression
   * @throws IllegalArgumentException if the expression is malformed
   */
  public static CronExpression parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    String trimmed = expression.trim();
    String[] fields = trimmed.split("\\s+");
    if (fields.length != 5 && fields.length != 6) {
      throw new IllegalArgumentException(
          "Cron expression must have 5 or 6 fields but has " + fields.length + ": '" + expression + "'");
    }
    return new CronExpression(trimmed, fields);
  }

  /**
   * Returns the first matching time strictly after {@code after}, in the same zone.
   *
   * @param after the reference time
   * @return the next matching time
   * @throws IllegalStateException if nothing matches within the search horizon
   *     (for example {@code 0 0 30 2 *})
   */
  public ZonedDateTime next(ZonedDateTime after) {
    Objects.requireNonNull(after, "after");
    ZonedDateTime t = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
    int lastYear = after.getYear() + SEARCH_YEARS;
    while (t.getYear() <= lastYear) {
      if (!months.get(t.getMonthValue())) {
        t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
        continue;
      }
      if (!dayMatches(t)) {
        t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
        continue;
      }
      if (!hours.get(t.getHour())) {
        t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        continue;
      }
      if (!minutes.get(t.getMinute())) {
        t = t.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        continue;
      }
      if (!seconds.get(t.getSecond())) {
        t = t.plusSeconds(1);
        continue;
      }
      return t;
    }
    throw new IllegalStateException("Cron expression '" + expression
        + "' has no match within " + SEARCH_YEARS + " years after " + after);
  }

  private boolean dayMatches(ZonedDateTime t) {
    boolean domMatch = daysOfMonth.get(t.getDayOfMonth());
    boolean dowMatch = daysOfWeek.get(t.getDayOfWeek().getValue() % 7);
    if (dayOfMonthRestricted && dayOfWeekRestricted) {
      return domMatch || dowMatch;
    }
    return domMatch && dowMatch;
  }

  public String expression() {
    return expression;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CronExpression)) return false;
    return expression.equals(((CronExpression) o).expression);
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public String toString() {
    return expression;
  }

  private static boolean isRestricted(String field) {
    return !(field.startsWith("*") || field.startsWith("?"));
  }

  private static BitSet single(int value) {
    BitSet bits = new BitSet();
    bits.set(value);
    return bits;
  }

  private static BitSet parseField(String field, String name, int min, int max, String[] names) {
    BitSet bits = new BitSet(max + 1);
    for (String part : field.split(",", -1)) {
      if (part.isEmpty()) {
        throw invalid(name, field, "empty list element");
      }
      int step = 1;
      String range = part;
      int slash = part.indexOf('/');
      if (slash >= 0) {
        range = part.substring(0, slash);
        step = parseNumber(part.substring(slash + 1), name, field);
        if (step <= 0) {
          throw invalid(name, field, "step must be positive");
        }
      }
      int from;
      int to;
      if (range.equals("*") || range.equals("?")) {
        if (range.equals("?") && !name.startsWith("day-of-")) {
          throw invalid(name, field, "'?' is only allowed for day-of-month and day-of-week");
        }
        from = min;
        to = max;
      } else {
        int dash = range.indexOf('-');
        if (dash > 0) {
          from = parseValue(range.substring(0, dash), name, field, names, min);
          to = parseValue(range.substring(dash + 1), name, field, names, min);
        } else {
          from = parseValue(range, name, field, names, min);
          to = slash >= 0 ? max : from;
        }
      }
      if (from < min || to > max || from > to) {
        throw invalid(name, field, "values must be within " + min + "-" + max);
      }
      for (int v = from; v <= to; v += step) {
        bits.set(v);
      }
    }
    return bits;
  }

  private static int parseValue(String token, String name, String field, String[] names, int min) {
    if (names != null) {
      String upper = token.toUpperCase(Locale.ROOT);
      for (int i = 0; i < names.length; i++) {
        if (names[i].equals(upper)) {
          return i + min;
        }
      }
    }
    return parseNumber(token, name, field);
  }

  private static int parseNumber(String token, String name, String field) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw invalid(name, field, "'" + token + "' is not a number");
    }
  }

  private static IllegalArgumentException invalid(String name, String field, String reason) {
    return new IllegalArgumentException("Invalid " + name + " field '" + field + "': " + reason);
  }
}
