package io.jobqueue.routing;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps queue classes to physical queue names under a common prefix, by default
 * {@code jobs.}: {@code jobs.regular}, {@code jobs.retry}, and
 * {@code jobs.periodic.<periodicId>} for periodic occurrences.
 */
public final class QueueNames {
  public static final String DEFAULT_PREFIX = "jobs.";

  private static final Pattern VALID_PREFIX = Pattern.compile("[A-Za-z0-9_.:-]*");
  private static final Pattern VALID_PERIODIC_ID = Pattern.compile("[A-Za-z0-9_.:-]+");

  private final String prefix;

  public QueueNames() {
    this(DEFAULT_PREFIX);
  }

  public QueueNames(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!VALID_PREFIX.matcher(prefix).matches()) {
      throw new IllegalArgumentException("Invalid queue prefix: " + prefix);
    }
    this.prefix = prefix;
  }

  /**
   * Returns the queue name for a non-periodic class.
   *
   * @param queueClass the class
   * @return the physical queue name
   * @throws IllegalArgumentException for {@link QueueClass#PERIODIC}
   */
  public String name(QueueClass queueClass) {
    if (queueClass == QueueClass.PERIODIC) {
      throw new IllegalArgumentException("Periodic queues are per periodic id; use periodic(id)");
    }
    return prefix + queueClass.id();
  }

  public String periodic(String periodicId) {
    validatePeriodicId(periodicId);
    return prefix + QueueClass.PERIODIC.id() + "." + periodicId;
  }

  public String prefix() {
    return prefix;
  }

  public static void validatePeriodicId(String periodicId) {
    Objects.requireNonNull(periodicId, "periodicId");
    if (!VALID_PERIODIC_ID.matcher(periodicId).matches()) {
      throw new IllegalArgumentException("Invalid periodic id '" + periodicId
          + "': use letters, digits, '_', '.', ':' or '-'");
    }
  }
}
