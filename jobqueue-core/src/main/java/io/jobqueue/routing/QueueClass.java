package io.jobqueue.routing;

/**
 * Logical queue classes. Each maps to one physical queue, except
 * {@link #PERIODIC}, which has one queue per periodic id.
 */
public enum QueueClass {
  REGULAR("regular", true),
  LONG_RUNNING("long-running", true),
  DELAYED("delayed", false),
  RETRY("retry", true),
  PERIODIC("periodic", true),
  FAILED("failed", false);

  private final String id;
  private final boolean consumable;

  QueueClass(String id, boolean consumable) {
    this.id = id;
    this.consumable = consumable;
  }

  /**
   * Returns the wire identifier used in queue names.
   *
   * @return the identifier
   */
  public String id() {
    return id;
  }

  /**
   * Returns whether workers consume this class. Delayed messages are only
   * released by the transport and failed messages are only touched by the
   * failed-job manager.
   *
   * @return {@code true} if workers consume this class
   */
  public boolean consumable() {
    return consumable;
  }

  public static QueueClass fromId(String id) {
    for (QueueClass queueClass : values()) {
      if (queueClass.id.equals(id)) {
        return queueClass;
      }
    }
    throw new IllegalArgumentException("Unknown queue class: " + id);
  }
}
