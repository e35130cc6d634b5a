package io.jobqueue;

/**
 * Thrown when a periodic job is registered under an id that is already taken
 * on the same scheduler.
 */
public class DuplicatePeriodicIdException extends RuntimeException {

  private final String periodicId;

  public DuplicatePeriodicIdException(String periodicId) {
    super("Periodic job already registered: " + periodicId);
    this.periodicId = periodicId;
  }

  public String periodicId() {
    return periodicId;
  }
}
