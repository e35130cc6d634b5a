package io.jobqueue;

import java.util.Objects;

/**
 * A {@link JobType} backed by a plain string.
 */
public final class StringJobType implements JobType {

  private final String name;

  private StringJobType(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Job type name cannot be empty");
    }
  }

  /**
   * Creates a job type from a string.
   *
   * @param name the job type name
   * @return the job type
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static StringJobType of(String name) {
    return new StringJobType(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringJobType)) return false;
    return name.equals(((StringJobType) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
