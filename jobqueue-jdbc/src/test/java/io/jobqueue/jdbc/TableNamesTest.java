package io.jobqueue.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void acceptsIdentifiers() {
    assertEquals("job_message", TableNames.validate("job_message"));
    assertEquals("_Jobs2", TableNames.validate("_Jobs2"));
  }

  @Test
  void rejectsAnythingElse() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("2jobs"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("jobs.message"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("jobs;DROP TABLE x"));
  }
}
