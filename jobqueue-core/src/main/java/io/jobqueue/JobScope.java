package io.jobqueue;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resources shared by the jobs of one delivery batch.
 *
 * <p>A worker opens a scope per fetched batch and closes it once every
 * delivery in the batch has been settled. Resources obtained through
 * {@link #resource(String, Supplier)} are created lazily, shared by key, and
 * closed in reverse creation order when they implement {@link AutoCloseable}.
 */
public final class JobScope implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobScope.class.getName());

  private final String scopeId;
  private final String queue;
  private final Map<String, Object> resources = new LinkedHashMap<>();
  private boolean closed;

  public JobScope(String queue) {
    this.scopeId = UlidCreator.getMonotonicUlid().toString();
    this.queue = Objects.requireNonNull(queue, "queue");
  }

  public String scopeId() {
    return scopeId;
  }

  /**
   * Returns the queue the batch was fetched from.
   *
   * @return the queue name
   */
  public String queue() {
    return queue;
  }

  /**
   * Returns the resource stored under {@code key}, creating it on first use.
   *
   * @param key the resource key
   * @param factory creates the resource
   * @param <T> the resource type
   * @return the shared resource
   * @throws IllegalStateException if the scope is closed
   */
  @SuppressWarnings("unchecked")
  public synchronized <T> T resource(String key, Supplier<T> factory) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(factory, "factory");
    if (closed) {
      throw new IllegalStateException("JobScope " + scopeId + " is closed");
    }
    Object existing = resources.get(key);
    if (existing == null) {
      existing = Objects.requireNonNull(factory.get(), "factory returned null for " + key);
      resources.put(key, existing);
    }
    return (T) existing;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    List<Object> created = new ArrayList<>(resources.values());
    resources.clear();
    for (int i = created.size() - 1; i >= 0; i--) {
      if (created.get(i) instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          logger.log(Level.WARNING, "Failed to close scope resource in " + scopeId, e);
        }
      }
    }
  }
}
