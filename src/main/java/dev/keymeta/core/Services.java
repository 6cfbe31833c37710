/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.Attributes;
import dev.keymeta.api.BulkAttributes;
import dev.keymeta.api.storage.AttributeStore;
import java.io.IOException;

/**
 * Service locator for a running Keymeta engine.
 *
 * <p>Each accessor returns a singleton owned by the container. Call {@link #shutdown()} to release
 * resources (connection pool, scheduler, metrics MBean).
 */
public interface Services {

  /**
   * Single attribute operations.
   *
   * @return the accessor singleton
   */
  Attributes attributes();

  /**
   * Multi-key and multi-entity operations.
   *
   * @return the bulk coordinator singleton
   */
  BulkAttributes bulk();

  /**
   * Backing store shared by {@link #attributes()} and {@link #bulk()}.
   *
   * @return the store singleton
   */
  AttributeStore store();

  /**
   * Metrics registry.
   *
   * @return metrics registry or {@code null} when unavailable
   */
  default Metrics metrics() {
    return null;
  }

  /**
   * Shuts down background resources and closes the connection pool.
   *
   * @throws IOException if closing resources fails
   */
  void shutdown() throws IOException;
}
