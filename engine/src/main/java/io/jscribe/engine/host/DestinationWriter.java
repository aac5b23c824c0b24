package io.jscribe.engine.host;

import java.io.IOException;

/**
 * Persists the flattened text of root branches. Called once per root that has a destination, in
 * root creation order, after every root flattened successfully.
 *
 * <p>The first failing write aborts the remaining ones. Outputs written before it are left in
 * place; cleaning up such partial output is up to the host.
 */
@FunctionalInterface
public interface DestinationWriter {

  /**
   * Persists one output.
   *
   * @param destination destination tag of the root branch
   * @param kind kind of the root branch, as given at creation
   * @param text flattened text
   * @throws IOException if the output cannot be written
   */
  void write(String destination, String kind, String text) throws IOException;
}
