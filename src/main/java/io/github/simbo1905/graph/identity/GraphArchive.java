// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.Objects;

/// Wraps a user supplied engine so that pointers between co-serialized objects survive a round trip. Every visit is
/// forwarded first to the engine, which sees exactly the calls it would have seen unwrapped, and then to a tracker.
/// [#complete()] writes or reads the identity map that follows the payload; after that any visit is an error.
///
/// Use it in try-with-resources so that completion runs on every exit path:
///
/// ```java
/// try (var archive = new OutputGraphArchive(new BinaryOutputArchive(buffer))) {
///   archive.visit(graph);
/// }
/// ```
public abstract sealed class GraphArchive<E extends EncodingVisitor, T extends TrackingVisitor>
    implements Archive, AutoCloseable permits OutputGraphArchive, InputGraphArchive {
  final E archive;
  final T tracker;
  private boolean completed;

  GraphArchive(E archive, T tracker) {
    this.archive = Objects.requireNonNull(archive, "archive must not be null");
    this.tracker = tracker;
  }

  /// Forward the values to the engine and then to the tracker.
  /// @throws GraphIdentityException if [#complete()] has already been called
  @Override
  public GraphArchive<E, T> visit(Object... values) {
    if (completed) {
      throw new GraphIdentityException(GraphIdentityException.Reason.USE_AFTER_COMPLETE,
          "Attempted serialization after complete was called");
    }
    archive.visit(values);
    tracker.visit(values);
    return this;
  }

  /// Write the identity map when saving, or read it and assign every pointer when loading. Only the first call
  /// does anything.
  /// @throws GraphIdentityException if the pointer book-keeping cannot be written or applied
  public final void complete() {
    if (completed) {
      return;
    }
    completed = true;
    completeTracking();
  }

  abstract void completeTracking();

  public boolean isCompleted() {
    return completed;
  }

  /// Same as [#complete()].
  @Override
  public void close() {
    complete();
  }
}
