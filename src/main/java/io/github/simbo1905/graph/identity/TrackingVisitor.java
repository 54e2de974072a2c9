// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.Objects;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// A shadow recipient that walks the same values as the engine but moves no bytes. It hands out object-ids in
/// traversal order to every [Value], [SizeTag] and [ThisReference] and records every [RawPointer].
public sealed interface TrackingVisitor extends Visitor permits SaveTracker, LoadTracker {

  /// Give the unit the next object-id.
  void trackIdentity(Object unit);

  /// Record the pointer and then give its slot the next object-id.
  <T> void trackPointer(RawPointer<T> pointer);

  @Override
  default TrackingVisitor visit(Object... values) {
    for (Object value : values) {
      Objects.requireNonNull(value, "Cannot visit a null value");
      if (value instanceof Value<?> || value instanceof SizeTag) {
        trackIdentity(value);
      } else if (value instanceof NamedValue named) {
        visit(named.value());
      } else if (value instanceof BinaryData) {
        // identities inside binary data are not tracked
        LOGGER.finer(() -> getClass().getSimpleName() + " skipping " + value);
      } else if (value instanceof Traversable traversable) {
        traversable.traverse(this);
      } else {
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
      }
    }
    return this;
  }
}
