// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Serializes a graph of [Traversable] objects whose pointers may share targets or form cycles. The payload written
/// by [BinaryOutputArchive] is followed by an identity map that lets [#deserialize(ByteBuffer)] point each loaded
/// pointer at the loaded object in the same position as the original target.
public sealed interface GraphPickler<T extends Traversable> permits GraphPicklerImpl {

  Logger LOGGER = Logger.getLogger(GraphPickler.class.getName());

  /// Serialize the graph reachable from the root to a ByteBuffer
  /// @param buffer The buffer to write to
  /// @param root The root of the graph
  /// @return The number of bytes written
  int serialize(ByteBuffer buffer, T root);

  /// Deserialize a graph into a fresh root from the factory
  /// @param buffer The buffer to read from
  /// @return The root with every pointer assigned
  T deserialize(ByteBuffer buffer);

  /// Calculate the maximum size needed to serialize a graph, identity map included
  /// @param root The root of the graph
  /// @return The maximum number of bytes needed
  int maxSizeOf(T root);

  /// @param rootFactory creates the empty root that [#deserialize(ByteBuffer)] loads into
  static <T extends Traversable> GraphPickler<T> forRoot(Supplier<T> rootFactory) {
    Objects.requireNonNull(rootFactory, "Root factory must not be null");
    return new GraphPicklerImpl<>(rootFactory);
  }
}
