// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.function.Supplier;

final class GraphPicklerImpl<T extends Traversable> implements GraphPickler<T> {
  final Supplier<T> rootFactory;

  GraphPicklerImpl(Supplier<T> rootFactory) {
    this.rootFactory = rootFactory;
  }

  @Override
  public int serialize(ByteBuffer buffer, T root) {
    Objects.requireNonNull(buffer, "Buffer must not be null");
    Objects.requireNonNull(root, "Root must not be null");
    final int start = buffer.position();
    LOGGER.fine(() -> "Serializing " + root.getClass().getSimpleName() + " at position " + start);
    try (var archive = new OutputGraphArchive(new BinaryOutputArchive(buffer))) {
      archive.visit(root);
    }
    return buffer.position() - start;
  }

  @Override
  public T deserialize(ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "Buffer must not be null");
    final T root = Objects.requireNonNull(rootFactory.get(), "Root factory must not return null");
    LOGGER.fine(() -> "Deserializing " + root.getClass().getSimpleName() + " at position " + buffer.position());
    try (var archive = new InputGraphArchive(new BinaryInputArchive(buffer))) {
      archive.visit(root);
    }
    return root;
  }

  @Override
  public int maxSizeOf(T root) {
    Objects.requireNonNull(root, "Root must not be null");
    final var sizer = new SizingArchive();
    try (var archive = new OutputGraphArchive(sizer)) {
      archive.visit(root);
    }
    return sizer.size();
  }
}
