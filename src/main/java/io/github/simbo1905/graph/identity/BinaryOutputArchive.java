// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// A compact big-endian binary engine over a [ByteBuffer]. It knows nothing about object identity: pointers and
/// self references write no bytes.
public final class BinaryOutputArchive implements OutputArchive {
  private final ByteBuffer buffer;

  public BinaryOutputArchive(ByteBuffer buffer) {
    this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
    buffer.order(ByteOrder.BIG_ENDIAN);
  }

  @Override
  public BinaryOutputArchive visit(Object... values) {
    for (Object value : values) {
      write(value);
    }
    return this;
  }

  private void write(Object value) {
    Objects.requireNonNull(value, "Cannot visit a null value");
    final int position = buffer.position();
    if (value instanceof Value<?> primitive) {
      primitive.type().write(buffer, primitive.get());
      LOGGER.finer(() -> "Wrote " + primitive.type() + " at position " + position);
    } else if (value instanceof SizeTag sizeTag) {
      final int size = sizeTag.get();
      ZigZagEncoding.putInt(buffer, size);
      LOGGER.finer(() -> "Wrote size " + size + " at position " + position);
    } else if (value instanceof NamedValue named) {
      write(named.value());
    } else if (value instanceof BinaryData binaryData) {
      final byte[] bytes = binaryData.get();
      ZigZagEncoding.putInt(buffer, bytes.length);
      buffer.put(bytes);
      LOGGER.finer(() -> "Wrote " + bytes.length + " bytes of binary data at position " + position);
    } else if (value instanceof Traversable traversable) {
      traversable.traverse(this);
    } else {
      throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }
  }

  @Override
  public void appendSequence(int[] values) {
    Objects.requireNonNull(values, "values must not be null");
    final int position = buffer.position();
    ZigZagEncoding.putInt(buffer, values.length);
    for (int value : values) {
      if (value < 0) {
        throw new IllegalArgumentException("Sequence values must not be negative: " + value);
      }
      ZigZagEncoding.putInt(buffer, value);
    }
    LOGGER.fine(() -> "Appended sequence of " + values.length + " at position " + position);
  }

  public ByteBuffer buffer() {
    return buffer;
  }
}
