// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// Reads what [BinaryOutputArchive] wrote, assigning each decoded value through its setter as it goes.
public final class BinaryInputArchive implements InputArchive {
  private final ByteBuffer buffer;

  public BinaryInputArchive(ByteBuffer buffer) {
    this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
    buffer.order(ByteOrder.BIG_ENDIAN);
  }

  @Override
  public BinaryInputArchive visit(Object... values) {
    for (Object value : values) {
      read(value);
    }
    return this;
  }

  private void read(Object value) {
    Objects.requireNonNull(value, "Cannot visit a null value");
    final int position = buffer.position();
    if (value instanceof Value<?> primitive) {
      final Object decoded = primitive.type().read(buffer);
      LOGGER.finer(() -> "Read " + primitive.type() + " " + decoded + " at position " + position);
      primitive.assignDecoded(decoded);
    } else if (value instanceof SizeTag sizeTag) {
      final int size = ZigZagEncoding.getInt(buffer);
      LOGGER.finer(() -> "Read size " + size + " at position " + position);
      sizeTag.set(size);
    } else if (value instanceof NamedValue named) {
      read(named.value());
    } else if (value instanceof BinaryData binaryData) {
      final int length = ZigZagEncoding.getInt(buffer);
      if (length < 0 || length > buffer.remaining()) {
        throw new IllegalStateException("Invalid binary data length " + length + " at position " + position +
            " with " + buffer.remaining() + " bytes remaining");
      }
      final byte[] bytes = new byte[length];
      buffer.get(bytes);
      LOGGER.finer(() -> "Read " + length + " bytes of binary data at position " + position);
      binaryData.set(bytes);
    } else if (value instanceof Traversable traversable) {
      traversable.traverse(this);
    } else {
      throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }
  }

  @Override
  public int[] readSequence() {
    final int position = buffer.position();
    final int length = ZigZagEncoding.getInt(buffer);
    // every entry takes at least one byte
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalStateException("Invalid sequence length " + length + " at position " + position +
          " with " + buffer.remaining() + " bytes remaining");
    }
    final int[] values = new int[length];
    for (int i = 0; i < length; i++) {
      values[i] = ZigZagEncoding.getInt(buffer);
    }
    LOGGER.fine(() -> "Read sequence of " + length + " at position " + position);
    return values;
  }

  public ByteBuffer buffer() {
    return buffer;
  }
}
