// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.Objects;

/// Computes how many bytes [BinaryOutputArchive] could need for the same visits, without writing anything.
/// Strings are counted at three bytes per char.
public final class SizingArchive implements OutputArchive {
  private int size;

  @Override
  public SizingArchive visit(Object... values) {
    for (Object value : values) {
      measure(value);
    }
    return this;
  }

  private void measure(Object value) {
    Objects.requireNonNull(value, "Cannot visit a null value");
    if (value instanceof Value<?> primitive) {
      size += primitive.type().maxSizeOf(primitive.get());
    } else if (value instanceof SizeTag sizeTag) {
      size += ZigZagEncoding.sizeOf(sizeTag.get());
    } else if (value instanceof NamedValue named) {
      measure(named.value());
    } else if (value instanceof BinaryData binaryData) {
      final int length = binaryData.get().length;
      size += ZigZagEncoding.sizeOf(length) + length;
    } else if (value instanceof Traversable traversable) {
      traversable.traverse(this);
    } else {
      throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }
  }

  @Override
  public void appendSequence(int[] values) {
    size += ZigZagEncoding.sizeOf(values.length);
    for (int value : values) {
      size += ZigZagEncoding.sizeOf(value);
    }
  }

  public int size() {
    return size;
  }
}
