// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;

/// ZigZag varint encoding so that small magnitudes of either sign take few bytes.
/// An int takes one to five bytes and a long one to ten.
final class ZigZagEncoding {

  private ZigZagEncoding() {
  }

  static void putInt(ByteBuffer buffer, int value) {
    int encoded = (value << 1) ^ (value >> 31);
    while ((encoded & ~0x7F) != 0) {
      buffer.put((byte) ((encoded & 0x7F) | 0x80));
      encoded >>>= 7;
    }
    buffer.put((byte) encoded);
  }

  static int getInt(ByteBuffer buffer) {
    int encoded = 0;
    for (int shift = 0; shift < 35; shift += 7) {
      final byte b = buffer.get();
      encoded |= (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return (encoded >>> 1) ^ -(encoded & 1);
      }
    }
    throw new IllegalStateException("Malformed varint int ending at position " + buffer.position());
  }

  static void putLong(ByteBuffer buffer, long value) {
    long encoded = (value << 1) ^ (value >> 63);
    while ((encoded & ~0x7FL) != 0) {
      buffer.put((byte) ((encoded & 0x7F) | 0x80));
      encoded >>>= 7;
    }
    buffer.put((byte) encoded);
  }

  static long getLong(ByteBuffer buffer) {
    long encoded = 0;
    for (int shift = 0; shift < 70; shift += 7) {
      final byte b = buffer.get();
      encoded |= (long) (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return (encoded >>> 1) ^ -(encoded & 1);
      }
    }
    throw new IllegalStateException("Malformed varint long ending at position " + buffer.position());
  }

  static int sizeOf(int value) {
    int encoded = (value << 1) ^ (value >> 31);
    int size = 1;
    while ((encoded & ~0x7F) != 0) {
      encoded >>>= 7;
      size++;
    }
    return size;
  }

  static int sizeOf(long value) {
    long encoded = (value << 1) ^ (value >> 63);
    int size = 1;
    while ((encoded & ~0x7FL) != 0) {
      encoded >>>= 7;
      size++;
    }
    return size;
  }
}
