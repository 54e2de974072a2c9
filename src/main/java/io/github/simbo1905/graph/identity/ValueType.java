// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// The primitive values the binary engine understands, each with its codec.
enum ValueType {
  BOOLEAN(
      (buffer, value) -> buffer.put((byte) ((Boolean) value ? 1 : 0)),
      buffer -> buffer.get() != 0,
      value -> 1),
  BYTE(
      (buffer, value) -> buffer.put((Byte) value),
      buffer -> buffer.get(),
      value -> Byte.BYTES),
  SHORT(
      (buffer, value) -> buffer.putShort((Short) value),
      buffer -> buffer.getShort(),
      value -> Short.BYTES),
  CHARACTER(
      (buffer, value) -> buffer.putChar((Character) value),
      buffer -> buffer.getChar(),
      value -> Character.BYTES),
  INTEGER(
      (buffer, value) -> ZigZagEncoding.putInt(buffer, (Integer) value),
      ZigZagEncoding::getInt,
      value -> ZigZagEncoding.sizeOf((Integer) value)),
  LONG(
      (buffer, value) -> ZigZagEncoding.putLong(buffer, (Long) value),
      ZigZagEncoding::getLong,
      value -> ZigZagEncoding.sizeOf((Long) value)),
  FLOAT(
      (buffer, value) -> buffer.putFloat((Float) value),
      buffer -> buffer.getFloat(),
      value -> Float.BYTES),
  DOUBLE(
      (buffer, value) -> buffer.putDouble((Double) value),
      buffer -> buffer.getDouble(),
      value -> Double.BYTES),
  // null is written as length -1
  STRING(
      ValueType::writeString,
      ValueType::readString,
      ValueType::sizeOfString);

  private final Writer writer;
  private final Reader reader;
  private final Sizer sizer;

  ValueType(Writer writer, Reader reader, Sizer sizer) {
    this.writer = writer;
    this.reader = reader;
    this.sizer = sizer;
  }

  void write(ByteBuffer buffer, Object value) {
    writer.write(buffer, nullCheck(value));
  }

  Object read(ByteBuffer buffer) {
    return reader.read(buffer);
  }

  int maxSizeOf(Object value) {
    return sizer.sizeOf(nullCheck(value));
  }

  private Object nullCheck(Object value) {
    if (this == STRING) {
      return value;
    }
    return Objects.requireNonNull(value, () -> "A " + this + " value must not be null");
  }

  private static void writeString(ByteBuffer buffer, Object value) {
    if (value == null) {
      ZigZagEncoding.putInt(buffer, -1);
      return;
    }
    final byte[] bytes = ((String) value).getBytes(StandardCharsets.UTF_8);
    ZigZagEncoding.putInt(buffer, bytes.length);
    buffer.put(bytes);
  }

  private static Object readString(ByteBuffer buffer) {
    final int length = ZigZagEncoding.getInt(buffer);
    if (length == -1) {
      return null;
    }
    if (length < 0 || length > buffer.remaining()) {
      throw new IllegalStateException("Invalid string length " + length + " at position " + buffer.position() +
          " with " + buffer.remaining() + " bytes remaining");
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static int sizeOfString(Object value) {
    if (value == null) {
      return 1;
    }
    // three bytes is the most UTF-8 needs for one UTF-16 char
    final int maxBytes = ((String) value).length() * 3;
    return ZigZagEncoding.sizeOf(maxBytes) + maxBytes;
  }
}
