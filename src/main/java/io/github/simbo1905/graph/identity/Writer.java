// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.util.function.BiConsumer;

/// Encodes one primitive value at the buffer's position.
interface Writer extends BiConsumer<ByteBuffer, Object> {

  default void write(ByteBuffer buffer, Object value) {
    accept(buffer, value);
  }
}
