// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;
import java.util.function.Function;

/// Decodes one primitive value from the buffer's position.
interface Reader extends Function<ByteBuffer, Object> {

  default Object read(ByteBuffer buffer) {
    return apply(buffer);
  }
}
