// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

import java.util.function.ToIntFunction;

/// Upper bound on the bytes a [Writer] will use for a value.
interface Sizer extends ToIntFunction<Object> {

  default int sizeOf(Object value) {
    return applyAsInt(value);
  }
}
