// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

/// The "visit a sequence of values" entry point shared by engines, trackers and the graph archives.
/// User code calls this with the fields of a type in a fixed order; the same calls serve both saving and loading.
public interface Archive {

  /// Visit the values in order.
  /// @param values the values, wrappers and traversable composites to visit
  /// @return this archive so that calls can be chained
  Archive visit(Object... values);
}
