// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

/// A real serialization engine. It encodes or decodes [Value], [SizeTag] and [BinaryData], unwraps
/// [NamedValue] and walks into a [Traversable] by calling it back with itself.
public non-sealed interface EncodingVisitor extends Visitor {

  /// @return true for an engine that writes, false for one that reads
  boolean isSaving();
}
