// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

/// The recipient a [Traversable] is walked with. There are exactly two kinds: an [EncodingVisitor] that moves
/// bytes and a [TrackingVisitor] that only records object identities. Adapter types switch on the kind so that
/// they are inert for the former and visible to the latter.
public sealed interface Visitor extends Archive permits EncodingVisitor, TrackingVisitor {

  @Override
  Visitor visit(Object... values);
}
