// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

/// A composite type that knows how to visit its own members. The implementation is written once and is called
/// both by the engine (to move bytes) and by a tracker (to record identities), so it must visit the same values in
/// the same order every time and must only change structure inside setters that the engine invokes.
///
/// ```java
/// class Node implements Traversable {
///   int value;
///   Node next;
///
///   public void traverse(Visitor visitor) {
///     visitor.visit(
///         Value.ofInt(() -> value, v -> value = v),
///         ThisReference.of(this),
///         RawPointer.of(Node.class, () -> next, n -> next = n));
///   }
/// }
/// ```
@FunctionalInterface
public interface Traversable {

  void traverse(Visitor visitor);
}
