// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/// Makes the identity of the composite being traversed visible to a tracker. Walking into a composite only ever
/// exposes its members, so a type that may be the target of a pointer must visit `ThisReference.of(this)` once in
/// its [Traversable#traverse(Visitor)]. The engine writes nothing for it.
///
/// ```java
/// public void traverse(Visitor visitor) {
///   visitor.visit(Value.ofDouble(() -> x, v -> x = v), Value.ofDouble(() -> y, v -> y = v), ThisReference.of(this));
/// }
/// ```
public final class ThisReference<T> implements Traversable {
  private final T referent;

  private ThisReference(T referent) {
    this.referent = Objects.requireNonNull(referent, "referent must not be null");
  }

  public static @NotNull <T> ThisReference<T> of(T self) {
    return new ThisReference<>(self);
  }

  public T referent() {
    return referent;
  }

  @Override
  public void traverse(Visitor visitor) {
    if (visitor instanceof TrackingVisitor tracker) {
      tracker.trackIdentity(referent);
    }
  }

  @Override
  public String toString() {
    return "ThisReference[" + referent.getClass().getSimpleName() + "]";
  }
}
