// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/// A reference held in a field or a collection that is visited directly, without wrapping it in a [RawPointer] by
/// hand. Useful as the element type of a [Sequence]. The holder itself takes the pointer's object-id, so another
/// pointer may refer to it.
public final class Pointer<T> implements Traversable {
  private final Class<T> type;
  private T target;

  private Pointer(Class<T> type, T target) {
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.target = target;
  }

  public static @NotNull <T> Pointer<T> to(Class<T> type, T target) {
    return new Pointer<>(type, target);
  }

  public static @NotNull <T> Pointer<T> empty(Class<T> type) {
    return new Pointer<>(type, null);
  }

  public T get() {
    return target;
  }

  public void set(T target) {
    this.target = target;
  }

  public boolean isNull() {
    return target == null;
  }

  @Override
  public void traverse(Visitor visitor) {
    if (visitor instanceof TrackingVisitor tracker) {
      tracker.trackPointer(RawPointer.heldBy(this, type, this::get, this::set));
    }
  }

  @Override
  public String toString() {
    return "Pointer[" + type.getSimpleName() + "]";
  }
}
