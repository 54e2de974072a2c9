// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/// Wraps a mutable field that refers to another object co-serialized in the same traversal. The engine writes nothing
/// for it: a reference has no portable value of its own. The save tracker records the current target and the load
/// tracker records how to assign the field once the identity map has been read.
///
/// The target class is kept so that the deferred assignment can check what it is given. The slot is the object that
/// takes the pointer's own object-id so that other pointers can refer to it; it is the wrapper unless a holder such
/// as [Pointer] supplies itself.
public final class RawPointer<T> implements Traversable {
  private final Object slot;
  private final Class<T> type;
  private final Supplier<? extends T> getter;
  private final Consumer<? super T> setter;

  private RawPointer(Object slot, Class<T> type, Supplier<? extends T> getter, Consumer<? super T> setter) {
    this.slot = slot == null ? this : slot;
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.getter = Objects.requireNonNull(getter, "getter must not be null");
    this.setter = Objects.requireNonNull(setter, "setter must not be null");
  }

  public static @NotNull <T> RawPointer<T> of(Class<T> type, Supplier<? extends T> getter, Consumer<? super T> setter) {
    return new RawPointer<>(null, type, getter, setter);
  }

  static <T> RawPointer<T> heldBy(Object slot, Class<T> type, Supplier<? extends T> getter,
                                  Consumer<? super T> setter) {
    return new RawPointer<>(Objects.requireNonNull(slot, "slot must not be null"), type, getter, setter);
  }

  Object slot() {
    return slot;
  }

  public Class<T> type() {
    return type;
  }

  /// @return the current target, which may be null
  public T target() {
    return getter.get();
  }

  void assign(T target) {
    setter.accept(target);
  }

  @Override
  public void traverse(Visitor visitor) {
    if (visitor instanceof TrackingVisitor tracker) {
      tracker.trackPointer(this);
    }
  }

  @Override
  public String toString() {
    return "RawPointer[" + type.getSimpleName() + "]";
  }
}
