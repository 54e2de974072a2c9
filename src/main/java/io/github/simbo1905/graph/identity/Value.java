// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/// A primitive member of a [Traversable] exposed as a getter and a setter so that the same visit call can write
/// the member on save and assign it on load. Trackers give each value its own object-id but a value can never be
/// the target of a pointer.
public final class Value<T> {
  private final ValueType type;
  private final Supplier<T> getter;
  private final Consumer<T> setter;

  private Value(ValueType type, Supplier<T> getter, Consumer<T> setter) {
    this.type = type;
    this.getter = Objects.requireNonNull(getter, "getter must not be null");
    this.setter = Objects.requireNonNull(setter, "setter must not be null");
  }

  public static @NotNull Value<Boolean> ofBoolean(Supplier<Boolean> getter, Consumer<Boolean> setter) {
    return new Value<>(ValueType.BOOLEAN, getter, setter);
  }

  public static @NotNull Value<Byte> ofByte(Supplier<Byte> getter, Consumer<Byte> setter) {
    return new Value<>(ValueType.BYTE, getter, setter);
  }

  public static @NotNull Value<Short> ofShort(Supplier<Short> getter, Consumer<Short> setter) {
    return new Value<>(ValueType.SHORT, getter, setter);
  }

  public static @NotNull Value<Character> ofChar(Supplier<Character> getter, Consumer<Character> setter) {
    return new Value<>(ValueType.CHARACTER, getter, setter);
  }

  public static @NotNull Value<Integer> ofInt(Supplier<Integer> getter, Consumer<Integer> setter) {
    return new Value<>(ValueType.INTEGER, getter, setter);
  }

  public static @NotNull Value<Long> ofLong(Supplier<Long> getter, Consumer<Long> setter) {
    return new Value<>(ValueType.LONG, getter, setter);
  }

  public static @NotNull Value<Float> ofFloat(Supplier<Float> getter, Consumer<Float> setter) {
    return new Value<>(ValueType.FLOAT, getter, setter);
  }

  public static @NotNull Value<Double> ofDouble(Supplier<Double> getter, Consumer<Double> setter) {
    return new Value<>(ValueType.DOUBLE, getter, setter);
  }

  /// Strings may be null.
  public static @NotNull Value<String> ofString(Supplier<String> getter, Consumer<String> setter) {
    return new Value<>(ValueType.STRING, getter, setter);
  }

  ValueType type() {
    return type;
  }

  public T get() {
    return getter.get();
  }

  /// Assign a value decoded by the engine, which has already checked it matches [#type()].
  @SuppressWarnings("unchecked")
  void assignDecoded(Object decoded) {
    setter.accept((T) decoded);
  }

  @Override
  public String toString() {
    return "Value[" + type + "]";
  }
}
