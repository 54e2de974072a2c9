// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/// A mutable list of traversable elements visited as a [SizeTag] followed by each element in order. On load the size
/// tag grows or shrinks the list with fresh elements from the factory before they are visited, so the elements are
/// the newly constructed objects that pointers will be resolved against.
public final class Sequence<E extends Traversable> implements Traversable {
  private final List<E> elements;
  private final Supplier<? extends E> factory;

  private Sequence(List<E> elements, Supplier<? extends E> factory) {
    this.elements = Objects.requireNonNull(elements, "elements must not be null");
    this.factory = Objects.requireNonNull(factory, "factory must not be null");
  }

  public static @NotNull <E extends Traversable> Sequence<E> of(List<E> elements, Supplier<? extends E> factory) {
    return new Sequence<>(elements, factory);
  }

  @Override
  public void traverse(Visitor visitor) {
    visitor.visit(SizeTag.of(elements::size, this::resize));
    for (E element : elements) {
      visitor.visit(element);
    }
  }

  private void resize(int size) {
    if (size < 0) {
      throw new IllegalStateException("Invalid sequence size " + size);
    }
    while (elements.size() > size) {
      elements.remove(elements.size() - 1);
    }
    while (elements.size() < size) {
      elements.add(Objects.requireNonNull(factory.get(), "factory must not return null"));
    }
  }
}
