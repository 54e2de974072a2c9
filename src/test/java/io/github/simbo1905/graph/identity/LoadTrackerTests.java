// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.graph.identity.model.Leaf;
import io.github.simbo1905.graph.identity.model.Node;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/// Package-private checks of how the load side resolves an identity map against the units it tracked
public class LoadTrackerTests {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  @DisplayName("Object-ids resolve to the units tracked at those positions")
  void testResolvesByPosition() {
    final var first = new Node(1);
    final var second = new Node(2);
    final var tracker = new LoadTracker();
    tracker.visit(first, second);

    assertThat(first.next).isNull();
    tracker.complete(new FixedInputArchive(5, 2));

    assertThat(first.next).isSameAs(second);
    assertThat(second.next).isSameAs(first);
  }

  @Test
  @DisplayName("Object-id zero assigns null")
  void testZeroIsNull() {
    final var node = new Node(1);
    node.next = node;
    final var tracker = new LoadTracker();
    tracker.visit(node);

    tracker.complete(new FixedInputArchive(0));

    assertThat(node.next).isNull();
  }

  @Test
  @DisplayName("Identity map with the wrong number of entries is a size mismatch")
  void testSizeMismatch() {
    final var tracker = new LoadTracker();
    tracker.visit(new Node(1));

    final var e = assertThrows(GraphIdentityException.class, () -> tracker.complete(new FixedInputArchive(2, 2)));

    assertThat(e.reason()).isEqualTo(GraphIdentityException.Reason.SIZE_MISMATCH);
  }

  @Test
  @DisplayName("Object-id beyond the tracked units is out of range")
  void testIdOutOfRange() {
    final var tracker = new LoadTracker();
    tracker.visit(new Node(1));
    assertThat(tracker.unitCount()).isEqualTo(3);

    final var e = assertThrows(GraphIdentityException.class, () -> tracker.complete(new FixedInputArchive(4)));

    assertThat(e.reason()).isEqualTo(GraphIdentityException.Reason.ID_OUT_OF_RANGE);
  }

  @Test
  @DisplayName("Object-id of a unit the pointer cannot hold is a type mismatch")
  void testTargetTypeMismatch() {
    final var node = new Node(1);
    final var tracker = new LoadTracker();
    tracker.visit(new Leaf(), node);

    // object-id 2 is the leaf
    final var e = assertThrows(GraphIdentityException.class, () -> tracker.complete(new FixedInputArchive(2)));

    assertThat(e.reason()).isEqualTo(GraphIdentityException.Reason.TARGET_TYPE_MISMATCH);
    assertThat(node.next).isNull();
  }

  @Test
  @DisplayName("Pointer holders in a sequence are assigned")
  void testPointerHolder() {
    final var leaf = new Leaf();
    final var pointer = Pointer.empty(Leaf.class);
    final var tracker = new LoadTracker();
    tracker.visit(leaf, pointer);

    tracker.complete(new FixedInputArchive(2));

    assertThat(pointer.get()).isSameAs(leaf);
  }

  @Test
  @DisplayName("Complete reads the identity map exactly once")
  void testCompleteIsIdempotent() {
    final var node = new Node(1);
    final var tracker = new LoadTracker();
    tracker.visit(node);
    final var archive = new FixedInputArchive(2) {
      int reads;

      @Override
      public int[] readSequence() {
        reads++;
        return super.readSequence();
      }
    };

    tracker.complete(archive);
    node.next = null;
    tracker.complete(archive);

    assertThat(archive.reads).isEqualTo(1);
    assertThat(node.next).isNull();
  }
}
