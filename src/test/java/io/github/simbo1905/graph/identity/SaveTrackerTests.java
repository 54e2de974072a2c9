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

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/// Package-private checks of how the save side numbers units and resolves pointers
public class SaveTrackerTests {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  final RecordingOutputArchive archive = new RecordingOutputArchive(ByteBuffer.allocate(256));

  @Test
  @DisplayName("Null pointer is written as object-id zero")
  void testNullPointerIsObjectIdZero() {
    final var tracker = new SaveTracker();
    tracker.visit(new Node(1));

    tracker.complete(archive);

    assertThat(archive.sequences).hasSize(1);
    assertThat(archive.sequences.get(0)).containsExactly(0);
    // value, self and the pointer slot; nothing for the null target
    assertThat(tracker.unitCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("Object-ids follow traversal order")
  void testIdsFollowTraversalOrder() {
    final var first = new Node(1);
    final var second = new Node(2);
    first.next = second;
    second.next = first;
    final var tracker = new SaveTracker();

    tracker.visit(first, second);
    tracker.complete(archive);

    // 1 value, 2 first, 3 pointer, 4 value, 5 second, 6 pointer
    assertThat(archive.sequences.get(0)).containsExactly(5, 2);
    assertThat(tracker.pointerCount()).isEqualTo(2);
    assertThat(tracker.unitCount()).isEqualTo(6);
  }

  @Test
  @DisplayName("A unit tracked twice resolves to its most recent object-id")
  void testLastWriteWins() {
    final var leaf = new Leaf();
    final var other = new Leaf();
    final var tracker = new SaveTracker();

    tracker.trackIdentity(leaf);
    tracker.trackIdentity(other);
    tracker.trackIdentity(leaf);
    tracker.visit(RawPointer.of(Leaf.class, () -> leaf, ignored -> {
    }));
    tracker.complete(archive);

    assertThat(archive.sequences.get(0)).containsExactly(3);
  }

  @Test
  @DisplayName("Pointer to an object outside the traversal fails on complete")
  void testTargetNotTraversed() {
    final var inside = new Node(1);
    inside.next = new Node(2);
    final var tracker = new SaveTracker();
    tracker.visit(inside);

    final var e = assertThrows(GraphIdentityException.class, () -> tracker.complete(archive));

    assertThat(e.reason()).isEqualTo(GraphIdentityException.Reason.TARGET_NOT_TRAVERSED);
    assertThat(e.getMessage()).contains("Pointer 0").contains(Node.class.getName());
    assertThat(archive.sequences).isEmpty();
  }

  @Test
  @DisplayName("Complete writes the identity map exactly once")
  void testCompleteIsIdempotent() {
    final var node = new Node(1);
    node.next = node;
    final var tracker = new SaveTracker();
    tracker.visit(node);

    tracker.complete(archive);
    tracker.complete(archive);

    assertThat(archive.sequences).hasSize(1);
  }

  @Test
  @DisplayName("Names are transparent and binary data takes no object-id")
  void testWrappersAndBinaryData() {
    final var tracker = new SaveTracker();

    tracker.visit(
        NamedValue.of("x", Value.ofInt(() -> 1, ignored -> {
        })),
        BinaryData.of(() -> new byte[]{1}, ignored -> {
        }),
        SizeTag.of(() -> 0, ignored -> {
        }));

    assertThat(tracker.unitCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("Self references are tracked by referent not by wrapper")
  void testThisReferenceTracksReferent() {
    final var leaf = new Leaf();
    final var tracker = new SaveTracker();

    tracker.visit(ThisReference.of(leaf), Pointer.to(Leaf.class, leaf));
    tracker.complete(archive);

    assertThat(archive.sequences.get(0)).containsExactly(1);
  }

  @Test
  @DisplayName("Unsupported values are rejected")
  void testUnsupportedValue() {
    final var tracker = new SaveTracker();

    assertThrows(IllegalArgumentException.class, () -> tracker.visit("not a value"));
    assertThrows(NullPointerException.class, () -> tracker.visit((Object) null));
  }

  @Test
  @DisplayName("Pointer holder takes its own object-id")
  void testPointerHolderIsTrackedAsSlot() {
    final var leaf = new Leaf();
    final var holder = Pointer.to(Leaf.class, leaf);
    final var tracker = new SaveTracker();

    // 1 leaf label, 2 leaf, 3 holder
    tracker.visit(leaf, holder, RawPointer.of(Pointer.class, () -> holder, ignored -> {
    }));
    tracker.complete(archive);

    assertThat(archive.sequences.get(0)).containsExactly(2, 3);
  }
}
