/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChunkLayoutTest {

  @Test
  void testSingleAxis() {
    ChunkLayout layout = ChunkLayout.of(2, 3);
    assertEquals(1, layout.getAxisCount());
    assertEquals(2, layout.getChunkCount());
    assertEquals(5, layout.getLength());
    assertEquals(3, layout.chunkSize(1));
    assertEquals(0, layout.chunkOf(1));
    assertEquals(1, layout.chunkOf(2));
    assertArrayEquals(new int[]{2, 3, 4}, layout.positions(1));
    assertArrayEquals(new int[]{0, 0, 1, 1, 1}, layout.chunkIdsByPosition());
  }

  @Test
  void testUniform() {
    assertEquals(ChunkLayout.of(4, 4, 2), ChunkLayout.uniform(10, 4));
    assertEquals(ChunkLayout.of(5, 5), ChunkLayout.uniform(10, 5));
    assertEquals(ChunkLayout.of(7), ChunkLayout.single(7));
  }

  @Test
  void testTwoAxesFlattenRowMajor() {
    // a 2 x 4 reduced block split into 1 x 2 chunks, four chunks in total
    ChunkLayout layout = ChunkLayout.ofAxes(new int[]{1, 1}, new int[]{2, 2});
    assertEquals(2, layout.getAxisCount());
    assertEquals(4, layout.getChunkCount());
    assertEquals(8, layout.getLength());
    assertArrayEquals(new int[]{0, 1}, layout.positions(0));
    assertArrayEquals(new int[]{2, 3}, layout.positions(1));
    assertArrayEquals(new int[]{4, 5}, layout.positions(2));
    assertArrayEquals(new int[]{6, 7}, layout.positions(3));
    assertEquals(3, layout.chunkOf(6));

    ChunkLayout blocks = ChunkLayout.ofAxes(new int[]{2}, new int[]{1, 3});
    assertArrayEquals(new int[]{0, 4}, blocks.positions(0));
    assertArrayEquals(new int[]{1, 2, 3, 5, 6, 7}, blocks.positions(1));
    assertEquals(6, blocks.chunkSize(1));
  }

  @Test
  void testStructuralEquality() {
    assertEquals(ChunkLayout.of(2, 3), ChunkLayout.of(2, 3));
    assertEquals(ChunkLayout.of(2, 3).hashCode(), ChunkLayout.of(2, 3).hashCode());
    assertNotEquals(ChunkLayout.of(3, 2), ChunkLayout.of(2, 3));
  }

  @Test
  void testInvalid() {
    assertThrows(GroupByConfigurationException.class, () -> ChunkLayout.of(2, 0));
    assertThrows(GroupByConfigurationException.class, () -> ChunkLayout.of(2).chunkOf(2));
    assertThrows(GroupByConfigurationException.class, () -> ChunkLayout.of(2).positions(1));
  }
}
