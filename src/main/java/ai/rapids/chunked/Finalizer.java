/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

/**
 * Turns the combined intermediates of one output cell into the value the user sees, for
 * example {@code sum / count} for a mean. Only called for cells with contributing elements.
 */
@FunctionalInterface
public interface Finalizer {
  double apply(double[] intermediates);

  /**
   * A finalizer returning one intermediate slot unchanged.
   */
  static Finalizer slot(int index) {
    return intermediates -> intermediates[index];
  }
}
