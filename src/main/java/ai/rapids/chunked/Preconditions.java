/*
 * SPDX-FileCopyrightText: Copyright (c) 2026, NVIDIA CORPORATION.
 * SPDX-License-Identifier: Apache-2.0
 */
package ai.rapids.chunked;

import java.util.function.Supplier;

/**
 * This class contains utility methods for checking preconditions.
 */
final class Preconditions {
  private Preconditions() {
  }

  /**
   * Check if the condition is true, otherwise throw an IllegalStateException with the given message.
   */
  static void ensure(boolean condition, String message) {
    if (!condition) {
      throw new IllegalStateException(message);
    }
  }

  /**
   * Check if the condition is true, otherwise throw an IllegalStateException with the given message supplier.
   */
  static void ensure(boolean condition, Supplier<String> messageSupplier) {
    if (!condition) {
      throw new IllegalStateException(messageSupplier.get());
    }
  }

  /**
   * Check a caller supplied setting, throwing a {@link GroupByConfigurationException} if it
   * does not hold.
   */
  static void checkConfig(boolean condition, Supplier<String> messageSupplier) {
    if (!condition) {
      throw new GroupByConfigurationException(messageSupplier.get());
    }
  }

  /**
   * Check a property of the input data, throwing a {@link GroupByDataException} if it does
   * not hold.
   */
  static void checkData(boolean condition, Supplier<String> messageSupplier) {
    if (!condition) {
      throw new GroupByDataException(messageSupplier.get());
    }
  }
}
