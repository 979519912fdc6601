/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.patterns.builder;

import java.math.BigDecimal;

/**
 * A single dish or drink on the menu.
 *
 * <p>The {@code name} is what identifies the item within an {@link Order}: two items with the same
 * name added to the same {@link Category} end up in one {@link LineItem}.
 *
 * @param name of the item, must not be blank
 * @param price of a single unit, must not be negative
 */
public record MenuItem(String name, BigDecimal price) {
  public MenuItem {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Menu item name cannot be blank");
    }

    if (price == null) {
      throw new IllegalArgumentException("Menu item price cannot be null");
    }

    if (price.signum() < 0) {
      throw new IllegalArgumentException(
          "Menu item '%s' price cannot be negative: %s".formatted(name, price.toPlainString()));
    }
  }

  /**
   * Shortcut to avoid binary floating point when declaring prices.
   *
   * @param name of the item
   * @param price as a decimal string, for example {@code "12.30"}
   * @return a new instance of {@link MenuItem}
   * @throws NumberFormatException if price is not a valid decimal
   */
  public static MenuItem of(String name, String price) {
    if (price == null) {
      throw new IllegalArgumentException("Menu item price cannot be null");
    }

    return new MenuItem(name, new BigDecimal(price));
  }
}
