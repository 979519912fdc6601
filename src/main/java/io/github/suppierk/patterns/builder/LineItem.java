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
 * Describes "N units of this {@link MenuItem}" within an {@link Order}.
 *
 * <p>Only the quantity can change and only the owning {@link Order} can change it.
 */
public final class LineItem {
  private final MenuItem menuItem;
  private int quantity;

  LineItem(final MenuItem menuItem) {
    this(menuItem, 1);
  }

  LineItem(final MenuItem menuItem, final int quantity) {
    this.menuItem = menuItem;
    this.quantity = quantity;
  }

  public MenuItem menuItem() {
    return menuItem;
  }

  /**
   * @return how many units were ordered, always positive
   */
  public int quantity() {
    return quantity;
  }

  /**
   * @return unit price multiplied by quantity
   */
  public BigDecimal lineTotal() {
    return menuItem.price().multiply(BigDecimal.valueOf(quantity));
  }

  void increment() {
    quantity = Math.addExact(quantity, 1);
  }

  LineItem copy() {
    return new LineItem(menuItem, quantity);
  }

  @Override
  public String toString() {
    return "%dx %s".formatted(quantity, menuItem.name());
  }
}
