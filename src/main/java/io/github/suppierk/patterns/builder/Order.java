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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * The product of the {@link OrderBuilder}: one ordered sequence of {@link LineItem}s per {@link
 * Category}.
 *
 * <p>Within a single sequence {@link MenuItem#name()}s are unique, repeated additions of the same
 * item increase {@link LineItem#quantity()} instead.
 *
 * <p>Instances can only be created and changed by the builders in this package. Consumers get a
 * read-only view of an instance which no builder holds anymore.
 */
public final class Order {
  private final List<LineItem> starters;
  private final List<LineItem> mainCourse;
  private final List<LineItem> sideDishes;
  private final List<LineItem> beverages;

  Order() {
    this.starters = new ArrayList<>();
    this.mainCourse = new ArrayList<>();
    this.sideDishes = new ArrayList<>();
    this.beverages = new ArrayList<>();
  }

  /**
   * @param category to look into
   * @return an unmodifiable view of the line items in insertion order
   */
  public List<LineItem> lineItems(final Category category) {
    if (category == null) {
      throw new IllegalArgumentException("Category cannot be null");
    }

    return Collections.unmodifiableList(sequenceFor(category));
  }

  /**
   * Derived on every call, nothing is cached.
   *
   * @return sum of unit price multiplied by quantity over all categories
   */
  public BigDecimal totalPrice() {
    return Arrays.stream(Category.values())
        .flatMap(category -> sequenceFor(category).stream())
        .map(LineItem::lineTotal)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /**
   * @return total amount of units ordered across all categories
   */
  public int itemCount() {
    return Arrays.stream(Category.values())
        .flatMap(category -> sequenceFor(category).stream())
        .map(LineItem::quantity)
        .reduce(0, Math::addExact);
  }

  /**
   * @return {@code true} if nothing was ordered yet
   */
  public boolean isEmpty() {
    return Arrays.stream(Category.values()).allMatch(category -> sequenceFor(category).isEmpty());
  }

  /**
   * @return an independent {@link Order} with the same line items, later changes to either
   *     instance are not visible in the other
   */
  Order copy() {
    final Order copy = new Order();

    for (Category category : Category.values()) {
      for (LineItem lineItem : sequenceFor(category)) {
        copy.sequenceFor(category).add(lineItem.copy());
      }
    }

    return copy;
  }

  void add(final MenuItem menuItem, final Category category) {
    final List<LineItem> sequence = sequenceFor(category);

    for (LineItem lineItem : sequence) {
      if (lineItem.menuItem().name().equals(menuItem.name())) {
        lineItem.increment();
        return;
      }
    }

    sequence.add(new LineItem(menuItem));
  }

  List<LineItem> sequenceFor(final Category category) {
    return switch (category) {
      case STARTERS -> starters;
      case MAIN_COURSE -> mainCourse;
      case SIDE_DISHES -> sideDishes;
      case BEVERAGES -> beverages;
    };
  }

  @Override
  public String toString() {
    final StringJoiner joiner = new StringJoiner(", ", "Order{", "}");

    for (Category category : Category.values()) {
      joiner.add("%s=%s".formatted(category.label(), sequenceFor(category)));
    }

    return joiner.toString();
  }
}
