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

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concrete {@link OrderBuilder} which keeps a single {@link Order} in progress at a time.
 *
 * <p><b>Design note</b>: {@link #addItem(MenuItem, Category)} never creates an {@link Order} on
 * its own, what happens instead is controlled by {@link MissingOrderPolicy}.
 */
public final class MenuOrderBuilder extends Suspicious implements OrderBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(MenuOrderBuilder.class);

  private final MissingOrderPolicy missingOrderPolicy;
  private Order order;

  /** Creates a builder which ignores items added before {@link #reset()}. */
  public MenuOrderBuilder() {
    this(MissingOrderPolicy.IGNORE);
  }

  /**
   * @param missingOrderPolicy to apply when items are added before {@link #reset()}
   */
  public MenuOrderBuilder(final MissingOrderPolicy missingOrderPolicy) {
    this.missingOrderPolicy =
        throwIllegalArgumentIfNull(missingOrderPolicy, "Missing order policy");
  }

  /**
   * @return the policy this builder was configured with
   */
  public MissingOrderPolicy getMissingOrderPolicy() {
    return missingOrderPolicy;
  }

  /** {@inheritDoc} */
  @Override
  public void reset() {
    if (order != null && !order.isEmpty()) {
      LOGGER.debug("Discarding unfinished order with {} item(s)", order.itemCount());
    }

    order = new Order();
  }

  /**
   * {@inheritDoc}
   *
   * @throws OrderNotStartedException if {@link #reset()} was never called and the builder uses
   *     {@link MissingOrderPolicy#FAIL}
   */
  @Override
  public void addItem(final MenuItem item, final Category category) {
    final MenuItem nonNullItem = throwIllegalArgumentIfNull(item, "Menu item");
    final Category nonNullCategory = throwIllegalArgumentIfNull(category, "Category");

    if (order == null) {
      switch (missingOrderPolicy) {
        case IGNORE -> LOGGER.warn(
            "Ignoring '{}' for {}: no order in progress, call reset() first",
            nonNullItem.name(),
            nonNullCategory.label());
        case FAIL -> throw new OrderNotStartedException(
            "Cannot add '%s' for %s: no order in progress, call reset() first"
                .formatted(nonNullItem.name(), nonNullCategory.label()));
      }

      return;
    }

    order.add(nonNullItem, nonNullCategory);
    LOGGER.debug("Added '{}' to {}", nonNullItem.name(), nonNullCategory.label());
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Order> getResult() {
    return Optional.ofNullable(order).map(Order::copy);
  }
}
