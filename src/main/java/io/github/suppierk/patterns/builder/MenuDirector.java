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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Director of the Builder pattern: knows the order of steps for {@link SetMenu}s but not how
 * an {@link Order} is stored.
 *
 * <p>Each call to {@link #construct(SetMenu...)} resets the underlying {@link OrderBuilder}, so
 * any unfinished work in it is discarded.
 */
public final class MenuDirector extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(MenuDirector.class);

  private final OrderBuilder orderBuilder;

  /**
   * @param orderBuilder to drive
   */
  public MenuDirector(final OrderBuilder orderBuilder) {
    this.orderBuilder = throwIllegalArgumentIfNull(orderBuilder, "Order builder");
  }

  /**
   * Puts all given set menus into one fresh {@link Order}. Dishes shared between set menus are
   * aggregated into one {@link LineItem}.
   *
   * @param setMenus to combine, can be empty
   * @return a new {@link Order}
   * @throws IllegalArgumentException if set menus or any of them are {@code null}
   * @throws IllegalStateException if the builder produced no result after reset
   */
  public Order construct(final SetMenu... setMenus) {
    final SetMenu[] nonNullSetMenus = throwIllegalArgumentIfNull(setMenus, "Set menus");

    for (SetMenu setMenu : nonNullSetMenus) {
      throwIllegalArgumentIfNull(setMenu, "Set menu");
    }

    orderBuilder.reset();

    for (SetMenu setMenu : nonNullSetMenus) {
      LOGGER.debug(
          "Constructing set menu '{}' of {} step(s)", setMenu.name(), setMenu.steps().size());

      for (SetMenu.Step step : setMenu.steps()) {
        orderBuilder.addItem(step.item(), step.category());
      }
    }

    return throwIllegalStateIfNull(orderBuilder.getResult(), "Order builder result")
        .orElseThrow(
            () -> new IllegalStateException("Order builder produced no order after reset"));
  }
}
