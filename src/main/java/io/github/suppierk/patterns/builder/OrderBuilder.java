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

/**
 * Defines the steps available to compose an {@link Order}.
 *
 * <p>Typical usage:
 *
 * <pre>{@code
 * builder.reset();
 * builder.addItem(steak, Category.MAIN_COURSE);
 * builder.addItem(beer, Category.BEVERAGES);
 * builder.getResult().ifPresent(order -> pay(order.totalPrice()));
 * }</pre>
 *
 * <p>Implementations are not required to be thread-safe.
 */
public interface OrderBuilder {
  /** Discards any unfinished {@link Order} and starts a new, empty one. */
  void reset();

  /**
   * Adds a single unit of the item to the given section of the {@link Order} in progress.
   *
   * <p>If an item with the same {@link MenuItem#name()} is already present in that section, its
   * quantity is increased and its position is kept, otherwise a new {@link LineItem} is appended.
   *
   * @param item to add
   * @param category to add item to
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  void addItem(MenuItem item, Category category);

  /**
   * Does not finalize anything: the builder can be used further, but changes made through it
   * afterwards are not visible in the returned instance, which belongs to the caller.
   *
   * @return a snapshot of the {@link Order} in progress or {@link Optional#empty()} if {@link
   *     #reset()} was never called
   */
  Optional<Order> getResult();
}
