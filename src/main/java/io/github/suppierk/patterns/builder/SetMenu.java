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

import java.util.ArrayList;
import java.util.List;

/**
 * A predefined combination of dishes which {@link MenuDirector} knows how to put into an {@link
 * Order}.
 *
 * @param name of the combination as printed on the menu
 * @param steps to replay, in order
 */
public record SetMenu(String name, List<Step> steps) {
  public SetMenu {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Set menu name cannot be blank");
    }

    if (steps == null) {
      throw new IllegalArgumentException("Set menu steps cannot be null");
    }

    for (Step step : steps) {
      if (step == null) {
        throw new IllegalArgumentException("Set menu '%s' contains null step".formatted(name));
      }
    }

    steps = List.copyOf(steps);
  }

  /**
   * Starts describing a new set menu.
   *
   * @param name of the set menu
   * @return a new instance of {@link Composer}
   */
  public static Composer named(String name) {
    return new Composer(name);
  }

  /**
   * A single {@link OrderBuilder#addItem(MenuItem, Category)} call.
   *
   * @param item to add
   * @param category to add item to
   */
  public record Step(MenuItem item, Category category) {
    public Step {
      if (item == null) {
        throw new IllegalArgumentException("Step item cannot be null");
      }

      if (category == null) {
        throw new IllegalArgumentException("Step category cannot be null");
      }
    }
  }

  /** Fluent way to collect {@link Step}s. */
  public static final class Composer {
    private final String name;
    private final List<Step> steps;

    private Composer(final String name) {
      this.name = name;
      this.steps = new ArrayList<>();
    }

    public Composer starter(final MenuItem item) {
      return with(item, Category.STARTERS);
    }

    public Composer mainCourse(final MenuItem item) {
      return with(item, Category.MAIN_COURSE);
    }

    public Composer sideDish(final MenuItem item) {
      return with(item, Category.SIDE_DISHES);
    }

    public Composer beverage(final MenuItem item) {
      return with(item, Category.BEVERAGES);
    }

    public Composer with(final MenuItem item, final Category category) {
      steps.add(new Step(item, category));
      return this;
    }

    public SetMenu compose() {
      return new SetMenu(name, steps);
    }
  }
}
