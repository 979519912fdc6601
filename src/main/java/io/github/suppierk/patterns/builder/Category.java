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

/**
 * Sections of the menu an {@link Order} is split into.
 *
 * <p>Declaration order is the order in which courses are served and the order in which {@link
 * Order} reports them.
 */
public enum Category {
  STARTERS,
  MAIN_COURSE,
  SIDE_DISHES,
  BEVERAGES;

  /**
   * @return a human-readable name of the section as printed on the menu
   */
  public String label() {
    return switch (this) {
      case STARTERS -> "Starters";
      case MAIN_COURSE -> "Main course";
      case SIDE_DISHES -> "Side dishes";
      case BEVERAGES -> "Beverages";
    };
  }
}
