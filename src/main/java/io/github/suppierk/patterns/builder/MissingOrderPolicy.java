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
 * Decides what {@link MenuOrderBuilder#addItem(MenuItem, Category)} does when {@link
 * MenuOrderBuilder#reset()} was never called.
 *
 * <p>In both cases no {@link Order} is created implicitly.
 */
public enum MissingOrderPolicy {
  /** The item is dropped and a warning is logged. */
  IGNORE,

  /** {@link OrderNotStartedException} is thrown. */
  FAIL
}
