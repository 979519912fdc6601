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

/**
 * Builder pattern, told through a restaurant.
 *
 * <p>Let's assume that we are a waiter taking an order at a table:
 *
 * <ul>
 *   <li>The dishes on the menu are {@link io.github.suppierk.patterns.builder.MenuItem}s - they
 *       have a name and a price and never change.
 *   <li>The menu is split into sections, {@link io.github.suppierk.patterns.builder.Category}s:
 *       starters, main course, side dishes and beverages.
 *   <li>Our notepad is the {@link io.github.suppierk.patterns.builder.OrderBuilder}:
 *       <ul>
 *         <li>We flip to a clean page with {@link
 *             io.github.suppierk.patterns.builder.OrderBuilder#reset()}.
 *         <li>Every time a guest asks for something we call {@link
 *             io.github.suppierk.patterns.builder.OrderBuilder#addItem} - if the same dish was
 *             already written down in that section, we put a tally mark next to it instead of
 *             writing it again, which is what a {@link
 *             io.github.suppierk.patterns.builder.LineItem} quantity is.
 *         <li>When the table is done we tear the page off with {@link
 *             io.github.suppierk.patterns.builder.OrderBuilder#getResult()} and hand the {@link
 *             io.github.suppierk.patterns.builder.Order} over to the kitchen.
 *       </ul>
 *   <li>Some guests simply point at a combo - a {@link
 *       io.github.suppierk.patterns.builder.SetMenu}. The {@link
 *       io.github.suppierk.patterns.builder.MenuDirector} is the head waiter who knows which dishes
 *       make up a combo and dictates them to our notepad in the right order.
 * </ul>
 *
 * <p>The bill is never written down - {@link
 * io.github.suppierk.patterns.builder.Order#totalPrice()} is computed from the page every time it
 * is asked for.
 */
package io.github.suppierk.patterns.builder;
