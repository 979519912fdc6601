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

package io.github.suppierk.patterns.adapter;

import io.github.suppierk.patterns.adapter.vendor.VendorCalendarEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The calendar event as the rest of our code wants to see it.
 *
 * <p>Defined with {@code title()} style accessors so that a {@link Record} can implement it
 * directly, while third-party types are brought in via {@link #adapt(VendorCalendarEvent)}.
 */
public interface CalendarEvent {
  /**
   * Wraps a third-party event without exposing {@link VendorCalendarEventAdapter} to callers.
   *
   * @param vendorCalendarEvent to adapt
   * @return a new instance of {@link CalendarEvent} backed by the given vendor event
   */
  static CalendarEvent adapt(VendorCalendarEvent vendorCalendarEvent) {
    return new VendorCalendarEventAdapter(vendorCalendarEvent);
  }

  String title();

  Instant start();

  Instant end();

  Optional<String> location();

  boolean allDay();

  /**
   * @return time between {@link #start()} and {@link #end()}
   */
  default Duration duration() {
    return Duration.between(start(), end());
  }
}
