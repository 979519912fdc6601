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
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Object adapter from {@link VendorCalendarEvent} to {@link CalendarEvent}.
 *
 * <p>Values are read from the adaptee on every call, so changes made by the vendor SDK are visible
 * immediately. Since vendor data is outside our control, inconsistent values are reported with
 * {@link IllegalStateException} upon access.
 */
public final class VendorCalendarEventAdapter implements CalendarEvent {
  private final VendorCalendarEvent adaptee;

  /**
   * @param adaptee to wrap
   */
  public VendorCalendarEventAdapter(final VendorCalendarEvent adaptee) {
    if (adaptee == null) {
      throw new IllegalArgumentException("Vendor calendar event is null");
    }

    this.adaptee = adaptee;
  }

  /** {@inheritDoc} */
  @Override
  public String title() {
    final String summary = adaptee.getSummary();

    if (summary == null) {
      throw new IllegalStateException("Vendor calendar event summary cannot be null");
    }

    return summary;
  }

  /** {@inheritDoc} */
  @Override
  public Instant start() {
    return Instant.ofEpochMilli(adaptee.getStartEpochMillis());
  }

  /** {@inheritDoc} */
  @Override
  public Instant end() {
    final int lengthMinutes = adaptee.getLengthMinutes();

    if (lengthMinutes < 0) {
      throw new IllegalStateException(
          "Vendor calendar event length cannot be negative: %d".formatted(lengthMinutes));
    }

    return start().plus(lengthMinutes, ChronoUnit.MINUTES);
  }

  /**
   * Blank location text is treated the same way as missing one.
   *
   * @return location of the event, if known
   */
  @Override
  public Optional<String> location() {
    return Optional.ofNullable(adaptee.getLocationText()).filter(text -> !text.isBlank());
  }

  /** {@inheritDoc} */
  @Override
  public boolean allDay() {
    return adaptee.isAllDay();
  }
}
