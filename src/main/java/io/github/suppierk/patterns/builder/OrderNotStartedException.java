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

import java.io.Serial;

/**
 * Thrown by {@link MenuOrderBuilder} configured with {@link MissingOrderPolicy#FAIL} when an item
 * is added before {@link OrderBuilder#reset()}.
 */
public class OrderNotStartedException extends IllegalStateException {
  @Serial private static final long serialVersionUID = 3318402914416035272L;

  /**
   * Constructs a new exception with {@code null} as its detail message.
   *
   * <p>The cause is not initialized, and may subsequently be initialized by a call to {@link
   * #initCause}.
   */
  public OrderNotStartedException() {
    super();
  }

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public OrderNotStartedException(String message) {
    super(message);
  }

  /**
   * Constructs a new exception with the specified detail message and cause.
   *
   * <p>Note that the detail message associated with {@code cause} is <i>not</i> automatically
   * incorporated in this exception's detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public OrderNotStartedException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructs a new exception with the specified cause and a detail message of {@code
   * (cause==null ? null : cause.toString())}.
   *
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public OrderNotStartedException(Throwable cause) {
    super(cause);
  }
}
