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

package io.github.suppierk.patterns.receipt;

import io.github.suppierk.patterns.builder.Category;
import io.github.suppierk.patterns.builder.LineItem;
import io.github.suppierk.patterns.builder.Order;
import java.math.BigDecimal;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record5;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Presents an {@link Order} as a table, one row per {@link LineItem}.
 *
 * <p>Rows are built as jOOQ {@link Result} without touching any database, which gives us jOOQ's
 * text and CSV formatting for free.
 */
public final class OrderReceipt {
  public static final Field<String> CATEGORY = DSL.field(DSL.name("category"), SQLDataType.VARCHAR);
  public static final Field<String> ITEM = DSL.field(DSL.name("item"), SQLDataType.VARCHAR);
  public static final Field<BigDecimal> UNIT_PRICE =
      DSL.field(DSL.name("unit_price"), SQLDataType.NUMERIC);
  public static final Field<Integer> QUANTITY =
      DSL.field(DSL.name("quantity"), SQLDataType.INTEGER);
  public static final Field<BigDecimal> LINE_TOTAL =
      DSL.field(DSL.name("line_total"), SQLDataType.NUMERIC);

  private final DSLContext dslContext;

  /**
   * @param dslContext to create records with, does not need a connection
   */
  public OrderReceipt(final DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.dslContext = dslContext;
  }

  /**
   * @return a new instance of {@link OrderReceipt} backed by a connection-less {@link DSLContext}
   */
  public static OrderReceipt create() {
    return new OrderReceipt(DSL.using(SQLDialect.DEFAULT));
  }

  /**
   * @param order to present
   * @return rows grouped by {@link Category} in declaration order, then in insertion order
   */
  public Result<Record5<String, String, BigDecimal, Integer, BigDecimal>> lines(final Order order) {
    if (order == null) {
      throw new IllegalArgumentException("Order is null");
    }

    final Result<Record5<String, String, BigDecimal, Integer, BigDecimal>> result =
        dslContext.newResult(CATEGORY, ITEM, UNIT_PRICE, QUANTITY, LINE_TOTAL);

    for (Category category : Category.values()) {
      for (LineItem lineItem : order.lineItems(category)) {
        final Record5<String, String, BigDecimal, Integer, BigDecimal> row =
            dslContext.newRecord(CATEGORY, ITEM, UNIT_PRICE, QUANTITY, LINE_TOTAL);

        row.values(
            category.label(),
            lineItem.menuItem().name(),
            lineItem.menuItem().price(),
            lineItem.quantity(),
            lineItem.lineTotal());

        result.add(row);
      }
    }

    return result;
  }

  /**
   * @param order to present
   * @return a text table of {@link #lines(Order)} followed by the {@code Total: } line
   */
  public String format(final Order order) {
    final Result<Record5<String, String, BigDecimal, Integer, BigDecimal>> lines = lines(order);

    return lines.format() + "\nTotal: " + order.totalPrice().toPlainString();
  }

  /**
   * @param order to present
   * @return {@link #lines(Order)} as CSV with a header row
   */
  public String formatCsv(final Order order) {
    return lines(order).formatCSV();
  }
}
