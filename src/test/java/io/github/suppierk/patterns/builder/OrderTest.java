package io.github.suppierk.patterns.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class OrderTest {
  @Test
  void when_category_is_null_illegal_argument_exception_is_thrown() {
    final var order = new Order();

    assertThrows(IllegalArgumentException.class, () -> order.lineItems(null));
  }

  @Test
  void when_line_items_are_returned_they_cannot_be_modified() {
    final var order = new Order();
    order.add(MenuItem.of("Tea", "2.00"), Category.BEVERAGES);

    final var beverages = order.lineItems(Category.BEVERAGES);

    assertThrows(UnsupportedOperationException.class, beverages::clear);
    assertThrows(
        UnsupportedOperationException.class,
        () -> beverages.add(new LineItem(MenuItem.of("Coffee", "2.50"))));
  }

  @Test
  void when_line_items_are_returned_they_reflect_later_changes() {
    final var order = new Order();
    final var beverages = order.lineItems(Category.BEVERAGES);

    order.add(MenuItem.of("Tea", "2.00"), Category.BEVERAGES);

    assertEquals(1, beverages.size());
  }

  @Test
  void when_total_price_is_computed_it_must_sum_all_categories() {
    final var order = new Order();
    order.add(MenuItem.of("Bruschetta", "6.75"), Category.STARTERS);
    order.add(MenuItem.of("Lasagna", "14.25"), Category.MAIN_COURSE);
    order.add(MenuItem.of("Lasagna", "14.25"), Category.MAIN_COURSE);
    order.add(MenuItem.of("Olives", "3.10"), Category.SIDE_DISHES);
    order.add(MenuItem.of("Water", "0"), Category.BEVERAGES);
    order.add(MenuItem.of("Water", "0"), Category.BEVERAGES);
    order.add(MenuItem.of("Water", "0"), Category.BEVERAGES);

    BigDecimal expected = BigDecimal.ZERO;
    for (Category category : Category.values()) {
      for (LineItem lineItem : order.lineItems(category)) {
        expected =
            expected.add(
                lineItem.menuItem().price().multiply(BigDecimal.valueOf(lineItem.quantity())));
      }
    }

    assertEquals(new BigDecimal("38.35"), order.totalPrice());
    assertEquals(0, expected.compareTo(order.totalPrice()));
    assertEquals(7, order.itemCount());
  }

  @Test
  void when_item_count_overflows_arithmetic_exception_is_thrown() {
    final var order = new Order();
    order
        .sequenceFor(Category.MAIN_COURSE)
        .add(new LineItem(MenuItem.of("Steak", "12.30"), Integer.MAX_VALUE));
    order.add(MenuItem.of("Beer", "3.50"), Category.BEVERAGES);

    assertThrows(ArithmeticException.class, order::itemCount);
  }

  @Test
  void when_quantity_overflows_arithmetic_exception_is_thrown() {
    final var lineItem = new LineItem(MenuItem.of("Steak", "12.30"), Integer.MAX_VALUE);

    assertThrows(ArithmeticException.class, lineItem::increment);
    assertEquals(Integer.MAX_VALUE, lineItem.quantity());
  }

  @Test
  void when_order_is_copied_copy_is_independent() {
    final var order = new Order();
    order.add(MenuItem.of("Tea", "2.00"), Category.BEVERAGES);

    final var copy = order.copy();
    order.add(MenuItem.of("Tea", "2.00"), Category.BEVERAGES);
    copy.add(MenuItem.of("Cake", "4.00"), Category.STARTERS);

    assertEquals(2, order.lineItems(Category.BEVERAGES).get(0).quantity());
    assertEquals(1, copy.lineItems(Category.BEVERAGES).get(0).quantity());
    assertTrue(order.lineItems(Category.STARTERS).isEmpty());
    assertEquals(new BigDecimal("6.00"), copy.totalPrice());
  }

  @Test
  void when_order_is_printed_all_categories_are_listed() {
    final var order = new Order();
    order.add(MenuItem.of("Steak", "12.30"), Category.MAIN_COURSE);
    order.add(MenuItem.of("Steak", "12.30"), Category.MAIN_COURSE);

    final var text = order.toString();

    assertTrue(text.contains("Starters=[]"));
    assertTrue(text.contains("Main course=[2x Steak]"));
    assertTrue(text.contains("Side dishes=[]"));
    assertTrue(text.contains("Beverages=[]"));
  }
}
