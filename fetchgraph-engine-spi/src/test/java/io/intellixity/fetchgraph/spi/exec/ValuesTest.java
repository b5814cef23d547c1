package io.intellixity.fetchgraph.spi.exec;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

final class ValuesTest {

  @Test
  void numericKeysIgnoreRepresentation() {
    assertEquals(Values.key(100), Values.key(100L));
    assertEquals(Values.key(100), Values.key(new BigDecimal("100.00")));
    assertEquals(Values.key(100), Values.key(100.0d));
    assertNotEquals(Values.key(100), Values.key("100"));
  }

  @Test
  void compareAcrossNumericTypes() {
    assertTrue(Values.compare(2, 10L) < 0);
    assertEquals(0, Values.compare(1.5d, new BigDecimal("1.50")));
    assertTrue(Values.equal(3, 3.0f));
  }

  @Test
  void datesCompareWithIsoStrings() {
    LocalDate d = LocalDate.of(2024, 3, 1);
    assertEquals(0, Values.compare(d, "2024-03-01"));
    assertTrue(Values.compare(d, "2024-02-28") > 0);
    assertTrue(Values.compare("2024-02-28", d) < 0);
    assertTrue(Values.compare(LocalDateTime.of(2024, 3, 1, 10, 0), "2024-03-01") > 0);
    assertTrue(Values.compare(d, "not a date") < 0);
  }

  @Test
  void nullsAreOnlyEqualToNull() {
    assertTrue(Values.equal(null, null));
    assertFalse(Values.equal(null, 1));
    assertFalse(Values.equal("a", null));
  }
}
