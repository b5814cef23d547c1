package io.intellixity.fetchgraph.jdbc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Conversions between JDBC driver values and the cell values both engines work with. */
final class JdbcValues {
  private JdbcValues() {}

  /** java.sql temporal types become java.time; everything else passes through. */
  static Object read(ResultSet rs, int index) throws SQLException {
    Object v = rs.getObject(index);
    if (v == null) return null;
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof java.sql.Timestamp t) return t.toLocalDateTime();
    if (v instanceof java.sql.Time t) return t.toLocalTime();
    if (v instanceof OffsetDateTime o) return o.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (v instanceof java.sql.Clob c) return c.getSubString(1, (int) c.length());
    return v;
  }

  static Object toJdbc(Object v) {
    if (v instanceof BigInteger i) return new BigDecimal(i);
    if (v instanceof Instant i) return java.sql.Timestamp.from(i);
    return v;
  }
}
