package dfs;

import java.math.BigDecimal;

/** Number formatting shared by the encoder and the source printer. */
final class Numbers {
  private static final double MAX_EXACT_INTEGER = 1e15;

  // Integral values print without a fractional part: 5, not 5.0
  static String format(double value) {
    if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGER) {
      return Long.toString((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  // Collapses -0.0 into 0.0, which the wire format cannot tell apart.
  static double normalize(double value) {
    return value == 0 ? 0.0 : value;
  }

  private Numbers() {}
}
