package com.github.forax.dynproxy;

/**
 * Conversions of the value returned by a {@link ProxyHandler} to the return type
 * of the proxied method. These methods are called by the generated proxies.
 */
public final class ReturnValues {
  private ReturnValues() {
    // no instance
  }

  public static boolean asBoolean(Object value) {
    Object result = requireNonNull(value, boolean.class);
    if (!(result instanceof Boolean)) {
      throw mismatch(result, boolean.class);
    }
    return (Boolean) result;
  }

  public static byte asByte(Object value) {
    return asNumber(value, byte.class).byteValue();
  }

  public static char asChar(Object value) {
    Object result = requireNonNull(value, char.class);
    if (result instanceof Character) {
      return (Character) result;
    }
    if (result instanceof Number) {
      return (char) ((Number) result).intValue();
    }
    throw mismatch(result, char.class);
  }

  public static short asShort(Object value) {
    return asNumber(value, short.class).shortValue();
  }

  public static int asInt(Object value) {
    return asNumber(value, int.class).intValue();
  }

  public static long asLong(Object value) {
    return asNumber(value, long.class).longValue();
  }

  public static float asFloat(Object value) {
    return asNumber(value, float.class).floatValue();
  }

  public static double asDouble(Object value) {
    return asNumber(value, double.class).doubleValue();
  }

  /**
   * Converts a value to an enum constant, the value is either a constant of {@code enumType},
   * null or a {@link Number} representing the ordinal of a constant.
   *
   * @param value the value returned by the handler.
   * @param enumType the enum type.
   * @return the corresponding constant or null.
   */
  public static Object asEnum(Object value, Class<?> enumType) {
    if (value == null || enumType.isInstance(value)) {
      return value;
    }
    if (value instanceof Number) {
      Object[] constants = enumType.getEnumConstants();
      int ordinal = ((Number) value).intValue();
      if (ordinal < 0 || ordinal >= constants.length) {
        throw new IllegalArgumentException("no constant of " + enumType.getName() + " with ordinal " + ordinal);
      }
      return constants[ordinal];
    }
    throw mismatch(value, enumType);
  }

  private static Number asNumber(Object value, Class<?> type) {
    Object result = requireNonNull(value, type);
    if (!(result instanceof Number)) {
      throw mismatch(result, type);
    }
    return (Number) result;
  }

  private static Object requireNonNull(Object value, Class<?> type) {
    if (value == null) {
      throw new NullPointerException("the handler returns null for a method returning " + type.getName());
    }
    return value;
  }

  private static ClassCastException mismatch(Object value, Class<?> type) {
    return new ClassCastException("the handler returns an instance of " + value.getClass().getName()
        + " for a method returning " + type.getName());
  }
}
