package io.assay.core.expansion;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;

/// Binds the values of a data row to the parameters of a test body.
///
/// ### Contracts
/// - The row must supply exactly one value per parameter
/// - `null` binds to any reference parameter, never to a primitive one
/// - Boxed values bind to their primitive type and widen the way Java widens primitives
///   (`int` to `long`, `float` to `double`, `char` to `int`, ...)
/// - Any other value must be an instance of the parameter type
public final class ArgumentBinder {

    private static final Map<Class<?>, Class<?>> BOXES =
            Map.of(
                    boolean.class, Boolean.class,
                    byte.class, Byte.class,
                    short.class, Short.class,
                    char.class, Character.class,
                    int.class, Integer.class,
                    long.class, Long.class,
                    float.class, Float.class,
                    double.class, Double.class);

    /// Widening rank of the numeric types; a value widens to any type of higher rank.
    private static final Map<Class<?>, Integer> RANKS =
            Map.of(
                    Byte.class, 1,
                    Short.class, 2,
                    Character.class, 2,
                    Integer.class, 3,
                    Long.class, 4,
                    Float.class, 5,
                    Double.class, 6);

    private ArgumentBinder() {}

    /// Converts `values` into the argument array for `method`.
    ///
    /// @param method test body, not null
    /// @param values row values, not null, may contain nulls
    /// @return arguments ready for reflective invocation, never null
    /// @throws ArgumentMismatchException if arity or a value type does not match
    public static Object[] bind(Method method, List<Object> values)
            throws ArgumentMismatchException {
        Class<?>[] parameters = method.getParameterTypes();
        if (parameters.length != values.size()) {
            throw new ArgumentMismatchException(
                    "Parameter count mismatch: "
                            + method.getName()
                            + " declares "
                            + parameters.length
                            + " parameter(s) but the row supplies "
                            + values.size()
                            + ".");
        }
        Object[] arguments = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            arguments[i] = convert(method, i, parameters[i], values.get(i));
        }
        return arguments;
    }

    private static Object convert(Method method, int index, Class<?> parameter, Object value)
            throws ArgumentMismatchException {
        if (value == null) {
            if (parameter.isPrimitive()) {
                throw mismatch(method, index, parameter, "null");
            }
            return null;
        }
        Class<?> target = parameter.isPrimitive() ? BOXES.get(parameter) : parameter;
        if (target.isInstance(value)) {
            return value;
        }
        Integer from = RANKS.get(value.getClass());
        Integer to = RANKS.get(target);
        if (from != null && to != null && to > from && !isCharTarget(target)) {
            return widen(value, target);
        }
        throw mismatch(method, index, parameter, value.getClass().getName());
    }

    private static boolean isCharTarget(Class<?> target) {
        return target == Character.class;
    }

    private static Object widen(Object value, Class<?> target) {
        long integral =
                value instanceof Character c ? c.charValue() : ((Number) value).longValue();
        boolean floating = value instanceof Float || value instanceof Double;
        if (target == Short.class) {
            return (short) integral;
        }
        if (target == Integer.class) {
            return (int) integral;
        }
        if (target == Long.class) {
            return integral;
        }
        if (target == Float.class) {
            return floating ? ((Number) value).floatValue() : (float) integral;
        }
        return floating ? ((Number) value).doubleValue() : (double) integral;
    }

    private static ArgumentMismatchException mismatch(
            Method method, int index, Class<?> parameter, String actual) {
        return new ArgumentMismatchException(
                "Argument "
                        + index
                        + " of "
                        + method.getName()
                        + " expects "
                        + parameter.getName()
                        + " but the row supplies "
                        + actual
                        + ".");
    }
}
