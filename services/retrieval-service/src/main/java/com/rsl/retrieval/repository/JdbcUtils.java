package com.rsl.retrieval.repository;

import java.sql.Array;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class JdbcUtils {
    private JdbcUtils() {
    }

    public static String asString(Object value) {
        if (value == null) {
            return null;
        }
        return String.valueOf(value);
    }

    public static String asStringOrEmpty(Object value) {
        String text = asString(value);
        return text == null ? "" : text;
    }

    public static long asLongOrZero(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    public static Double asDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static Instant asInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    /**
     * Reads a Postgres {@code text[]} column; plain Java collections pass through.
     */
    public static List<String> asStringList(Object value) {
        List<String> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        Object raw = value;
        if (value instanceof Array array) {
            try {
                raw = array.getArray();
            } catch (SQLException ex) {
                throw new IllegalStateException("failed to read array column", ex);
            }
        }
        if (raw instanceof Object[] items) {
            for (Object item : items) {
                if (item != null) {
                    values.add(item.toString());
                }
            }
        } else if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null) {
                    values.add(item.toString());
                }
            }
        }
        return values;
    }

    public static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    /**
     * Renders a vector as a pgvector literal, e.g. {@code [0.1,0.2]}.
     */
    public static String toVectorLiteral(float[] values) {
        StringBuilder builder = new StringBuilder(values.length * 10 + 2);
        builder.append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(values[i]);
        }
        builder.append(']');
        return builder.toString();
    }

    public static String placeholders(int count) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append('?');
        }
        return builder.toString();
    }

    /**
     * Wraps a user-supplied term for ILIKE, escaping the pattern metacharacters.
     */
    public static String containsPattern(String term) {
        String escaped = term
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
