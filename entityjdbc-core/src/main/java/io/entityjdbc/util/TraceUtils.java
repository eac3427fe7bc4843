package io.entityjdbc.util;

import java.util.Map;
import java.util.Objects;

public abstract class TraceUtils {
    private TraceUtils() {
    }

    private static final int PARAMETER_MAX_LENGTH = 50;

    private static final int COMMAND_TEXT_MAX_LENGTH = 1024;

    public static String parametersToString(Map<Integer, Object> parameters, boolean masked) {
        if (parameters == null || parameters.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        parameters.forEach((index, arg) -> {
            if (sb.length() > 0) {
                sb.append(",");
            }
            sb.append("$").append(index).append("=");
            String displayParam = truncate(parameterAsString(arg, masked), PARAMETER_MAX_LENGTH);
            if (arg instanceof String) {
                sb.append("\"");
                sb.append(displayParam);
                sb.append("\"");
            } else {
                sb.append(displayParam);
            }
        });
        return sb.toString();
    }

    public static String parameterAsString(Object arg, boolean masked) {
        if (arg == null) {
            return "null";
        }
        String v = Objects.toString(arg);
        if (masked) {
            return v.replaceAll(".", "*");
        }
        return v;
    }

    public static String commandText(String sql) {
        if (sql == null) {
            return "";
        }
        return truncate(sql.trim().replaceAll("\\s+", " "), COMMAND_TEXT_MAX_LENGTH);
    }

    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
