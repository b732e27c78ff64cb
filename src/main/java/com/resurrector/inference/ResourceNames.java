package com.resurrector.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming helpers shared by the analyzers: resource names from URL paths, and naive English
 * singular/plural forms.
 */
public final class ResourceNames {

    private static final Pattern VERSION_SEGMENT = Pattern.compile("^v\\d+(\\.\\d+)*$");
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("^\\d+$");
    private static final List<String> OPERATION_PREFIXES =
            List.of("GetAll", "Get", "Fetch", "Create", "Add", "Update", "Delete", "Remove", "List", "Find", "Search");
    private static final List<String> OPERATION_SUFFIXES = List.of("Response", "Request", "Result");
    private static final Pattern UUID_SEGMENT =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private ResourceNames() {
    }

    /**
     * The last meaningful segment of a path, lower-cased: {@code /api/v1/users/{id} -> users}.
     * Path parameters, numeric or uuid ids, {@code api} and version segments are skipped.
     *
     * @return the resource name, or {@code null} when the path has no meaningful segment.
     */
    public static String fromPath(String path) {
        if (path == null) {
            return null;
        }
        String[] segments = stripQuery(path).split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = segments[i].trim();
            if (segment.isEmpty() || isParameter(segment) || isIdSegment(segment)) {
                continue;
            }
            String lower = segment.toLowerCase(Locale.ROOT);
            if (lower.equals("api") || lower.equals("rest") || VERSION_SEGMENT.matcher(lower).matches()) {
                continue;
            }
            return lower;
        }
        return null;
    }

    /**
     * Whether a path addresses a single record: its last segment is a path parameter or an id.
     */
    public static boolean isItemScoped(String path) {
        if (path == null) {
            return false;
        }
        String[] segments = stripQuery(path).split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = segments[i].trim();
            if (!segment.isEmpty()) {
                return isParameter(segment) || isIdSegment(segment);
            }
        }
        return false;
    }

    /**
     * The collection part of a path, with trailing parameter and id segments removed:
     * {@code /users/{id}/ -> /users}, {@code /users/{id}/posts -> /users/{id}/posts}.
     */
    public static String collectionPath(String path) {
        List<String> segments = new ArrayList<>(List.of(stripQuery(path).split("/")));
        while (!segments.isEmpty()) {
            String last = segments.get(segments.size() - 1).trim();
            if (last.isEmpty() || isParameter(last) || isIdSegment(last)) {
                segments.remove(segments.size() - 1);
            } else {
                break;
            }
        }
        String joined = String.join("/", segments);
        if (joined.isEmpty()) {
            return "/";
        }
        return joined.startsWith("/") ? joined : "/" + joined;
    }

    public static String singularize(String name) {
        if (name == null || name.length() <= 3) {
            return name;
        }
        if (name.endsWith("ies") && name.length() > 4) {
            return name.substring(0, name.length() - 3) + "y";
        }
        if (name.endsWith("sses") || name.endsWith("shes") || name.endsWith("ches") || name.endsWith("xes")) {
            return name.substring(0, name.length() - 2);
        }
        if (name.endsWith("ss")) {
            return name;
        }
        if (name.endsWith("s")) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }

    public static String pluralize(String name) {
        if (name == null || name.isEmpty() || name.endsWith("s")) {
            return name;
        }
        if (name.endsWith("y") && name.length() > 1 && "aeiou".indexOf(name.charAt(name.length() - 2)) < 0) {
            return name.substring(0, name.length() - 1) + "ies";
        }
        if (name.endsWith("ch") || name.endsWith("sh") || name.endsWith("x") || name.endsWith("z")) {
            return name + "es";
        }
        return name + "s";
    }

    /**
     * Derives a resource name from a SOAP operation: {@code GetCustomers -> customers},
     * {@code CreateOrderRequest -> orders}. Falls back to {@code resources}.
     */
    public static String fromOperationName(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            return "resources";
        }
        String name = operationName.trim();
        for (String prefix : OPERATION_PREFIXES) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                name = name.substring(prefix.length());
                break;
            }
        }
        for (String suffix : OPERATION_SUFFIXES) {
            if (name.endsWith(suffix) && name.length() > suffix.length()) {
                name = name.substring(0, name.length() - suffix.length());
            }
        }
        String snake = toSnakeCase(name);
        return snake.isEmpty() ? "resources" : pluralize(snake);
    }

    /**
     * {@code GetCustomerOrders -> get_customer_orders}.
     */
    public static String toSnakeCase(String name) {
        return String.join("_", NameFormatter.words(name)).toLowerCase(Locale.ROOT);
    }

    private static boolean isParameter(String segment) {
        return segment.startsWith("{") || segment.startsWith(":");
    }

    private static boolean isIdSegment(String segment) {
        return NUMERIC_SEGMENT.matcher(segment).matches() || UUID_SEGMENT.matcher(segment).matches();
    }

    private static String stripQuery(String path) {
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }
}
