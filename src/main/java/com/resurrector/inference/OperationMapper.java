package com.resurrector.inference;

import com.resurrector.model.CrudOperation;
import com.resurrector.model.ObservedCall;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps observed HTTP methods or declared SOAP operation names onto CRUD capability tags.
 * Results are always a subset of {@link CrudOperation}, in declaration order.
 */
@Slf4j
public final class OperationMapper {

    private static final List<String> LIST_HINTS = List.of("getall", "getlist", "list", "search", "find", "query");

    private static final Map<CrudOperation, List<String>> VERBS = new LinkedHashMap<>();

    static {
        VERBS.put(CrudOperation.CREATE, List.of("create", "add", "insert", "new", "register"));
        VERBS.put(CrudOperation.UPDATE, List.of("update", "modify", "edit", "save", "change"));
        VERBS.put(CrudOperation.DELETE, List.of("delete", "remove", "destroy", "cancel"));
        VERBS.put(CrudOperation.DETAIL, List.of("get", "fetch", "retrieve", "load", "read"));
    }

    private OperationMapper() {
    }

    /**
     * {@code GET} gives {@code list}, plus {@code detail} when a GET against an item-scoped path
     * was seen; {@code POST} gives {@code create}; {@code PUT}/{@code PATCH} give {@code update};
     * {@code DELETE} gives {@code delete}. Other methods are ignored.
     */
    public static List<CrudOperation> fromHttpCalls(Collection<ObservedCall> calls) {
        EnumSet<CrudOperation> operations = EnumSet.noneOf(CrudOperation.class);
        for (ObservedCall call : calls) {
            switch (call.method()) {
                case "GET" -> {
                    operations.add(CrudOperation.LIST);
                    if (call.itemScoped()) {
                        operations.add(CrudOperation.DETAIL);
                    }
                }
                case "POST" -> operations.add(CrudOperation.CREATE);
                case "PUT", "PATCH" -> operations.add(CrudOperation.UPDATE);
                case "DELETE" -> operations.add(CrudOperation.DELETE);
                default -> log.debug("Ignoring HTTP method {} for operation mapping", call.method());
            }
        }
        return List.copyOf(operations);
    }

    /**
     * Classifies each SOAP operation by its name, e.g. {@code GetAllCustomers -> list},
     * {@code GetCustomerById -> detail}, {@code AddCustomer -> create}.
     */
    public static List<CrudOperation> fromSoapOperations(Collection<String> operationNames) {
        EnumSet<CrudOperation> operations = EnumSet.noneOf(CrudOperation.class);
        for (String name : operationNames) {
            operations.add(classifySoapOperation(name));
        }
        return List.copyOf(operations);
    }

    /**
     * List-style names are recognised anywhere in the name; other verbs are matched as a prefix
     * first ({@code UpdateAddress} is an update, not a create), then anywhere.
     */
    public static CrudOperation classifySoapOperation(String operationName) {
        String name = operationName == null ? "" : operationName.toLowerCase(Locale.ROOT);
        if (LIST_HINTS.stream().anyMatch(name::contains)) {
            return CrudOperation.LIST;
        }
        for (Map.Entry<CrudOperation, List<String>> verb : VERBS.entrySet()) {
            if (verb.getValue().stream().anyMatch(name::startsWith)) {
                return verb.getKey();
            }
        }
        for (Map.Entry<CrudOperation, List<String>> verb : VERBS.entrySet()) {
            if (verb.getValue().stream().anyMatch(name::contains)) {
                return verb.getKey();
            }
        }
        return CrudOperation.DETAIL;
    }

    /**
     * Without any server interaction, a list sample only proves {@code list} and a single
     * object only proves {@code detail}.
     */
    public static List<CrudOperation> sampleDefault(boolean isList) {
        return List.of(isList ? CrudOperation.LIST : CrudOperation.DETAIL);
    }
}
