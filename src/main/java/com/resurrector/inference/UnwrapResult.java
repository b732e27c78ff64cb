package com.resurrector.inference;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * The records recovered from a response body.
 *
 * @param records The object records, possibly empty.
 * @param list    Whether the body held a record array rather than a single record.
 */
public record UnwrapResult(List<ObjectNode> records, boolean list) {

    public UnwrapResult {
        records = List.copyOf(records);
    }

    public static UnwrapResult empty() {
        return new UnwrapResult(List.of(), false);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
