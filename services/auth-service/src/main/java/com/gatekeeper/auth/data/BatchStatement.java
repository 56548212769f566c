package com.gatekeeper.auth.data;

import java.util.List;
import java.util.Map;

/**
 * A statement paired with a batch of payloads.
 * <p>
 * For a multi-row insert the text holds one placeholder group per payload
 * and group <i>i</i> is bound to {@code params.get(i)}.
 *
 * @param text   SQL text
 * @param params one payload per row
 */
public record BatchStatement(String text, List<Map<String, Object>> params) {

    public BatchStatement {
        params = List.copyOf(params);
    }
}
