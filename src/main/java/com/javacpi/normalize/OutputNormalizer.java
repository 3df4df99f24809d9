package com.javacpi.normalize;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.javacpi.exec.ExecutionResult;
import com.javacpi.schema.ValidatedArguments;

/**
 * Turns the stdout of a successful tool run into the action's payload.
 *
 * @see Normalizers
 */
public interface OutputNormalizer {

    OutputShape shape();

    /**
     * @throws com.javacpi.shared.error.MalformedOutputException when the output cannot be
     *         parsed in the declared shape at all
     */
    ObjectNode normalize(ExecutionResult raw, ValidatedArguments args);
}
