package org.Aayush.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between client-facing order/drone ids and dense internal indices.
 *
 * <p>The engine works exclusively on internal indices {@code 0..size-1}; external ids only
 * appear again when a selected plan is rendered.</p>
 */
public interface IDMapper {

    /**
     * Converts an external id to its internal index.
     *
     * @param externalId client-facing id.
     * @return dense internal index.
     * @throws UnknownIDException if the id is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its external id.
     *
     * @param internalId dense internal index.
     * @return client-facing id.
     * @throws IndexOutOfBoundsException if the index is outside mapper bounds.
     */
    String toExternal(int internalId);

    /**
     * Checks whether an external id is mapped.
     */
    boolean containsExternal(String externalId);

    /**
     * Returns number of mapped ids.
     */
    int size();

    /**
     * Raised when an external id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Raised when the same external id is offered twice while building a mapping.
     */
    @StandardException
    class DuplicateIDException extends RuntimeException {
    }

    /**
     * Builds an immutable mapper that assigns internal indices in list order.
     *
     * @param externalIds external ids in their canonical (input document) order.
     * @return immutable mapper where {@code toExternal(i) == externalIds.get(i)}.
     * @throws DuplicateIDException if an id repeats.
     */
    static IDMapper ofOrdered(List<String> externalIds) {
        return new FastUtilIDMapper(externalIds);
    }
}
