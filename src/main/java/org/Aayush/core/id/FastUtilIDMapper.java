package org.Aayush.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} backed by a fastutil open hash map for the forward
 * direction and a plain array for the reverse direction.
 *
 * <p>Safe for concurrent reads once constructed.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapping, assigning index {@code i} to {@code externalIds.get(i)}.
     *
     * @param externalIds ordered, non-blank, unique external ids.
     */
    public FastUtilIDMapper(List<String> externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("External ids cannot be null");
        }
        int size = externalIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String externalId = requireExternalId(externalIds.get(i), i);
            if (forward.containsKey(externalId)) {
                throw new DuplicateIDException(
                        "Duplicate external id at position " + i + ": " + externalId
                );
            }
            forward.put(externalId, i);
            reverse[i] = externalId;
        }
        forward.trim();
    }

    private static String requireExternalId(String externalId, int position) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External id at position " + position + " must be non-blank");
        }
        return externalId;
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        if (externalId == null) {
            throw new IllegalArgumentException("External id cannot be null");
        }
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
