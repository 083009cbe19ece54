package org.span.core.id;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import lombok.experimental.StandardException;

import java.util.Arrays;

/**
 * Bidirectional mapping between opaque server ids and dense internal indices.
 * <p>
 * Dense indices are assigned in ascending server-id order so that every array
 * keyed by server index iterates deterministically, independent of how the
 * ids were supplied.
 * <p>
 * This class is immutable and thread-safe for concurrent reads.
 */
public final class ServerIndex {

    // fastutil map for id -> index (forward lookup)
    private final Int2IntOpenHashMap forward;
    // index -> id (reverse lookup), ascending
    private final int[] reverse;

    /**
     * Builds the index from a set of distinct server ids.
     *
     * @param serverIds server ids in any order.
     * @throws IllegalArgumentException when ids are missing or duplicated.
     */
    public ServerIndex(int[] serverIds) {
        if (serverIds == null) {
            throw new IllegalArgumentException("serverIds cannot be null");
        }
        this.reverse = serverIds.clone();
        Arrays.sort(this.reverse);
        for (int i = 1; i < reverse.length; i++) {
            if (reverse[i] == reverse[i - 1]) {
                throw new IllegalArgumentException("Duplicate server id: " + reverse[i]);
            }
        }

        this.forward = new Int2IntOpenHashMap(reverse.length);
        this.forward.defaultReturnValue(-1);
        for (int i = 0; i < reverse.length; i++) {
            forward.put(reverse[i], i);
        }
        this.forward.trim();
    }

    /**
     * Converts a server id into its dense index.
     *
     * @param serverId client-facing server id.
     * @return dense index in {@code [0, size())}.
     * @throws UnknownServerException if the id is not indexed.
     */
    public int toInternal(int serverId) {
        int index = forward.get(serverId);
        if (index == -1) {
            throw new UnknownServerException("Server id not found: " + serverId);
        }
        return index;
    }

    /**
     * Converts a dense index back into its server id.
     *
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    public int toExternal(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("Server index out of bounds: " + index);
        }
        return reverse[index];
    }

    public boolean containsExternal(int serverId) {
        return forward.containsKey(serverId);
    }

    public boolean containsInternal(int index) {
        return index >= 0 && index < reverse.length;
    }

    public int size() {
        return reverse.length;
    }

    /**
     * Returns all server ids in dense-index order.
     */
    public int[] externalIds() {
        return reverse.clone();
    }

    /**
     * Thrown when a server id is not part of the index.
     */
    @StandardException
    public static class UnknownServerException extends RuntimeException {
    }
}
