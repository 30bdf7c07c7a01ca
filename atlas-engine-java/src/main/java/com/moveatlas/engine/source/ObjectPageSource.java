package com.moveatlas.engine.source;

import java.util.List;

/**
 * Cursor-paginated listing of on-chain objects by struct type.
 */
public interface ObjectPageSource {

    /** First-page size estimate for a struct type. */
    CountEstimate estimateCount(String typeFqn);

    /**
     * @param cursor null for the first page
     */
    ObjectPage queryPage(String typeFqn, int limit, String cursor);

    record CountEstimate(int estimatedCount, boolean hasMore) {}

    record ObjectPage(List<ChainObject> objects, String nextCursor, boolean hasNextPage) {

        public static ObjectPage empty() {
            return new ObjectPage(List.of(), null, false);
        }
    }
}
