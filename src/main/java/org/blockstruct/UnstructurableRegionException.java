package org.blockstruct;

import java.util.Collections;
import java.util.List;

/**
 * The control flow graph could not be reduced to a single structured block. The regions that were
 * left are available so the caller can fall back to plain graph output.
 */
public class UnstructurableRegionException extends Exception {
    private final List<AbstractBlock> regions;

    public UnstructurableRegionException(String message, List<AbstractBlock> regions) {
        super(message);
        this.regions = Collections.unmodifiableList(regions);
    }

    /** Roots of the partially structured regions, entry region first */
    public List<AbstractBlock> getRegions() {
        return regions;
    }
}
