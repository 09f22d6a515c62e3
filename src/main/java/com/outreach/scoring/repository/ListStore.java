package com.outreach.scoring.repository;

import com.outreach.scoring.model.bulk.ListCatalog;

/**
 * Backing store of list metadata. {@link #save} replaces the whole catalog atomically:
 * readers see either the previous or the new catalog, never a mix.
 */
public interface ListStore {

    /**
     * Fresh copy of the stored catalog; changes to it are not visible until saved.
     * An absent store reads as an empty catalog.
     */
    ListCatalog load();

    void save(ListCatalog catalog);
}
