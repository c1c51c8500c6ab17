package com.dbexplorer.service;

import com.dbexplorer.model.TableDescriptor;

import java.util.Optional;

/**
 * Read access to table shapes, as needed by domain resolution.
 */
public interface CatalogView {

    /**
     * Look a table up by name, ignoring case.
     *
     * @param tableName table name
     * @return descriptor, empty when the table does not exist
     * @throws com.dbexplorer.error.CatalogUnavailableException when the database cannot be asked
     */
    Optional<TableDescriptor> find(String tableName);
}
