package com.pinclick.copilot.repository;

import com.pinclick.copilot.model.CatalogQuery;
import com.pinclick.copilot.model.ProjectRecord;

import java.util.List;

public interface ProjectRecordRepositoryCustom {

    /**
     * Projects matching locality, price band, property type and status. Bedroom counts live
     * inside the free-form configuration column and are filtered by the caller.
     */
    List<ProjectRecord> findByCatalogQuery(CatalogQuery query, int limit);
}
