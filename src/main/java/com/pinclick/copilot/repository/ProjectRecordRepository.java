package com.pinclick.copilot.repository;

import com.pinclick.copilot.model.ProjectRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectRecordRepository extends JpaRepository<ProjectRecord, String>, ProjectRecordRepositoryCustom {
    /**
     * Case-insensitive lookup by exact project name.
     */
    List<ProjectRecord> findByNameIgnoreCase(String name);

    /**
     * All distinct project names, used for mention detection.
     */
    @Query("SELECT DISTINCT p.name FROM ProjectRecord p WHERE p.name IS NOT NULL")
    List<String> findAllNames();
}
