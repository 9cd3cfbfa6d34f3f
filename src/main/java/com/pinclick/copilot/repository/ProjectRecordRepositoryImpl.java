package com.pinclick.copilot.repository;

import com.pinclick.copilot.model.CatalogQuery;
import com.pinclick.copilot.model.ProjectRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class ProjectRecordRepositoryImpl implements ProjectRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<ProjectRecord> findByCatalogQuery(CatalogQuery query, int limit) {
        StringBuilder jpql = new StringBuilder("SELECT p FROM ProjectRecord p WHERE 1 = 1");
        Map<String, Object> params = new LinkedHashMap<>();

        if (!query.localities().isEmpty()) {
            List<String> clauses = new ArrayList<>();
            int i = 0;
            for (String locality : query.localities()) {
                String param = "loc" + i++;
                clauses.add("LOWER(COALESCE(p.location, '')) LIKE :" + param
                        + " OR LOWER(COALESCE(p.zone, '')) LIKE :" + param);
                params.put(param, "%" + locality.toLowerCase(Locale.ROOT) + "%");
            }
            jpql.append(" AND (").append(String.join(" OR ", clauses)).append(")");
        }
        if (query.budgetMax() != null) {
            // price band overlaps the ceiling
            jpql.append(" AND p.budgetMin <= :budgetMax");
            params.put("budgetMax", query.budgetMax());
        }
        if (query.budgetMin() != null) {
            jpql.append(" AND COALESCE(p.budgetMax, p.budgetMin) >= :budgetMin");
            params.put("budgetMin", query.budgetMin());
        }
        if (!query.propertyTypes().isEmpty()) {
            jpql.append(" AND p.propertyType IN :propertyTypes");
            params.put("propertyTypes", query.propertyTypes());
        }
        if (!query.possessionStatuses().isEmpty()) {
            jpql.append(" AND p.status IN :statuses");
            params.put("statuses", query.possessionStatuses());
        }
        jpql.append(" ORDER BY p.budgetMin ASC, p.name ASC");

        TypedQuery<ProjectRecord> q = entityManager.createQuery(jpql.toString(), ProjectRecord.class);
        params.forEach(q::setParameter);
        q.setMaxResults(Math.max(1, limit));
        return q.getResultList();
    }
}
