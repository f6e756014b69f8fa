package com.dealbot.data.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Repository
@Slf4j
public class JobScheduleStateRepositoryImpl implements JobScheduleStateRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public List<String> deleteSchedulesForInactiveProviders(List<String> activeAddresses) {
        Query query;
        if (activeAddresses == null || activeAddresses.isEmpty()) {
            log.warn("[SCHEDULE_REPO] No active providers supplied - removing every provider schedule row");
            query = entityManager.createNativeQuery("""
                DELETE FROM job_schedule_state
                WHERE job_type IN ('DEAL', 'RETRIEVAL')
                  AND sp_address <> ''
                RETURNING sp_address
                """);
        } else {
            query = entityManager.createNativeQuery("""
                DELETE FROM job_schedule_state
                WHERE job_type IN ('DEAL', 'RETRIEVAL')
                  AND sp_address <> ''
                  AND sp_address NOT IN (:addresses)
                RETURNING sp_address
                """);
            query.setParameter("addresses", activeAddresses);
        }

        @SuppressWarnings("unchecked")
        List<Object> rows = query.getResultList();

        LinkedHashSet<String> removed = new LinkedHashSet<>();
        for (Object row : rows) {
            if (row != null) {
                removed.add(row.toString());
            }
        }
        return new ArrayList<>(removed);
    }
}
