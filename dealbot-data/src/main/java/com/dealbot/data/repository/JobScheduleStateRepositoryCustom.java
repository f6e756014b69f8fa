package com.dealbot.data.repository;

import java.util.List;

public interface JobScheduleStateRepositoryCustom {

    /**
     * Deletes deal and retrieval schedule rows whose provider is not in {@code activeAddresses}.
     * Global rows (empty address) are never touched.
     *
     * @return the addresses whose rows were removed
     */
    List<String> deleteSchedulesForInactiveProviders(List<String> activeAddresses);
}
