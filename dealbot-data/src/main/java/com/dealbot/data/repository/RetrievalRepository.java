package com.dealbot.data.repository;

import com.dealbot.data.entity.Retrieval;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RetrievalRepository extends JpaRepository<Retrieval, UUID> {

    List<Retrieval> findByDealIdOrderByStartedAtDesc(UUID dealId);
}
