package com.dealbot.data.repository;

import com.dealbot.common.constants.DealStatus;
import com.dealbot.data.entity.Deal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DealRepository extends JpaRepository<Deal, UUID> {

    Optional<Deal> findFirstBySpAddressAndStatusOrderByCreatedAtDesc(String spAddress, DealStatus status);

    List<Deal> findTop20BySpAddressOrderByCreatedAtDesc(String spAddress);

    long countBySpAddressAndStatus(String spAddress, DealStatus status);
}
