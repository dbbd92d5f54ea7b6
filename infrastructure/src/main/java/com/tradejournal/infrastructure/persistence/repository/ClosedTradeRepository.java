package com.tradejournal.infrastructure.persistence.repository;

import com.tradejournal.infrastructure.persistence.entity.ClosedTradeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClosedTradeRepository extends JpaRepository<ClosedTradeEntity, String> {

    List<ClosedTradeEntity> findAllByAccountIdOrderByExitDateDesc(String accountId);
}
