package com.tradejournal.infrastructure.persistence.repository;

import com.tradejournal.infrastructure.persistence.entity.LiveTradeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LiveTradeRepository extends JpaRepository<LiveTradeEntity, String> {

    List<LiveTradeEntity> findAllByAccountIdOrderByEntryDateDesc(String accountId);
}
