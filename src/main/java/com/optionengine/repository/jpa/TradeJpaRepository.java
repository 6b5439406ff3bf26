package com.optionengine.repository.jpa;

import com.optionengine.entity.TradeEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the append-only trades table. */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByTradingDateOrderByExecutedAtAsc(LocalDate tradingDate);
}
