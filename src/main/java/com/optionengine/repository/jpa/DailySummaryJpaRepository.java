package com.optionengine.repository.jpa;

import com.optionengine.entity.DailySummaryEntity;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DailySummaryJpaRepository extends JpaRepository<DailySummaryEntity, Long> {

    Optional<DailySummaryEntity> findByTradingDate(LocalDate tradingDate);
}
