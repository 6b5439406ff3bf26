package com.optionengine.repository.jpa;

import com.optionengine.domain.enums.PositionStatus;
import com.optionengine.entity.PositionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for aggregate positions. At most one OPEN row exists per symbol. */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    Optional<PositionEntity> findFirstBySymbolAndStatus(String symbol, PositionStatus status);

    List<PositionEntity> findByStatus(PositionStatus status);
}
