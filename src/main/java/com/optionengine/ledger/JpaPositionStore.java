package com.optionengine.ledger;

import com.optionengine.domain.enums.ExitReason;
import com.optionengine.domain.enums.PositionStatus;
import com.optionengine.domain.model.AggregatePosition;
import com.optionengine.domain.model.Contract;
import com.optionengine.domain.model.DailySummary;
import com.optionengine.domain.model.Order;
import com.optionengine.domain.model.TradeRecord;
import com.optionengine.entity.DailySummaryEntity;
import com.optionengine.entity.PositionEntity;
import com.optionengine.exception.PersistenceFailureException;
import com.optionengine.mapper.DailySummaryMapper;
import com.optionengine.mapper.OrderMapper;
import com.optionengine.mapper.PositionMapper;
import com.optionengine.mapper.TradeMapper;
import com.optionengine.repository.jpa.DailySummaryJpaRepository;
import com.optionengine.repository.jpa.OrderJpaRepository;
import com.optionengine.repository.jpa.PositionJpaRepository;
import com.optionengine.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA-backed {@link PositionStore}.
 *
 * <p>Re-applies the same fill arithmetic as the in-memory ledger against the persisted
 * row, so a restart can inspect the session's positions. Storage errors surface as
 * {@link PersistenceFailureException}.
 */
@Service
public class JpaPositionStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPositionStore.class);

    private final PositionJpaRepository positionJpaRepository;
    private final OrderJpaRepository orderJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final DailySummaryJpaRepository dailySummaryJpaRepository;
    private final Clock clock;

    private final PositionMapper positionMapper = Mappers.getMapper(PositionMapper.class);
    private final OrderMapper orderMapper = Mappers.getMapper(OrderMapper.class);
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);
    private final DailySummaryMapper dailySummaryMapper = Mappers.getMapper(DailySummaryMapper.class);

    public JpaPositionStore(
            PositionJpaRepository positionJpaRepository,
            OrderJpaRepository orderJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            DailySummaryJpaRepository dailySummaryJpaRepository,
            Clock clock) {
        this.positionJpaRepository = positionJpaRepository;
        this.orderJpaRepository = orderJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.dailySummaryJpaRepository = dailySummaryJpaRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void applyEntryFill(Contract contract, String orderId, int quantity, BigDecimal fillPrice) {
        execute("applyEntryFill " + orderId, () -> {
            Optional<PositionEntity> existing =
                    positionJpaRepository.findFirstBySymbolAndStatus(contract.getSymbol(), PositionStatus.OPEN);
            AggregatePosition position;
            if (existing.isPresent()) {
                position = positionMapper.toDomain(existing.get());
                position.applyEntry(orderId, quantity, fillPrice);
            } else {
                position = AggregatePosition.open(contract, orderId, quantity, fillPrice, LocalDateTime.now(clock));
            }
            positionJpaRepository.save(positionMapper.toEntity(position));
            return null;
        });
    }

    @Override
    @Transactional
    public void applyExitFill(
            Contract contract, String exitOrderId, int quantity, BigDecimal exitPrice, ExitReason reason) {
        execute("applyExitFill " + exitOrderId, () -> {
            Optional<PositionEntity> existing =
                    positionJpaRepository.findFirstBySymbolAndStatus(contract.getSymbol(), PositionStatus.OPEN);
            if (existing.isEmpty()) {
                log.debug("No persisted OPEN position for {}, exit not stored", contract.getSymbol());
                return null;
            }
            AggregatePosition position = positionMapper.toDomain(existing.get());
            position.applyExit(exitOrderId, quantity, exitPrice, reason, LocalDateTime.now(clock));
            positionJpaRepository.save(positionMapper.toEntity(position));
            return null;
        });
    }

    @Override
    @Transactional
    public void markToMarket(Contract contract, BigDecimal lastPrice) {
        execute("markToMarket " + contract.getSymbol(), () -> {
            positionJpaRepository
                    .findFirstBySymbolAndStatus(contract.getSymbol(), PositionStatus.OPEN)
                    .ifPresent(entity -> {
                        AggregatePosition position = positionMapper.toDomain(entity);
                        if (position.markToMarket(lastPrice)) {
                            positionJpaRepository.save(positionMapper.toEntity(position));
                        }
                    });
            return null;
        });
    }

    @Override
    @Transactional
    public void recordOrder(Order order) {
        execute("recordOrder " + order.getId(), () -> orderJpaRepository.save(orderMapper.toEntity(order)));
    }

    @Override
    @Transactional
    public void recordTrade(TradeRecord tradeRecord) {
        execute("recordTrade " + tradeRecord.getId(), () -> tradeJpaRepository.save(tradeMapper.toEntity(tradeRecord)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TradeRecord> findTrades(LocalDate tradingDate) {
        return execute(
                "findTrades " + tradingDate,
                () -> tradeMapper.toDomainList(tradeJpaRepository.findByTradingDateOrderByExecutedAtAsc(tradingDate)));
    }

    @Override
    @Transactional
    public void saveDailySummary(DailySummary dailySummary) {
        execute("saveDailySummary " + dailySummary.getTradingDate(), () -> {
            DailySummaryEntity entity = dailySummaryMapper.toEntity(dailySummary);
            dailySummaryJpaRepository
                    .findByTradingDate(dailySummary.getTradingDate())
                    .ifPresent(existing -> entity.setId(existing.getId()));
            return dailySummaryJpaRepository.save(entity);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DailySummary> findDailySummary(LocalDate tradingDate) {
        return execute(
                "findDailySummary " + tradingDate,
                () -> dailySummaryJpaRepository.findByTradingDate(tradingDate).map(dailySummaryMapper::toDomain));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Position store " + operation + " failed", e);
        }
    }
}
