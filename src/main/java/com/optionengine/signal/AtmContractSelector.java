package com.optionengine.signal;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.model.Contract;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the at-the-money option: right type, nearest expiry on or after today, strike
 * nearest to spot. Equidistant strikes resolve to the lower one.
 */
@Component
public class AtmContractSelector implements ContractSelector {

    private static final Logger log = LoggerFactory.getLogger(AtmContractSelector.class);

    private final InstrumentCatalog instrumentCatalog;
    private final SignalConfig signalConfig;
    private final MarketClock marketClock;

    public AtmContractSelector(InstrumentCatalog instrumentCatalog, SignalConfig signalConfig, MarketClock marketClock) {
        this.instrumentCatalog = instrumentCatalog;
        this.signalConfig = signalConfig;
        this.marketClock = marketClock;
    }

    @Override
    public Optional<Contract> select(Signal signal, BigDecimal spotPrice) {
        if (signal == null || spotPrice == null) {
            return Optional.empty();
        }
        LocalDate today = marketClock.today();
        List<Contract> candidates = instrumentCatalog.optionContracts(signalConfig.getUnderlyingName()).stream()
                .filter(contract -> contract.getOptionType() == signal.getOptionType())
                .filter(contract -> contract.getExpiry() != null && !contract.getExpiry().isBefore(today))
                .filter(contract -> contract.getStrike() != null)
                .toList();
        if (candidates.isEmpty()) {
            log.warn("No {} contracts listed for {} on or after {}", signal.getOptionType(), signalConfig.getUnderlyingName(), today);
            return Optional.empty();
        }

        LocalDate nearestExpiry = candidates.stream()
                .map(Contract::getExpiry)
                .min(Comparator.naturalOrder())
                .orElseThrow();
        Optional<Contract> selected = candidates.stream()
                .filter(contract -> contract.getExpiry().equals(nearestExpiry))
                .min(Comparator.comparing((Contract contract) -> contract.getStrike().subtract(spotPrice).abs())
                        .thenComparing(Contract::getStrike));
        selected.ifPresent(contract -> log.info(
                "ATM {} for spot {}: {} strike {} expiry {}",
                signal.getOptionType(),
                spotPrice,
                contract.getSymbol(),
                contract.getStrike(),
                contract.getExpiry()));
        return selected;
    }
}
