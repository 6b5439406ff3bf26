package com.optionengine.broker;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.OptionType;
import com.optionengine.domain.model.Contract;
import com.optionengine.exception.BrokerException;
import com.optionengine.signal.InstrumentCatalog;
import com.optionengine.signal.SignalConfig;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Instrument;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link InstrumentCatalog} over Kite's daily instrument dump for the option exchange.
 *
 * <p>The dump is downloaded once per trading day, on first use, and kept in memory grouped
 * by underlying name. Only CE and PE rows are kept.
 */
@Service
public class KiteInstrumentCatalog implements InstrumentCatalog {

    private static final Logger log = LoggerFactory.getLogger(KiteInstrumentCatalog.class);

    private final KiteConnect kiteConnect;
    private final SignalConfig signalConfig;
    private final MarketClock marketClock;

    private volatile LocalDate loadedFor;
    private volatile Map<String, List<Contract>> optionsByUnderlying = Map.of();

    public KiteInstrumentCatalog(KiteConnect kiteConnect, SignalConfig signalConfig, MarketClock marketClock) {
        this.kiteConnect = kiteConnect;
        this.signalConfig = signalConfig;
        this.marketClock = marketClock;
    }

    @Override
    public List<Contract> optionContracts(String underlyingName) {
        LocalDate today = marketClock.today();
        if (!today.equals(loadedFor)) {
            load(today);
        }
        return optionsByUnderlying.getOrDefault(underlyingName, List.of());
    }

    private synchronized void load(LocalDate today) {
        if (today.equals(loadedFor)) {
            return;
        }
        String exchange = signalConfig.getOptionExchange();
        try {
            List<Instrument> instruments = kiteConnect.getInstruments(exchange);
            log.info("Downloaded {} {} instruments from Kite API", instruments.size(), exchange);
            optionsByUnderlying = instruments.stream()
                    .filter(i -> "CE".equals(i.instrument_type) || "PE".equals(i.instrument_type))
                    .filter(i -> i.name != null)
                    .collect(Collectors.groupingBy(
                            i -> i.name, Collectors.mapping(this::toContract, Collectors.toUnmodifiableList())));
            loadedFor = today;
        } catch (KiteException e) {
            throw new BrokerException("Failed to download instruments from Kite API: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new BrokerException("Failed to download instruments from Kite API: " + e.getMessage(), e);
        }
    }

    Contract toContract(Instrument instrument) {
        return Contract.builder()
                .symbol(instrument.tradingsymbol)
                .exchange(instrument.exchange)
                .instrumentToken(instrument.instrument_token)
                .lotSize(instrument.lot_size)
                .optionType(OptionType.valueOf(instrument.instrument_type))
                .strike(parseStrike(instrument.strike))
                .expiry(toLocalDate(instrument.expiry))
                .build();
    }

    private BigDecimal parseStrike(String strike) {
        if (strike == null || strike.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(strike);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private LocalDate toLocalDate(Date date) {
        if (date == null) {
            return null;
        }
        return date.toInstant().atZone(marketClock.now().getZone()).toLocalDate();
    }
}
