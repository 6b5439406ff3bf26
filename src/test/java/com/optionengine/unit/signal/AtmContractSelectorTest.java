package com.optionengine.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.optionengine.calendar.MarketClock;
import com.optionengine.domain.enums.OptionType;
import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.model.Contract;
import com.optionengine.signal.AtmContractSelector;
import com.optionengine.signal.InstrumentCatalog;
import com.optionengine.signal.SignalConfig;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AtmContractSelectorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 12, 16);
    private static final LocalDate EXPIRED = LocalDate.of(2024, 12, 12);
    private static final LocalDate NEAR = LocalDate.of(2024, 12, 19);
    private static final LocalDate FAR = LocalDate.of(2024, 12, 26);

    private InstrumentCatalog instrumentCatalog;
    private AtmContractSelector selector;

    @BeforeEach
    void setUp() {
        instrumentCatalog = mock(InstrumentCatalog.class);
        MarketClock marketClock = mock(MarketClock.class);
        when(marketClock.today()).thenReturn(TODAY);
        selector = new AtmContractSelector(instrumentCatalog, new SignalConfig(), marketClock);

        List<Contract> contracts = new ArrayList<>();
        for (LocalDate expiry : List.of(EXPIRED, NEAR, FAR)) {
            for (int strike : new int[] {23950, 24000, 24050}) {
                contracts.add(contract(OptionType.CE, strike, expiry));
                contracts.add(contract(OptionType.PE, strike, expiry));
            }
        }
        when(instrumentCatalog.optionContracts("NIFTY")).thenReturn(contracts);
    }

    private static Contract contract(OptionType type, int strike, LocalDate expiry) {
        return Contract.builder()
                .symbol("NIFTY" + expiry + strike + type)
                .exchange("NFO")
                .instrumentToken(strike * 10L + type.ordinal())
                .lotSize(25)
                .optionType(type)
                .strike(BigDecimal.valueOf(strike))
                .expiry(expiry)
                .build();
    }

    @Test
    @DisplayName("Picks the nearest unexpired call with the strike closest to spot")
    void atmCall() {
        Contract contract = selector.select(Signal.BUY_CE, new BigDecimal("24010")).orElseThrow();

        assertThat(contract.getOptionType()).isEqualTo(OptionType.CE);
        assertThat(contract.getStrike()).isEqualByComparingTo("24000");
        assertThat(contract.getExpiry()).isEqualTo(NEAR);
    }

    @Test
    @DisplayName("Picks a put for BUY_PE")
    void atmPut() {
        Contract contract = selector.select(Signal.BUY_PE, new BigDecimal("24040")).orElseThrow();

        assertThat(contract.getOptionType()).isEqualTo(OptionType.PE);
        assertThat(contract.getStrike()).isEqualByComparingTo("24050");
    }

    @Test
    @DisplayName("Resolves equidistant strikes to the lower one")
    void tieBreak() {
        Contract contract = selector.select(Signal.BUY_CE, new BigDecimal("24025")).orElseThrow();

        assertThat(contract.getStrike()).isEqualByComparingTo("24000");
    }

    @Test
    @DisplayName("Accepts contracts expiring today")
    void expiryToday() {
        when(instrumentCatalog.optionContracts("NIFTY"))
                .thenReturn(List.of(contract(OptionType.CE, 24000, TODAY), contract(OptionType.CE, 24000, NEAR)));

        assertThat(selector.select(Signal.BUY_CE, new BigDecimal("24000")))
                .get()
                .extracting(Contract::getExpiry)
                .isEqualTo(TODAY);
    }

    @Test
    @DisplayName("Finds nothing when only expired contracts are listed")
    void onlyExpired() {
        when(instrumentCatalog.optionContracts("NIFTY")).thenReturn(List.of(contract(OptionType.CE, 24000, EXPIRED)));

        assertThat(selector.select(Signal.BUY_CE, new BigDecimal("24000"))).isEmpty();
    }

    @Test
    @DisplayName("Finds nothing without a spot price")
    void noSpot() {
        assertThat(selector.select(Signal.BUY_CE, null)).isEmpty();
    }
}
