package com.optionengine.unit.margin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optionengine.domain.enums.SizingMode;
import com.optionengine.exception.InvalidConfigurationException;
import com.optionengine.margin.PositionSizerFactory;
import com.optionengine.margin.PositionSizingContext;
import com.optionengine.margin.impl.FixedLotSizer;
import com.optionengine.margin.impl.PercentOfCapitalSizer;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the sizer implementations and the PositionSizerFactory.
 */
class PositionSizerTest {

    private PositionSizingContext context(String price, int lotSize, String value, String capital) {
        return PositionSizingContext.builder()
                .entryPrice(new BigDecimal(price))
                .lotSize(lotSize)
                .value(new BigDecimal(value))
                .availableCapital(new BigDecimal(capital))
                .build();
    }

    @Nested
    @DisplayName("FixedLotSizer")
    class FixedLotSizerTests {

        private final FixedLotSizer fixedLotSizer = new FixedLotSizer();

        @Test
        @DisplayName("Trades the configured number of lots")
        void tradesConfiguredLots() {
            assertThat(fixedLotSizer.calculateQuantity(context("100", 75, "2", "0")))
                    .isEqualTo(150);
        }

        @Test
        @DisplayName("Ignores available capital")
        void ignoresCapital() {
            assertThat(fixedLotSizer.calculateQuantity(context("1000", 50, "3", "10")))
                    .isEqualTo(150);
        }

        @Test
        @DisplayName("Negative lot counts size to zero")
        void negativeLotsAreZero() {
            assertThat(fixedLotSizer.calculateQuantity(context("100", 75, "-1", "0")))
                    .isZero();
        }
    }

    @Nested
    @DisplayName("PercentOfCapitalSizer")
    class PercentOfCapitalSizerTests {

        private final PercentOfCapitalSizer percentOfCapitalSizer = new PercentOfCapitalSizer();

        @Test
        @DisplayName("Allocates a percentage of capital in whole lots")
        void allocatesWholeLots() {
            // 10% of 100000 = 10000; one lot costs 50 * 25 = 1250 -> 8 lots
            assertThat(percentOfCapitalSizer.calculateQuantity(context("50", 25, "10", "100000")))
                    .isEqualTo(200);
        }

        @Test
        @DisplayName("Rounds down to the last affordable lot")
        void roundsDown() {
            // 10% of 100000 = 10000; one lot costs 120 * 25 = 3000 -> 3 lots
            assertThat(percentOfCapitalSizer.calculateQuantity(context("120", 25, "10", "100000")))
                    .isEqualTo(75);
        }

        @Test
        @DisplayName("Returns zero when the allocation does not cover a lot")
        void belowOneLot() {
            assertThat(percentOfCapitalSizer.calculateQuantity(context("500", 75, "1", "100000")))
                    .isZero();
        }

        @Test
        @DisplayName("More capital never sizes smaller")
        void monotonicInCapital() {
            int previous = 0;
            for (int capital = 0; capital <= 200_000; capital += 2_500) {
                int quantity = percentOfCapitalSizer.calculateQuantity(
                        context("50", 25, "10", String.valueOf(capital)));

                assertThat(quantity).as("capital %d", capital).isGreaterThanOrEqualTo(previous);
                previous = quantity;
            }
            assertThat(previous).isEqualTo(400);
        }

        @Test
        @DisplayName("Quantity is always a whole number of lots")
        void wholeLotsOnly() {
            String[] prices = {"7.35", "50", "121.4", "333"};
            int[] lotSizes = {15, 25, 50, 75};
            for (String price : prices) {
                for (int lotSize : lotSizes) {
                    for (int capital = 10_000; capital <= 1_000_000; capital += 99_000) {
                        int quantity = percentOfCapitalSizer.calculateQuantity(
                                context(price, lotSize, "15", String.valueOf(capital)));

                        assertThat(quantity % lotSize)
                                .as("price %s lot %d capital %d", price, lotSize, capital)
                                .isZero();
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("PositionSizerFactory")
    class FactoryTests {

        @Test
        @DisplayName("Resolves each registered mode")
        void resolvesModes() {
            PositionSizerFactory factory =
                    new PositionSizerFactory(List.of(new FixedLotSizer(), new PercentOfCapitalSizer()));

            assertThat(factory.getSizer(SizingMode.FIXED_LOT)).isInstanceOf(FixedLotSizer.class);
            assertThat(factory.getSizer(SizingMode.PERCENT)).isInstanceOf(PercentOfCapitalSizer.class);
        }

        @Test
        @DisplayName("Missing sizer is a configuration error")
        void missingSizer() {
            PositionSizerFactory factory = new PositionSizerFactory(List.of(new FixedLotSizer()));

            assertThatThrownBy(() -> factory.getSizer(SizingMode.PERCENT))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Unknown mode names are rejected")
        void unknownModeName() {
            assertThatThrownBy(() -> SizingMode.fromConfig("martingale"))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThat(SizingMode.fromConfig("PERCENT")).isEqualTo(SizingMode.PERCENT);
            assertThat(SizingMode.fromConfig("fixed_lot")).isEqualTo(SizingMode.FIXED_LOT);
        }
    }
}
