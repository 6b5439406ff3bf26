package com.optionengine.domain.model;

import com.optionengine.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A tradable instrument as known to the broker. Immutable; shared by value between
 * the execution, exit and ledger views.
 */
@Value
@Builder
public class Contract {

    String symbol;
    String exchange;
    long instrumentToken;
    int lotSize;

    /** Null for the underlying index. */
    OptionType optionType;

    BigDecimal strike;
    LocalDate expiry;
}
