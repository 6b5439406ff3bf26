package com.optionengine.signal;

import com.optionengine.domain.enums.Signal;
import com.optionengine.domain.model.Contract;
import java.math.BigDecimal;
import java.util.Optional;

/** Resolves the option contract to trade for a signal at the given underlying spot price. */
public interface ContractSelector {

    Optional<Contract> select(Signal signal, BigDecimal spotPrice);
}
