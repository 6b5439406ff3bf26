package com.optionengine.signal;

import com.optionengine.domain.model.Contract;
import java.util.List;

/** Tradable option contracts of an underlying, as listed by the exchange. */
public interface InstrumentCatalog {

    List<Contract> optionContracts(String underlyingName);
}
