package com.optionengine.margin;

import com.optionengine.domain.enums.SizingMode;
import com.optionengine.exception.InvalidConfigurationException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link PositionSizer} implementation by {@link SizingMode}.
 *
 * <p>Spring discovers all PositionSizer beans and this factory indexes them by type at
 * construction time. A missing sizer is a configuration error.
 */
@Component
public class PositionSizerFactory {

    private final Map<SizingMode, PositionSizer> sizersByType;

    public PositionSizerFactory(List<PositionSizer> positionSizers) {
        this.sizersByType =
                positionSizers.stream().collect(Collectors.toMap(PositionSizer::getType, Function.identity()));
    }

    /**
     * @throws InvalidConfigurationException if no sizer is registered for the mode
     */
    public PositionSizer getSizer(SizingMode sizingMode) {
        PositionSizer positionSizer = sizersByType.get(sizingMode);
        if (positionSizer == null) {
            throw new InvalidConfigurationException("No position sizer found for mode: " + sizingMode);
        }
        return positionSizer;
    }
}
