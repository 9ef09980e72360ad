package com.example.SmartDairy.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link StrategyLabel} as its wire label ({@code tabular_analysis}, ...), so the
 * analytics tables read the same as the API.
 * Rows holding the enum name are still read back.
 */
@Converter(autoApply = true)
public class StrategyLabelConverter implements AttributeConverter<StrategyLabel, String> {

    @Override
    public String convertToDatabaseColumn(StrategyLabel strategy) {
        return strategy == null ? null : strategy.label();
    }

    @Override
    public StrategyLabel convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return StrategyLabel.parse(dbData).orElse(StrategyLabel.GENERAL);
    }
}
