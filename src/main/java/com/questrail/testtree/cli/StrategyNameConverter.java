package com.questrail.testtree.cli;

import com.questrail.testtree.config.StrategyName;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

final class StrategyNameConverter implements ITypeConverter<StrategyName>
{
    @Override
    public StrategyName convert(String value)
    {
        try {
            return StrategyName.parse(value);
        }
        catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
