package com.questrail.testtree.cli;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Accepts a plain number of milliseconds ({@code 1500}) or an ISO-8601
 * duration ({@code PT1.5S}).
 */
final class DurationConverter implements ITypeConverter<Duration>
{
    @Override
    public Duration convert(String value)
    {
        String text = value.trim();
        try {
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(text));
            }
            return Duration.parse(text);
        }
        catch (NumberFormatException | DateTimeParseException e) {
            throw new TypeConversionException("'" + value + "' is neither milliseconds nor an ISO-8601 duration");
        }
    }
}
