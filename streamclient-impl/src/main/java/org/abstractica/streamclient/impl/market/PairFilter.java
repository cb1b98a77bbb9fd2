package org.abstractica.streamclient.impl.market;

import java.util.Objects;

/**
 * Restricts the pairs returned by {@code getPairs}.
 *
 * @param field the filtered field, {@code currency} or {@code baseCurrency}
 * @param value the currency to match
 */
public record PairFilter(String field, String value)
{
    public PairFilter
    {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        if (!field.equals("currency") && !field.equals("baseCurrency"))
        {
            throw new IllegalArgumentException("Filter field must be currency or baseCurrency: " + field);
        }
        if (value.isBlank())
        {
            throw new IllegalArgumentException("Filter value must not be empty");
        }
    }

    /**
     * Matches pairs quoted in a currency, e.g. {@code BTC} in {@code BTC-ETH}.
     *
     * @param currency the currency
     * @return the filter
     */
    public static PairFilter currency(String currency)
    {
        return new PairFilter("currency", currency);
    }

    /**
     * Matches pairs of a base currency, e.g. {@code ETH} in {@code BTC-ETH}.
     *
     * @param baseCurrency the base currency
     * @return the filter
     */
    public static PairFilter baseCurrency(String baseCurrency)
    {
        return new PairFilter("baseCurrency", baseCurrency);
    }
}
