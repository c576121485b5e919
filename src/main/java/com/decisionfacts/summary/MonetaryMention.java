package com.decisionfacts.summary;

import java.math.BigDecimal;

/**
 * An amount of money found in the text.
 *
 * @param surfaceText  the amount as written, e.g. "R$ 2,5 milhões"
 * @param numericValue the amount in reais, two decimal places
 * @param context      surrounding text with collapsed whitespace
 */
public record MonetaryMention(String surfaceText, BigDecimal numericValue, String context) {
}
