package me.golemcore.apollo.domain.model;

/**
 * Token count for a piece of text.
 *
 * @param tokens
 *            estimated count, never negative
 * @param approximate
 *            true when no exact tokenizer was available for the model
 */
public record TokenEstimate(int tokens, boolean approximate) {

    public static final TokenEstimate ZERO = new TokenEstimate(0, false);

    public TokenEstimate plus(TokenEstimate other) {
        return new TokenEstimate(tokens + other.tokens, approximate || other.approximate);
    }
}
