package io.github.nabilcarel.gateway.model.context;

/**
 * How generated template values such as {@code $guid} are shared inside one composite request.
 */
public enum SharedValueScope {
    /** One value per expression text for the whole request. */
    REQUEST,
    /** One value per step and expression text. */
    STEP
}
