package io.secondbrain.search;

/**
 * How a keyword list narrows search results.
 *
 * <ul>
 *   <li>{@code BOOST}: keywords only feed the keyword match score.</li>
 *   <li>{@code REQUIRE_ANY}: memories sharing no keyword with the list are excluded as well.</li>
 * </ul>
 */
public enum KeywordFilterMode {
    BOOST,
    REQUIRE_ANY
}
