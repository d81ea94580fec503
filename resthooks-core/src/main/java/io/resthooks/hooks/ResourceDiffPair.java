package io.resthooks.hooks;

/**
 * A requested resource next to its persisted counterpart.
 *
 * @param resource the resource as sent in the request
 * @param databaseValue the persisted resource, or null when nothing is stored under its id
 */
public record ResourceDiffPair<T>(T resource, T databaseValue) {
}
