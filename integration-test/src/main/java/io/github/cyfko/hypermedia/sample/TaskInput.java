package io.github.cyfko.hypermedia.sample;

/**
 * Body of the create and update operations.
 */
public record TaskInput(String title, String notes, Priority priority, Boolean done) {
}
