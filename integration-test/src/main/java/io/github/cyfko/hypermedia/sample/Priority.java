package io.github.cyfko.hypermedia.sample;

public enum Priority {
    LOW, MEDIUM, HIGH
}
