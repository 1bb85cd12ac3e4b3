package io.github.nabilcarel.gateway.model;

public enum EndpointType {
    STANDARD,
    COMPOSITE,
    PRIVATE
}
