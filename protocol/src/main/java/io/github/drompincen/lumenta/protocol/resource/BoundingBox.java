package io.github.drompincen.lumenta.protocol.resource;

public record BoundingBox(
        double x,
        double y,
        double width,
        double height
) {}
