package io.github.drompincen.lumenta.runtime.integration;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A tool call rewritten by an integration: the tool to run and the arguments to run it with.
 */
public record RoutedCall(
        String integrationId,
        String toolName,
        ObjectNode arguments
) {}
