package io.github.drompincen.lumenta.runtime.mcp;

import io.github.drompincen.lumenta.protocol.mcp.ServerInfo;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A {@code lumenta://segment[/part...]} URI split into its collection segment and trailing parts.
 */
record ResourceUri(String raw, String segment, List<String> parts) {

    static Optional<ResourceUri> parse(String uri) {
        if (uri == null || !uri.startsWith(ServerInfo.URI_SCHEME)) {
            return Optional.empty();
        }
        String path = uri.substring(ServerInfo.URI_SCHEME.length());
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.isEmpty()) {
            return Optional.empty();
        }
        List<String> all = Arrays.asList(path.split("/", -1));
        if (all.stream().anyMatch(String::isEmpty)) {
            return Optional.empty();
        }
        return Optional.of(new ResourceUri(uri, all.get(0), List.copyOf(all.subList(1, all.size()))));
    }

    int depth() {
        return parts.size();
    }

    String part(int index) {
        return parts.get(index);
    }
}
