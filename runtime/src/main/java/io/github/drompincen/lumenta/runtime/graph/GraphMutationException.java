package io.github.drompincen.lumenta.runtime.graph;

public class GraphMutationException extends RuntimeException {

    public GraphMutationException(String message) {
        super(message);
    }
}
