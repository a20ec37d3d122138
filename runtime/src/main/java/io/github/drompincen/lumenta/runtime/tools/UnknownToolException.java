package io.github.drompincen.lumenta.runtime.tools;

public class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
