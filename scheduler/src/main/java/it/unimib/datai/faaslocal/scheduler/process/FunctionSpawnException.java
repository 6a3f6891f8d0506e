package it.unimib.datai.faaslocal.scheduler.process;

public final class FunctionSpawnException extends RuntimeException {
    private final String functionName;

    public FunctionSpawnException(String functionName, Throwable cause) {
        super("Failed to spawn process for function " + functionName + ": " + cause.getMessage(), cause);
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }
}
