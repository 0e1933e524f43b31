package com.pmatic.ccu.client.api.exception;

public class MethodNotFoundException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String methodName;

    public MethodNotFoundException(String methodName) {
        super("Method \"" + methodName + "\" is not a valid method.");
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.METHOD_NOT_FOUND;
    }
}
