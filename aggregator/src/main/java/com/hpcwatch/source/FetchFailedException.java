package com.hpcwatch.source;

public class FetchFailedException extends RuntimeException {

    private final FetchError error;

    public FetchFailedException(FetchError error) {
        super(error.toString(), error.cause());
        this.error = error;
    }

    public FetchError getError() {
        return error;
    }
}
