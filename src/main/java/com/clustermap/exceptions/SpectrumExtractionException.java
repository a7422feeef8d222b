package com.clustermap.exceptions;

public class SpectrumExtractionException extends Exception {

    public SpectrumExtractionException(String message) {
        super(message);
    }

    public SpectrumExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
