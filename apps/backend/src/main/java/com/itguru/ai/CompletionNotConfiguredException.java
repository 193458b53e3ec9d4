package com.itguru.ai;

public class CompletionNotConfiguredException extends IllegalStateException {

    public CompletionNotConfiguredException() {
        super("completion endpoint has no API key configured");
    }
}
