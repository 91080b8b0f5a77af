package com.rtcc.orchestrator.core.exception;

import java.util.Collection;

/**
 * Raw event rejected by its channel schema. The event is dropped, never forwarded.
 */
public class SchemaValidationException extends OrchestratorException {

    public static final String ERROR_CODE = "SCHEMA_ERROR";

    private final String channel;

    public SchemaValidationException(String channel, Collection<String> missingFields) {
        super(ERROR_CODE, String.format(
            "Event on channel '%s' is missing required fields %s",
            channel, missingFields
        ));
        this.channel = channel;
    }

    public SchemaValidationException(String channel, String reason) {
        super(ERROR_CODE, String.format("Event on channel '%s' rejected: %s", channel, reason));
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
