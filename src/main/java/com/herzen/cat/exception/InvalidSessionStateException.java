package com.herzen.cat.exception;

import com.herzen.cat.session.SessionModels.SessionState;

public class InvalidSessionStateException extends RuntimeException {

    private final String sessionId;
    private final SessionState state;

    public InvalidSessionStateException(String sessionId, SessionState state, String operation) {
        super("Cannot " + operation + " for session " + sessionId + " in state " + state);
        this.sessionId = sessionId;
        this.state = state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }
}
