package com.herzen.cat.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.herzen.cat.exception.SnapshotIncompatibleException;
import com.herzen.cat.session.SessionModels.SessionSnapshot;
import org.springframework.stereotype.Component;

@Component
public class SessionSnapshotCodec {
    private final ObjectMapper mapper;

    public SessionSnapshotCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public String write(SessionSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session " + snapshot.sessionId(), e);
        }
    }

    public SessionSnapshot read(String json) {
        try {
            return mapper.readValue(json, SessionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotIncompatibleException("Cannot read session snapshot", e);
        }
    }
}
