package com.gt.lse.sessionState.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.lse.exception.MappingException;
import com.gt.lse.model.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SessionContextJsonConverter {

    private static final Logger log = LoggerFactory.getLogger(SessionContextJsonConverter.class);

    private final ObjectMapper objectMapper;

    public SessionContextJsonConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(SessionContext sessionContext) {
        try {
            return objectMapper.writeValueAsString(sessionContext);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to serialize context of session " + sessionContext.sessionId();

            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }

    public SessionContext fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new MappingException("Stored session context is empty");
        }

        try {
            return objectMapper.readValue(json, SessionContext.class);
        } catch (JsonProcessingException ex) {
            String errMsg = "Unable to deserialize stored session context";

            log.error(errMsg, ex);
            throw new MappingException(errMsg, ex);
        }
    }
}
