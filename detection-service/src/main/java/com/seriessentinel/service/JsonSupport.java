package com.seriessentinel.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for every JSON surface of the service.
 */
public final class JsonSupport {

    private JsonSupport() {
        // utility class, not instantiable
    }

    /**
     * Create a mapper that tolerates unknown request properties, refuses
     * fractional numbers for integer fields and writes {@code java.time}
     * values as ISO-8601 strings.
     *
     * @return new, fully configured mapper
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        return mapper;
    }
}
