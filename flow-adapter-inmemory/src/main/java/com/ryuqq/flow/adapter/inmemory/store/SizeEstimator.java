package com.ryuqq.flow.adapter.inmemory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximate in-memory size of stored values.
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>strings: 2 bytes per char</li>
 *   <li>numbers: 8 bytes</li>
 *   <li>booleans: 4 bytes</li>
 *   <li>null: 0</li>
 *   <li>anything else: 2 bytes per char of its JSON form, or {@value #FALLBACK_SIZE} when it cannot be serialized</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SizeEstimator {

    private static final Logger log = LoggerFactory.getLogger(SizeEstimator.class);

    static final long FALLBACK_SIZE = 100;

    private final ObjectMapper mapper;

    public SizeEstimator() {
        this(new ObjectMapper());
    }

    public SizeEstimator(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    public long estimate(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence text) {
            return text.length() * 2L;
        }
        if (value instanceof Number) {
            return 8;
        }
        if (value instanceof Boolean) {
            return 4;
        }
        try {
            return mapper.writeValueAsString(value).length() * 2L;
        } catch (JsonProcessingException e) {
            log.debug("Falling back to fixed size estimate for {}: {}", value.getClass().getName(), e.getMessage());
            return FALLBACK_SIZE;
        }
    }
}
