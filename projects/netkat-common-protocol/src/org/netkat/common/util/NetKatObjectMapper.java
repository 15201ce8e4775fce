package org.netkat.common.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * The object mapper used for settings and answers.
 */
public class NetKatObjectMapper extends ObjectMapper {

    private static final long serialVersionUID = 1L;

    public NetKatObjectMapper() {
        enable(SerializationFeature.INDENT_OUTPUT);
        enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

}
