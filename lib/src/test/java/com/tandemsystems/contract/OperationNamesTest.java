package com.tandemsystems.contract;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class OperationNamesTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "MsgOne, msg_one",
            "MsgTwo, msg_two",
            "Ping, ping",
            "HTTPServer, http_server",
            "GetHTTPResponse, get_http_response",
            "Msg2Go, msg2_go",
            "V2, v2",
            "Already_Snake, already_snake",
            "lowercase, lowercase",
            "ABC, abc"
    })
    void testSnakeCase(String identifier, String expected) {
        assertEquals(expected, OperationNames.snakeCase(identifier));
    }

    @Test
    void testNoWaitNameAppendsSuffix() {
        assertEquals("msg_one_no_wait", OperationNames.noWaitName("MsgOne"));
        assertEquals("msg_one", OperationNames.waitName("MsgOne"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Class", "Return", "True", "Null"})
    void testKeywordsGetTrailingUnderscore(String identifier) {
        String name = OperationNames.waitName(identifier);

        assertTrue(name.endsWith("_"), name);
        assertEquals(identifier.toLowerCase() + "_", name);
        assertEquals(identifier.toLowerCase() + "_no_wait", OperationNames.noWaitName(identifier));
    }

    @Test
    void testLeadingDigitIsEscaped() {
        assertEquals("_1st", OperationNames.waitName("_1st"));
        assertEquals("_1st_no_wait", OperationNames.noWaitName("_1st"));
    }

    @Test
    void testRejectsIdentifierWithoutLetters() {
        assertThrows(IllegalArgumentException.class, () -> OperationNames.snakeCase("__"));
    }
}
