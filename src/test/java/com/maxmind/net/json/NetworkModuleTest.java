package com.maxmind.net.json;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.maxmind.net.Network;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class NetworkModuleTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new NetworkModule());

    @Test
    public void testWrite() throws JsonProcessingException {
        assertEquals("\"10.0.0.0/8\"", mapper.writeValueAsString(Network.parse("10.1.2.3/8")));
        assertEquals("[\"192.168.0.0/24\",\"2001:db8::/32\"]", mapper.writeValueAsString(List.of(
            Network.parse("192.168.0.0/24"),
            Network.parse("2001:db8::/32")
        )));
    }

    @Test
    public void testRead() throws JsonProcessingException {
        assertEquals(Network.parse("192.168.1.0/24"), mapper.readValue("\"192.168.1.7/24\"", Network.class));
        assertEquals(Network.parse("10.0.0.0/8"), mapper.readValue("\" 10.0.0.0/8 \"", Network.class));

        Map<String, Network> routes = mapper.readValue(
            "{\"office\":\"172.16.4.0/22\",\"lab\":\"fd00::/8\"}",
            new TypeReference<Map<String, Network>>() {
            });
        assertEquals(Network.parse("172.16.4.0/22"), routes.get("office"));
        assertEquals(Network.parse("fd00::/8"), routes.get("lab"));
    }

    @Test
    public void testRoundTrip() throws JsonProcessingException {
        var networks = List.of(
            Network.parse("0.0.0.0/0"),
            Network.parse("203.0.113.0/24"),
            Network.parse("::/0"),
            Network.parse("2001:db8:85a3::/48")
        );
        var json = mapper.writeValueAsString(networks);

        assertEquals(networks, mapper.readValue(json, new TypeReference<List<Network>>() {
        }));
    }

    @Test
    public void testInvalidString() {
        var ex = assertThrows(InvalidFormatException.class,
            () -> mapper.readValue("\"10.0.0.1/33\"", Network.class));
        assertThat(ex.getMessage(), containsString("10.0.0.1/33"));

        assertThrows(InvalidFormatException.class, () -> mapper.readValue("\"224.0.0.1\"", Network.class));
    }

    @Test
    public void testWrongToken() {
        assertThrows(MismatchedInputException.class, () -> mapper.readValue("42", Network.class));
        assertThrows(MismatchedInputException.class, () -> mapper.readValue("{}", Network.class));
    }
}
