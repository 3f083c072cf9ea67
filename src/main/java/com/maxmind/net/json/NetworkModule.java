package com.maxmind.net.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.maxmind.net.Network;
import com.maxmind.net.NetworkException;
import java.io.IOException;

/**
 * A Jackson module that stores a {@link Network} as its canonical CIDR
 * string, e.g. {@code "10.0.0.0/8"}, and reads it back with
 * {@link Network#parse(String)}.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new NetworkModule());
 * }</pre>
 */
public final class NetworkModule extends SimpleModule {

    private static final long serialVersionUID = -8313470262548371245L;

    /**
     * Creates the module with the {@link Network} serializer and deserializer
     * registered.
     */
    public NetworkModule() {
        super("NetworkModule");
        addSerializer(Network.class, new NetworkSerializer());
        addDeserializer(Network.class, new NetworkDeserializer());
    }

    static final class NetworkSerializer extends StdSerializer<Network> {

        private static final long serialVersionUID = 2709373394744416153L;

        NetworkSerializer() {
            super(Network.class);
        }

        @Override
        public void serialize(Network value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
            gen.writeString(value.toString());
        }
    }

    static final class NetworkDeserializer extends StdScalarDeserializer<Network> {

        private static final long serialVersionUID = -4052116437045817316L;

        NetworkDeserializer() {
            super(Network.class);
        }

        @Override
        public Network deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {
            if (!parser.hasToken(JsonToken.VALUE_STRING)) {
                return (Network) context.handleUnexpectedToken(Network.class, parser);
            }
            String text = parser.getText().trim();
            try {
                return Network.parse(text);
            } catch (NetworkException e) {
                return (Network) context.handleWeirdStringValue(Network.class, text, "%s", e.getMessage());
            }
        }
    }
}
