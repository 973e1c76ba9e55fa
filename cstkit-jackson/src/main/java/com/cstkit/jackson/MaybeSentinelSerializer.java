package com.cstkit.jackson;

import com.cstkit.nodes.MaybeSentinel;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a slot's node as the node itself, and a defaulted slot as the string
 * {@code "DEFAULT"}.
 */
public class MaybeSentinelSerializer extends StdSerializer<MaybeSentinel<?>> {

    static final String DEFAULT = "DEFAULT";

    public MaybeSentinelSerializer() {
        super(MaybeSentinel.class, false);
    }

    @Override
    public void serialize(MaybeSentinel<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value instanceof MaybeSentinel.Value<?> slot) {
            // Typed lookup, so the node keeps its "type" property
            provider.defaultSerializeValue(slot.node(), gen);
        } else {
            gen.writeString(DEFAULT);
        }
    }
}
