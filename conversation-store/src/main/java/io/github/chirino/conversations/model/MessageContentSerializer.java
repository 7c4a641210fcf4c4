package io.github.chirino.conversations.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

public class MessageContentSerializer extends StdSerializer<MessageContent> {

    public MessageContentSerializer() {
        super(MessageContent.class);
    }

    @Override
    public void serialize(MessageContent value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof BlockListContent list) {
            gen.writeStartArray();
            for (ContentBlock block : list.getBlocks()) {
                provider.defaultSerializeValue(block, gen);
            }
            gen.writeEndArray();
        } else {
            gen.writeString(value.plainText());
        }
    }
}
