package io.aim.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.aim.core.evaluator.ResultValue;
import java.io.IOException;
import java.io.Serial;

/// Writes a result value as a bare JSON number (integer or float) or a base64 string (image).
class ResultValueSerializer extends StdSerializer<ResultValue> {

    @Serial private static final long serialVersionUID = 8204402381125969934L;

    ResultValueSerializer() {
        super(ResultValue.class);
    }

    @Override
    public void serialize(ResultValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof ResultValue.IntegerValue integer) {
            gen.writeNumber(integer.value());
        } else if (value instanceof ResultValue.FloatValue floating) {
            gen.writeNumber(floating.value());
        } else {
            gen.writeString(((ResultValue.ImageValue) value).base64());
        }
    }
}
