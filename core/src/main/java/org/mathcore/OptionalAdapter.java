package org.mathcore;

import com.google.gson.*;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Optional;

// Gson can't reach into java.util.Optional, so we unwrap it ourselves:
// a present value is written as is, an empty one as null
class OptionalAdapter implements JsonSerializer<Optional<?>> {
    @Override
    public JsonElement serialize(Optional<?> src, Type typeOfSrc, JsonSerializationContext context) {
        if (src.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        if (typeOfSrc instanceof ParameterizedType parameterized) {
            // Get the T in Optional<T>
            Type innerType = parameterized.getActualTypeArguments()[0];
            return context.serialize(src.get(), innerType);
        }
        return context.serialize(src.get());
    }
}
