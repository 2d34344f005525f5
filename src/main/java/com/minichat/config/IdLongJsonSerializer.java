package com.minichat.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.ContextualSerializer;

import java.io.IOException;
import java.util.Locale;

/**
 * 消息 id 是雪花 long，超过 JS Number 的安全范围，所以“语义为 ID 的字段”一律输出为字符串。
 *
 * <p>判定规则（按 JSON 属性名）：</p>
 * <ul>
 *   <li>{@code id}</li>
 *   <li>以 {@code Id} 或 {@code _id} 结尾，例如 {@code messageId} / {@code message_id}</li>
 * </ul>
 * 其余 long（分页 total、计数等）保持 number。
 */
public class IdLongJsonSerializer extends JsonSerializer<Long> implements ContextualSerializer {

    private final boolean asString;

    public IdLongJsonSerializer() {
        this(false);
    }

    private IdLongJsonSerializer(boolean asString) {
        this.asString = asString;
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (asString) {
            gen.writeString(Long.toString(value));
        } else {
            gen.writeNumber(value);
        }
    }

    @Override
    public JsonSerializer<?> createContextual(SerializerProvider prov, BeanProperty property) {
        if (property == null) {
            return this;
        }
        return new IdLongJsonSerializer(isIdFieldName(property.getName()));
    }

    static boolean isIdFieldName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return "id".equals(lower) || lower.endsWith("_id") || name.endsWith("Id");
    }
}
