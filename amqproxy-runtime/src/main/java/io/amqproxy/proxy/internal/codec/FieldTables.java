/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.netty.buffer.ByteBuf;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads and writes the AMQP 0-9-1 primitive string types and field tables, using the field
 * type octets of the RabbitMQ errata (the ones every mainstream client actually sends).
 *
 * <p>Values map to Java types as follows: {@code t} Boolean, {@code b} Byte, {@code B} and
 * {@code s} Short, {@code u} and {@code I} Integer, {@code i} and {@code l} Long, {@code f} Float,
 * {@code d} Double, {@code D} BigDecimal, {@code S} String, {@code x} byte[], {@code T} Date,
 * {@code F} Map, {@code A} List, {@code V} null.</p>
 */
public final class FieldTables {

    private FieldTables() {
    }

    public static String readShortString(ByteBuf in) {
        int length = in.readUnsignedByte();
        return in.readCharSequence(length, StandardCharsets.UTF_8).toString();
    }

    public static void writeShortString(ByteBuf out, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > 255) {
            throw new IllegalArgumentException("short string longer than 255 bytes: " + value);
        }
        out.writeByte(bytes.length);
        out.writeBytes(bytes);
    }

    public static byte[] readLongString(ByteBuf in) {
        long length = in.readUnsignedInt();
        if (length > in.readableBytes()) {
            throw new MalformedFrameException("long string length " + length + " exceeds remaining " + in.readableBytes() + " bytes");
        }
        byte[] bytes = new byte[(int) length];
        in.readBytes(bytes);
        return bytes;
    }

    public static void writeLongString(ByteBuf out, byte[] value) {
        out.writeInt(value.length);
        out.writeBytes(value);
    }

    public static void writeLongString(ByteBuf out, String value) {
        writeLongString(out, value.getBytes(StandardCharsets.UTF_8));
    }

    public static Map<String, Object> readTable(ByteBuf in) {
        long length = in.readUnsignedInt();
        if (length > in.readableBytes()) {
            throw new MalformedFrameException("field table length " + length + " exceeds remaining " + in.readableBytes() + " bytes");
        }
        ByteBuf table = in.readSlice((int) length);
        Map<String, Object> result = new LinkedHashMap<>();
        while (table.isReadable()) {
            String name = readShortString(table);
            result.put(name, readFieldValue(table));
        }
        return result;
    }

    public static void writeTable(ByteBuf out, Map<String, ?> table) {
        int lengthIndex = out.writerIndex();
        out.writeInt(0);
        int start = out.writerIndex();
        for (Map.Entry<String, ?> entry : table.entrySet()) {
            writeShortString(out, entry.getKey());
            writeFieldValue(out, entry.getValue());
        }
        out.setInt(lengthIndex, out.writerIndex() - start);
    }

    @Nullable
    static Object readFieldValue(ByteBuf in) {
        char type = (char) in.readUnsignedByte();
        return switch (type) {
            case 't' -> in.readBoolean();
            case 'b' -> in.readByte();
            case 'B' -> in.readUnsignedByte();
            case 's' -> in.readShort();
            case 'u' -> in.readUnsignedShort();
            case 'I' -> in.readInt();
            case 'i' -> in.readUnsignedInt();
            case 'l' -> in.readLong();
            case 'f' -> in.readFloat();
            case 'd' -> in.readDouble();
            case 'D' -> {
                int scale = in.readUnsignedByte();
                yield new BigDecimal(BigInteger.valueOf(in.readInt()), scale);
            }
            case 'S' -> new String(readLongString(in), StandardCharsets.UTF_8);
            case 'x' -> readLongString(in);
            case 'T' -> new Date(in.readLong() * 1000L);
            case 'F' -> readTable(in);
            case 'A' -> readArray(in);
            case 'V' -> null;
            default -> throw new MalformedFrameException("unknown field type '" + type + "'");
        };
    }

    private static List<Object> readArray(ByteBuf in) {
        long length = in.readUnsignedInt();
        if (length > in.readableBytes()) {
            throw new MalformedFrameException("field array length " + length + " exceeds remaining " + in.readableBytes() + " bytes");
        }
        ByteBuf array = in.readSlice((int) length);
        List<Object> result = new ArrayList<>();
        while (array.isReadable()) {
            result.add(readFieldValue(array));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    static void writeFieldValue(ByteBuf out, @Nullable Object value) {
        if (value == null) {
            out.writeByte('V');
        }
        else if (value instanceof Boolean b) {
            out.writeByte('t');
            out.writeBoolean(b);
        }
        else if (value instanceof Byte b) {
            out.writeByte('b');
            out.writeByte(b);
        }
        else if (value instanceof Short s) {
            out.writeByte('s');
            out.writeShort(s);
        }
        else if (value instanceof Integer i) {
            out.writeByte('I');
            out.writeInt(i);
        }
        else if (value instanceof Long l) {
            out.writeByte('l');
            out.writeLong(l);
        }
        else if (value instanceof Float f) {
            out.writeByte('f');
            out.writeFloat(f);
        }
        else if (value instanceof Double d) {
            out.writeByte('d');
            out.writeDouble(d);
        }
        else if (value instanceof BigDecimal decimal) {
            out.writeByte('D');
            out.writeByte(decimal.scale());
            out.writeInt(decimal.unscaledValue().intValueExact());
        }
        else if (value instanceof String s) {
            out.writeByte('S');
            writeLongString(out, s);
        }
        else if (value instanceof byte[] bytes) {
            out.writeByte('x');
            writeLongString(out, bytes);
        }
        else if (value instanceof Date date) {
            out.writeByte('T');
            out.writeLong(date.getTime() / 1000L);
        }
        else if (value instanceof Map<?, ?> map) {
            out.writeByte('F');
            writeTable(out, (Map<String, ?>) map);
        }
        else if (value instanceof List<?> list) {
            out.writeByte('A');
            int lengthIndex = out.writerIndex();
            out.writeInt(0);
            int start = out.writerIndex();
            for (Object element : list) {
                writeFieldValue(out, element);
            }
            out.setInt(lengthIndex, out.writerIndex() - start);
        }
        else {
            throw new IllegalArgumentException("unsupported field value type " + value.getClass().getName());
        }
    }
}
