/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.codec;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldTablesTest {

    @Test
    void nestedTableSurvivesWire() {
        Map<String, Object> table = new LinkedHashMap<>();
        table.put("product", "AMQProxy");
        table.put("capabilities", Map.of("publisher_confirms", true));
        table.put("count", 7);
        table.put("big", 1L << 40);
        table.put("price", new BigDecimal("12.50"));
        table.put("list", List.of("a", 1));
        table.put("nothing", null);
        table.put("raw", new byte[]{ 1, 2 });
        ByteBuf buf = Unpooled.buffer();

        FieldTables.writeTable(buf, table);
        Map<String, Object> decoded = FieldTables.readTable(buf);

        assertEquals("AMQProxy", decoded.get("product"));
        assertEquals(Map.of("publisher_confirms", true), decoded.get("capabilities"));
        assertEquals(7, decoded.get("count"));
        assertEquals(1L << 40, decoded.get("big"));
        assertEquals(new BigDecimal("12.50"), decoded.get("price"));
        assertEquals(List.of("a", 1), decoded.get("list"));
        assertTrue(decoded.containsKey("nothing"));
        assertNull(decoded.get("nothing"));
        assertArrayEquals(new byte[]{ 1, 2 }, (byte[]) decoded.get("raw"));
        assertFalse(buf.isReadable());
        buf.release();
    }

    @Test
    void readsUnsignedIntegerTypes() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(0);
        FieldTables.writeShortString(buf, "u");
        buf.writeByte('u');
        buf.writeShort(0xFFFF);
        FieldTables.writeShortString(buf, "i");
        buf.writeByte('i');
        buf.writeInt(-1);
        buf.setInt(0, buf.readableBytes() - 4);

        Map<String, Object> decoded = FieldTables.readTable(buf);

        assertEquals(0xFFFF, decoded.get("u"));
        assertEquals(0xFFFFFFFFL, decoded.get("i"));
        buf.release();
    }

    @Test
    void tableLengthBeyondPayloadIsMalformed() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(100);
        buf.writeByte(0);

        assertThrows(MalformedFrameException.class, () -> FieldTables.readTable(buf));
        buf.release();
    }

    @Test
    void unknownFieldTypeIsMalformed() {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(0);
        FieldTables.writeShortString(buf, "k");
        buf.writeByte('?');
        buf.setInt(0, buf.readableBytes() - 4);

        assertThrows(MalformedFrameException.class, () -> FieldTables.readTable(buf));
        buf.release();
    }

    @Test
    void shortStringLimitedTo255Bytes() {
        ByteBuf buf = Unpooled.buffer();

        assertThrows(IllegalArgumentException.class, () -> FieldTables.writeShortString(buf, "y".repeat(256)));
        buf.release();
    }
}
