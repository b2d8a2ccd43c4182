package com.p14n.fanout.vertx.codec;

import com.p14n.fanout.data.ChangeRecord;

import io.vertx.core.buffer.Buffer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeRecordCodecTest {

    private final ChangeRecordCodec codec = new ChangeRecordCodec();

    @Test
    void decodesFromTheGivenPosition() {
        ChangeRecord record = new ChangeRecord("e1", "dashboard_update",
                List.of("user:u1", "org:42"), "{\"overallScore\":81}", null);

        Buffer buffer = Buffer.buffer().appendString("header");
        codec.encodeToWire(buffer, record);

        ChangeRecord decoded = codec.decodeFromWire("header".length(), buffer);
        assertEquals(record, decoded);
        assertNull(decoded.traceparent());
    }

    @Test
    void localDeliveryPassesTheRecordThrough() {
        ChangeRecord record = new ChangeRecord("e1", "team_activity", List.of("room:general"), "{}",
                "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");
        assertSame(record, codec.transform(record));
        assertEquals(ChangeRecordCodec.NAME, codec.name());
        assertEquals(-1, codec.systemCodecID());
    }
}
