package com.p14n.fanout.vertx.codec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.p14n.fanout.data.ChangeRecord;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.MessageCodec;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * MessageCodec carrying {@link ChangeRecord}s across the Vert.x EventBus.
 *
 * <p>
 * Wire format:
 * [4 bytes: length][JSON object with id, kind, scopeKeys, json, traceparent]
 * </p>
 *
 * <p>
 * Local delivery skips the wire format and passes the record through, which
 * is safe since records are immutable.
 * </p>
 */
public class ChangeRecordCodec implements MessageCodec<ChangeRecord, ChangeRecord> {

    public static final String NAME = "fanout-change-record";

    @Override
    public void encodeToWire(Buffer buffer, ChangeRecord record) {
        JsonObject wire = new JsonObject()
                .put("id", record.id())
                .put("kind", record.kind())
                .put("scopeKeys", new JsonArray(new ArrayList<>(record.scopeKeys())))
                .put("json", record.json())
                .put("traceparent", record.traceparent());
        byte[] bytes = wire.encode().getBytes(StandardCharsets.UTF_8);

        buffer.appendInt(bytes.length);
        buffer.appendBytes(bytes);
    }

    @Override
    public ChangeRecord decodeFromWire(int pos, Buffer buffer) {
        int length = buffer.getInt(pos);
        byte[] bytes = buffer.getBytes(pos + 4, pos + 4 + length);
        JsonObject wire = new JsonObject(new String(bytes, StandardCharsets.UTF_8));

        List<String> scopeKeys = new ArrayList<>();
        JsonArray keys = wire.getJsonArray("scopeKeys");
        if (keys != null) {
            for (int i = 0; i < keys.size(); i++) {
                scopeKeys.add(keys.getString(i));
            }
        }
        return new ChangeRecord(
                wire.getString("id"),
                wire.getString("kind"),
                scopeKeys,
                wire.getString("json"),
                wire.getString("traceparent"));
    }

    @Override
    public ChangeRecord transform(ChangeRecord record) {
        return record;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }
}
