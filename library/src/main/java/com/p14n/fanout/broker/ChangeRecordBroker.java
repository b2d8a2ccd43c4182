package com.p14n.fanout.broker;

import com.p14n.fanout.data.ChangeRecord;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Routes change records by scope key and hands subscribers the record's raw
 * JSON, leaving decoding to the subscriber.
 */
public class ChangeRecordBroker extends DefaultMessageBroker<ChangeRecord, String> {

    public ChangeRecordBroker(OpenTelemetry ot, String scopeName) {
        super(ot, scopeName);
    }

    @Override
    public String convert(ChangeRecord m) {
        return m.json();
    }

}
