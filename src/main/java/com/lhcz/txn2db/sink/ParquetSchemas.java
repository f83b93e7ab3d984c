package com.lhcz.txn2db.sink;

import com.lhcz.txn2db.model.ExtractedRecord;
import com.lhcz.txn2db.model.TableSchema;
import com.lhcz.txn2db.model.TableSchema.Column;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.SchemaBuilder.FieldAssembler;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * TableSchema -> Avro schema / GenericRecord
 * <p>
 * NUMERIC 与 JSON 均写成字符串；TIMESTAMP 为 timestamp-micros (UTC)。
 */
final class ParquetSchemas {

    static final String NAMESPACE = "com.lhcz.txn2db";

    private ParquetSchemas() {
    }

    static Schema schema(TableSchema table) {
        FieldAssembler<Schema> fields = SchemaBuilder.record(table.name()).namespace(NAMESPACE).fields();
        for (Column column : table.columns()) {
            Schema type = avroType(column);
            if (column.nullable()) {
                fields = fields.name(column.name())
                        .type(Schema.createUnion(Schema.create(Schema.Type.NULL), type))
                        .withDefault(null);
            } else {
                fields = fields.name(column.name()).type(type).noDefault();
            }
        }
        return fields.endRecord();
    }

    private static Schema avroType(Column column) {
        return switch (column.type()) {
            case BIGINT -> Schema.create(Schema.Type.LONG);
            case BOOLEAN -> Schema.create(Schema.Type.BOOLEAN);
            case TIMESTAMP -> LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));
            case TEXT, NUMERIC, JSON -> Schema.create(Schema.Type.STRING);
        };
    }

    static GenericRecord toRecord(Schema schema, ExtractedRecord record) {
        GenericData.Record row = new GenericData.Record(schema);
        for (Column column : record.table().columns()) {
            Object value = record.get(column.name());
            if (value == null && !column.nullable()) {
                throw new IllegalArgumentException("非空列缺值: " + record.tableName() + "." + column.name()
                        + " @ version " + record.version());
            }
            row.put(column.name(), convert(column, value));
        }
        return row;
    }

    private static Object convert(Column column, Object value) {
        if (value == null) {
            return null;
        }
        return switch (column.type()) {
            case BIGINT -> ((Number) value).longValue();
            case BOOLEAN -> value;
            case TIMESTAMP -> ChronoUnit.MICROS.between(Instant.EPOCH, (Instant) value);
            case TEXT, NUMERIC, JSON -> value.toString();
        };
    }
}
