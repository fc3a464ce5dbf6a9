package org.zhelev.avroconsumer.registry;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.EncoderFactory;
import org.apache.avro.io.JsonEncoder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Avro {@link SchemaCodec}: binary data is read into generic data and written back out with Avro's JSON encoding.
 */
public class AvroSchemaCodec implements SchemaCodec {

    private final Schema schema;

    private final GenericDatumReader<Object> reader;

    private final GenericDatumWriter<Object> writer;

    public AvroSchemaCodec(Schema schema) {
        this.schema = schema;
        this.reader = new GenericDatumReader<>(schema);
        this.writer = new GenericDatumWriter<>(schema);
    }

    /**
     * @throws org.apache.avro.SchemaParseException if the definition is not a valid Avro schema
     */
    public static AvroSchemaCodec parse(String schemaDefinition) {
        return new AvroSchemaCodec(new Schema.Parser().parse(schemaDefinition));
    }

    public Schema getSchema() {
        return schema;
    }

    @Override
    public Object binaryToNative(byte[] data, int offset, int length) throws IOException {
        BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(data, offset, length, null);
        try {
            return reader.read(null, decoder);
        } catch (RuntimeException e) {
            // corrupt input shows up as AvroRuntimeException, ArrayIndexOutOfBounds or NegativeArraySize
            throw new IOException("Cannot read binary data with schema " + schema.getFullName(), e);
        }
    }

    @Override
    public byte[] nativeToTextual(Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonEncoder encoder = EncoderFactory.get().jsonEncoder(schema, out);
        try {
            writer.write(value, encoder);
        } catch (RuntimeException e) {
            throw new IOException("Cannot write value as " + schema.getFullName() + " json", e);
        }
        encoder.flush();
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return "AvroSchemaCodec{" + schema.getFullName() + '}';
    }
}
