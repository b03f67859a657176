import com.mongodb.client.model.Filters;
import io.github.flameyossnowy.mongofilter.api.exceptions.ShapeMismatchException;
import io.github.flameyossnowy.mongofilter.api.json.JacksonValueBridge;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.NumberValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import io.github.flameyossnowy.mongofilter.mongodb.codec.BsonValueBridge;
import org.bson.BsonBinary;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonObjectId;
import org.bson.BsonRegularExpression;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BsonValueBridgeTest {

    @Test
    void structured_values_survive_a_round_trip() {
        ObjectValue value = ObjectValue.builder()
            .put("int", 1)
            .put("long", 5_000_000_000L)
            .put("double", 1.5)
            .put("decimal", new BigDecimal("12.340"))
            .put("string", "x")
            .put("bool", false)
            .put("nothing", null)
            .put("array", List.of(1, "two", List.of()))
            .put("nested", ObjectValue.builder().put("a", ObjectValue.EMPTY).build())
            .build();

        BsonDocument bson = BsonValueBridge.toBsonDocument(value);
        assertEquals(value, BsonValueBridge.toStructuredValue(bson));
    }

    @Test
    void numbers_keep_their_bson_width() {
        BsonDocument bson = BsonValueBridge.toBsonDocument(ObjectValue.builder().put("i", 1).put("l", 1L).build());

        assertEquals(new BsonInt32(1), bson.get("i"));
        assertEquals(new BsonInt64(1L), bson.get("l"));
        assertEquals(new NumberValue(1L), BsonValueBridge.toStructuredValue(new BsonInt64(1L)));
    }

    @Test
    void object_ids_use_extended_form() {
        ObjectId id = new ObjectId();
        BsonDocument bson = new BsonDocument("_id", new BsonObjectId(id));

        StructuredValue value = BsonValueBridge.toStructuredValue(bson);
        assertEquals(JacksonValueBridge.parse("{\"_id\": {\"$oid\": \"" + id.toHexString() + "\"}}"), value);
        assertEquals(bson, BsonValueBridge.toBsonValue(value));
    }

    @Test
    void dates_use_extended_form() {
        BsonDocument bson = new BsonDocument("at", new BsonDateTime(1_700_000_000_000L));

        StructuredValue value = BsonValueBridge.toStructuredValue(bson);
        assertEquals(ObjectValue.of("at", ObjectValue.of("$date", new NumberValue(1_700_000_000_000L))), value);
        assertEquals(bson, BsonValueBridge.toBsonValue(value));
    }

    @Test
    void extended_keys_with_other_shapes_stay_documents() {
        ObjectValue notAnId = ObjectValue.of("$oid", StructuredValue.of("not-hex"));
        ObjectValue intDate = ObjectValue.of("$date", StructuredValue.of(5));

        assertTrue(BsonValueBridge.toBsonValue(notAnId).isDocument());
        assertTrue(BsonValueBridge.toBsonValue(intDate).isDocument());
    }

    @Test
    void upper_case_object_id_hex_stays_a_document() {
        ObjectValue upper = ObjectValue.of("$oid", StructuredValue.of("507F1F77BCF86CD799439011"));
        ObjectValue filter = ObjectValue.of("_id", ObjectValue.of("$eq", upper));

        assertTrue(BsonValueBridge.toBsonValue(upper).isDocument());
        assertEquals(filter, BsonValueBridge.toStructuredValue(BsonValueBridge.toBsonDocument(filter)));
    }

    @Test
    void lower_case_object_id_hex_becomes_an_object_id() {
        ObjectValue lower = ObjectValue.of("$oid", StructuredValue.of("507f1f77bcf86cd799439011"));

        assertEquals(new BsonObjectId(new ObjectId("507f1f77bcf86cd799439011")), BsonValueBridge.toBsonValue(lower));
        assertEquals(lower, BsonValueBridge.toStructuredValue(BsonValueBridge.toBsonValue(lower)));
    }

    @Test
    void java_values_with_driver_types_convert() {
        ObjectId id = new ObjectId();
        Instant at = Instant.ofEpochMilli(1_700_000_000_000L);

        assertEquals(ObjectValue.of("$oid", StructuredValue.of(id.toHexString())), BsonValueBridge.fromJava(id));
        assertEquals(ObjectValue.of("$date", new NumberValue(1_700_000_000_000L)), BsonValueBridge.fromJava(at));
        assertEquals(ObjectValue.of("$date", new NumberValue(1_700_000_000_000L)), BsonValueBridge.fromJava(Date.from(at)));
        assertEquals(StructuredValue.of(5L), BsonValueBridge.fromJava(new BsonInt64(5L)));

        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("owner", id);
        nested.put("seen", List.of(at));
        assertEquals(
            ObjectValue.builder()
                .put("owner", ObjectValue.of("$oid", StructuredValue.of(id.toHexString())))
                .put("seen", List.of(ObjectValue.of("$date", new NumberValue(1_700_000_000_000L))))
                .build(),
            BsonValueBridge.fromJava(nested));
    }

    @Test
    void documents_convert_through_the_codec_registry() {
        ObjectId id = new ObjectId();
        StructuredValue value = BsonValueBridge.fromJava(new Document("_id", id).append("name", "x"));

        assertEquals(
            ObjectValue.builder().put("_id", ObjectValue.of("$oid", StructuredValue.of(id.toHexString()))).put("name", "x").build(),
            value);
    }

    @Test
    void plain_java_values_fall_back_to_structured_conversion() {
        assertEquals(StructuredValue.of("x"), BsonValueBridge.fromJava("x"));
        assertSame(ObjectValue.EMPTY, BsonValueBridge.fromJava(ObjectValue.EMPTY));
        assertThrows(IllegalArgumentException.class, () -> BsonValueBridge.fromJava(new Object()));
    }

    @Test
    void regular_expressions_become_regex_objects() {
        assertEquals(
            JacksonValueBridge.parse("{\"$regex\": \"^a\", \"$options\": \"i\"}"),
            BsonValueBridge.toStructuredValue(new BsonRegularExpression("^a", "i")));
        assertEquals(
            JacksonValueBridge.parse("{\"$regex\": \"^a\"}"),
            BsonValueBridge.toStructuredValue(new BsonRegularExpression("^a")));
    }

    @Test
    void unsupported_bson_types_are_rejected() {
        assertThrows(ShapeMismatchException.class,
            () -> BsonValueBridge.toStructuredValue(new BsonBinary(new byte[] {1, 2})));
        assertThrows(ShapeMismatchException.class,
            () -> BsonValueBridge.toStructuredValue(new BsonTimestamp(1, 1)));
        assertThrows(ShapeMismatchException.class,
            () -> BsonValueBridge.toStructuredValue(new BsonDecimal128(Decimal128.NaN)));
    }

    @Test
    void driver_filters_and_documents_convert() {
        assertEquals(JacksonValueBridge.parse("{\"a\": 1}"), BsonValueBridge.toObjectValue(Filters.eq("a", 1)));
        assertEquals(JacksonValueBridge.parse("{\"name\": \"x\", \"qty\": 2}"),
            BsonValueBridge.toObjectValue(new Document("name", "x").append("qty", 2)));
    }

    @Test
    void require_object_rejects_scalars() {
        assertThrows(ShapeMismatchException.class, () -> BsonValueBridge.requireObject(StructuredValue.of("x")));
        assertSame(ObjectValue.EMPTY, BsonValueBridge.requireObject(ObjectValue.EMPTY));
    }
}
