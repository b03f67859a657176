package io.github.flameyossnowy.mongofilter.mongodb.codec;

import com.mongodb.MongoClientSettings;
import io.github.flameyossnowy.mongofilter.api.exceptions.ShapeMismatchException;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ArrayValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.BooleanValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.NullValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.NumberValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.StringValue;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonRegularExpression;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.conversions.Bson;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link StructuredValue}s and the driver's BSON values.
 *
 * <p>Documents, arrays, strings, booleans, int32, int64, doubles, decimal128 and null map one to
 * one. Object ids, dates and regular expressions read from the server are represented as
 * {@code {"$oid": hex}}, {@code {"$date": millis}} (a {@code Long}) and {@code {"$regex": pattern, "$options": flags}};
 * the first two convert back to their BSON types. Every other BSON type is rejected.</p>
 */
public final class BsonValueBridge {
    public static final String OBJECT_ID_KEY = "$oid";
    public static final String DATE_KEY = "$date";
    public static final String REGEX_KEY = "$regex";
    public static final String REGEX_OPTIONS_KEY = "$options";

    private BsonValueBridge() {
        throw new AssertionError("No instances");
    }

    public static @NotNull BsonDocument toBsonDocument(@NotNull ObjectValue value) {
        BsonDocument document = new BsonDocument();
        for (Map.Entry<String, StructuredValue> entry : value.fields().entrySet()) {
            document.append(entry.getKey(), toBsonValue(entry.getValue()));
        }
        return document;
    }

    public static @NotNull BsonValue toBsonValue(@NotNull StructuredValue value) {
        if (value instanceof ObjectValue object) {
            BsonValue extended = extendedValue(object);
            return extended != null ? extended : toBsonDocument(object);
        }
        if (value instanceof ArrayValue array) {
            List<BsonValue> values = new ArrayList<>(array.size());
            for (StructuredValue element : array) {
                values.add(toBsonValue(element));
            }
            return new BsonArray(values);
        }
        if (value instanceof StringValue string) return new BsonString(string.value());
        if (value instanceof BooleanValue bool) return BsonBoolean.valueOf(bool.value());
        if (value instanceof NumberValue number) return toBsonNumber(number.value());
        return BsonNull.VALUE;
    }

    private static BsonValue toBsonNumber(Number number) {
        if (number instanceof Integer i) return new BsonInt32(i);
        if (number instanceof Long l) return new BsonInt64(l);
        if (number instanceof Double d) return new BsonDouble(d);
        try {
            return new BsonDecimal128(new Decimal128((BigDecimal) number));
        } catch (NumberFormatException e) {
            throw new ShapeMismatchException("Number " + number + " does not fit in a decimal128", e);
        }
    }

    private static @Nullable BsonValue extendedValue(ObjectValue object) {
        if (object.size() != 1) return null;

        if (object.get(OBJECT_ID_KEY) instanceof StringValue hex && isCanonicalObjectId(hex.value())) {
            return new BsonObjectId(new ObjectId(hex.value()));
        }
        if (object.get(DATE_KEY) instanceof NumberValue millis && millis.value() instanceof Long epochMillis) {
            return new BsonDateTime(epochMillis);
        }
        return null;
    }

    // only the lower-case form comes back from toStructuredValue
    private static boolean isCanonicalObjectId(String hex) {
        return ObjectId.isValid(hex) && hex.equals(new ObjectId(hex).toHexString());
    }

    /**
     * Converts a Java value that may contain driver types. {@link ObjectId}s become
     * {@code {"$oid": hex}}, {@link Date}s and {@link Instant}s become {@code {"$date": millis}}, and
     * {@link BsonValue}s and other {@link Bson} documents are converted as read from the server. Maps,
     * iterables and arrays are walked; anything else goes through {@link StructuredValue#of(Object)}.
     *
     * @throws IllegalArgumentException if a value has no structured form
     */
    public static @NotNull StructuredValue fromJava(@Nullable Object value) {
        if (value instanceof StructuredValue structured) return structured;
        if (value instanceof ObjectId id) return objectIdOf(id);
        if (value instanceof Date date) return dateOf(date.getTime());
        if (value instanceof Instant instant) return dateOf(instant.toEpochMilli());
        if (value instanceof BsonValue bson) return toStructuredValue(bson);
        if (value instanceof Bson bson) return toObjectValue(bson);

        if (value instanceof Map<?, ?> map) {
            Map<String, StructuredValue> fields = new LinkedHashMap<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                fields.put(String.valueOf(entry.getKey()), fromJava(entry.getValue()));
            }
            return new ObjectValue(fields);
        }
        if (value instanceof Iterable<?> iterable) {
            List<StructuredValue> out = new ArrayList<>();
            for (Object element : iterable) {
                out.add(fromJava(element));
            }
            return new ArrayValue(out);
        }
        if (value instanceof Object[] array) {
            List<StructuredValue> out = new ArrayList<>(array.length);
            for (Object element : array) {
                out.add(fromJava(element));
            }
            return new ArrayValue(out);
        }
        return StructuredValue.of(value);
    }

    /**
     * Renders any driver {@link Bson} (a filter from {@code com.mongodb.client.model.Filters}, a
     * {@link org.bson.Document}, ...) with the default codec registry and converts the result.
     */
    public static @NotNull ObjectValue toObjectValue(@NotNull Bson bson) {
        BsonDocument document = bson.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry());
        return (ObjectValue) toStructuredValue(document);
    }

    public static @NotNull StructuredValue toStructuredValue(@Nullable BsonValue value) {
        if (value == null) return NullValue.INSTANCE;

        return switch (value.getBsonType()) {
            case DOCUMENT -> {
                BsonDocument document = value.asDocument();
                Map<String, StructuredValue> fields = new LinkedHashMap<>(document.size());
                for (Map.Entry<String, BsonValue> entry : document.entrySet()) {
                    fields.put(entry.getKey(), toStructuredValue(entry.getValue()));
                }
                yield new ObjectValue(fields);
            }
            case ARRAY -> {
                List<BsonValue> values = value.asArray().getValues();
                List<StructuredValue> out = new ArrayList<>(values.size());
                for (BsonValue element : values) {
                    out.add(toStructuredValue(element));
                }
                yield new ArrayValue(out);
            }
            case STRING -> new StringValue(value.asString().getValue());
            case BOOLEAN -> BooleanValue.of(value.asBoolean().getValue());
            case INT32 -> new NumberValue(value.asInt32().getValue());
            case INT64 -> new NumberValue(value.asInt64().getValue());
            case DOUBLE -> new NumberValue(value.asDouble().getValue());
            case DECIMAL128 -> new NumberValue(decimalOf(value.asDecimal128().getValue()));
            case NULL -> NullValue.INSTANCE;
            case OBJECT_ID -> objectIdOf(value.asObjectId().getValue());
            case DATE_TIME -> dateOf(value.asDateTime().getValue());
            case REGULAR_EXPRESSION -> regexOf(value.asRegularExpression());
            default -> throw new ShapeMismatchException("BSON type " + value.getBsonType() + " has no structured form");
        };
    }

    private static ObjectValue objectIdOf(ObjectId id) {
        return ObjectValue.of(OBJECT_ID_KEY, new StringValue(id.toHexString()));
    }

    private static ObjectValue dateOf(long epochMillis) {
        return ObjectValue.of(DATE_KEY, new NumberValue(epochMillis));
    }

    private static BigDecimal decimalOf(Decimal128 decimal) {
        try {
            return decimal.bigDecimalValue();
        } catch (ArithmeticException e) {
            throw new ShapeMismatchException("Decimal128 " + decimal + " is not a finite number", e);
        }
    }

    private static ObjectValue regexOf(BsonRegularExpression regex) {
        ObjectValue.Builder builder = ObjectValue.builder().put(REGEX_KEY, regex.getPattern());
        if (!regex.getOptions().isEmpty()) {
            builder.put(REGEX_OPTIONS_KEY, regex.getOptions());
        }
        return builder.build();
    }

    /**
     * @throws ShapeMismatchException if {@code value} is not an object
     */
    public static @NotNull ObjectValue requireObject(@NotNull StructuredValue value) {
        if (value instanceof ObjectValue object) return object;
        throw new ShapeMismatchException("Expected an object, but got " + value);
    }
}
