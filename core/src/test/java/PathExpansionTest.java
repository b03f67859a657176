import io.github.flameyossnowy.mongofilter.api.expansion.PathExpansion;
import io.github.flameyossnowy.mongofilter.api.json.JacksonValueBridge;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue.ObjectValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PathExpansionTest {

    private static StructuredValue json(String json) {
        return JacksonValueBridge.parse(json);
    }

    @Test
    void already_flat_operator_document_is_unchanged() {
        StructuredValue flat = json("{\"qty\": {\"$eq\": 20}}");
        assertEquals(flat, PathExpansion.expand("", flat));
    }

    @Test
    void nested_fields_become_dotted_paths() {
        ObjectValue expanded = PathExpansion.expand("", json("{\"a\": {\"b\": {\"c\": \"v\"}}}"));
        assertEquals(json("{\"a.b.c\": \"v\"}"), expanded);
    }

    @Test
    void prefix_is_prepended_to_every_path() {
        ObjectValue expanded = PathExpansion.expand("_id", json("{\"tenant\": \"t1\", \"key\": {\"n\": 7}}"));
        assertEquals(json("{\"_id.tenant\": \"t1\", \"_id.key.n\": 7}"), expanded);
    }

    @Test
    void scalar_with_prefix_is_wrapped() {
        assertEquals(json("{\"_id\": 42}"), PathExpansion.expand("_id", StructuredValue.of(42)));
    }

    @Test
    void scalar_without_prefix_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expand("", StructuredValue.of(42)));
    }

    @Test
    void top_level_operator_passes_through_without_prefix() {
        StructuredValue or = json("{\"$or\": [{\"a\": 1}, {\"b\": 2}]}");
        assertEquals(or, PathExpansion.expand("", or));
    }

    @Test
    void operator_under_prefix_is_wrapped_in_operator_object() {
        ObjectValue expanded = PathExpansion.expand("price", json("{\"$gt\": 1}"));
        assertEquals(json("{\"price\": {\"$gt\": 1}}"), expanded);
    }

    @Test
    void sibling_operators_stay_together() {
        ObjectValue expanded = PathExpansion.expand("", json("{\"price\": {\"$gt\": 1, \"$lt\": 5}}"));
        assertEquals(json("{\"price\": {\"$gt\": 1, \"$lt\": 5}}"), expanded);
    }

    @Test
    void mixed_level_keeps_operators_on_the_parent_path() {
        ObjectValue expanded = PathExpansion.expand("", json("{\"a\": {\"$exists\": true, \"b\": 2}}"));
        assertEquals(json("{\"a\": {\"$exists\": true}, \"a.b\": 2}"), expanded);
    }

    @Test
    void arrays_are_leaves() {
        ObjectValue expanded = PathExpansion.expand("", json("{\"tags\": [{\"x\": 1}, \"y\"]}"));
        assertEquals(json("{\"tags\": [{\"x\": 1}, \"y\"]}"), expanded);
    }

    @Test
    void empty_object_contributes_nothing() {
        assertEquals(ObjectValue.EMPTY, PathExpansion.expand("a", ObjectValue.EMPTY));
        assertEquals(ObjectValue.EMPTY, PathExpansion.expand("", ObjectValue.EMPTY));
        assertEquals(json("{\"b\": 1}"), PathExpansion.expand("", json("{\"meta\": {}, \"b\": 1}")));
    }

    @Test
    void expand_with_operator_on_empty_object_is_empty() {
        assertEquals(ObjectValue.EMPTY, PathExpansion.expandWithOperator("a", "$eq", ObjectValue.EMPTY));
        assertEquals(json("{\"id.b\": {\"$eq\": 2}}"),
            PathExpansion.expandWithOperator("id", "$eq", json("{\"a\": {}, \"b\": 2}")));
    }

    @Test
    void expand_with_operator_wraps_scalar() {
        ObjectValue expanded = PathExpansion.expandWithOperator("qty", "$gte", StructuredValue.of(10));
        assertEquals(json("{\"qty\": {\"$gte\": 10}}"), expanded);
    }

    @Test
    void expand_with_operator_wraps_every_leaf_of_an_object() {
        ObjectValue expanded = PathExpansion.expandWithOperator("id", "$eq", json("{\"a\": 1, \"b\": {\"c\": \"x\"}}"));
        assertEquals(json("{\"id.a\": {\"$eq\": 1}, \"id.b.c\": {\"$eq\": \"x\"}}"), expanded);
    }

    @Test
    void expand_with_operator_nests_operator_objects() {
        ObjectValue expanded = PathExpansion.expandWithOperator("price", "$eq", json("{\"$gt\": 1, \"$lt\": 5}"));
        assertEquals(json("{\"price\": {\"$eq\": {\"$gt\": 1, \"$lt\": 5}}}"), expanded);
    }

    @Test
    void expand_with_operator_keeps_arrays_whole() {
        ObjectValue expanded = PathExpansion.expandWithOperator("tags", "$eq", json("[\"a\", \"b\"]"));
        assertEquals(json("{\"tags\": {\"$eq\": [\"a\", \"b\"]}}"), expanded);
    }

    @Test
    void expand_with_operator_rejects_empty_names() {
        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expandWithOperator("", "$eq", StructuredValue.of(1)));
        assertThrows(IllegalArgumentException.class, () -> PathExpansion.expandWithOperator("qty", "", StructuredValue.of(1)));
    }

    @Test
    void merge_is_last_write_wins() {
        ObjectValue left = (ObjectValue) json("{\"a\": 1, \"b\": 2}");
        ObjectValue right = (ObjectValue) json("{\"b\": 3, \"c\": 4}");

        assertEquals(json("{\"a\": 1, \"b\": 3, \"c\": 4}"), PathExpansion.merge(left, right));
        assertEquals(left, PathExpansion.merge(left, ObjectValue.EMPTY));
        assertEquals(right, PathExpansion.merge(ObjectValue.EMPTY, right));
    }

    @Test
    void merge_does_not_combine_nested_values() {
        ObjectValue left = (ObjectValue) json("{\"a\": {\"$gt\": 1}}");
        ObjectValue right = (ObjectValue) json("{\"a\": {\"$lt\": 5}}");

        assertEquals(right, PathExpansion.merge(left, right));
    }

    @Test
    void input_is_left_untouched() {
        StructuredValue input = json("{\"a\": {\"b\": 1}}");
        PathExpansion.expand("", input);
        assertEquals(json("{\"a\": {\"b\": 1}}"), input);
    }
}
