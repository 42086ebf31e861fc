package com.ragguard.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ragguard.util.AttributeValues;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Allow-only authorization predicate: a document matches when any condition matches.
 *
 * <p>There is no deny clause at this level. Deny lists are enforced after retrieval
 * against each document's {@link AccessPolicy}.
 */
@Value
public class AccessPredicate {

    List<AccessCondition> conditions;

    public AccessPredicate(List<AccessCondition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    /**
     * Post-hoc evaluation against a document's metadata
     */
    public boolean matches(Map<String, Object> metadata) {
        if (metadata == null) {
            return false;
        }
        for (AccessCondition condition : conditions) {
            List<String> values = AttributeValues.toStringList(metadata.get(condition.getField().key()));
            if (condition.getField() == AccessCondition.Field.CLASSIFICATION) {
                // Classification labels are not case-normalized by every backend
                if (values.stream().anyMatch(v -> v.equalsIgnoreCase(condition.getValue()))) {
                    return true;
                }
            } else if (values.contains(condition.getValue())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Knowledge-store filter form: {"orAll":[{"equals":{"key":..,"value":..}}, ...]}
     */
    public JsonObject toFilterJson() {
        JsonArray orAll = new JsonArray();
        for (AccessCondition condition : conditions) {
            JsonObject equals = new JsonObject();
            equals.addProperty("key", condition.getField().key());
            equals.addProperty("value", condition.getValue());

            JsonObject wrapper = new JsonObject();
            wrapper.add("equals", equals);
            orAll.add(wrapper);
        }
        JsonObject filter = new JsonObject();
        filter.add("orAll", orAll);
        return filter;
    }
}
