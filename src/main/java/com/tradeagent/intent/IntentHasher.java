package com.tradeagent.intent;

import com.tradeagent.domain.model.OrderIntent;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonicalizes an {@link OrderIntent} and digests it.
 *
 * <p>Covers every immutable field. {@code status} and the hash itself are excluded, so
 * status transitions never change the hash an approval was bound to.
 */
public final class IntentHasher {

    private IntentHasher() {}

    public static String canonicalJson(OrderIntent intent) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("intent_id", intent.getIntentId());
        fields.put("created_at", intent.getCreatedAt());
        fields.put("symbol", intent.getSymbol());
        fields.put("side", intent.getSide().wireValue());
        fields.put("size", intent.getSize());
        fields.put("price", intent.getPrice());
        fields.put("order_type", intent.getOrderType().wireValue());
        fields.put("time_in_force", intent.getTimeInForce().wireValue());
        fields.put("strategy", intent.getStrategy());
        fields.put("confidence", intent.getConfidence());
        fields.put("rationale", intent.getRationale());
        fields.put("rationale_features_ref", intent.getRationaleFeaturesRef());
        fields.put("expires_at", intent.getExpiresAt());
        fields.put("mode", intent.getMode().wireValue());
        return CanonicalJson.write(fields);
    }

    public static String hash(OrderIntent intent) {
        return CanonicalJson.sha256Hex(canonicalJson(intent));
    }
}
