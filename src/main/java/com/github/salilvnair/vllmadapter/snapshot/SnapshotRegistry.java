package com.github.salilvnair.vllmadapter.snapshot;

import com.github.salilvnair.vllmadapter.exception.LlmErrorCode;
import com.github.salilvnair.vllmadapter.exception.LlmException;
import com.github.salilvnair.vllmadapter.util.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Explicit mapping from a type name to the factory that rebuilds it from a snapshot.
 * Populated once at startup; see
 * {@link com.github.salilvnair.vllmadapter.config.VllmAdapterAutoConfiguration}.
 *
 * <p>Serialized form: {@code {"type": "<name>", "snapshot": {...}}}.</p>
 */
public class SnapshotRegistry {

    private final Map<String, Registration<?, ?>> registrations = new LinkedHashMap<>();

    public <T extends Snapshottable<S>, S> SnapshotRegistry register(String typeName,
                                                                     Class<T> type,
                                                                     Class<S> snapshotType,
                                                                     Supplier<T> factory) {
        registrations.put(typeName, new Registration<>(type, snapshotType, factory));
        return this;
    }

    public Set<String> registeredTypes() {
        return registrations.keySet();
    }

    public String serialize(Snapshottable<?> target) {
        String typeName = registrations.entrySet().stream()
                .filter(e -> e.getValue().type().equals(target.getClass()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow(() -> new LlmException(LlmErrorCode.SNAPSHOT_TYPE_UNKNOWN,
                        "No snapshot factory registered for " + target.getClass().getName()));
        try {
            return JsonUtil.toJson(new SnapshotEnvelope(typeName, target.createSnapshot()));
        } catch (IllegalStateException e) {
            throw new LlmException(LlmErrorCode.SNAPSHOT_SERIALIZATION_FAILED, e);
        }
    }

    public Snapshottable<?> restore(String json) {
        SnapshotEnvelope envelope;
        try {
            envelope = JsonUtil.fromJson(json, SnapshotEnvelope.class);
        } catch (IllegalStateException e) {
            throw new LlmException(LlmErrorCode.SNAPSHOT_SERIALIZATION_FAILED, e);
        }
        Registration<?, ?> registration = registrations.get(envelope.type());
        if (registration == null) {
            throw new LlmException(LlmErrorCode.SNAPSHOT_TYPE_UNKNOWN,
                    "No snapshot factory registered for type " + envelope.type());
        }
        return registration.restore(envelope.snapshot());
    }

    public <T extends Snapshottable<?>> T restore(String json, Class<T> expectedType) {
        Snapshottable<?> restored = restore(json);
        if (!expectedType.isInstance(restored)) {
            throw new LlmException(LlmErrorCode.SNAPSHOT_TYPE_UNKNOWN,
                    "Snapshot holds " + restored.getClass().getName() + ", expected " + expectedType.getName());
        }
        return expectedType.cast(restored);
    }

    private record Registration<T extends Snapshottable<S>, S>(Class<T> type, Class<S> snapshotType, Supplier<T> factory) {

        T restore(Object rawSnapshot) {
            S snapshot;
            try {
                snapshot = JsonUtil.convert(rawSnapshot, snapshotType);
            } catch (IllegalArgumentException e) {
                throw new LlmException(LlmErrorCode.SNAPSHOT_SERIALIZATION_FAILED, e);
            }
            T instance = factory.get();
            instance.loadSnapshot(snapshot);
            return instance;
        }
    }
}
