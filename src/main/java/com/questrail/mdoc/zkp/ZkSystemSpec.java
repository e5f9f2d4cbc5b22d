package com.questrail.mdoc.zkp;

import com.questrail.mdoc.cbor.MdocCbor;
import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One concrete configuration of a proof system, such as a circuit.
 *
 * <p>Parameter values are {@code String}, {@code Long} or {@code Boolean}. Two
 * specs describe the same configuration when system and parameters are equal;
 * the id is a local label.</p>
 *
 * <pre>
 * ZkSystemSpec = { "id": tstr, "system": tstr, "params": { * tstr => tstr / int / bool } }
 * </pre>
 */
public record ZkSystemSpec(String id, String system, Map<String, Object> params)
{
    public ZkSystemSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(system, "system");
        Objects.requireNonNull(params, "params");
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object v = e.getValue();
            if (!(v instanceof String || v instanceof Long || v instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported value for param " + e.getKey() + ": " + v);
            }
        }
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public <T> Optional<T> param(String name, Class<T> type) {
        Object value = params.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /** Same system and parameters, ignoring the id. */
    public boolean matches(ZkSystemSpec other) {
        return system.equals(other.system) && params.equals(other.params);
    }

    public CBORObject toCbor() {
        CBORObject map = MdocCbor.newMap();
        map.Add("id", id);
        map.Add("system", system);
        CBORObject p = MdocCbor.newMap();
        for (Map.Entry<String, Object> e : params.entrySet()) {
            p.Add(e.getKey(), CBORObject.FromObject(e.getValue()));
        }
        map.Add("params", p);
        return map;
    }

    public static ZkSystemSpec fromCbor(CBORObject item) {
        CBORObject map = MdocCbor.requireMap(item, "ZkSystemSpec");
        Map<String, Object> params = new LinkedHashMap<>();
        CBORObject p = MdocCbor.optionalField(map, "params");
        if (p != null) {
            MdocCbor.requireMap(p, "params");
            for (CBORObject key : p.getKeys()) {
                String name = MdocCbor.requireString(key, "param name");
                CBORObject value = p.get(key);
                if (value.getType() == CBORType.TextString) {
                    params.put(name, value.AsString());
                } else if (value.getType() == CBORType.Boolean) {
                    params.put(name, value.AsBoolean());
                } else {
                    params.put(name, MdocCbor.requireLong(value, name));
                }
            }
        }
        return new ZkSystemSpec(
                MdocCbor.requireString(MdocCbor.field(map, "id"), "id"),
                MdocCbor.requireString(MdocCbor.field(map, "system"), "system"),
                params);
    }
}
