package com.questrail.mdoc.request;

import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.zkp.ZkSystemSpec;
import com.upokecenter.cbor.CBORObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a reader asks of one document: data elements per namespace, each with
 * an intent-to-retain flag, and optionally the proof systems it accepts.
 *
 * <pre>
 * ItemsRequest = {
 *   "docType": tstr,
 *   "nameSpaces": { * tstr => { * tstr => bool } },
 *   ? "requestInfo": { ? "zkRequest": { "systemSpecs": [* ZkSystemSpec], "zkRequired": bool } }
 * }
 * </pre>
 */
public record DocRequest(
    String docType,
    Map<String, Map<String, Boolean>> namespaces,
    List<ZkSystemSpec> zkSystemSpecs,
    boolean zkRequired
) {
    public DocRequest {
        Objects.requireNonNull(docType, "docType");
        Objects.requireNonNull(namespaces, "namespaces");
        Map<String, Map<String, Boolean>> copy = new LinkedHashMap<>();
        namespaces.forEach((ns, elements) -> copy.put(ns, Collections.unmodifiableMap(new LinkedHashMap<>(elements))));
        namespaces = Collections.unmodifiableMap(copy);
        zkSystemSpecs = zkSystemSpecs == null ? List.of() : List.copyOf(zkSystemSpecs);
        if (zkRequired && zkSystemSpecs.isEmpty()) {
            throw new IllegalArgumentException("zkRequired without any system spec");
        }
    }

    public static DocRequest of(String docType, Map<String, Map<String, Boolean>> namespaces) {
        return new DocRequest(docType, namespaces, List.of(), false);
    }

    public DocRequest withZkRequest(List<ZkSystemSpec> specs, boolean required) {
        return new DocRequest(docType, namespaces, specs, required);
    }

    public boolean hasZkRequest() {
        return !zkSystemSpecs.isEmpty();
    }

    CBORObject toItemsRequest() {
        CBORObject map = MdocCbor.newMap();
        map.Add("docType", docType);
        CBORObject ns = MdocCbor.newMap();
        namespaces.forEach((name, elements) -> {
            CBORObject e = MdocCbor.newMap();
            elements.forEach(e::Add);
            ns.Add(name, e);
        });
        map.Add("nameSpaces", ns);
        if (hasZkRequest()) {
            CBORObject specs = CBORObject.NewArray();
            for (ZkSystemSpec spec : zkSystemSpecs) {
                specs.Add(spec.toCbor());
            }
            CBORObject zkRequest = MdocCbor.newMap();
            zkRequest.Add("systemSpecs", specs);
            zkRequest.Add("zkRequired", zkRequired);
            CBORObject requestInfo = MdocCbor.newMap();
            requestInfo.Add("zkRequest", zkRequest);
            map.Add("requestInfo", requestInfo);
        }
        return map;
    }

    static DocRequest fromItemsRequest(CBORObject item) {
        CBORObject map = MdocCbor.requireMap(item, "ItemsRequest");
        String docType = MdocCbor.requireString(MdocCbor.field(map, "docType"), "docType");
        CBORObject ns = MdocCbor.requireMap(MdocCbor.field(map, "nameSpaces"), "nameSpaces");
        Map<String, Map<String, Boolean>> namespaces = new LinkedHashMap<>();
        for (CBORObject name : ns.getKeys()) {
            CBORObject elements = MdocCbor.requireMap(ns.get(name), "namespace");
            Map<String, Boolean> e = new LinkedHashMap<>();
            for (CBORObject element : elements.getKeys()) {
                e.put(MdocCbor.requireString(element, "element identifier"),
                        MdocCbor.requireBoolean(elements.get(element), "intentToRetain"));
            }
            namespaces.put(MdocCbor.requireString(name, "namespace"), e);
        }
        List<ZkSystemSpec> specs = new ArrayList<>();
        boolean required = false;
        CBORObject requestInfo = MdocCbor.optionalField(map, "requestInfo");
        if (requestInfo != null) {
            CBORObject zkRequest = MdocCbor.optionalField(MdocCbor.requireMap(requestInfo, "requestInfo"), "zkRequest");
            if (zkRequest != null) {
                MdocCbor.requireMap(zkRequest, "zkRequest");
                CBORObject array = MdocCbor.requireArray(MdocCbor.field(zkRequest, "systemSpecs"), "systemSpecs");
                for (int i = 0; i < array.size(); i++) {
                    specs.add(ZkSystemSpec.fromCbor(array.get(i)));
                }
                CBORObject flag = MdocCbor.optionalField(zkRequest, "zkRequired");
                required = flag != null && MdocCbor.requireBoolean(flag, "zkRequired");
            }
        }
        return new DocRequest(docType, namespaces, specs, required && !specs.isEmpty());
    }
}
