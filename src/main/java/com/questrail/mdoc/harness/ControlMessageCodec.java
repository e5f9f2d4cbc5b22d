package com.questrail.mdoc.harness;

import com.questrail.mdoc.cbor.CborStructureException;
import com.questrail.mdoc.cbor.MdocCbor;
import com.questrail.mdoc.presentment.TerminationStyle;
import com.upokecenter.cbor.CBORObject;

import java.util.ArrayList;
import java.util.List;

/**
 * CBOR encoding of {@link ControlMessage}s: a map whose {@code "type"} names the
 * message, plus its fields. Enum values travel by name.
 */
public final class ControlMessageCodec
{
    private ControlMessageCodec() {}

    public static byte[] encode(ControlMessage message) {
        CBORObject map = MdocCbor.newMap();
        if (message instanceof ControlMessage.Plan m) {
            map.Add("type", "plan");
            CBORObject entries = CBORObject.NewArray();
            for (TestPlan.Entry e : m.plan().entries()) {
                CBORObject entry = MdocCbor.newMap();
                entry.Add("transport", e.transport().name());
                entry.Add("style", e.style().name());
                entry.Add("iterations", e.iterations());
                entries.Add(entry);
            }
            map.Add("entries", entries);
        } else if (message instanceof ControlMessage.Prepare m) {
            map.Add("type", "prepare");
            map.Add("iteration", m.iteration());
            map.Add("total", m.totalIterations());
            map.Add("transport", m.transport().name());
            map.Add("style", m.style().name());
            map.Add("engagement", m.deviceEngagement());
        } else if (message instanceof ControlMessage.Prepared m) {
            map.Add("type", "prepared");
            map.Add("iteration", m.iteration());
        } else if (message instanceof ControlMessage.Start m) {
            map.Add("type", "start");
            map.Add("iteration", m.iteration());
        } else if (message instanceof ControlMessage.Success m) {
            map.Add("type", "success");
            map.Add("iteration", m.iteration());
            map.Add("transactionMillis", m.transactionMillis());
            if (m.scanningMillis() != null) {
                map.Add("scanningMillis", m.scanningMillis());
            }
        } else if (message instanceof ControlMessage.Timeout m) {
            map.Add("type", "timeout");
            map.Add("iteration", m.iteration());
        } else if (message instanceof ControlMessage.Failed m) {
            map.Add("type", "failed");
            map.Add("iteration", m.iteration());
            map.Add("reason", m.reason());
        } else if (message instanceof ControlMessage.Result m) {
            map.Add("type", "result");
            map.Add("result", encodeResult(m.result()));
        } else if (message == ControlMessage.Done.INSTANCE) {
            map.Add("type", "done");
        } else {
            throw new IllegalArgumentException("Unknown control message " + message);
        }
        return map.EncodeToBytes();
    }

    /**
     * @throws CborStructureException if the bytes are not a known control message
     */
    public static ControlMessage decode(byte[] encoded) {
        CBORObject map = MdocCbor.requireMap(MdocCbor.decode(encoded, "ControlMessage"), "ControlMessage");
        String type = MdocCbor.requireString(MdocCbor.field(map, "type"), "type");
        switch (type) {
            case "plan": {
                CBORObject array = MdocCbor.requireArray(MdocCbor.field(map, "entries"), "entries");
                List<TestPlan.Entry> entries = new ArrayList<>();
                for (int i = 0; i < array.size(); i++) {
                    CBORObject e = MdocCbor.requireMap(array.get(i), "entry");
                    entries.add(new TestPlan.Entry(
                            enumField(e, "transport", HarnessTransport.class),
                            enumField(e, "style", TerminationStyle.class),
                            intField(e, "iterations")));
                }
                return new ControlMessage.Plan(new TestPlan(entries));
            }
            case "prepare":
                return new ControlMessage.Prepare(
                        intField(map, "iteration"),
                        intField(map, "total"),
                        enumField(map, "transport", HarnessTransport.class),
                        enumField(map, "style", TerminationStyle.class),
                        MdocCbor.requireBytes(MdocCbor.field(map, "engagement"), "engagement"));
            case "prepared":
                return new ControlMessage.Prepared(intField(map, "iteration"));
            case "start":
                return new ControlMessage.Start(intField(map, "iteration"));
            case "success": {
                CBORObject scanning = MdocCbor.optionalField(map, "scanningMillis");
                return new ControlMessage.Success(
                        intField(map, "iteration"),
                        MdocCbor.requireLong(MdocCbor.field(map, "transactionMillis"), "transactionMillis"),
                        scanning == null ? null : MdocCbor.requireLong(scanning, "scanningMillis"));
            }
            case "timeout":
                return new ControlMessage.Timeout(intField(map, "iteration"));
            case "failed":
                return new ControlMessage.Failed(intField(map, "iteration"),
                        MdocCbor.requireString(MdocCbor.field(map, "reason"), "reason"));
            case "result":
                return new ControlMessage.Result(decodeResult(MdocCbor.field(map, "result")));
            case "done":
                return ControlMessage.Done.INSTANCE;
            default:
                throw new CborStructureException("Unknown control message type " + type);
        }
    }

    // -------------------------------------------------------------------------

    private static CBORObject encodeResult(TestResult r) {
        CBORObject map = MdocCbor.newMap();
        map.Add("total", r.numIterationsTotal());
        map.Add("completed", r.numIterationsCompleted());
        map.Add("successful", r.numIterationsSuccessful());
        CBORObject failed = CBORObject.NewArray();
        r.failedIterations().forEach(failed::Add);
        map.Add("failed", failed);
        map.Add("holderTimeouts", r.numHolderTimeouts());
        map.Add("holderErrors", r.numHolderErrors());
        map.Add("readerTimeouts", r.numReaderTimeouts());
        map.Add("readerErrors", r.numReaderErrors());
        map.Add("transactionTime", encodeTiming(r.transactionTime()));
        map.Add("scanningTime", encodeTiming(r.scanningTime()));
        return map;
    }

    private static TestResult decodeResult(CBORObject item) {
        CBORObject map = MdocCbor.requireMap(item, "result");
        CBORObject failedArray = MdocCbor.requireArray(MdocCbor.field(map, "failed"), "failed");
        List<Integer> failed = new ArrayList<>();
        for (int i = 0; i < failedArray.size(); i++) {
            failed.add(MdocCbor.requireInt(failedArray.get(i), "failed iteration"));
        }
        return new TestResult(
                intField(map, "total"),
                intField(map, "completed"),
                intField(map, "successful"),
                failed,
                intField(map, "holderTimeouts"),
                intField(map, "holderErrors"),
                intField(map, "readerTimeouts"),
                intField(map, "readerErrors"),
                decodeTiming(MdocCbor.field(map, "transactionTime")),
                decodeTiming(MdocCbor.field(map, "scanningTime")));
    }

    private static CBORObject encodeTiming(TestResult.Timing t) {
        CBORObject array = CBORObject.NewArray();
        array.Add(t.min());
        array.Add(t.max());
        array.Add(t.avg());
        array.Add(t.stdDev());
        return array;
    }

    private static TestResult.Timing decodeTiming(CBORObject item) {
        CBORObject array = MdocCbor.requireArray(item, "timing");
        if (array.size() != 4) {
            throw new CborStructureException("timing: expected 4 values, got " + array.size());
        }
        return new TestResult.Timing(
                doubleAt(array, 0), doubleAt(array, 1), doubleAt(array, 2), doubleAt(array, 3));
    }

    private static double doubleAt(CBORObject array, int index) {
        CBORObject value = array.get(index);
        if (!value.isNumber()) {
            throw new CborStructureException("timing: expected a number");
        }
        return value.AsDoubleValue();
    }

    private static int intField(CBORObject map, String key) {
        return MdocCbor.requireInt(MdocCbor.field(map, key), key);
    }

    private static <E extends Enum<E>> E enumField(CBORObject map, String key, Class<E> type) {
        String name = MdocCbor.requireString(MdocCbor.field(map, key), key);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new CborStructureException(key + ": unknown value " + name, e);
        }
    }
}
